package es.hargos.tenantguard.exception;

import org.springframework.http.HttpStatus;

/**
 * Client-facing error with an HTTP status and a stable error kind.
 * The message is returned to the caller as-is, so it must never carry internals.
 */
public class ApiErrorException extends RuntimeException {

    private final HttpStatus status;
    private final String error;

    public ApiErrorException(HttpStatus status, String error, String message) {
        super(message);
        this.status = status;
        this.error = error;
    }

    public static ApiErrorException badRequest(String message) {
        return new ApiErrorException(HttpStatus.BAD_REQUEST, "BadRequest", message);
    }

    public static ApiErrorException validation(String message) {
        return new ApiErrorException(HttpStatus.BAD_REQUEST, "ValidationError", message);
    }

    public static ApiErrorException notFound(String message) {
        return new ApiErrorException(HttpStatus.NOT_FOUND, "NotFound", message);
    }

    public static ApiErrorException conflict(String message) {
        return new ApiErrorException(HttpStatus.CONFLICT, "ConflictError", message);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }
}
