package es.hargos.tenantguard.exception;

/**
 * Raised when tenant-scoped code runs without a verified membership.
 */
public class TenantAccessException extends RuntimeException {

    public TenantAccessException(String message) {
        super(message);
    }
}
