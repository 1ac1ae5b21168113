package es.hargos.tenantguard.exception;

public class DiscountCodeLimitReachedException extends RuntimeException {

    public DiscountCodeLimitReachedException(String message) {
        super(message);
    }
}
