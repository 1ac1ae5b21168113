package es.hargos.tenantguard.exception;

public class SubscriptionTierNotFoundException extends RuntimeException {

    public SubscriptionTierNotFoundException(String slug) {
        super("Subscription tier not found: " + slug);
    }
}
