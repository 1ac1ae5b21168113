package es.hargos.tenantguard.context;

import es.hargos.tenantguard.exception.TenantAccessException;

/**
 * Thread-local holder for the current request's verified tenant membership.
 * Set by TenantContextFilter after the membership check and cleared when the request completes.
 *
 * Only identity lives here. Database work always goes through an explicit
 * {@link ScopedTransaction} handle.
 */
public class TenantContext {

    private static final ThreadLocal<RequestTenant> CONTEXT = new ThreadLocal<>();

    private TenantContext() {
    }

    public static void setCurrentTenant(RequestTenant tenant) {
        CONTEXT.set(tenant);
    }

    /**
     * @return the verified tenant or null if the request is not tenant-scoped
     */
    public static RequestTenant getCurrentTenant() {
        return CONTEXT.get();
    }

    /**
     * Fails closed when no verified membership is bound.
     */
    public static RequestTenant requireCurrentTenant() {
        RequestTenant tenant = CONTEXT.get();
        if (tenant == null) {
            throw new TenantAccessException("Tenant context is required for this operation");
        }
        return tenant;
    }

    /**
     * MUST be called after request completion
     */
    public static void clear() {
        CONTEXT.remove();
    }
}
