package es.hargos.tenantguard.rbac;

import java.util.List;

/**
 * Raised by {@link RbacGuard} hard checks. Mapped to a 403 "RbacDenied" response.
 */
public class RbacDeniedException extends RuntimeException {

    private final List<TenantAction> deniedActions;

    public RbacDeniedException(List<TenantAction> deniedActions) {
        super("You do not have permission to perform this action");
        this.deniedActions = List.copyOf(deniedActions);
    }

    public List<TenantAction> getDeniedActions() {
        return deniedActions;
    }
}
