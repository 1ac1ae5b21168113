package es.hargos.tenantguard.rbac;

import es.hargos.tenantguard.context.RequestTenant;

import java.util.List;

/**
 * Inline permission checks for the current membership.
 *
 * Soft checks return booleans, hard checks throw {@link RbacDeniedException}.
 */
public class RbacGuard {

    private final RbacService rbacService;
    private final TenantRole role;
    private final Long userId;

    public RbacGuard(RbacService rbacService, RequestTenant tenant) {
        if (tenant == null) {
            throw new IllegalStateException("RbacGuard requires a verified tenant membership");
        }
        this.rbacService = rbacService;
        this.role = tenant.getRole();
        this.userId = tenant.getUserId();
    }

    public TenantRole getRole() {
        return role;
    }

    public Long getUserId() {
        return userId;
    }

    public boolean can(TenantAction action) {
        return rbacService.can(role, action);
    }

    public boolean canOrOwns(TenantAction action, Long resourceOwnerId) {
        return rbacService.canWithOwnership(ResourceOwnership.of(resourceOwnerId, userId), role, action);
    }

    public void authorize(TenantAction action) {
        if (!can(action)) {
            throw new RbacDeniedException(List.of(action));
        }
    }

    public void authorizeOrOwns(TenantAction action, Long resourceOwnerId) {
        if (!canOrOwns(action, resourceOwnerId)) {
            throw new RbacDeniedException(List.of(action));
        }
    }

    public boolean canAll(List<TenantAction> actions) {
        return rbacService.canAll(role, actions);
    }

    public boolean canAny(List<TenantAction> actions) {
        return rbacService.canAny(role, actions);
    }

    /**
     * Throws with every denied action, not just the first.
     */
    public void authorizeAll(List<TenantAction> actions) {
        List<TenantAction> denied = rbacService.getDeniedActions(role, actions);
        if (!denied.isEmpty()) {
            throw new RbacDeniedException(denied);
        }
    }
}
