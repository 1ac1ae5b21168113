package es.hargos.tenantguard.rbac;

import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure role-based authorization decisions for tenant-scoped actions.
 *
 * No I/O and no exceptions: unknown roles, unknown actions and malformed
 * ownership contexts all resolve to a denial.
 */
@Service
public class RbacService {

    /**
     * Check if a role may perform an action.
     */
    public boolean can(TenantRole role, TenantAction action) {
        if (role == null || action == null) {
            return false;
        }
        return RolePermissions.forRole(role).contains(action);
    }

    /**
     * Boundary variant for raw role strings. Unregistered roles are denied.
     */
    public boolean can(String role, TenantAction action) {
        Optional<TenantRole> parsed = TenantRole.fromValue(role);
        return parsed.isPresent() && can(parsed.get(), action);
    }

    /**
     * Role check with an ownership override.
     *
     * The owner short-circuits only for actions in the bypass set. For every
     * other action, including all sensitive ones, the role decides.
     */
    public boolean canWithOwnership(ResourceOwnership ownership, TenantRole role, TenantAction action) {
        if (ownership != null
                && ownership.isOwnedByRequester()
                && RolePermissions.OWNERSHIP_BYPASS_ACTIONS.contains(action)) {
            return true;
        }
        return can(role, action);
    }

    public boolean canWithOwnership(ResourceOwnership ownership, String role, TenantAction action) {
        return canWithOwnership(ownership, TenantRole.fromValue(role).orElse(null), action);
    }

    public boolean isSensitiveAction(TenantAction action) {
        return action != null && RolePermissions.SENSITIVE_ACTIONS.contains(action);
    }

    /**
     * @return allowed actions for the role, empty for unknown roles
     */
    public Set<TenantAction> getPermissionsForRole(TenantRole role) {
        return RolePermissions.forRole(role);
    }

    public Set<TenantAction> getPermissionsForRole(String role) {
        return TenantRole.fromValue(role)
                .map(RolePermissions::forRole)
                .orElse(Set.of());
    }

    /**
     * True for an empty or null action list.
     */
    public boolean canAll(TenantRole role, Collection<TenantAction> actions) {
        if (actions == null) {
            return true;
        }
        return actions.stream().allMatch(action -> can(role, action));
    }

    /**
     * False for an empty or null action list.
     */
    public boolean canAny(TenantRole role, Collection<TenantAction> actions) {
        if (actions == null) {
            return false;
        }
        return actions.stream().anyMatch(action -> can(role, action));
    }

    /**
     * Actions from the input the role may NOT perform, in input order.
     */
    public List<TenantAction> getDeniedActions(TenantRole role, Collection<TenantAction> actions) {
        if (actions == null) {
            return List.of();
        }
        return actions.stream()
                .filter(action -> !can(role, action))
                .collect(Collectors.toList());
    }

    public List<TenantAction> getDeniedActions(String role, Collection<TenantAction> actions) {
        return getDeniedActions(TenantRole.fromValue(role).orElse(null), actions);
    }
}
