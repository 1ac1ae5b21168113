package es.hargos.tenantguard.rbac;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static es.hargos.tenantguard.rbac.TenantAction.*;

/**
 * Static role to action table plus the sensitive and ownership-bypass sets.
 *
 * Code-based rather than stored in the database so every change goes through review.
 */
public final class RolePermissions {

    private static final Map<TenantRole, Set<TenantAction>> PERMISSIONS = new EnumMap<>(TenantRole.class);

    /**
     * Destructive or privilege-affecting actions. Never granted through ownership.
     */
    public static final Set<TenantAction> SENSITIVE_ACTIONS = Collections.unmodifiableSet(EnumSet.of(
            TENANT_DELETE,
            MEMBER_REMOVE,
            MEMBER_UPDATE_ROLE,
            BILLING_MANAGE,
            SUBSCRIPTION_CANCEL
    ));

    /**
     * Actions the owner of a resource may perform regardless of role.
     */
    public static final Set<TenantAction> OWNERSHIP_BYPASS_ACTIONS = Collections.unmodifiableSet(EnumSet.of(
            TENANT_READ,
            TENANT_UPDATE,
            MEMBER_LIST,
            INVITATION_LIST,
            INVITATION_SEND,
            INVITATION_CANCEL,
            BILLING_VIEW,
            SUBSCRIPTION_VIEW,
            SUBSCRIPTION_UPGRADE
    ));

    static {
        PERMISSIONS.put(TenantRole.OWNER, Collections.unmodifiableSet(EnumSet.allOf(TenantAction.class)));

        // Everything except delete, role changes, billing mutation and cancellation
        PERMISSIONS.put(TenantRole.ADMIN, Collections.unmodifiableSet(EnumSet.of(
                TENANT_READ,
                TENANT_UPDATE,
                MEMBER_LIST,
                MEMBER_ADD,
                MEMBER_REMOVE,
                INVITATION_LIST,
                INVITATION_SEND,
                INVITATION_CANCEL,
                BILLING_VIEW,
                SUBSCRIPTION_VIEW,
                SUBSCRIPTION_UPGRADE,
                PLUGIN_MANAGE
        )));

        PERMISSIONS.put(TenantRole.MEMBER, Collections.unmodifiableSet(EnumSet.of(
                TENANT_READ,
                MEMBER_LIST,
                BILLING_VIEW,
                SUBSCRIPTION_VIEW
        )));

        // Strict read-only, no billing or subscription visibility
        PERMISSIONS.put(TenantRole.VIEWER, Collections.unmodifiableSet(EnumSet.of(
                TENANT_READ,
                MEMBER_LIST
        )));

        for (TenantAction action : OWNERSHIP_BYPASS_ACTIONS) {
            if (SENSITIVE_ACTIONS.contains(action)) {
                throw new ExceptionInInitializerError(
                        "Sensitive action " + action + " must not be grantable through ownership");
            }
        }
    }

    private RolePermissions() {
    }

    /**
     * Allowed actions for a role. Total over the enum: every role has an entry.
     */
    public static Set<TenantAction> forRole(TenantRole role) {
        if (role == null) {
            return Collections.emptySet();
        }
        return PERMISSIONS.getOrDefault(role, Collections.emptySet());
    }
}
