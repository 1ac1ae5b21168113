package es.hargos.tenantguard.rbac;

import java.util.Arrays;
import java.util.Optional;

/**
 * Catalog of tenant-scoped actions checked by the RBAC engine.
 */
public enum TenantAction {

    // Tenant management
    TENANT_READ("tenant:read"),
    TENANT_UPDATE("tenant:update"),
    TENANT_DELETE("tenant:delete"),

    // Member management
    MEMBER_LIST("member:list"),
    MEMBER_ADD("member:add"),
    MEMBER_REMOVE("member:remove"),
    MEMBER_UPDATE_ROLE("member:update_role"),

    // Invitations
    INVITATION_LIST("invitation:list"),
    INVITATION_SEND("invitation:send"),
    INVITATION_CANCEL("invitation:cancel"),

    // Billing
    BILLING_VIEW("billing:view"),
    BILLING_MANAGE("billing:manage"),

    // Subscription
    SUBSCRIPTION_VIEW("subscription:view"),
    SUBSCRIPTION_UPGRADE("subscription:upgrade"),
    SUBSCRIPTION_CANCEL("subscription:cancel"),

    PLUGIN_MANAGE("plugin:manage");

    private final String value;

    TenantAction(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<TenantAction> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(action -> action.value.equals(raw))
                .findFirst();
    }

    @Override
    public String toString() {
        return value;
    }
}
