package es.hargos.tenantguard.rbac;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Role of a user inside one tenant. Stored on the membership, never on the user.
 */
public enum TenantRole {

    OWNER("owner"),
    ADMIN("admin"),
    MEMBER("member"),
    VIEWER("viewer");

    private final String value;

    TenantRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parse a stored/wire role. Unknown values resolve to empty so callers deny.
     */
    public static Optional<TenantRole> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.value.equals(normalized))
                .findFirst();
    }

    public boolean isAdmin() {
        return this == OWNER || this == ADMIN;
    }
}
