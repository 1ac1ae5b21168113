package es.hargos.tenantguard.context;

import es.hargos.tenantguard.rbac.TenantRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tenant membership of the current request, verified against the database.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class RequestTenant {

    private final Long tenantId;

    private final Long userId;

    private final Long membershipId;

    private final TenantRole role;
}
