package es.hargos.tenantguard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Effective ceilings for a tenant. Null means unlimited.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaLimits {

    private Integer members;
    private Integer pendingInvitations;
    private Integer authTokensPerTenant;
    private Integer authTokensPerUser;
}
