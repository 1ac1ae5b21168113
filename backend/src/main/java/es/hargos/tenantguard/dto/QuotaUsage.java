package es.hargos.tenantguard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaUsage {

    private long members;
    private long pendingInvitations;
    private long authTokensPerTenant;
    private long authTokensPerUser;
}
