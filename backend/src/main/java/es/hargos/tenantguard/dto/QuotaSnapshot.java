package es.hargos.tenantguard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuotaSnapshot {

    private QuotaMetric members;
    private QuotaMetric pendingInvitations;
    private QuotaMetric authTokensPerTenant;
    private QuotaMetric authTokensPerUser;

    public static QuotaSnapshot of(QuotaLimits limits, QuotaUsage usage) {
        return QuotaSnapshot.builder()
                .members(QuotaMetric.of(limits.getMembers(), usage.getMembers()))
                .pendingInvitations(QuotaMetric.of(limits.getPendingInvitations(), usage.getPendingInvitations()))
                .authTokensPerTenant(QuotaMetric.of(limits.getAuthTokensPerTenant(), usage.getAuthTokensPerTenant()))
                .authTokensPerUser(QuotaMetric.of(limits.getAuthTokensPerUser(), usage.getAuthTokensPerUser()))
                .build();
    }
}
