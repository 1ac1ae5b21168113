package es.hargos.tenantguard.repository;

/**
 * Projection for {@link TenantRepository#countQuotaUsage(Long, Long)}.
 */
public interface QuotaUsageCounts {

    Long getMembers();

    Long getPendingInvitations();

    Long getAuthTokensPerTenant();

    Long getAuthTokensPerUser();
}
