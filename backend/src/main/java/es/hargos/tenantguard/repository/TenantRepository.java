package es.hargos.tenantguard.repository;

import es.hargos.tenantguard.entity.TenantEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TenantRepository extends JpaRepository<TenantEntity, Long> {

    Optional<TenantEntity> findBySlug(String slug);

    boolean existsBySlug(String slug);

    /**
     * All four quota usage counters in one round trip on the current (RLS-bound) connection.
     */
    @Query(value = "SELECT " +
            "(SELECT COUNT(*) FROM public.tenant_memberships m WHERE m.tenant_id = :tenantId) AS members, " +
            "(SELECT COUNT(*) FROM public.tenant_invitations i " +
            " WHERE i.tenant_id = :tenantId AND i.status = 'pending') AS pendingInvitations, " +
            "(SELECT COUNT(*) FROM public.auth_tokens t WHERE t.tenant_id = :tenantId) AS authTokensPerTenant, " +
            "(SELECT COUNT(*) FROM public.auth_tokens t " +
            " WHERE t.tenant_id = :tenantId AND t.user_id = :userId) AS authTokensPerUser",
            nativeQuery = true)
    QuotaUsageCounts countQuotaUsage(@Param("tenantId") Long tenantId, @Param("userId") Long userId);
}
