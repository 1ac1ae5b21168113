package es.hargos.tenantguard.repository;

import es.hargos.tenantguard.entity.SubscriptionTierEntity;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionTierRepository extends JpaRepository<SubscriptionTierEntity, Long> {

    @Cacheable("subscriptionTiers")
    Optional<SubscriptionTierEntity> findBySlug(String slug);

    List<SubscriptionTierEntity> findByIsActiveTrueOrderByLevelAsc();

    /**
     * Tiers of the tenant's active subscriptions, most recent subscription first.
     */
    @Query("SELECT t FROM SubscriptionTierEntity t, SubscriptionEntity s " +
           "WHERE s.tierId = t.id AND s.tenantId = :tenantId AND s.status = 'active' " +
           "ORDER BY s.createdAt DESC")
    List<SubscriptionTierEntity> findActiveTiersForTenant(@Param("tenantId") Long tenantId);
}
