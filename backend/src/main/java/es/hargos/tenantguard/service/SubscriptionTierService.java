package es.hargos.tenantguard.service;

import es.hargos.tenantguard.context.ScopedTransaction;
import es.hargos.tenantguard.entity.SubscriptionTierEntity;
import es.hargos.tenantguard.exception.SubscriptionTierNotFoundException;
import es.hargos.tenantguard.repository.SubscriptionTierRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves the subscription tier that applies to a tenant.
 */
@Service
@RequiredArgsConstructor
public class SubscriptionTierService {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionTierService.class);

    private final SubscriptionTierRepository tierRepository;

    /**
     * Tier of the tenant's most recent active subscription, or the free tier.
     *
     * @throws SubscriptionTierNotFoundException if the tenant has no subscription and no free tier exists
     */
    public SubscriptionTierEntity getTierForTenant(ScopedTransaction trx, Long tenantId) {
        trx.assertActive();
        List<SubscriptionTierEntity> tiers = tierRepository.findActiveTiersForTenant(tenantId);
        if (!tiers.isEmpty()) {
            return tiers.get(0);
        }
        logger.debug("Tenant {}: no active subscription, using free tier", tenantId);
        return getFreeTier();
    }

    public SubscriptionTierEntity getFreeTier() {
        return tierRepository.findBySlug(SubscriptionTierEntity.FREE_SLUG)
                .orElseThrow(() -> new SubscriptionTierNotFoundException(SubscriptionTierEntity.FREE_SLUG));
    }
}
