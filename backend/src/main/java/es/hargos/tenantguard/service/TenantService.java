package es.hargos.tenantguard.service;

import es.hargos.tenantguard.context.ScopedTransaction;
import es.hargos.tenantguard.dto.UpdateTenantQuotaInput;
import es.hargos.tenantguard.dto.request.UpdateTenantRequest;
import es.hargos.tenantguard.entity.TenantEntity;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.repository.TenantMembershipRepository;
import es.hargos.tenantguard.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tenant reads and writes. Authorization is checked by the caller before any of these run.
 */
@Service
@RequiredArgsConstructor
public class TenantService {

    private static final Logger logger = LoggerFactory.getLogger(TenantService.class);

    private final TenantRepository tenantRepository;
    private final TenantMembershipRepository membershipRepository;
    private final TenantQuotaService quotaService;

    public TenantEntity getTenant(Long tenantId, ScopedTransaction trx) {
        trx.assertActive();
        return tenantRepository.findById(tenantId)
                .orElseThrow(() -> ApiErrorException.notFound("Tenant not found"));
    }

    public TenantEntity updateTenant(Long tenantId, UpdateTenantRequest request, ScopedTransaction trx) {
        TenantEntity tenant = getTenant(tenantId, trx);
        if (request.getName() != null) {
            tenant.setName(request.getName().trim());
        }
        TenantEntity saved = tenantRepository.save(tenant);
        logger.info("Tenant {} updated", tenantId);
        return saved;
    }

    /**
     * Apply and persist a partial quota update.
     */
    public TenantEntity updateQuotas(Long tenantId, UpdateTenantQuotaInput input, ScopedTransaction trx) {
        TenantEntity tenant = getTenant(tenantId, trx);
        quotaService.applyQuotaUpdates(tenant, input);
        TenantEntity saved = tenantRepository.save(tenant);
        logger.info("Tenant {}: quotas updated (maxMembers={}, overrides={})",
                tenantId, saved.getMaxMembers(), saved.getQuotaOverrides());
        return saved;
    }

    /**
     * Delete the tenant and its memberships in one transaction.
     */
    public void deleteTenant(Long tenantId, Long callerUserId, ScopedTransaction trx) {
        TenantEntity tenant = getTenant(tenantId, trx);
        membershipRepository.deleteByTenantId(tenantId);
        tenantRepository.delete(tenant);
        logger.info("Tenant {} ({}) deleted by user {}", tenantId, tenant.getSlug(), callerUserId);
    }
}
