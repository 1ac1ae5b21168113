package es.hargos.tenantguard.service;

import es.hargos.tenantguard.context.ScopedTransaction;
import es.hargos.tenantguard.dto.QuotaLimits;
import es.hargos.tenantguard.dto.QuotaSnapshot;
import es.hargos.tenantguard.dto.QuotaUsage;
import es.hargos.tenantguard.dto.UpdateTenantQuotaInput;
import es.hargos.tenantguard.entity.SubscriptionTierEntity;
import es.hargos.tenantguard.entity.TenantEntity;
import es.hargos.tenantguard.exception.SubscriptionTierNotFoundException;
import es.hargos.tenantguard.repository.QuotaUsageCounts;
import es.hargos.tenantguard.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective quota ceilings and usage for a tenant.
 *
 * Resolution order per metric, highest priority first:
 * 1. Tenant override (tenants.quota_overrides)
 * 2. Tier default (subscription_tiers.features.quotas)
 * 3. Hard fallback by tier level (tokens) or the members limit (pending invitations)
 *
 * Members are resolved from tenants.max_members, then the tier's max_team_members.
 */
@Service
@RequiredArgsConstructor
public class TenantQuotaService {

    private static final Logger logger = LoggerFactory.getLogger(TenantQuotaService.class);

    private final SubscriptionTierService tierService;
    private final TenantRepository tenantRepository;

    public QuotaLimits getEffectiveLimits(TenantEntity tenant, ScopedTransaction trx) {
        Integer memberLimit = tenant.getMaxMembers();
        int tierLevel = 0;
        Map<String, Object> tierQuotas = null;

        try {
            SubscriptionTierEntity tier = tierService.getTierForTenant(trx, tenant.getId());
            if (tenant.getMaxMembers() == null) {
                memberLimit = tier.getMaxTeamMembers();
            }
            tierLevel = tier.getLevel() != null ? tier.getLevel() : 0;
            tierQuotas = extractTierQuotas(tier.getFeatures());
        } catch (SubscriptionTierNotFoundException e) {
            logger.warn("Tenant {}: {}, using stored member limit and free-tier fallbacks",
                    tenant.getId(), e.getMessage());
        }

        Map<String, Object> overrides = tenant.getQuotaOverrides();

        return QuotaLimits.builder()
                .members(memberLimit)
                .pendingInvitations(LimitSetting.resolve(
                        LimitSetting.fromMap(overrides, UpdateTenantQuotaInput.MAX_PENDING_INVITATIONS),
                        LimitSetting.fromMap(tierQuotas, "maxPendingInvitations", "max_pending_invitations"),
                        LimitSetting.ofNullable(memberLimit)))
                .authTokensPerTenant(LimitSetting.resolve(
                        LimitSetting.fromMap(overrides, UpdateTenantQuotaInput.MAX_AUTH_TOKENS_PER_TENANT),
                        LimitSetting.fromMap(tierQuotas, "maxAuthTokensPerTenant", "max_auth_tokens_per_tenant"),
                        LimitSetting.of(tokenFallbackPerTenant(tierLevel))))
                .authTokensPerUser(LimitSetting.resolve(
                        LimitSetting.fromMap(overrides, UpdateTenantQuotaInput.MAX_AUTH_TOKENS_PER_USER),
                        LimitSetting.fromMap(tierQuotas, "maxAuthTokensPerUser", "max_auth_tokens_per_user"),
                        LimitSetting.of(tokenFallbackPerUser(tierLevel))))
                .build();
    }

    /**
     * Counts run as one aggregate query on the caller's transaction so they see
     * the same RLS binding and the same snapshot.
     */
    public QuotaUsage getUsage(Long tenantId, Long userId, ScopedTransaction trx) {
        trx.assertActive();
        QuotaUsageCounts counts = tenantRepository.countQuotaUsage(tenantId, userId);
        if (counts == null) {
            return new QuotaUsage(0, 0, 0, 0);
        }
        return QuotaUsage.builder()
                .members(toCount(counts.getMembers()))
                .pendingInvitations(toCount(counts.getPendingInvitations()))
                .authTokensPerTenant(toCount(counts.getAuthTokensPerTenant()))
                .authTokensPerUser(toCount(counts.getAuthTokensPerUser()))
                .build();
    }

    public QuotaSnapshot getSnapshot(TenantEntity tenant, Long userId, ScopedTransaction trx) {
        QuotaLimits limits = getEffectiveLimits(tenant, trx);
        QuotaUsage usage = getUsage(tenant.getId(), userId, trx);
        return QuotaSnapshot.of(limits, usage);
    }

    /**
     * Advisory pre-flight check. Null limit never exceeds.
     */
    public boolean willExceed(Integer limit, long used, long increment) {
        if (limit == null) {
            return false;
        }
        return used + increment > limit;
    }

    public boolean willExceed(Integer limit, long used) {
        return willExceed(limit, used, 1);
    }

    /**
     * Applies a partial update to the tenant in memory. The caller saves the tenant.
     * Malformed entries already stored in the overrides are dropped.
     */
    public void applyQuotaUpdates(TenantEntity tenant, UpdateTenantQuotaInput input) {
        if (input.getMaxMembers().isPresent()) {
            tenant.setMaxMembers(input.getMaxMembers().toLimit());
        }

        Map<String, Object> current = tenant.getQuotaOverrides();
        Map<String, Object> next = new LinkedHashMap<>();
        copyOverride(next, UpdateTenantQuotaInput.MAX_PENDING_INVITATIONS,
                input.getMaxPendingInvitations().or(LimitSetting.fromMap(current, UpdateTenantQuotaInput.MAX_PENDING_INVITATIONS)));
        copyOverride(next, UpdateTenantQuotaInput.MAX_AUTH_TOKENS_PER_TENANT,
                input.getMaxAuthTokensPerTenant().or(LimitSetting.fromMap(current, UpdateTenantQuotaInput.MAX_AUTH_TOKENS_PER_TENANT)));
        copyOverride(next, UpdateTenantQuotaInput.MAX_AUTH_TOKENS_PER_USER,
                input.getMaxAuthTokensPerUser().or(LimitSetting.fromMap(current, UpdateTenantQuotaInput.MAX_AUTH_TOKENS_PER_USER)));

        tenant.setQuotaOverrides(next);
    }

    private static void copyOverride(Map<String, Object> target, String key, LimitSetting setting) {
        if (setting.isPresent()) {
            target.put(key, setting.toLimit());
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> extractTierQuotas(Map<String, Object> features) {
        if (features == null) {
            return null;
        }
        Object quotas = features.get("quotas");
        return quotas instanceof Map ? (Map<String, Object>) quotas : null;
    }

    private static int tokenFallbackPerTenant(int tierLevel) {
        if (tierLevel >= 2) return 5000;
        if (tierLevel >= 1) return 500;
        return 50;
    }

    private static int tokenFallbackPerUser(int tierLevel) {
        if (tierLevel >= 2) return 500;
        if (tierLevel >= 1) return 100;
        return 20;
    }

    private static long toCount(Long value) {
        return value != null ? value : 0L;
    }
}
