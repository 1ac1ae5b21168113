package es.hargos.tenantguard.service;

import es.hargos.tenantguard.context.ScopedTransaction;
import es.hargos.tenantguard.dto.response.ValidateDiscountCodeResult;
import es.hargos.tenantguard.entity.CouponEntity;
import es.hargos.tenantguard.entity.DiscountCodeEntity;
import es.hargos.tenantguard.entity.DiscountCodeUsageEntity;
import es.hargos.tenantguard.entity.DiscountType;
import es.hargos.tenantguard.entity.PriceEntity;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.exception.DiscountCodeLimitReachedException;
import es.hargos.tenantguard.repository.DiscountCodeRepository;
import es.hargos.tenantguard.repository.DiscountCodeUsageRepository;
import es.hargos.tenantguard.repository.PriceRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checkout discount codes. The tenant is the billing unit for per-use limits.
 *
 * Validation reads only and takes no locks. Usage recording is append-only and
 * serialized on the discount code row.
 */
@Service
@RequiredArgsConstructor
public class DiscountCodeService {

    private static final Logger logger = LoggerFactory.getLogger(DiscountCodeService.class);

    private final DiscountCodeRepository discountCodeRepository;
    private final DiscountCodeUsageRepository usageRepository;
    private final PriceRepository priceRepository;

    /**
     * Checks in order: price, code, active, expired, max uses, per-tenant uses,
     * minimum amount, fixed-amount currency. Stops at the first failure.
     */
    public ValidateDiscountCodeResult validateCode(String code, Long priceId, Long tenantId, ScopedTransaction trx) {
        trx.assertActive();

        Optional<PriceEntity> priceOpt = priceId != null ? priceRepository.findById(priceId) : Optional.empty();
        if (priceOpt.isEmpty()) {
            return ValidateDiscountCodeResult.invalid(0L, "Price not found");
        }
        PriceEntity price = priceOpt.get();
        long amount = price.getUnitAmount();

        String normalizedCode = CouponEntity.normalizeCode(code);
        Optional<DiscountCodeEntity> codeOpt = normalizedCode == null || normalizedCode.isEmpty()
                ? Optional.empty()
                : discountCodeRepository.findByCode(normalizedCode);
        if (codeOpt.isEmpty()) {
            return ValidateDiscountCodeResult.invalid(amount, "Discount code not found");
        }
        DiscountCodeEntity discountCode = codeOpt.get();

        if (!Boolean.TRUE.equals(discountCode.getIsActive())) {
            return ValidateDiscountCodeResult.invalid(amount, "Discount code is inactive");
        }
        if (discountCode.isExpired()) {
            return ValidateDiscountCodeResult.invalid(amount, "Discount code has expired");
        }
        if (discountCode.hasReachedMaxUses()) {
            return ValidateDiscountCodeResult.invalid(amount, "Discount code has reached maximum uses");
        }
        if (!canBeUsedByTenant(discountCode, tenantId)) {
            return ValidateDiscountCodeResult.invalid(amount,
                    "This tenant has already used this discount code the maximum number of times");
        }
        if (discountCode.getMinAmount() != null && amount < discountCode.getMinAmount()) {
            String currency = discountCode.getCurrency() != null ? discountCode.getCurrency() : price.getCurrency();
            return ValidateDiscountCodeResult.invalid(amount,
                    String.format(Locale.ROOT, "Minimum purchase amount of %.2f %s required",
                            discountCode.getMinAmount() / 100.0, currency));
        }
        if (discountCode.getDiscountType() == DiscountType.FIXED
                && discountCode.getCurrency() != null
                && !discountCode.getCurrency().equalsIgnoreCase(price.getCurrency())) {
            return ValidateDiscountCodeResult.invalid(amount, "Discount code currency does not match price currency");
        }

        long discountApplied = calculateDiscount(discountCode, amount);
        return ValidateDiscountCodeResult.builder()
                .valid(true)
                .discountCodeId(discountCode.getId())
                .code(discountCode.getCode())
                .originalAmount(amount)
                .discountedAmount(Math.max(0L, amount - discountApplied))
                .discountApplied(discountApplied)
                .build();
    }

    public long calculateDiscount(DiscountCodeEntity discountCode, long amount) {
        return discountCode.calculateDiscount(amount);
    }

    /**
     * Append a usage row and bump the global counter under a row lock on the code.
     *
     * @throws DiscountCodeLimitReachedException if a global or per-tenant limit would be exceeded
     */
    public DiscountCodeUsageEntity recordUsage(Long discountCodeId, Long tenantId, Long userId,
                                               String checkoutSessionId, ScopedTransaction trx) {
        trx.assertActive();
        DiscountCodeEntity discountCode = discountCodeRepository.findById(discountCodeId)
                .orElseThrow(() -> ApiErrorException.notFound("Discount code not found"));

        trx.lockForUpdate(discountCode);

        if (discountCode.hasReachedMaxUses()) {
            throw new DiscountCodeLimitReachedException("Discount code has reached maximum uses");
        }
        if (!canBeUsedByTenant(discountCode, tenantId)) {
            throw new DiscountCodeLimitReachedException(
                    "This tenant has already used this discount code the maximum number of times");
        }

        int timesUsed = discountCode.getTimesUsed() != null ? discountCode.getTimesUsed() : 0;
        discountCode.setTimesUsed(timesUsed + 1);
        discountCodeRepository.save(discountCode);

        DiscountCodeUsageEntity usage = usageRepository.save(DiscountCodeUsageEntity.builder()
                .discountCodeId(discountCodeId)
                .tenantId(tenantId)
                .userId(userId)
                .checkoutSessionId(checkoutSessionId)
                .build());

        logger.info("Discount code {} used by tenant {} (user {}), times used: {}",
                discountCode.getCode(), tenantId, userId, discountCode.getTimesUsed());
        return usage;
    }

    public List<DiscountCodeUsageEntity> getUsages(Long discountCodeId, ScopedTransaction trx) {
        trx.assertActive();
        return usageRepository.findByDiscountCodeIdOrderByUsedAtDesc(discountCodeId);
    }

    public List<DiscountCodeUsageEntity> getTenantUsages(Long tenantId, ScopedTransaction trx) {
        trx.assertActive();
        return usageRepository.findByTenantIdOrderByUsedAtDesc(tenantId);
    }

    private boolean canBeUsedByTenant(DiscountCodeEntity discountCode, Long tenantId) {
        if (discountCode.getMaxUsesPerTenant() == null) {
            return true;
        }
        long used = usageRepository.countByDiscountCodeIdAndTenantId(discountCode.getId(), tenantId);
        return used < discountCode.getMaxUsesPerTenant();
    }
}
