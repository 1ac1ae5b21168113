package es.hargos.tenantguard.service;

import es.hargos.tenantguard.context.ScopedTransaction;
import es.hargos.tenantguard.dto.request.CreateCouponRequest;
import es.hargos.tenantguard.dto.request.UpdateCouponRequest;
import es.hargos.tenantguard.dto.response.BalanceResponse;
import es.hargos.tenantguard.dto.response.CouponResponse;
import es.hargos.tenantguard.dto.response.RedeemCouponResult;
import es.hargos.tenantguard.entity.CouponEntity;
import es.hargos.tenantguard.entity.TenantEntity;
import es.hargos.tenantguard.entity.TenantMembershipEntity;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.exception.CouponNotRedeemableException;
import es.hargos.tenantguard.repository.CouponRepository;
import es.hargos.tenantguard.repository.TenantMembershipRepository;
import es.hargos.tenantguard.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Credit coupons: redemption for tenants and administration for platform admins.
 *
 * Redemption protocol:
 * 1. Pre-flight without locks: coupon exists and is redeemable, tenant exists, user is owner/admin
 * 2. Locked phase: fresh SELECT ... FOR UPDATE of the coupon, re-check, lock the tenant, credit and mark redeemed
 *
 * The coupon row lock makes redemption at-most-once: a concurrent attempt blocks on the
 * lock, then sees the redeemed row and fails.
 */
@Service
@RequiredArgsConstructor
public class CouponService {

    private static final Logger logger = LoggerFactory.getLogger(CouponService.class);

    static final String MSG_CODE_REQUIRED = "Coupon code is required";
    static final String MSG_NOT_FOUND = "Coupon not found";
    static final String MSG_INACTIVE = "Coupon is inactive";
    static final String MSG_EXPIRED = "Coupon has expired";
    static final String MSG_ALREADY_REDEEMED = "Coupon has already been redeemed";
    static final String MSG_TENANT_NOT_FOUND = "Tenant not found";
    static final String MSG_NOT_ADMIN = "Only tenant owners or admins can redeem coupons";

    private final CouponRepository couponRepository;
    private final TenantRepository tenantRepository;
    private final TenantMembershipRepository membershipRepository;
    private final SystemOperationService systemOps;

    /**
     * Redeem in a new transaction bound to the tenant and the redeeming user.
     */
    public RedeemCouponResult redeemCouponForTenant(String code, Long tenantId, Long userId) {
        if (code == null || code.isBlank()) {
            return RedeemCouponResult.failure(null, MSG_CODE_REQUIRED);
        }
        return systemOps.withTenantContext(tenantId,
                trx -> redeemCouponForTenant(code, tenantId, userId, trx), userId);
    }

    /**
     * Redeem inside the caller's transaction. Lookup and locked phase both run on {@code trx}.
     */
    public RedeemCouponResult redeemCouponForTenant(String code, Long tenantId, Long userId, ScopedTransaction trx) {
        trx.assertActive();
        String normalizedCode = CouponEntity.normalizeCode(code);
        if (normalizedCode == null || normalizedCode.isEmpty()) {
            return RedeemCouponResult.failure(null, MSG_CODE_REQUIRED);
        }

        Optional<CouponEntity> found = couponRepository.findByCode(normalizedCode);
        if (found.isEmpty()) {
            logger.warn("Coupon redemption rejected for tenant {}: code not found", tenantId);
            return RedeemCouponResult.failure(null, MSG_NOT_FOUND);
        }
        CouponEntity coupon = found.get();

        String notRedeemableReason = classifyNotRedeemable(coupon);
        if (notRedeemableReason != null) {
            logger.warn("Coupon {} rejected for tenant {}: {}", coupon.getCode(), tenantId, notRedeemableReason);
            return RedeemCouponResult.failure(coupon.getCurrency(), notRedeemableReason);
        }

        Optional<TenantEntity> tenantOpt = tenantRepository.findById(tenantId);
        if (tenantOpt.isEmpty()) {
            return RedeemCouponResult.failure(coupon.getCurrency(), MSG_TENANT_NOT_FOUND);
        }
        TenantEntity tenant = tenantOpt.get();

        boolean isAdmin = membershipRepository.findByTenantIdAndUserId(tenantId, userId)
                .map(TenantMembershipEntity::isAdminOrOwner)
                .orElse(false);
        if (!isAdmin) {
            logger.warn("User {} is not owner/admin of tenant {}, coupon redemption denied", userId, tenantId);
            return RedeemCouponResult.failure(coupon.getCurrency(), MSG_NOT_ADMIN);
        }

        try {
            return redeemLocked(coupon, tenant, userId, trx);
        } catch (CouponNotRedeemableException e) {
            // Lost the race to another redemption
            logger.warn("Coupon {} no longer redeemable after acquiring lock (tenant {})", coupon.getCode(), tenantId);
            return RedeemCouponResult.failure(coupon.getCurrency(), MSG_ALREADY_REDEEMED);
        }
    }

    /**
     * The locked re-read comes back empty when the row was deleted or is hidden by RLS;
     * both count as not redeemable.
     */
    private RedeemCouponResult redeemLocked(CouponEntity coupon, TenantEntity tenant, Long userId,
                                            ScopedTransaction trx) {
        CouponEntity locked = trx.reloadForUpdate(CouponEntity.class, coupon.getId(), coupon)
                .filter(CouponEntity::isRedeemable)
                .orElseThrow(() -> new CouponNotRedeemableException(coupon.getCode()));

        trx.lockForUpdate(tenant);
        locked.markRedeemed(tenant.getId(), userId);
        long newBalance = tenant.addCredit(locked.getCreditAmount(), locked.getCurrency());

        couponRepository.save(locked);
        tenantRepository.save(tenant);

        logger.info("Coupon {} redeemed for tenant {} by user {}: +{} {}, balance {}",
                locked.getCode(), tenant.getId(), userId, locked.getCreditAmount(), locked.getCurrency(), newBalance);
        return RedeemCouponResult.success(locked.getCreditAmount(), locked.getCurrency(), newBalance);
    }

    /**
     * @return the failure message, or null if the coupon is redeemable
     */
    static String classifyNotRedeemable(CouponEntity coupon) {
        if (coupon.isRedeemable()) {
            return null;
        }
        // Redeemed coupons are also inactive, so check redemption first
        if (coupon.isRedeemed()) {
            return MSG_ALREADY_REDEEMED;
        }
        if (!Boolean.TRUE.equals(coupon.getIsActive())) {
            return MSG_INACTIVE;
        }
        if (coupon.isExpired()) {
            return MSG_EXPIRED;
        }
        return MSG_ALREADY_REDEEMED;
    }

    public BalanceResponse getTenantBalance(Long tenantId, ScopedTransaction trx) {
        trx.assertActive();
        TenantEntity tenant = tenantRepository.findById(tenantId)
                .orElseThrow(() -> ApiErrorException.notFound(MSG_TENANT_NOT_FOUND));
        long balance = tenant.getBalance() != null ? tenant.getBalance() : 0L;
        String currency = tenant.getBalanceCurrency() != null
                ? tenant.getBalanceCurrency()
                : TenantEntity.DEFAULT_CURRENCY;
        return new BalanceResponse(balance, currency);
    }

    // ========== Administration ==========

    public List<CouponResponse> listCoupons(ScopedTransaction trx) {
        trx.assertActive();
        return couponRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(CouponResponse::from)
                .collect(Collectors.toList());
    }

    public CouponResponse getCoupon(Long id, ScopedTransaction trx) {
        trx.assertActive();
        return CouponResponse.from(findCoupon(id));
    }

    public CouponResponse createCoupon(CreateCouponRequest request, ScopedTransaction trx) {
        trx.assertActive();
        String code = CouponEntity.normalizeCode(request.getCode());
        if (code == null || code.isEmpty() || request.getCreditAmount() == null) {
            throw ApiErrorException.validation("code and creditAmount are required");
        }
        if (request.getCreditAmount() <= 0) {
            throw ApiErrorException.validation("creditAmount must be greater than 0");
        }
        if (couponRepository.existsByCode(code)) {
            throw ApiErrorException.conflict("A coupon with this code already exists");
        }

        CouponEntity coupon = CouponEntity.builder()
                .code(code)
                .description(request.getDescription())
                .creditAmount(request.getCreditAmount())
                .currency(normalizeCurrency(request.getCurrency()))
                .expiresAt(request.getExpiresAt())
                .isActive(request.getIsActive() != null ? request.getIsActive() : Boolean.TRUE)
                .build();

        CouponEntity saved = couponRepository.save(coupon);
        logger.info("Coupon {} created: {} {}", saved.getCode(), saved.getCreditAmount(), saved.getCurrency());
        return CouponResponse.from(saved);
    }

    /**
     * Redeemed coupons are immutable.
     */
    public CouponResponse updateCoupon(Long id, UpdateCouponRequest request, ScopedTransaction trx) {
        trx.assertActive();
        CouponEntity coupon = findCoupon(id);

        if (coupon.isRedeemed()) {
            throw ApiErrorException.validation("Cannot update a redeemed coupon");
        }

        if (request.getCode() != null) {
            String code = CouponEntity.normalizeCode(request.getCode());
            Optional<CouponEntity> existing = couponRepository.findByCode(code);
            if (existing.isPresent() && !existing.get().getId().equals(coupon.getId())) {
                throw ApiErrorException.conflict("A coupon with this code already exists");
            }
            coupon.setCode(code);
        }
        if (request.getDescription() != null) {
            coupon.setDescription(request.getDescription());
        }
        if (request.getCreditAmount() != null) {
            if (request.getCreditAmount() <= 0) {
                throw ApiErrorException.validation("creditAmount must be greater than 0");
            }
            coupon.setCreditAmount(request.getCreditAmount());
        }
        if (request.getCurrency() != null) {
            coupon.setCurrency(normalizeCurrency(request.getCurrency()));
        }
        if (Boolean.TRUE.equals(request.getClearExpiresAt())) {
            coupon.setExpiresAt(null);
        } else if (request.getExpiresAt() != null) {
            coupon.setExpiresAt(request.getExpiresAt());
        }
        if (request.getIsActive() != null) {
            coupon.setIsActive(request.getIsActive());
        }

        CouponEntity saved = couponRepository.save(coupon);
        logger.info("Coupon {} updated", saved.getCode());
        return CouponResponse.from(saved);
    }

    public void deleteCoupon(Long id, ScopedTransaction trx) {
        trx.assertActive();
        CouponEntity coupon = findCoupon(id);
        couponRepository.delete(coupon);
        logger.info("Coupon {} deleted", coupon.getCode());
    }

    private CouponEntity findCoupon(Long id) {
        return couponRepository.findById(id)
                .orElseThrow(() -> ApiErrorException.notFound(MSG_NOT_FOUND));
    }

    private static String normalizeCurrency(String currency) {
        if (currency == null || currency.isBlank()) {
            return TenantEntity.DEFAULT_CURRENCY;
        }
        return currency.trim().toLowerCase(Locale.ROOT);
    }
}
