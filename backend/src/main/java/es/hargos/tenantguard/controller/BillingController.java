package es.hargos.tenantguard.controller;

import es.hargos.tenantguard.context.RequestTenant;
import es.hargos.tenantguard.context.TenantContext;
import es.hargos.tenantguard.dto.request.RedeemCouponRequest;
import es.hargos.tenantguard.dto.request.ValidateDiscountCodeRequest;
import es.hargos.tenantguard.dto.response.BalanceResponse;
import es.hargos.tenantguard.dto.response.RedeemCouponResult;
import es.hargos.tenantguard.dto.response.ValidateDiscountCodeResult;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.rbac.RequiresActions;
import es.hargos.tenantguard.rbac.TenantAction;
import es.hargos.tenantguard.service.CouponService;
import es.hargos.tenantguard.service.DiscountCodeService;
import es.hargos.tenantguard.service.RateLimitService;
import es.hargos.tenantguard.service.SystemOperationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tenant billing endpoints.
 *
 * Endpoints:
 * - POST /api/v1/billing/redeem-coupon           - Redeem a credit coupon (owner/admin)
 * - GET  /api/v1/billing/balance                 - Current credit balance
 * - POST /api/v1/billing/validate-discount-code  - Preview a discount for a price
 */
@RestController
@RequestMapping("/api/v1/billing")
public class BillingController {

    private final CouponService couponService;
    private final DiscountCodeService discountCodeService;
    private final RateLimitService rateLimitService;
    private final SystemOperationService systemOps;

    public BillingController(CouponService couponService,
                             DiscountCodeService discountCodeService,
                             RateLimitService rateLimitService,
                             SystemOperationService systemOps) {
        this.couponService = couponService;
        this.discountCodeService = discountCodeService;
        this.rateLimitService = rateLimitService;
        this.systemOps = systemOps;
    }

    /**
     * Owner/admin membership is checked by the redemption itself.
     * A failed redemption answers 400 with {error: "RedemptionError", message}.
     */
    @PostMapping("/redeem-coupon")
    public ResponseEntity<?> redeemCoupon(@Valid @RequestBody RedeemCouponRequest request) {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        requireRateLimit(RateLimitService.Operation.COUPON_REDEMPTION, tenant.getUserId());

        RedeemCouponResult result = couponService.redeemCouponForTenant(
                request.getCode(), tenant.getTenantId(), tenant.getUserId());

        if (!result.isSuccess()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "RedemptionError");
            body.put("message", result.getMessage());
            body.put("timestamp", System.currentTimeMillis());
            return ResponseEntity.badRequest().body(body);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("data", result);
        body.put("message", "Coupon redeemed successfully");
        return ResponseEntity.ok(body);
    }

    @GetMapping("/balance")
    @RequiresActions(TenantAction.BILLING_VIEW)
    public ResponseEntity<BalanceResponse> getBalance() {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        BalanceResponse balance = systemOps.withTenantContext(tenant.getTenantId(),
                trx -> couponService.getTenantBalance(tenant.getTenantId(), trx), tenant.getUserId());
        return ResponseEntity.ok(balance);
    }

    @PostMapping("/validate-discount-code")
    @RequiresActions(TenantAction.BILLING_VIEW)
    public ResponseEntity<ValidateDiscountCodeResult> validateDiscountCode(
            @Valid @RequestBody ValidateDiscountCodeRequest request) {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        requireRateLimit(RateLimitService.Operation.DISCOUNT_VALIDATION, tenant.getUserId());

        ValidateDiscountCodeResult result = systemOps.withTenantContext(tenant.getTenantId(),
                trx -> discountCodeService.validateCode(request.getCode(), request.getPriceId(),
                        tenant.getTenantId(), trx),
                tenant.getUserId());
        return ResponseEntity.ok(result);
    }

    private void requireRateLimit(RateLimitService.Operation operation, Long userId) {
        if (!rateLimitService.tryConsume(operation, userId)) {
            throw new ApiErrorException(HttpStatus.TOO_MANY_REQUESTS, "TooManyRequests",
                    "Too many attempts, please try again later");
        }
    }
}
