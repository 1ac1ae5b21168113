package es.hargos.tenantguard.controller;

import es.hargos.tenantguard.dto.QuotaSnapshot;
import es.hargos.tenantguard.dto.UpdateTenantQuotaInput;
import es.hargos.tenantguard.dto.request.CreateCouponRequest;
import es.hargos.tenantguard.dto.request.UpdateCouponRequest;
import es.hargos.tenantguard.dto.response.CouponResponse;
import es.hargos.tenantguard.entity.TenantEntity;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.service.CouponService;
import es.hargos.tenantguard.service.SystemOperationService;
import es.hargos.tenantguard.service.TenantQuotaService;
import es.hargos.tenantguard.service.TenantService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Platform administration (SUPER_ADMIN only, enforced by SecurityConfig).
 * Not tenant-scoped: coupons run under system context, tenant quotas under the target tenant's context.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class InternalAdminController {

    private static final Logger logger = LoggerFactory.getLogger(InternalAdminController.class);

    private final CouponService couponService;
    private final TenantService tenantService;
    private final TenantQuotaService quotaService;
    private final SystemOperationService systemOps;

    public InternalAdminController(CouponService couponService,
                                   TenantService tenantService,
                                   TenantQuotaService quotaService,
                                   SystemOperationService systemOps) {
        this.couponService = couponService;
        this.tenantService = tenantService;
        this.quotaService = quotaService;
        this.systemOps = systemOps;
    }

    @GetMapping("/coupons")
    public ResponseEntity<Map<String, Object>> listCoupons() {
        List<CouponResponse> coupons = systemOps.withSystemContext(couponService::listCoupons);
        return ResponseEntity.ok(Map.of("data", coupons));
    }

    @GetMapping("/coupons/{id}")
    public ResponseEntity<Map<String, Object>> getCoupon(@PathVariable Long id) {
        CouponResponse coupon = systemOps.withSystemContext(trx -> couponService.getCoupon(id, trx));
        return ResponseEntity.ok(Map.of("data", coupon));
    }

    @PostMapping("/coupons")
    public ResponseEntity<Map<String, Object>> createCoupon(@Valid @RequestBody CreateCouponRequest request) {
        CouponResponse coupon = systemOps.withSystemContext(trx -> couponService.createCoupon(request, trx));
        return ResponseEntity.status(HttpStatus.CREATED).body(withMessage(coupon, "Coupon created successfully"));
    }

    @PutMapping("/coupons/{id}")
    public ResponseEntity<Map<String, Object>> updateCoupon(@PathVariable Long id,
                                                            @Valid @RequestBody UpdateCouponRequest request) {
        if (!request.hasAnyUpdate()) {
            throw ApiErrorException.validation("No fields to update");
        }
        CouponResponse coupon = systemOps.withSystemContext(trx -> couponService.updateCoupon(id, request, trx));
        return ResponseEntity.ok(withMessage(coupon, "Coupon updated successfully"));
    }

    @DeleteMapping("/coupons/{id}")
    public ResponseEntity<Map<String, Object>> deleteCoupon(@PathVariable Long id) {
        systemOps.withSystemContext(trx -> {
            couponService.deleteCoupon(id, trx);
            return null;
        });
        return ResponseEntity.ok(Map.of("message", "Coupon deleted successfully"));
    }

    /**
     * Same body as PUT /api/v1/tenant/quotas, for any tenant.
     */
    @PutMapping("/tenants/{tenantId}/quotas")
    public ResponseEntity<QuotaSnapshot> updateTenantQuotas(@PathVariable Long tenantId,
                                                            @RequestBody Map<String, Object> body) {
        if (tenantId == null || tenantId <= 0) {
            throw ApiErrorException.notFound("Tenant not found");
        }
        UpdateTenantQuotaInput input = UpdateTenantQuotaInput.fromMap(body);
        if (!input.hasAnyUpdate()) {
            throw ApiErrorException.validation("No valid quota fields provided");
        }

        QuotaSnapshot snapshot = systemOps.withTenantContext(tenantId, trx -> {
            TenantEntity updated = tenantService.updateQuotas(tenantId, input, trx);
            return quotaService.getSnapshot(updated, updated.getOwnerId(), trx);
        });
        logger.info("Admin updated quotas for tenant {}", tenantId);
        return ResponseEntity.ok(snapshot);
    }

    private static Map<String, Object> withMessage(Object data, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("data", data);
        response.put("message", message);
        return response;
    }
}
