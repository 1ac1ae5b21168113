package es.hargos.tenantguard.controller;

import es.hargos.tenantguard.context.RequestTenant;
import es.hargos.tenantguard.context.TenantContext;
import es.hargos.tenantguard.dto.request.RedeemCouponRequest;
import es.hargos.tenantguard.dto.response.RedeemCouponResult;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.rbac.TenantRole;
import es.hargos.tenantguard.service.CouponService;
import es.hargos.tenantguard.service.DiscountCodeService;
import es.hargos.tenantguard.service.RateLimitService;
import es.hargos.tenantguard.service.SystemOperationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BillingController")
class BillingControllerTest {

    @Mock
    private CouponService couponService;

    @Mock
    private DiscountCodeService discountCodeService;

    @Mock
    private SystemOperationService systemOps;

    private RateLimitService rateLimitService;
    private BillingController controller;

    @BeforeEach
    void setUp() {
        rateLimitService = new RateLimitService(2, 1);
        controller = new BillingController(couponService, discountCodeService, rateLimitService, systemOps);
        TenantContext.setCurrentTenant(RequestTenant.builder()
                .tenantId(1L)
                .userId(5L)
                .membershipId(10L)
                .role(TenantRole.OWNER)
                .build());
    }

    @AfterEach
    void tearDown() {
        TenantContext.clear();
    }

    private static RedeemCouponRequest request(String code) {
        RedeemCouponRequest request = new RedeemCouponRequest();
        request.setCode(code);
        return request;
    }

    @Test
    @DisplayName("successful redemption wraps the result")
    @SuppressWarnings("unchecked")
    void success() {
        when(couponService.redeemCouponForTenant("WELCOME50", 1L, 5L))
                .thenReturn(RedeemCouponResult.success(5000, "usd", 5000));

        ResponseEntity<?> response = controller.redeemCoupon(request("WELCOME50"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = (Map<String, Object>) response.getBody();
        assertThat(body).containsEntry("message", "Coupon redeemed successfully");
        assertThat(((RedeemCouponResult) body.get("data")).getNewBalance()).isEqualTo(5000);
    }

    @Test
    @DisplayName("failed redemption is a 400 RedemptionError")
    @SuppressWarnings("unchecked")
    void failure() {
        when(couponService.redeemCouponForTenant("OLD", 1L, 5L))
                .thenReturn(RedeemCouponResult.failure("usd", "Coupon has expired"));

        ResponseEntity<?> response = controller.redeemCoupon(request("OLD"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat((Map<String, Object>) response.getBody())
                .containsEntry("error", "RedemptionError")
                .containsEntry("message", "Coupon has expired");
    }

    @Test
    @DisplayName("too many attempts are rejected before the coupon is looked up")
    void rateLimited() {
        when(couponService.redeemCouponForTenant("GUESS", 1L, 5L))
                .thenReturn(RedeemCouponResult.failure(null, "Coupon not found"));
        controller.redeemCoupon(request("GUESS"));
        controller.redeemCoupon(request("GUESS"));

        assertThatThrownBy(() -> controller.redeemCoupon(request("GUESS")))
                .isInstanceOf(ApiErrorException.class)
                .satisfies(ex -> assertThat(((ApiErrorException) ex).getStatus())
                        .isEqualTo(HttpStatus.TOO_MANY_REQUESTS));
        verifyNoInteractions(discountCodeService, systemOps);
    }
}
