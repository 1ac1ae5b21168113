package es.hargos.tenantguard.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CouponEntity")
class CouponEntityTest {

    @Test
    @DisplayName("codes are trimmed and uppercased")
    void normalizeCode() {
        assertThat(CouponEntity.normalizeCode("  welcome50 ")).isEqualTo("WELCOME50");
        assertThat(CouponEntity.normalizeCode(null)).isNull();
    }

    @Test
    @DisplayName("redeeming is terminal and deactivates the coupon")
    void markRedeemed() {
        CouponEntity coupon = CouponEntity.builder().code("X").creditAmount(100L).build();
        assertThat(coupon.isRedeemable()).isTrue();

        coupon.markRedeemed(1L, 5L);

        assertThat(coupon.isRedeemed()).isTrue();
        assertThat(coupon.isRedeemable()).isFalse();
        assertThat(coupon.getIsActive()).isFalse();

        coupon.setIsActive(true);
        assertThat(coupon.isRedeemable()).isFalse();
    }

    @Test
    @DisplayName("redemption is tracked by the redemption time, not the tenant reference")
    void redeemedWithoutTenant() {
        CouponEntity coupon = CouponEntity.builder().code("X").creditAmount(100L).build();
        coupon.markRedeemed(1L, 5L);
        coupon.setRedeemedForTenantId(null);
        coupon.setIsActive(true);

        assertThat(coupon.isRedeemed()).isTrue();
        assertThat(coupon.isRedeemable()).isFalse();
    }

    @Test
    @DisplayName("expiry in the past makes the coupon unredeemable")
    void expired() {
        CouponEntity coupon = CouponEntity.builder()
                .code("X")
                .creditAmount(100L)
                .expiresAt(LocalDateTime.now().minusSeconds(1))
                .build();

        assertThat(coupon.isExpired()).isTrue();
        assertThat(coupon.isRedeemable()).isFalse();
    }
}
