package es.hargos.tenantguard.dto.response;

import es.hargos.tenantguard.entity.CouponEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CouponResponse {

    private Long id;
    private String code;
    private String description;
    private Long creditAmount;
    private String currency;
    private LocalDateTime expiresAt;
    private Boolean isActive;
    private Long redeemedByUserId;
    private Long redeemedForTenantId;
    private LocalDateTime redeemedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static CouponResponse from(CouponEntity coupon) {
        return CouponResponse.builder()
                .id(coupon.getId())
                .code(coupon.getCode())
                .description(coupon.getDescription())
                .creditAmount(coupon.getCreditAmount())
                .currency(coupon.getCurrency())
                .expiresAt(coupon.getExpiresAt())
                .isActive(coupon.getIsActive())
                .redeemedByUserId(coupon.getRedeemedByUserId())
                .redeemedForTenantId(coupon.getRedeemedForTenantId())
                .redeemedAt(coupon.getRedeemedAt())
                .createdAt(coupon.getCreatedAt())
                .updatedAt(coupon.getUpdatedAt())
                .build();
    }
}
