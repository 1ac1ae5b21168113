package es.hargos.tenantguard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Checkout discount code. Percent codes carry 0-100 in discountValue,
 * fixed codes carry minor units in their own currency.
 */
@Entity
@Table(name = "discount_codes", schema = "public")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscountCodeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Column(length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_type", nullable = false, length = 10)
    private DiscountType discountType;

    @Column(name = "discount_value", nullable = false)
    private Long discountValue;

    @Column(length = 3)
    private String currency;

    @Column(name = "min_amount")
    private Long minAmount;

    @Column(name = "max_uses")
    private Integer maxUses;

    @Column(name = "max_uses_per_tenant")
    private Integer maxUsesPerTenant;

    @Column(name = "times_used", nullable = false)
    @Builder.Default
    private Integer timesUsed = 0;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isExpired() {
        return expiresAt != null && LocalDateTime.now().isAfter(expiresAt);
    }

    public boolean hasReachedMaxUses() {
        return maxUses != null && timesUsed != null && timesUsed >= maxUses;
    }

    /**
     * Discount for an amount in minor units. Percent is rounded half-up, fixed is capped at the amount.
     */
    public long calculateDiscount(long amount) {
        if (discountType == DiscountType.PERCENT) {
            return Math.round(amount * discountValue / 100.0);
        }
        return Math.min(discountValue, amount);
    }

    @PrePersist
    protected void onCreate() {
        code = CouponEntity.normalizeCode(code);
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        code = CouponEntity.normalizeCode(code);
        updatedAt = LocalDateTime.now();
    }
}
