package es.hargos.tenantguard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * One-shot credit coupon.
 *
 * States: active and unredeemed, then either redeemed (terminal) or
 * expired/inactive (derived, no explicit transition). Nothing leaves the redeemed state.
 */
@Entity
@Table(name = "coupons", schema = "public")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CouponEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Always stored uppercase.
     */
    @Column(nullable = false, unique = true, length = 50)
    private String code;

    @Column(length = 500)
    private String description;

    /**
     * Credit in minor units (cents).
     */
    @Column(name = "credit_amount", nullable = false)
    private Long creditAmount;

    @Column(nullable = false, length = 3)
    @Builder.Default
    private String currency = TenantEntity.DEFAULT_CURRENCY;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    /**
     * Who redeemed it (audit trail)
     */
    @Column(name = "redeemed_by_user_id")
    private Long redeemedByUserId;

    /**
     * Which tenant received the credit. Kept after the tenant is deleted.
     */
    @Column(name = "redeemed_for_tenant_id")
    private Long redeemedForTenantId;

    /**
     * Set once on redemption, never cleared.
     */
    @Column(name = "redeemed_at")
    private LocalDateTime redeemedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    public boolean isExpired() {
        return expiresAt != null && LocalDateTime.now().isAfter(expiresAt);
    }

    public boolean isRedeemed() {
        return redeemedAt != null;
    }

    public boolean isRedeemable() {
        return Boolean.TRUE.equals(isActive) && !isExpired() && !isRedeemed();
    }

    public void markRedeemed(Long tenantId, Long userId) {
        this.redeemedForTenantId = tenantId;
        this.redeemedByUserId = userId;
        this.redeemedAt = LocalDateTime.now();
        this.isActive = false;
    }

    @PrePersist
    protected void onCreate() {
        code = normalizeCode(code);
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        code = normalizeCode(code);
        updatedAt = LocalDateTime.now();
    }
}
