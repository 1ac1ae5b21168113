package es.hargos.tenantguard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only usage record: which tenant used a discount code, and who performed the checkout.
 */
@Entity
@Table(name = "discount_code_usages", schema = "public")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscountCodeUsageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "discount_code_id", nullable = false)
    private Long discountCodeId;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "checkout_session_id")
    private String checkoutSessionId;

    @Column(name = "used_at", nullable = false)
    private LocalDateTime usedAt;

    @PrePersist
    protected void onCreate() {
        if (usedAt == null) {
            usedAt = LocalDateTime.now();
        }
    }
}
