package es.hargos.tenantguard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Tenant entity - the billing and isolation unit.
 * Rows are protected by RLS: visible only to members of the bound tenant or to system context.
 */
@Entity
@Table(name = "tenants", schema = "public")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantEntity {

    public static final String DEFAULT_CURRENCY = "usd";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true, length = 100)
    private String slug;

    /**
     * "personal" or "team"
     */
    @Column(nullable = false, length = 20)
    @Builder.Default
    private String type = "team";

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    /**
     * Explicit member ceiling. NULL defers to the subscription tier.
     */
    @Column(name = "max_members")
    private Integer maxMembers;

    /**
     * Per-tenant quota overrides keyed by metric name.
     * A positive integer is a ceiling, an explicit JSON null means unlimited.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "quota_overrides", columnDefinition = "jsonb")
    private Map<String, Object> quotaOverrides;

    /**
     * Credit balance in minor units (cents).
     */
    @Column(nullable = false)
    @Builder.Default
    private Long balance = 0L;

    @Column(name = "balance_currency", length = 3)
    private String balanceCurrency;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Add credit to the balance. A tenant without a currency adopts the credited one.
     *
     * @return the new balance
     */
    public long addCredit(long amount, String currency) {
        long current = balance != null ? balance : 0L;
        balance = current + amount;
        if (balanceCurrency == null || balanceCurrency.isEmpty()) {
            balanceCurrency = currency != null && !currency.isEmpty() ? currency : DEFAULT_CURRENCY;
        }
        return balance;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
