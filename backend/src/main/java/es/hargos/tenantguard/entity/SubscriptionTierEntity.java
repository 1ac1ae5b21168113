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
 * Subscription tier catalog entry. Level 0 is the free tier.
 */
@Entity
@Table(name = "subscription_tiers", schema = "public")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionTierEntity {

    public static final String FREE_SLUG = "free";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 50)
    private String slug;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private Integer level;

    /**
     * NULL means unlimited members.
     */
    @Column(name = "max_team_members")
    private Integer maxTeamMembers;

    /**
     * Structured tier features, e.g. {"quotas": {"maxPendingInvitations": 20}}.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> features;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
