package es.hargos.tenantguard.entity;

import es.hargos.tenantguard.rbac.TenantRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Membership of a user in a tenant. Unique on (tenant_id, user_id).
 */
@Entity
@Table(name = "tenant_memberships", schema = "public",
        uniqueConstraints = @UniqueConstraint(columnNames = {"tenant_id", "user_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantMembershipEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private Long tenantId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /**
     * Raw role value as stored. Parsed into {@link TenantRole} at the boundary.
     */
    @Column(nullable = false, length = 20)
    private String role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public Optional<TenantRole> getTenantRole() {
        return TenantRole.fromValue(role);
    }

    public boolean isAdminOrOwner() {
        return getTenantRole().map(TenantRole::isAdmin).orElse(false);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
