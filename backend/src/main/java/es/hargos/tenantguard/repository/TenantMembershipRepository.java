package es.hargos.tenantguard.repository;

import es.hargos.tenantguard.entity.TenantMembershipEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TenantMembershipRepository extends JpaRepository<TenantMembershipEntity, Long> {

    Optional<TenantMembershipEntity> findByTenantIdAndUserId(Long tenantId, Long userId);

    List<TenantMembershipEntity> findByTenantId(Long tenantId);

    long countByTenantId(Long tenantId);

    void deleteByTenantId(Long tenantId);
}
