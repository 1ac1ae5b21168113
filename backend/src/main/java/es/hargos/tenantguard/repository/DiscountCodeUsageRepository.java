package es.hargos.tenantguard.repository;

import es.hargos.tenantguard.entity.DiscountCodeUsageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DiscountCodeUsageRepository extends JpaRepository<DiscountCodeUsageEntity, Long> {

    long countByDiscountCodeIdAndTenantId(Long discountCodeId, Long tenantId);

    List<DiscountCodeUsageEntity> findByDiscountCodeIdOrderByUsedAtDesc(Long discountCodeId);

    List<DiscountCodeUsageEntity> findByTenantIdOrderByUsedAtDesc(Long tenantId);
}
