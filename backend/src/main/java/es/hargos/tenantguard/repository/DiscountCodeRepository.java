package es.hargos.tenantguard.repository;

import es.hargos.tenantguard.entity.DiscountCodeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DiscountCodeRepository extends JpaRepository<DiscountCodeEntity, Long> {

    Optional<DiscountCodeEntity> findByCode(String code);
}
