package es.hargos.tenantguard.repository;

import es.hargos.tenantguard.entity.CouponEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CouponRepository extends JpaRepository<CouponEntity, Long> {

    /**
     * @param code already normalized to uppercase
     */
    Optional<CouponEntity> findByCode(String code);

    boolean existsByCode(String code);

    List<CouponEntity> findAllByOrderByCreatedAtDesc();
}
