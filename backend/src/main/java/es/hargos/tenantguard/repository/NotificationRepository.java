package es.hargos.tenantguard.repository;

import es.hargos.tenantguard.entity.NotificationEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Every query is double-scoped by (tenantId, recipientId).
 */
@Repository
public interface NotificationRepository extends JpaRepository<NotificationEntity, Long> {

    Optional<NotificationEntity> findByIdAndTenantIdAndRecipientId(Long id, Long tenantId, Long recipientId);

    List<NotificationEntity> findByTenantIdAndRecipientIdAndIdLessThanOrderByIdDesc(
            Long tenantId, Long recipientId, Long beforeId, Pageable pageable);

    List<NotificationEntity> findByTenantIdAndRecipientIdAndIdLessThanAndReadAtIsNullOrderByIdDesc(
            Long tenantId, Long recipientId, Long beforeId, Pageable pageable);

    long countByTenantIdAndRecipientIdAndReadAtIsNull(Long tenantId, Long recipientId);

    /**
     * @return number of rows that transitioned from unread to read
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE NotificationEntity n SET n.readAt = :readAt " +
           "WHERE n.tenantId = :tenantId AND n.recipientId = :recipientId AND n.readAt IS NULL")
    int markAllAsRead(@Param("tenantId") Long tenantId,
                      @Param("recipientId") Long recipientId,
                      @Param("readAt") LocalDateTime readAt);
}
