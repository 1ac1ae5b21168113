package es.hargos.tenantguard.service;

import es.hargos.tenantguard.context.ScopedTransaction;
import es.hargos.tenantguard.dto.NotificationListOptions;
import es.hargos.tenantguard.dto.NotificationPayload;
import es.hargos.tenantguard.dto.NotificationScope;
import es.hargos.tenantguard.entity.NotificationEntity;
import es.hargos.tenantguard.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tenant- and recipient-scoped notification store.
 *
 * Never opens its own transaction: every method runs on the caller's tenant-bound
 * {@link ScopedTransaction}. Notifications of another recipient are reported as
 * absent, never as forbidden.
 */
@Service
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final int defaultPageSize;
    private final int maxPageSize;

    public NotificationService(NotificationRepository notificationRepository,
                               @Value("${notifications.default-page-size:50}") int defaultPageSize,
                               @Value("${notifications.max-page-size:100}") int maxPageSize) {
        this.notificationRepository = notificationRepository;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    public NotificationEntity send(NotificationPayload payload, ScopedTransaction trx) {
        requireSameTenant(payload.getTenantId(), trx);

        NotificationEntity notification = NotificationEntity.builder()
                .tenantId(payload.getTenantId())
                .recipientId(payload.getRecipientId())
                .pluginId(payload.getPluginId())
                .type(payload.getType())
                .title(payload.getTitle())
                .body(payload.getBody())
                .url(payload.getUrl())
                .meta(payload.getMeta())
                .build();

        NotificationEntity saved = notificationRepository.save(notification);
        logger.debug("Notification {} ({}) sent to user {} in tenant {}",
                saved.getId(), saved.getType(), saved.getRecipientId(), saved.getTenantId());
        return saved;
    }

    public List<NotificationEntity> sendBatch(List<NotificationPayload> payloads, ScopedTransaction trx) {
        trx.requireTenantId();
        List<NotificationEntity> sent = new ArrayList<>(payloads.size());
        for (NotificationPayload payload : payloads) {
            sent.add(send(payload, trx));
        }
        return sent;
    }

    public List<NotificationEntity> listForRecipient(NotificationListOptions options, ScopedTransaction trx) {
        trx.assertActive();
        Pageable page = PageRequest.of(0, effectiveLimit(options.getLimit()));
        long beforeId = options.getBeforeId() != null ? options.getBeforeId() : Long.MAX_VALUE;

        if (options.isUnreadOnly()) {
            return notificationRepository.findByTenantIdAndRecipientIdAndIdLessThanAndReadAtIsNullOrderByIdDesc(
                    options.getTenantId(), options.getRecipientId(), beforeId, page);
        }
        return notificationRepository.findByTenantIdAndRecipientIdAndIdLessThanOrderByIdDesc(
                options.getTenantId(), options.getRecipientId(), beforeId, page);
    }

    public Optional<NotificationEntity> findForRecipient(Long notificationId, NotificationScope scope,
                                                         ScopedTransaction trx) {
        trx.assertActive();
        return notificationRepository.findByIdAndTenantIdAndRecipientId(
                notificationId, scope.getTenantId(), scope.getRecipientId());
    }

    /**
     * Idempotent: an already read notification keeps its original readAt.
     *
     * @return the notification, or empty if it is not visible to the recipient
     */
    public Optional<NotificationEntity> markAsRead(Long notificationId, NotificationScope scope,
                                                   ScopedTransaction trx) {
        Optional<NotificationEntity> found = findForRecipient(notificationId, scope, trx);
        found.filter(notification -> !notification.isRead())
                .ifPresent(notification -> {
                    notification.setReadAt(LocalDateTime.now());
                    notificationRepository.save(notification);
                });
        return found;
    }

    /**
     * @return number of notifications that were unread before this call
     */
    public int markAllAsRead(NotificationScope scope, ScopedTransaction trx) {
        trx.assertActive();
        int updated = notificationRepository.markAllAsRead(
                scope.getTenantId(), scope.getRecipientId(), LocalDateTime.now());
        if (updated > 0) {
            logger.debug("Marked {} notifications read for user {} in tenant {}",
                    updated, scope.getRecipientId(), scope.getTenantId());
        }
        return updated;
    }

    public long countUnreadForRecipient(NotificationScope scope, ScopedTransaction trx) {
        trx.assertActive();
        return notificationRepository.countByTenantIdAndRecipientIdAndReadAtIsNull(
                scope.getTenantId(), scope.getRecipientId());
    }

    int effectiveLimit(Integer requested) {
        if (requested == null || requested < 1) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }

    private static void requireSameTenant(Long payloadTenantId, ScopedTransaction trx) {
        Long boundTenant = trx.requireTenantId();
        if (!boundTenant.equals(payloadTenantId)) {
            throw new IllegalArgumentException("Notification tenant " + payloadTenantId
                    + " does not match transaction tenant " + boundTenant);
        }
    }
}
