package es.hargos.tenantguard.controller;

import es.hargos.tenantguard.context.RequestTenant;
import es.hargos.tenantguard.context.TenantContext;
import es.hargos.tenantguard.dto.NotificationListOptions;
import es.hargos.tenantguard.dto.NotificationScope;
import es.hargos.tenantguard.dto.response.NotificationResponse;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.service.NotificationService;
import es.hargos.tenantguard.service.SystemOperationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Notifications of the current user in the current tenant. Membership is the only requirement.
 */
@RestController
@RequestMapping("/api/v1/notifications")
public class NotificationController {

    private final NotificationService notificationService;
    private final SystemOperationService systemOps;

    public NotificationController(NotificationService notificationService, SystemOperationService systemOps) {
        this.notificationService = notificationService;
        this.systemOps = systemOps;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(defaultValue = "false") boolean unreadOnly,
                                                    @RequestParam(required = false) Integer limit,
                                                    @RequestParam(required = false) Long beforeId) {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        NotificationListOptions options = NotificationListOptions.builder()
                .tenantId(tenant.getTenantId())
                .recipientId(tenant.getUserId())
                .unreadOnly(unreadOnly)
                .limit(limit)
                .beforeId(beforeId)
                .build();

        List<NotificationResponse> data = systemOps.withTenantContext(tenant.getTenantId(),
                trx -> notificationService.listForRecipient(options, trx).stream()
                        .map(NotificationResponse::from)
                        .collect(Collectors.toList()),
                tenant.getUserId());
        return ResponseEntity.ok(Map.of("data", data));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Object>> unreadCount() {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        long count = systemOps.withTenantContext(tenant.getTenantId(),
                trx -> notificationService.countUnreadForRecipient(scopeOf(tenant), trx),
                tenant.getUserId());
        return ResponseEntity.ok(Map.of("count", count));
    }

    /**
     * 404 for notifications of other recipients, same as for missing ones.
     */
    @PostMapping("/{id}/read")
    public ResponseEntity<NotificationResponse> markAsRead(@PathVariable Long id) {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        NotificationResponse response = systemOps.withTenantContext(tenant.getTenantId(),
                trx -> notificationService.markAsRead(id, scopeOf(tenant), trx)
                        .map(NotificationResponse::from)
                        .orElseThrow(() -> ApiErrorException.notFound("Notification not found")),
                tenant.getUserId());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/read-all")
    public ResponseEntity<Map<String, Object>> markAllAsRead() {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        int updated = systemOps.withTenantContext(tenant.getTenantId(),
                trx -> notificationService.markAllAsRead(scopeOf(tenant), trx),
                tenant.getUserId());
        return ResponseEntity.ok(Map.of("updated", updated));
    }

    private static NotificationScope scopeOf(RequestTenant tenant) {
        return NotificationScope.of(tenant.getTenantId(), tenant.getUserId());
    }
}
