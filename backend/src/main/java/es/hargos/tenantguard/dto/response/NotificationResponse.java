package es.hargos.tenantguard.dto.response;

import es.hargos.tenantguard.entity.NotificationEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationResponse {

    private Long id;
    private String pluginId;
    private String type;
    private String title;
    private String body;
    private String url;
    private Map<String, Object> meta;
    private LocalDateTime readAt;
    private LocalDateTime createdAt;

    public static NotificationResponse from(NotificationEntity notification) {
        return NotificationResponse.builder()
                .id(notification.getId())
                .pluginId(notification.getPluginId())
                .type(notification.getType())
                .title(notification.getTitle())
                .body(notification.getBody())
                .url(notification.getUrl())
                .meta(notification.getMeta())
                .readAt(notification.getReadAt())
                .createdAt(notification.getCreatedAt())
                .build();
    }
}
