package es.hargos.tenantguard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A notification to deliver to one recipient of a tenant.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPayload {

    private Long tenantId;
    private Long recipientId;
    private String type;
    private String title;
    private String body;
    private String url;
    private Map<String, Object> meta;
    private String pluginId;
}
