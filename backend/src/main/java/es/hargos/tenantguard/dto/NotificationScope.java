package es.hargos.tenantguard.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Lookup scope: a notification is only visible to its own (tenant, recipient).
 */
@Data
@AllArgsConstructor(staticName = "of")
public class NotificationScope {

    private final Long tenantId;
    private final Long recipientId;
}
