package es.hargos.tenantguard.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Keyset-paginated listing, newest first.
 * beforeId is an exclusive cursor. A null limit uses the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationListOptions {

    private Long tenantId;
    private Long recipientId;
    private boolean unreadOnly;
    private Integer limit;
    private Long beforeId;
}
