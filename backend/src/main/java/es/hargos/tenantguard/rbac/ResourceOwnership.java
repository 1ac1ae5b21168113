package es.hargos.tenantguard.rbac;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Ownership context for a resource check: who owns it and who is asking.
 */
@Data
@AllArgsConstructor(staticName = "of")
public class ResourceOwnership {

    private Long ownerId;

    private Long userId;

    /**
     * Missing ids never count as ownership.
     */
    public boolean isOwnedByRequester() {
        return ownerId != null && userId != null && ownerId.equals(userId);
    }
}
