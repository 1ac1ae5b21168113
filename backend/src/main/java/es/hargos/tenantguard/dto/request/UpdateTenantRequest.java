package es.hargos.tenantguard.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial tenant update (null = unchanged).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTenantRequest {

    @Size(min = 1, max = 255)
    private String name;

    public boolean hasAnyUpdate() {
        return name != null;
    }
}
