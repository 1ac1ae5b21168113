package es.hargos.tenantguard.dto.request;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Partial coupon update. Every field is optional (null = unchanged).
 * Use clearExpiresAt to remove an expiry date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateCouponRequest {

    @Size(min = 1, max = 50)
    private String code;

    @Size(max = 500)
    private String description;

    @Positive(message = "creditAmount must be greater than 0")
    private Long creditAmount;

    @Size(min = 3, max = 3)
    private String currency;

    private LocalDateTime expiresAt;

    private Boolean clearExpiresAt;

    private Boolean isActive;

    public boolean hasAnyUpdate() {
        return code != null || description != null || creditAmount != null || currency != null
                || expiresAt != null || Boolean.TRUE.equals(clearExpiresAt) || isActive != null;
    }
}
