package es.hargos.tenantguard.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Coupon creation by a platform admin.
 *
 * <pre>
 * {
 *   "code": "WELCOME50",
 *   "creditAmount": 5000,
 *   "currency": "usd"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCouponRequest {

    @NotBlank(message = "code is required")
    @Size(max = 50)
    private String code;

    @Size(max = 500)
    private String description;

    /**
     * Minor units (cents)
     */
    @NotNull(message = "creditAmount is required")
    @Positive(message = "creditAmount must be greater than 0")
    private Long creditAmount;

    /**
     * Defaults to usd
     */
    @Size(min = 3, max = 3)
    private String currency;

    private LocalDateTime expiresAt;

    private Boolean isActive;
}
