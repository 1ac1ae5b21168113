package es.hargos.tenantguard.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Amounts are minor units. On failure discountedAmount equals originalAmount.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidateDiscountCodeResult {

    private boolean valid;
    private Long discountCodeId;
    private String code;
    private long originalAmount;
    private long discountedAmount;
    private long discountApplied;
    private String message;

    public static ValidateDiscountCodeResult invalid(long originalAmount, String message) {
        return ValidateDiscountCodeResult.builder()
                .valid(false)
                .originalAmount(originalAmount)
                .discountedAmount(originalAmount)
                .discountApplied(0)
                .message(message)
                .build();
    }
}
