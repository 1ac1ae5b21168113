package es.hargos.tenantguard.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidateDiscountCodeRequest {

    @NotBlank(message = "Discount code is required")
    private String code;

    @NotNull(message = "priceId is required")
    @Positive
    private Long priceId;
}
