package es.hargos.tenantguard.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import es.hargos.tenantguard.entity.TenantEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a coupon redemption. Failures carry creditAmount 0, newBalance 0 and a message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RedeemCouponResult {

    private boolean success;
    private long creditAmount;
    private String currency;
    private long newBalance;
    private String message;

    public static RedeemCouponResult success(long creditAmount, String currency, long newBalance) {
        return new RedeemCouponResult(true, creditAmount, currency, newBalance, null);
    }

    public static RedeemCouponResult failure(String currency, String message) {
        return new RedeemCouponResult(false, 0L,
                currency != null ? currency : TenantEntity.DEFAULT_CURRENCY, 0L, message);
    }
}
