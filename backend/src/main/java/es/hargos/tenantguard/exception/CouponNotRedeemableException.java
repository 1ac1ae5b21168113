package es.hargos.tenantguard.exception;

/**
 * Thrown inside the locked redemption phase when the re-read coupon row
 * is no longer redeemable. Rolls back the surrounding transaction.
 */
public class CouponNotRedeemableException extends RuntimeException {

    public CouponNotRedeemableException(String code) {
        super("Coupon is not redeemable: " + code);
    }
}
