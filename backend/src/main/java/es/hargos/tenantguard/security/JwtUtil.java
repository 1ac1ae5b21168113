package es.hargos.tenantguard.security;

import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Validates HMAC-signed bearer tokens and reads identity claims.
 * Tenant membership is NOT taken from the token: it is always verified against the database.
 */
@Component
public class JwtUtil {

    private static final Logger log = LoggerFactory.getLogger(JwtUtil.class);

    private final String jwtSecret;

    public JwtUtil(@Value("${jwt.secret}") String jwtSecret) {
        this.jwtSecret = jwtSecret;
    }

    /**
     * @return true if the signature verifies and the token is not expired
     */
    public boolean validateToken(String token) {
        try {
            SignedJWT signedJWT = SignedJWT.parse(token);
            JWSVerifier verifier = new MACVerifier(jwtSecret.getBytes(StandardCharsets.UTF_8));

            if (!signedJWT.verify(verifier)) {
                log.warn("JWT signature verification failed");
                return false;
            }

            Date expirationTime = signedJWT.getJWTClaimsSet().getExpirationTime();
            if (expirationTime == null || expirationTime.before(new Date())) {
                log.warn("JWT token expired");
                return false;
            }

            return true;
        } catch (Exception e) {
            log.warn("Rejected malformed JWT: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Extract user ID from token (without full validation)
     */
    public Long getUserIdFromToken(String token) {
        try {
            return SignedJWT.parse(token).getJWTClaimsSet().getLongClaim("userId");
        } catch (Exception e) {
            log.error("Error extracting user ID from JWT", e);
            return null;
        }
    }

    public String getEmailFromToken(String token) {
        try {
            JWTClaimsSet claims = SignedJWT.parse(token).getJWTClaimsSet();
            String email = claims.getStringClaim("email");
            return email != null ? email : claims.getSubject();
        } catch (Exception e) {
            log.error("Error extracting email from JWT", e);
            return null;
        }
    }

    /**
     * Platform-wide role such as SUPER_ADMIN, unrelated to any tenant.
     *
     * @return the role claim, or null if absent
     */
    public String extractGlobalRole(String token) {
        try {
            return SignedJWT.parse(token).getJWTClaimsSet().getStringClaim("role");
        } catch (Exception e) {
            log.debug("No global role found in JWT");
            return null;
        }
    }
}
