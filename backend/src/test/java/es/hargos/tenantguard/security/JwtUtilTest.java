package es.hargos.tenantguard.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JwtUtil")
class JwtUtilTest {

    private static final String SECRET = "test-secret-key-that-is-at-least-32-bytes-long";

    private final JwtUtil jwtUtil = new JwtUtil(SECRET);

    private static String token(String secret, Date expiresAt) throws JOSEException {
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject("ana@example.com")
                .claim("userId", 42L)
                .claim("role", "SUPER_ADMIN")
                .expirationTime(expiresAt)
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        jwt.sign(new MACSigner(secret.getBytes(StandardCharsets.UTF_8)));
        return jwt.serialize();
    }

    @Test
    @DisplayName("valid token exposes its identity claims")
    void validToken() throws Exception {
        String token = token(SECRET, new Date(System.currentTimeMillis() + 60_000));

        assertThat(jwtUtil.validateToken(token)).isTrue();
        assertThat(jwtUtil.getUserIdFromToken(token)).isEqualTo(42L);
        assertThat(jwtUtil.getEmailFromToken(token)).isEqualTo("ana@example.com");
        assertThat(jwtUtil.extractGlobalRole(token)).isEqualTo("SUPER_ADMIN");
    }

    @Test
    @DisplayName("expired token is rejected")
    void expired() throws Exception {
        String token = token(SECRET, new Date(System.currentTimeMillis() - 60_000));

        assertThat(jwtUtil.validateToken(token)).isFalse();
    }

    @Test
    @DisplayName("token signed with another key is rejected")
    void wrongKey() throws Exception {
        String token = token("another-secret-key-that-is-also-32-bytes-long!", new Date(System.currentTimeMillis() + 60_000));

        assertThat(jwtUtil.validateToken(token)).isFalse();
    }

    @Test
    @DisplayName("garbage is rejected, not thrown")
    void garbage() {
        assertThat(jwtUtil.validateToken("not-a-jwt")).isFalse();
        assertThat(jwtUtil.getUserIdFromToken("not-a-jwt")).isNull();
    }
}
