package es.hargos.tenantguard.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * Authenticates bearer tokens.
 *
 * Flow:
 * 1. Extract JWT from the Authorization header
 * 2. Validate signature and expiration
 * 3. Set Spring Security authentication with an {@link AuthenticatedUser} principal
 *
 * Tenant resolution happens later in {@link TenantContextFilter}.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    static final String SUPER_ADMIN = "SUPER_ADMIN";

    private final JwtUtil jwtUtil;

    public JwtAuthenticationFilter(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String jwt = extractJwtFromRequest(request);

        if (jwt != null && jwtUtil.validateToken(jwt)) {
            authenticateUser(jwt, request);
        } else {
            log.debug("No valid JWT token found in request to {}", request.getRequestURI());
        }

        filterChain.doFilter(request, response);
    }

    private String extractJwtFromRequest(HttpServletRequest request) {
        String bearerToken = request.getHeader("Authorization");

        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }

        return null;
    }

    private void authenticateUser(String jwt, HttpServletRequest request) {
        Long userId = jwtUtil.getUserIdFromToken(jwt);
        if (userId == null || userId <= 0) {
            log.warn("JWT without a valid userId claim, request left unauthenticated");
            return;
        }

        boolean superAdmin = SUPER_ADMIN.equals(jwtUtil.extractGlobalRole(jwt));
        AuthenticatedUser principal = new AuthenticatedUser(userId, jwtUtil.getEmailFromToken(jwt), superAdmin);

        SimpleGrantedAuthority authority = new SimpleGrantedAuthority(superAdmin ? "ROLE_" + SUPER_ADMIN : "ROLE_USER");
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                Collections.singletonList(authority)
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        log.debug("User {} authenticated (superAdmin={})", userId, superAdmin);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/actuator") ||
               path.startsWith("/error");
    }
}
