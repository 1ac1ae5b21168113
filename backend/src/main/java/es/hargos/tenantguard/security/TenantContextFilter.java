package es.hargos.tenantguard.security;

import es.hargos.tenantguard.context.RequestTenant;
import es.hargos.tenantguard.context.TenantContext;
import es.hargos.tenantguard.entity.TenantMembershipEntity;
import es.hargos.tenantguard.service.TenantMembershipService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves and verifies the tenant of an authenticated request.
 *
 * Flow:
 * 1. Read the tenant hint from the X-Tenant-ID header, else the tenant_id cookie
 * 2. Look up the membership (tenant, user) in the database under system context
 * 3. Publish the verified {@link RequestTenant} to {@link TenantContext}
 * 4. Clear the context after the request completes
 *
 * The hint is untrusted: access is granted only by the membership row.
 */
@Component
public class TenantContextFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TenantContextFilter.class);

    public static final String TENANT_HEADER = "X-Tenant-ID";
    public static final String TENANT_COOKIE = "tenant_id";

    private final TenantMembershipService membershipService;
    private final JsonErrorWriter errorWriter;

    public TenantContextFilter(TenantMembershipService membershipService, JsonErrorWriter errorWriter) {
        this.membershipService = membershipService;
        this.errorWriter = errorWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        AuthenticatedUser user = currentUser();
        if (user == null) {
            // Authorization rules reject the request further down the chain
            filterChain.doFilter(request, response);
            return;
        }

        Long tenantId = resolveTenantId(request);
        if (tenantId == null) {
            errorWriter.write(response, HttpStatus.BAD_REQUEST, "TenantRequired",
                    "A valid " + TENANT_HEADER + " header or " + TENANT_COOKIE + " cookie is required");
            return;
        }

        Optional<TenantMembershipEntity> membership = membershipService.findMembership(tenantId, user.getUserId());
        if (membership.isEmpty()) {
            log.warn("User {} denied access to tenant {}: not a member", user.getUserId(), tenantId);
            errorWriter.write(response, HttpStatus.FORBIDDEN, "Forbidden", "Not a member of this tenant");
            return;
        }

        TenantMembershipEntity m = membership.get();
        if (m.getTenantRole().isEmpty()) {
            // Unknown roles are denied by every RBAC check
            log.warn("Membership {} has unrecognized role '{}'", m.getId(), m.getRole());
        }

        TenantContext.setCurrentTenant(RequestTenant.builder()
                .tenantId(tenantId)
                .userId(user.getUserId())
                .membershipId(m.getId())
                .role(m.getTenantRole().orElse(null))
                .build());
        try {
            filterChain.doFilter(request, response);
        } finally {
            TenantContext.clear();
        }
    }

    /**
     * @return the hinted tenant id, or null if missing or not a positive number
     */
    static Long resolveTenantId(HttpServletRequest request) {
        String raw = request.getHeader(TENANT_HEADER);
        if (!StringUtils.hasText(raw) && request.getCookies() != null) {
            for (Cookie cookie : request.getCookies()) {
                if (TENANT_COOKIE.equals(cookie.getName())) {
                    raw = cookie.getValue();
                    break;
                }
            }
        }
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        try {
            long id = Long.parseLong(raw.trim());
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            log.debug("Invalid tenant hint: {}", raw);
            return null;
        }
    }

    private static AuthenticatedUser currentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser) {
            return (AuthenticatedUser) authentication.getPrincipal();
        }
        return null;
    }

    /**
     * Only tenant-scoped API routes. Platform admin routes are not tied to a tenant.
     */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !path.startsWith("/api/v1/") || path.startsWith("/api/v1/admin");
    }
}
