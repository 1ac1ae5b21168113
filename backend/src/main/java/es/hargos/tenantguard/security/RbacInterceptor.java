package es.hargos.tenantguard.security;

import es.hargos.tenantguard.context.RequestTenant;
import es.hargos.tenantguard.context.TenantContext;
import es.hargos.tenantguard.rbac.RbacService;
import es.hargos.tenantguard.rbac.RequiresActions;
import es.hargos.tenantguard.rbac.TenantAction;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Enforces {@link RequiresActions} on controller methods (or their class) before the handler runs.
 * Denials answer 403 with every denied action listed.
 */
@Component
public class RbacInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RbacInterceptor.class);

    private final RbacService rbacService;
    private final JsonErrorWriter errorWriter;

    public RbacInterceptor(RbacService rbacService, JsonErrorWriter errorWriter) {
        this.rbacService = rbacService;
        this.errorWriter = errorWriter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        RequiresActions required = findAnnotation((HandlerMethod) handler);
        if (required == null) {
            return true;
        }

        RequestTenant tenant = TenantContext.getCurrentTenant();
        if (tenant == null) {
            log.error("RBAC check on {} without tenant context", request.getRequestURI());
            errorWriter.write(response, HttpStatus.INTERNAL_SERVER_ERROR, "ConfigurationError",
                    "RBAC check requires tenant context");
            return false;
        }

        List<TenantAction> denied = rbacService.getDeniedActions(tenant.getRole(), Arrays.asList(required.value()));
        if (denied.isEmpty()) {
            return true;
        }

        if (denied.stream().anyMatch(rbacService::isSensitiveAction)) {
            log.warn("Sensitive action denied: user={}, tenant={}, role={}, actions={}",
                    tenant.getUserId(), tenant.getTenantId(), tenant.getRole(), denied);
        } else {
            log.debug("Action denied: user={}, tenant={}, actions={}", tenant.getUserId(), tenant.getTenantId(), denied);
        }

        errorWriter.write(response, HttpStatus.FORBIDDEN, "RbacDenied",
                "You do not have permission to perform this action",
                Map.of("deniedActions", denied.stream().map(TenantAction::getValue).collect(Collectors.toList())));
        return false;
    }

    private static RequiresActions findAnnotation(HandlerMethod handlerMethod) {
        RequiresActions onMethod = AnnotatedElementUtils.findMergedAnnotation(
                handlerMethod.getMethod(), RequiresActions.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(handlerMethod.getBeanType(), RequiresActions.class);
    }
}
