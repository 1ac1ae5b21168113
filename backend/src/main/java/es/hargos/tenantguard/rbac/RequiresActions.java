package es.hargos.tenantguard.rbac;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Route-level RBAC requirement, enforced by {@link RbacInterceptor}.
 * All listed actions must be allowed for the caller's tenant role.
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface RequiresActions {

    TenantAction[] value();
}
