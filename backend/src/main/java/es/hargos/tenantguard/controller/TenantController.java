package es.hargos.tenantguard.controller;

import es.hargos.tenantguard.context.RequestTenant;
import es.hargos.tenantguard.context.TenantContext;
import es.hargos.tenantguard.dto.request.UpdateTenantRequest;
import es.hargos.tenantguard.dto.response.TenantResponse;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.rbac.RbacGuard;
import es.hargos.tenantguard.rbac.RbacService;
import es.hargos.tenantguard.rbac.RequiresActions;
import es.hargos.tenantguard.rbac.TenantAction;
import es.hargos.tenantguard.service.SystemOperationService;
import es.hargos.tenantguard.service.TenantService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Current tenant (resolved from X-Tenant-ID).
 *
 * Endpoints:
 * - GET    /api/v1/tenant - Tenant details
 * - PUT    /api/v1/tenant - Partial update (tenant:update, or the tenant owner)
 * - DELETE /api/v1/tenant - Delete the tenant (owner only)
 */
@RestController
@RequestMapping("/api/v1/tenant")
public class TenantController {

    private static final Logger logger = LoggerFactory.getLogger(TenantController.class);

    private final TenantService tenantService;
    private final RbacService rbacService;
    private final SystemOperationService systemOps;

    public TenantController(TenantService tenantService, RbacService rbacService, SystemOperationService systemOps) {
        this.tenantService = tenantService;
        this.rbacService = rbacService;
        this.systemOps = systemOps;
    }

    @GetMapping
    @RequiresActions(TenantAction.TENANT_READ)
    public ResponseEntity<TenantResponse> getTenant() {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        TenantResponse response = systemOps.withTenantContext(tenant.getTenantId(),
                trx -> TenantResponse.from(tenantService.getTenant(tenant.getTenantId(), trx)),
                tenant.getUserId());
        return ResponseEntity.ok(response);
    }

    /**
     * The tenant owner passes through ownership even without the role permission.
     */
    @PutMapping
    public ResponseEntity<TenantResponse> updateTenant(@Valid @RequestBody UpdateTenantRequest request) {
        if (!request.hasAnyUpdate()) {
            throw ApiErrorException.validation("No fields to update");
        }
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        RbacGuard guard = new RbacGuard(rbacService, tenant);

        TenantResponse response = systemOps.withTenantContext(tenant.getTenantId(), trx -> {
            Long ownerId = tenantService.getTenant(tenant.getTenantId(), trx).getOwnerId();
            guard.authorizeOrOwns(TenantAction.TENANT_UPDATE, ownerId);
            return TenantResponse.from(tenantService.updateTenant(tenant.getTenantId(), request, trx));
        }, tenant.getUserId());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping
    @RequiresActions(TenantAction.TENANT_DELETE)
    public ResponseEntity<?> deleteTenant() {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        systemOps.withTenantContext(tenant.getTenantId(), trx -> {
            tenantService.deleteTenant(tenant.getTenantId(), tenant.getUserId(), trx);
            return null;
        }, tenant.getUserId());

        logger.info("Tenant {} deleted via API", tenant.getTenantId());
        return ResponseEntity.ok(Map.of("message", "Tenant deleted successfully"));
    }
}
