package es.hargos.tenantguard.controller;

import es.hargos.tenantguard.context.RequestTenant;
import es.hargos.tenantguard.context.TenantContext;
import es.hargos.tenantguard.dto.QuotaSnapshot;
import es.hargos.tenantguard.dto.UpdateTenantQuotaInput;
import es.hargos.tenantguard.entity.TenantEntity;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.rbac.RequiresActions;
import es.hargos.tenantguard.rbac.TenantAction;
import es.hargos.tenantguard.service.SystemOperationService;
import es.hargos.tenantguard.service.TenantQuotaService;
import es.hargos.tenantguard.service.TenantService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Quotas of the current tenant.
 *
 * PUT accepts any subset of maxMembers, maxPendingInvitations, maxAuthTokensPerTenant,
 * maxAuthTokensPerUser. A positive integer sets the ceiling, null removes it, anything
 * else is ignored:
 * <pre>
 * { "maxPendingInvitations": 25, "maxAuthTokensPerUser": null }
 * </pre>
 */
@RestController
@RequestMapping("/api/v1/tenant/quotas")
public class TenantQuotaController {

    private final TenantService tenantService;
    private final TenantQuotaService quotaService;
    private final SystemOperationService systemOps;

    public TenantQuotaController(TenantService tenantService,
                                 TenantQuotaService quotaService,
                                 SystemOperationService systemOps) {
        this.tenantService = tenantService;
        this.quotaService = quotaService;
        this.systemOps = systemOps;
    }

    @GetMapping
    @RequiresActions(TenantAction.TENANT_READ)
    public ResponseEntity<QuotaSnapshot> getQuotas() {
        RequestTenant tenant = TenantContext.requireCurrentTenant();
        QuotaSnapshot snapshot = systemOps.withTenantContext(tenant.getTenantId(), trx -> {
            TenantEntity entity = tenantService.getTenant(tenant.getTenantId(), trx);
            return quotaService.getSnapshot(entity, tenant.getUserId(), trx);
        }, tenant.getUserId());
        return ResponseEntity.ok(snapshot);
    }

    @PutMapping
    @RequiresActions(TenantAction.TENANT_UPDATE)
    public ResponseEntity<QuotaSnapshot> updateQuotas(@RequestBody Map<String, Object> body) {
        UpdateTenantQuotaInput input = UpdateTenantQuotaInput.fromMap(body);
        if (!input.hasAnyUpdate()) {
            throw ApiErrorException.validation("No valid quota fields provided");
        }

        RequestTenant tenant = TenantContext.requireCurrentTenant();
        QuotaSnapshot snapshot = systemOps.withTenantContext(tenant.getTenantId(), trx -> {
            TenantEntity updated = tenantService.updateQuotas(tenant.getTenantId(), input, trx);
            return quotaService.getSnapshot(updated, tenant.getUserId(), trx);
        }, tenant.getUserId());
        return ResponseEntity.ok(snapshot);
    }
}
