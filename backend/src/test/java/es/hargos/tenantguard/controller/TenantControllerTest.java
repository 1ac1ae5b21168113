package es.hargos.tenantguard.controller;

import es.hargos.tenantguard.context.RequestTenant;
import es.hargos.tenantguard.context.ScopedTransaction;
import es.hargos.tenantguard.context.TenantContext;
import es.hargos.tenantguard.dto.request.UpdateTenantRequest;
import es.hargos.tenantguard.dto.response.TenantResponse;
import es.hargos.tenantguard.entity.TenantEntity;
import es.hargos.tenantguard.exception.ApiErrorException;
import es.hargos.tenantguard.rbac.RbacDeniedException;
import es.hargos.tenantguard.rbac.RbacService;
import es.hargos.tenantguard.rbac.TenantAction;
import es.hargos.tenantguard.rbac.TenantRole;
import es.hargos.tenantguard.service.SystemOperationService;
import es.hargos.tenantguard.service.TenantService;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TenantController")
class TenantControllerTest {

    private static final long TENANT_ID = 1L;
    private static final long OWNER_ID = 5L;

    @Mock
    private TenantService tenantService;

    @Mock
    private SystemOperationService systemOps;

    private TenantController controller;
    private ScopedTransaction trx;

    @BeforeEach
    void setUp() {
        controller = new TenantController(tenantService, new RbacService(), systemOps);
        trx = ScopedTransaction.forTenant(mock(EntityManager.class), TENANT_ID, OWNER_ID);
    }

    @AfterEach
    void tearDown() {
        TenantContext.clear();
    }

    private static void bind(long userId, TenantRole role) {
        TenantContext.setCurrentTenant(RequestTenant.builder()
                .tenantId(TENANT_ID)
                .userId(userId)
                .membershipId(10L)
                .role(role)
                .build());
    }

    @SuppressWarnings("unchecked")
    private void runCallbacksInline(long userId) {
        when(systemOps.withTenantContext(eq(TENANT_ID), any(Function.class), eq(userId)))
                .thenAnswer(inv -> ((Function<ScopedTransaction, Object>) inv.getArgument(1)).apply(trx));
    }

    private static TenantEntity tenant() {
        return TenantEntity.builder().id(TENANT_ID).name("Acme").slug("acme").ownerId(OWNER_ID).build();
    }

    private static UpdateTenantRequest rename(String name) {
        UpdateTenantRequest request = new UpdateTenantRequest();
        request.setName(name);
        return request;
    }

    @Test
    @DisplayName("tenant owner may update through ownership even as a viewer")
    void ownerUpdates() {
        bind(OWNER_ID, TenantRole.VIEWER);
        runCallbacksInline(OWNER_ID);
        UpdateTenantRequest request = rename("Acme Inc");
        TenantEntity renamed = tenant();
        renamed.setName("Acme Inc");
        when(tenantService.getTenant(TENANT_ID, trx)).thenReturn(tenant());
        when(tenantService.updateTenant(TENANT_ID, request, trx)).thenReturn(renamed);

        TenantResponse response = controller.updateTenant(request).getBody();

        assertThat(response.getName()).isEqualTo("Acme Inc");
    }

    @Test
    @DisplayName("viewer who does not own the tenant is denied before any write")
    void viewerDenied() {
        bind(9L, TenantRole.VIEWER);
        runCallbacksInline(9L);
        UpdateTenantRequest request = rename("Hijacked");
        when(tenantService.getTenant(TENANT_ID, trx)).thenReturn(tenant());

        assertThatThrownBy(() -> controller.updateTenant(request))
                .isInstanceOf(RbacDeniedException.class)
                .satisfies(ex -> assertThat(((RbacDeniedException) ex).getDeniedActions())
                        .containsExactly(TenantAction.TENANT_UPDATE));
        verify(tenantService, never()).updateTenant(any(), any(), any());
    }

    @Test
    @DisplayName("empty update is a validation error")
    void emptyUpdate() {
        assertThatThrownBy(() -> controller.updateTenant(new UpdateTenantRequest()))
                .isInstanceOf(ApiErrorException.class)
                .hasMessage("No fields to update");
        verifyNoInteractions(systemOps);
    }

    @Test
    @DisplayName("delete runs in the caller's tenant context")
    void delete() {
        bind(OWNER_ID, TenantRole.OWNER);
        runCallbacksInline(OWNER_ID);

        controller.deleteTenant();

        verify(tenantService).deleteTenant(TENANT_ID, OWNER_ID, trx);
    }
}
