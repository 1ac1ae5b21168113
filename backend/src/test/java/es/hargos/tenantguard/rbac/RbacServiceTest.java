package es.hargos.tenantguard.rbac;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RbacService")
class RbacServiceTest {

    private final RbacService rbacService = new RbacService();

    @Nested
    @DisplayName("role table")
    class RoleTable {

        @ParameterizedTest
        @EnumSource(TenantAction.class)
        @DisplayName("owner can perform every action")
        void ownerCanDoEverything(TenantAction action) {
            assertThat(rbacService.can(TenantRole.OWNER, action)).isTrue();
        }

        @Test
        @DisplayName("admin cannot delete the tenant, change roles, manage billing or cancel")
        void adminRestrictions() {
            assertThat(rbacService.can(TenantRole.ADMIN, TenantAction.TENANT_DELETE)).isFalse();
            assertThat(rbacService.can(TenantRole.ADMIN, TenantAction.MEMBER_UPDATE_ROLE)).isFalse();
            assertThat(rbacService.can(TenantRole.ADMIN, TenantAction.BILLING_MANAGE)).isFalse();
            assertThat(rbacService.can(TenantRole.ADMIN, TenantAction.SUBSCRIPTION_CANCEL)).isFalse();
            assertThat(rbacService.can(TenantRole.ADMIN, TenantAction.MEMBER_REMOVE)).isTrue();
            assertThat(rbacService.can(TenantRole.ADMIN, TenantAction.PLUGIN_MANAGE)).isTrue();
        }

        @Test
        @DisplayName("member sees billing and subscription, viewer does not")
        void memberVersusViewer() {
            assertThat(rbacService.can(TenantRole.MEMBER, TenantAction.BILLING_VIEW)).isTrue();
            assertThat(rbacService.can(TenantRole.VIEWER, TenantAction.BILLING_VIEW)).isFalse();
            assertThat(rbacService.can(TenantRole.VIEWER, TenantAction.SUBSCRIPTION_VIEW)).isFalse();
            assertThat(rbacService.can(TenantRole.VIEWER, TenantAction.TENANT_READ)).isTrue();
        }

        @Test
        @DisplayName("permissions shrink monotonically from owner to viewer")
        void monotonic() {
            Set<TenantAction> owner = rbacService.getPermissionsForRole(TenantRole.OWNER);
            Set<TenantAction> admin = rbacService.getPermissionsForRole(TenantRole.ADMIN);
            Set<TenantAction> member = rbacService.getPermissionsForRole(TenantRole.MEMBER);
            Set<TenantAction> viewer = rbacService.getPermissionsForRole(TenantRole.VIEWER);

            assertThat(owner).containsAll(admin);
            assertThat(admin).containsAll(member);
            assertThat(member).containsAll(viewer);
        }

        @Test
        @DisplayName("returned permission sets are read-only")
        void permissionsAreImmutable() {
            Set<TenantAction> member = rbacService.getPermissionsForRole(TenantRole.MEMBER);
            assertThatThrownBy(() -> member.add(TenantAction.TENANT_DELETE))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("deny by default")
    class DenyByDefault {

        @Test
        @DisplayName("unknown role strings are denied everything")
        void unknownRole() {
            for (TenantAction action : TenantAction.values()) {
                assertThat(rbacService.can("superuser", action)).isFalse();
            }
            assertThat(rbacService.getPermissionsForRole("superuser")).isEmpty();
        }

        @Test
        @DisplayName("null role or action is denied")
        void nulls() {
            assertThat(rbacService.can((TenantRole) null, TenantAction.TENANT_READ)).isFalse();
            assertThat(rbacService.can(TenantRole.OWNER, null)).isFalse();
            assertThat(rbacService.can((String) null, TenantAction.TENANT_READ)).isFalse();
        }

        @Test
        @DisplayName("role strings are parsed case-insensitively")
        void roleParsing() {
            assertThat(rbacService.can(" Admin ", TenantAction.MEMBER_ADD)).isTrue();
        }
    }

    @Nested
    @DisplayName("ownership bypass")
    class OwnershipBypass {

        @Test
        @DisplayName("owner of the resource may update it with a viewer role")
        void bypassForUpdate() {
            ResourceOwnership ownership = ResourceOwnership.of(42L, 42L);
            assertThat(rbacService.canWithOwnership(ownership, TenantRole.VIEWER, TenantAction.TENANT_UPDATE)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(value = TenantAction.class,
                names = {"TENANT_DELETE", "MEMBER_REMOVE", "MEMBER_UPDATE_ROLE", "BILLING_MANAGE", "SUBSCRIPTION_CANCEL"})
        @DisplayName("sensitive actions are never granted through ownership")
        void noBypassForSensitive(TenantAction action) {
            ResourceOwnership ownership = ResourceOwnership.of(42L, 42L);
            assertThat(rbacService.isSensitiveAction(action)).isTrue();
            assertThat(rbacService.canWithOwnership(ownership, TenantRole.VIEWER, action)).isFalse();
            assertThat(rbacService.canWithOwnership(ownership, TenantRole.ADMIN, action)).isFalse();
        }

        @Test
        @DisplayName("plugin management is not in the bypass set")
        void noBypassForPluginManage() {
            ResourceOwnership ownership = ResourceOwnership.of(42L, 42L);
            assertThat(rbacService.canWithOwnership(ownership, TenantRole.MEMBER, TenantAction.PLUGIN_MANAGE)).isFalse();
        }

        @Test
        @DisplayName("non-owner falls back to the role")
        void nonOwner() {
            ResourceOwnership ownership = ResourceOwnership.of(42L, 7L);
            assertThat(rbacService.canWithOwnership(ownership, TenantRole.VIEWER, TenantAction.TENANT_UPDATE)).isFalse();
            assertThat(rbacService.canWithOwnership(ownership, TenantRole.ADMIN, TenantAction.TENANT_UPDATE)).isTrue();
        }

        @Test
        @DisplayName("missing ownership context falls back to the role")
        void nullOwnership() {
            assertThat(rbacService.canWithOwnership((ResourceOwnership) null, TenantRole.MEMBER, TenantAction.TENANT_READ)).isTrue();
            assertThat(rbacService.canWithOwnership(ResourceOwnership.of(null, 7L), TenantRole.VIEWER,
                    TenantAction.TENANT_UPDATE)).isFalse();
        }

        @Test
        @DisplayName("bypass and sensitive sets do not overlap")
        void disjointSets() {
            Set<TenantAction> overlap = EnumSet.copyOf(RolePermissions.OWNERSHIP_BYPASS_ACTIONS);
            overlap.retainAll(RolePermissions.SENSITIVE_ACTIONS);
            assertThat(overlap).isEmpty();
        }
    }

    @Nested
    @DisplayName("batch checks")
    class BatchChecks {

        @Test
        @DisplayName("denied actions keep input order")
        void deniedActionsInOrder() {
            List<TenantAction> denied = rbacService.getDeniedActions(TenantRole.MEMBER,
                    List.of(TenantAction.TENANT_DELETE, TenantAction.TENANT_READ, TenantAction.BILLING_MANAGE));
            assertThat(denied).containsExactly(TenantAction.TENANT_DELETE, TenantAction.BILLING_MANAGE);
        }

        @Test
        @DisplayName("canAll and canAny")
        void allAndAny() {
            List<TenantAction> actions = List.of(TenantAction.TENANT_READ, TenantAction.TENANT_DELETE);
            assertThat(rbacService.canAll(TenantRole.ADMIN, actions)).isFalse();
            assertThat(rbacService.canAny(TenantRole.ADMIN, actions)).isTrue();
            assertThat(rbacService.canAll(TenantRole.OWNER, actions)).isTrue();
        }

        @Test
        @DisplayName("empty input is allowed by canAll and denied by canAny")
        void emptyInput() {
            assertThat(rbacService.canAll(TenantRole.VIEWER, List.of())).isTrue();
            assertThat(rbacService.canAny(TenantRole.VIEWER, List.of())).isFalse();
            assertThat(rbacService.getDeniedActions("unknown", List.of())).isEmpty();
        }

        @Test
        @DisplayName("null action list behaves like an empty one")
        void nullInput() {
            assertThat(rbacService.canAll(TenantRole.MEMBER, null)).isTrue();
            assertThat(rbacService.canAny(TenantRole.OWNER, null)).isFalse();
            assertThat(rbacService.getDeniedActions(TenantRole.VIEWER, null)).isEmpty();
            assertThat(rbacService.getDeniedActions("admin", null)).isEmpty();
        }
    }
}
