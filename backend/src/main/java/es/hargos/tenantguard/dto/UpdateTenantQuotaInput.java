package es.hargos.tenantguard.dto;

import es.hargos.tenantguard.service.LimitSetting;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Partial quota update. Absent fields are left unchanged, unlimited clears the ceiling.
 *
 * Built from the raw JSON body so that a missing key and an explicit null stay distinguishable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTenantQuotaInput {

    public static final String MAX_MEMBERS = "maxMembers";
    public static final String MAX_PENDING_INVITATIONS = "maxPendingInvitations";
    public static final String MAX_AUTH_TOKENS_PER_TENANT = "maxAuthTokensPerTenant";
    public static final String MAX_AUTH_TOKENS_PER_USER = "maxAuthTokensPerUser";

    @Builder.Default
    private LimitSetting maxMembers = LimitSetting.ABSENT;

    @Builder.Default
    private LimitSetting maxPendingInvitations = LimitSetting.ABSENT;

    @Builder.Default
    private LimitSetting maxAuthTokensPerTenant = LimitSetting.ABSENT;

    @Builder.Default
    private LimitSetting maxAuthTokensPerUser = LimitSetting.ABSENT;

    public static UpdateTenantQuotaInput fromMap(Map<String, Object> body) {
        return UpdateTenantQuotaInput.builder()
                .maxMembers(LimitSetting.fromMap(body, MAX_MEMBERS))
                .maxPendingInvitations(LimitSetting.fromMap(body, MAX_PENDING_INVITATIONS))
                .maxAuthTokensPerTenant(LimitSetting.fromMap(body, MAX_AUTH_TOKENS_PER_TENANT))
                .maxAuthTokensPerUser(LimitSetting.fromMap(body, MAX_AUTH_TOKENS_PER_USER))
                .build();
    }

    public boolean hasAnyUpdate() {
        return maxMembers.isPresent()
                || maxPendingInvitations.isPresent()
                || maxAuthTokensPerTenant.isPresent()
                || maxAuthTokensPerUser.isPresent();
    }
}
