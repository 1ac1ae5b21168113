package es.hargos.tenantguard.dto.response;

import es.hargos.tenantguard.entity.TenantEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantResponse {

    private Long id;
    private String name;
    private String slug;
    private String type;
    private Long ownerId;
    private Integer maxMembers;
    private Long balance;
    private String balanceCurrency;
    private LocalDateTime createdAt;

    public static TenantResponse from(TenantEntity tenant) {
        return TenantResponse.builder()
                .id(tenant.getId())
                .name(tenant.getName())
                .slug(tenant.getSlug())
                .type(tenant.getType())
                .ownerId(tenant.getOwnerId())
                .maxMembers(tenant.getMaxMembers())
                .balance(tenant.getBalance())
                .balanceCurrency(tenant.getBalanceCurrency())
                .createdAt(tenant.getCreatedAt())
                .build();
    }
}
