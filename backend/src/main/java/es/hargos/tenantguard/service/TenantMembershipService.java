package es.hargos.tenantguard.service;

import es.hargos.tenantguard.entity.TenantMembershipEntity;
import es.hargos.tenantguard.repository.TenantMembershipRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Membership lookups performed before a tenant context exists.
 */
@Service
@RequiredArgsConstructor
public class TenantMembershipService {

    private final TenantMembershipRepository membershipRepository;
    private final SystemOperationService systemOps;

    /**
     * Runs under system context: the caller's tenant is not verified yet, so no tenant binding applies.
     */
    public Optional<TenantMembershipEntity> findMembership(Long tenantId, Long userId) {
        if (tenantId == null || userId == null) {
            return Optional.empty();
        }
        return systemOps.withSystemContext(trx ->
                membershipRepository.findByTenantIdAndUserId(tenantId, userId));
    }
}
