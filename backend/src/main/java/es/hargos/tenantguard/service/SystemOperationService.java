package es.hargos.tenantguard.service;

import es.hargos.tenantguard.context.ScopedTransaction;
import es.hargos.tenantguard.context.SessionContextBinder;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Entry points for database work bound to an RLS identity.
 *
 * Each call opens its own transaction, binds app.user_id / app.tenant_id for that
 * transaction only, runs the callback with an explicit {@link ScopedTransaction} and
 * commits, or rolls back if the callback throws.
 *
 * Authorization must be checked BEFORE calling into this service: it binds whatever
 * identity it is given.
 */
@Service
@RequiredArgsConstructor
public class SystemOperationService {

    private static final Logger logger = LoggerFactory.getLogger(SystemOperationService.class);

    private final TransactionOperations transactionOperations;
    private final SessionContextBinder contextBinder;
    private final EntityManager entityManager;

    /**
     * Run with system identity (user 0, tenant 0). Only policies that explicitly
     * allow the system identity will pass. Use for lookups that must happen before
     * a tenant is known.
     */
    public <T> T withSystemContext(Function<ScopedTransaction, T> callback) {
        return transactionOperations.execute(status -> {
            contextBinder.bindSystem();
            ScopedTransaction trx = ScopedTransaction.system(entityManager);
            try {
                return callback.apply(trx);
            } finally {
                trx.end();
            }
        });
    }

    /**
     * Run bound to a tenant as the system user.
     */
    public <T> T withTenantContext(Long tenantId, Function<ScopedTransaction, T> callback) {
        return withTenantContext(tenantId, callback, ScopedTransaction.SYSTEM_USER_ID);
    }

    /**
     * Run bound to a tenant and acting user.
     *
     * @param tenantId verified tenant id, must be positive
     * @param userId acting user, 0 for system
     */
    public <T> T withTenantContext(Long tenantId, Function<ScopedTransaction, T> callback, long userId) {
        validateIdentity(tenantId, userId);

        return transactionOperations.execute(status -> {
            contextBinder.bind(userId, tenantId);
            ScopedTransaction trx = ScopedTransaction.forTenant(entityManager, tenantId, userId);
            logger.debug("Tenant context opened: tenant={}, user={}", tenantId, userId);
            try {
                return callback.apply(trx);
            } finally {
                trx.end();
            }
        });
    }

    /**
     * System-context lookup followed by tenant-scoped work in the same transaction.
     * The lookup handle is ended before the session is rebound to the found tenant.
     *
     * @param lookupFn returns the tenant id, or null when nothing matched
     * @return empty when the lookup found no tenant
     */
    public <T> Optional<T> lookupThenOperate(Function<ScopedTransaction, Long> lookupFn,
                                             BiFunction<ScopedTransaction, Long, T> operationFn) {
        return transactionOperations.execute(status -> {
            contextBinder.bindSystem();
            ScopedTransaction lookupTrx = ScopedTransaction.system(entityManager);
            Long tenantId;
            try {
                tenantId = lookupFn.apply(lookupTrx);
            } finally {
                lookupTrx.end();
            }

            if (tenantId == null) {
                return Optional.empty();
            }
            validateIdentity(tenantId, ScopedTransaction.SYSTEM_USER_ID);

            contextBinder.bind(ScopedTransaction.SYSTEM_USER_ID, tenantId);
            ScopedTransaction tenantTrx = ScopedTransaction.forTenant(
                    entityManager, tenantId, ScopedTransaction.SYSTEM_USER_ID);
            try {
                return Optional.ofNullable(operationFn.apply(tenantTrx, tenantId));
            } finally {
                tenantTrx.end();
            }
        });
    }

    private static void validateIdentity(Long tenantId, long userId) {
        if (tenantId == null || tenantId <= 0) {
            throw new IllegalArgumentException("Tenant id must be a positive number, got " + tenantId);
        }
        if (userId < 0) {
            throw new IllegalArgumentException("User id must not be negative, got " + userId);
        }
    }
}
