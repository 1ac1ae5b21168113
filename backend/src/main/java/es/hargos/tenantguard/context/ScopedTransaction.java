package es.hargos.tenantguard.context;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;

import java.util.Optional;

/**
 * Handle to one database transaction whose session is bound to an RLS identity.
 *
 * Created only by SystemOperationService. Every write-capable service method
 * takes this handle explicitly so the binding is visible at each call site.
 */
public final class ScopedTransaction {

    /**
     * Reserved user id meaning "system, no RLS restriction".
     */
    public static final long SYSTEM_USER_ID = 0L;

    private final EntityManager entityManager;
    private final long userId;
    private final Long tenantId;
    private volatile boolean active = true;

    private ScopedTransaction(EntityManager entityManager, long userId, Long tenantId) {
        this.entityManager = entityManager;
        this.userId = userId;
        this.tenantId = tenantId;
    }

    public static ScopedTransaction system(EntityManager entityManager) {
        return new ScopedTransaction(entityManager, SYSTEM_USER_ID, null);
    }

    public static ScopedTransaction forTenant(EntityManager entityManager, Long tenantId, long userId) {
        if (tenantId == null || tenantId <= 0) {
            throw new IllegalArgumentException("Tenant id must be a positive number");
        }
        return new ScopedTransaction(entityManager, userId, tenantId);
    }

    public long getUserId() {
        return userId;
    }

    /**
     * @return bound tenant, or null for system context
     */
    public Long getTenantId() {
        return tenantId;
    }

    /**
     * True only for the unscoped system identity. A tenant-bound handle acting as
     * user 0 is still tenant-scoped.
     */
    public boolean isSystem() {
        return userId == SYSTEM_USER_ID && tenantId == null;
    }

    public boolean isActive() {
        return active;
    }

    public void assertActive() {
        if (!active) {
            throw new IllegalStateException("Transaction handle used after its transaction ended");
        }
    }

    /**
     * Tenant bound to this transaction. Fails for system context.
     */
    public Long requireTenantId() {
        assertActive();
        if (tenantId == null) {
            throw new IllegalStateException("Operation requires a tenant-scoped transaction");
        }
        return tenantId;
    }

    /**
     * Re-read an entity under a row lock (SELECT ... FOR UPDATE).
     * The lock is held until this transaction commits or rolls back.
     */
    public <T> T lockForUpdate(T entity) {
        assertActive();
        entityManager.refresh(entity, LockModeType.PESSIMISTIC_WRITE);
        return entity;
    }

    /**
     * Re-read a row under a row lock into a fresh instance. {@code stale} is detached
     * first so the locked read is not served from the persistence context.
     *
     * @return empty when the row was deleted or is not visible to this RLS identity
     */
    public <T> Optional<T> reloadForUpdate(Class<T> type, Object id, T stale) {
        assertActive();
        if (stale != null && entityManager.contains(stale)) {
            entityManager.detach(stale);
        }
        return Optional.ofNullable(entityManager.find(type, id, LockModeType.PESSIMISTIC_WRITE));
    }

    public EntityManager getEntityManager() {
        assertActive();
        return entityManager;
    }

    /**
     * Called by the owner when the transaction callback returns or throws.
     */
    public void end() {
        active = false;
    }

    @Override
    public String toString() {
        return "ScopedTransaction{userId=" + userId + ", tenantId=" + tenantId + ", active=" + active + "}";
    }
}
