package es.hargos.tenantguard.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Writes the PostgreSQL session variables read by the RLS policies.
 *
 * Values are set with {@code set_config(key, value, true)}, which is scoped to the
 * current transaction and reset by PostgreSQL on commit or rollback. Both keys are
 * written on every bind so a pooled connection never carries an earlier identity.
 *
 * The database side reads them through app_current_user_id() / app_current_tenant_id(),
 * which return NULL when a key is unset or empty, so unbound connections are denied.
 */
@Component
public class SessionContextBinder {

    private static final Logger log = LoggerFactory.getLogger(SessionContextBinder.class);

    static final String USER_KEY = "app.user_id";
    static final String TENANT_KEY = "app.tenant_id";

    private static final String SET_LOCAL_SQL = "SELECT set_config(?, ?, true)";

    private final JdbcTemplate jdbcTemplate;

    public SessionContextBinder(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * System identity: user 0 and tenant 0. Policies must opt in to this bypass explicitly.
     */
    public void bindSystem() {
        bind(ScopedTransaction.SYSTEM_USER_ID, 0L);
    }

    public void bind(long userId, Long tenantId) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("RLS context can only be bound inside an active transaction");
        }
        if (userId < 0) {
            throw new IllegalArgumentException("User id must not be negative");
        }

        setLocal(USER_KEY, String.valueOf(userId));
        // Empty value reads back as NULL, which no tenant policy matches
        setLocal(TENANT_KEY, tenantId != null ? String.valueOf(tenantId) : "");

        log.debug("RLS context bound: user={}, tenant={}", userId, tenantId);
    }

    private void setLocal(String key, String value) {
        jdbcTemplate.queryForObject(SET_LOCAL_SQL, String.class, key, value);
    }
}
