package com.nayem.warden.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Coordination token backed by a PostgreSQL session-level advisory lock.
 * <p>
 * The lock belongs to the database session, so one connection is checked out
 * for the whole cycle and both {@code pg_try_advisory_lock} and
 * {@code pg_advisory_unlock} run on it. Closing the lease unlocks and returns
 * the connection; if the process dies the server drops the lock with the
 * session.
 * </p>
 */
public class PostgresAdvisoryCoordinationLock implements CoordinationLock {

    private static final Logger log = LoggerFactory.getLogger(PostgresAdvisoryCoordinationLock.class);
    private static final String TRY_LOCK_SQL = "SELECT pg_try_advisory_lock(hashtext(?))";
    private static final String UNLOCK_SQL = "SELECT pg_advisory_unlock(hashtext(?))";

    private final DataSource dataSource;

    public PostgresAdvisoryCoordinationLock(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<CoordinationLease> tryAcquire(String token) {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException e) {
            throw new CannotGetJdbcConnectionException("Failed to obtain connection for advisory lock", e);
        }

        JdbcTemplate session = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        try {
            Boolean acquired = session.queryForObject(TRY_LOCK_SQL, Boolean.class, token);
            if (Boolean.TRUE.equals(acquired)) {
                return Optional.of(new AdvisoryLease(token, connection, session));
            }
        } catch (RuntimeException e) {
            closeConnection(connection);
            throw e;
        }
        closeConnection(connection);
        return Optional.empty();
    }

    private static void closeConnection(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to return advisory lock connection: {}", e.getMessage());
        }
    }

    private static final class AdvisoryLease implements CoordinationLease {
        private final String token;
        private final Connection connection;
        private final JdbcTemplate session;
        private final AtomicBoolean released = new AtomicBoolean();

        AdvisoryLease(String token, Connection connection, JdbcTemplate session) {
            this.token = token;
            this.connection = connection;
            this.session = session;
        }

        @Override
        public String token() {
            return token;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                Boolean unlocked = session.queryForObject(UNLOCK_SQL, Boolean.class, token);
                if (!Boolean.TRUE.equals(unlocked)) {
                    log.warn("Advisory lock for {} was not held by this session at release", token);
                }
            } finally {
                closeConnection(connection);
            }
        }
    }
}
