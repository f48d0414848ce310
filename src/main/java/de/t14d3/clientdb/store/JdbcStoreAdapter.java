package de.t14d3.clientdb.store;

import de.t14d3.clientdb.config.ClientDbConfig;
import de.t14d3.clientdb.exceptions.StoreException;
import de.t14d3.clientdb.query.Dialect;
import de.t14d3.clientdb.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link StoreAdapter} over a single JDBC connection.
 *
 * All access is serialized on the connection; a transaction holds it until commit or rollback.
 */
public class JdbcStoreAdapter implements StoreAdapter {
    private static final Logger log = LoggerFactory.getLogger(JdbcStoreAdapter.class);

    private final Connection connection;
    private final Dialect dialect;
    private final Object monitor = new Object();
    private boolean transactionActive;

    public JdbcStoreAdapter(Connection connection, Dialect dialect) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    /**
     * Open the store named by the configuration.
     */
    public static JdbcStoreAdapter open(ClientDbConfig config) {
        return open(config.getJdbcUrl());
    }

    public static JdbcStoreAdapter open(String jdbcUrl) {
        try {
            Connection connection = DriverManager.getConnection(jdbcUrl);
            log.debug("Opened client store {}", jdbcUrl);
            return new JdbcStoreAdapter(connection, Dialect.detectFromUrl(jdbcUrl));
        } catch (SQLException e) {
            throw new StoreException("Failed to open client store: " + jdbcUrl, e);
        }
    }

    /**
     * Wrap an existing connection, detecting the dialect from its metadata.
     */
    public static JdbcStoreAdapter create(Connection connection) {
        return new JdbcStoreAdapter(connection, detectDialect(connection));
    }

    private static Dialect detectDialect(Connection connection) {
        try {
            String productName = connection.getMetaData().getDatabaseProductName().toLowerCase();
            if (productName.contains("mysql")) {
                return Dialect.MYSQL;
            } else if (productName.contains("postgresql")) {
                return Dialect.POSTGRESQL;
            } else if (productName.contains("sqlite")) {
                return Dialect.SQLITE;
            } else if (productName.contains("h2")) {
                return Dialect.H2;
            }
        } catch (SQLException e) {
            log.debug("Could not read database product name, using generic dialect", e);
        }
        return Dialect.GENERIC;
    }

    @Override
    public Dialect getDialect() {
        return dialect;
    }

    public Connection getConnection() {
        return connection;
    }

    @Override
    public <T> List<T> query(Query query, RowMapper<T> mapper) {
        synchronized (monitor) {
            return doQuery(query, mapper);
        }
    }

    @Override
    public int execute(Query query) {
        synchronized (monitor) {
            if (transactionActive) {
                return doExecute(query);
            }
            return inTransaction(session -> session.execute(query));
        }
    }

    @Override
    public <T> T inTransaction(Function<StoreSession, T> work) {
        synchronized (monitor) {
            if (transactionActive) {
                // nested work joins the open transaction
                return work.apply(session);
            }
            boolean originalAutoCommit;
            try {
                originalAutoCommit = connection.getAutoCommit();
                connection.setAutoCommit(false);
                transactionActive = true;
            } catch (SQLException e) {
                throw new StoreException("Failed to begin transaction", e);
            }
            try {
                T result = work.apply(session);
                connection.commit();
                return result;
            } catch (SQLException e) {
                rollbackQuietly(e);
                throw new StoreException("Failed to commit transaction", e);
            } catch (RuntimeException e) {
                rollbackQuietly(e);
                throw e;
            } finally {
                transactionActive = false;
                restoreAutoCommit(originalAutoCommit);
            }
        }
    }

    @Override
    public void executeNonTransactional(Query query) {
        synchronized (monitor) {
            if (transactionActive) {
                throw new IllegalStateException("Cannot run a non-transactional statement inside a transaction");
            }
            try (Statement stmt = connection.createStatement()) {
                stmt.execute(query.getSql());
            } catch (SQLException e) {
                throw new StoreException("Failed to execute SQL: " + query.getSql(), e);
            }
        }
    }

    @Override
    public void close() {
        synchronized (monitor) {
            try {
                connection.close();
            } catch (SQLException e) {
                log.warn("Failed to close client store connection", e);
            }
        }
    }

    private final StoreSession session = new StoreSession() {
        @Override
        public <T> List<T> query(Query query, RowMapper<T> mapper) {
            return doQuery(query, mapper);
        }

        @Override
        public int execute(Query query) {
            return doExecute(query);
        }
    };

    private <T> List<T> doQuery(Query query, RowMapper<T> mapper) {
        try (PreparedStatement ps = connection.prepareStatement(query.getSql())) {
            setParameters(ps, query.getParameters());
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query: " + query, e);
        }
    }

    private int doExecute(Query query) {
        try (PreparedStatement ps = connection.prepareStatement(query.getSql())) {
            setParameters(ps, query.getParameters());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to execute SQL: " + query, e);
        }
    }

    private void setParameters(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setObject(i + 1, params.get(i));
        }
    }

    private void rollbackQuietly(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackEx) {
            cause.addSuppressed(rollbackEx);
        }
    }

    private void restoreAutoCommit(boolean originalAutoCommit) {
        try {
            connection.setAutoCommit(originalAutoCommit);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit mode", e);
        }
    }
}
