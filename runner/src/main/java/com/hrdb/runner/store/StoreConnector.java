package com.hrdb.runner.store;

import com.hrdb.runner.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens the store for one batch run. Backed by a single-connection Hikari
 * pool; closing the connector closes the pool.
 *
 * <p>For file-backed SQLite URLs the database file must already exist. The
 * SQLite driver would otherwise create an empty database and every
 * statement would fail with "no such table".
 */
public class StoreConnector implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StoreConnector.class);

    static final String SQLITE_PREFIX = "jdbc:sqlite:";

    private final HikariDataSource dataSource;

    private StoreConnector(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Validates the target and starts the pool.
     *
     * @throws StoreUnavailableException if the database is absent or refuses connections
     */
    public static StoreConnector open(AppConfig config) {
        String jdbcUrl = config.getJdbcUrl();
        Path sqliteFile = sqliteDatabaseFile(jdbcUrl);
        if (sqliteFile != null && !Files.isRegularFile(sqliteFile)) {
            throw new StoreUnavailableException("Database file not found: " + sqliteFile.toAbsolutePath());
        }

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(jdbcUrl);
        if (config.getDbUser() != null) {
            hikari.setUsername(config.getDbUser());
        }
        if (config.getDbPassword() != null) {
            hikari.setPassword(config.getDbPassword());
        }
        hikari.setPoolName("hrdb-runner");
        hikari.setMaximumPoolSize(1);
        hikari.setMinimumIdle(1);
        hikari.setAutoCommit(true);
        hikari.setConnectionTimeout(config.getConnectTimeoutMs());
        // A failed statement must not close the connection the rest of the batch runs on
        hikari.setExceptionOverrideClassName(NonEvictingExceptionOverride.class.getName());

        try {
            logger.info("Opening store {}", jdbcUrl);
            return new StoreConnector(new HikariDataSource(hikari));
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Cannot connect to " + jdbcUrl + ": " + rootMessage(e), e);
        }
    }

    /**
     * Borrows the run's connection. The caller closes it.
     */
    public Connection getConnection() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Cannot obtain connection: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            logger.debug("Store pool closed");
        }
    }

    /**
     * Returns the database file of a file-backed SQLite URL, or null for
     * other drivers and in-memory databases.
     */
    static Path sqliteDatabaseFile(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return null;
        }
        String location = jdbcUrl.substring(SQLITE_PREFIX.length());
        int query = location.indexOf('?');
        if (query >= 0) {
            if (location.substring(query).contains("mode=memory")) {
                return null;
            }
            location = location.substring(0, query);
        }
        if (location.startsWith("file:")) {
            location = location.substring("file:".length());
        }
        if (location.isEmpty() || location.startsWith(":memory:") || location.startsWith(":resource:")) {
            return null;
        }
        return Path.of(location);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
