package com.hrdb.runner.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Every key has a default,
 * so an empty environment points at {@code hr_database.db} and
 * {@code queries.sql} in the working directory.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    public static final String KEY_JDBC_URL = "HRDB_JDBC_URL";
    public static final String KEY_SCRIPT_PATH = "HRDB_SCRIPT_PATH";
    public static final String KEY_DB_USER = "HRDB_DB_USER";
    public static final String KEY_DB_PASSWORD = "HRDB_DB_PASSWORD";
    public static final String KEY_CONNECT_TIMEOUT_MS = "HRDB_CONNECT_TIMEOUT_MS";

    static final String DEFAULT_JDBC_URL = "jdbc:sqlite:hr_database.db";
    static final String DEFAULT_SCRIPT_PATH = "queries.sql";
    static final long DEFAULT_CONNECT_TIMEOUT_MS = 30_000;
    static final long MIN_CONNECT_TIMEOUT_MS = 250;

    private final String jdbcUrl;
    private final Path scriptPath;
    private final String dbUser;
    private final String dbPassword;
    private final long connectTimeoutMs;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        String url = resolve(dotenv, KEY_JDBC_URL, DEFAULT_JDBC_URL);
        String script = resolve(dotenv, KEY_SCRIPT_PATH, DEFAULT_SCRIPT_PATH);
        String timeout = resolve(dotenv, KEY_CONNECT_TIMEOUT_MS, String.valueOf(DEFAULT_CONNECT_TIMEOUT_MS));

        this.jdbcUrl = url;
        this.dbUser = resolveOptional(dotenv, KEY_DB_USER);
        this.dbPassword = resolveOptional(dotenv, KEY_DB_PASSWORD);
        this.connectTimeoutMs = parseTimeout(timeout);
        this.scriptPath = isBlank(script) ? null : Path.of(script);

        validate();

        logger.info("Configuration loaded: jdbcUrl={}, scriptPath={}", jdbcUrl, scriptPath);
    }

    /**
     * Constructor for testing: accepts values directly.
     */
    public AppConfig(String jdbcUrl, String scriptPath, String dbUser, String dbPassword,
                     long connectTimeoutMs) {
        this.jdbcUrl = jdbcUrl;
        this.scriptPath = isBlank(scriptPath) ? null : Path.of(scriptPath);
        this.dbUser = dbUser;
        this.dbPassword = dbPassword;
        this.connectTimeoutMs = connectTimeoutMs;

        validate();
    }

    private void validate() {
        StringBuilder invalid = new StringBuilder();
        if (isBlank(jdbcUrl) || !jdbcUrl.startsWith("jdbc:")) invalid.append(KEY_JDBC_URL).append(' ');
        if (scriptPath == null) invalid.append(KEY_SCRIPT_PATH).append(' ');
        if (connectTimeoutMs < MIN_CONNECT_TIMEOUT_MS) invalid.append(KEY_CONNECT_TIMEOUT_MS).append(' ');

        if (!invalid.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid or missing configuration: " + invalid.toString().trim());
        }
    }

    private static long parseTimeout(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            // validate() reports the key
            return -1;
        }
    }

    private static String resolve(Dotenv dotenv, String key, String defaultValue) {
        String value = resolveOptional(dotenv, key);
        return value != null ? value : defaultValue;
    }

    private static String resolveOptional(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        String dotenvValue = dotenv.get(key);
        return isBlank(dotenvValue) ? null : dotenvValue;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public Path getScriptPath() {
        return scriptPath;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }
}
