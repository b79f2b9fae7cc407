package com.hrdb.runner.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for {@link AppConfig} validation logic.
 */
class AppConfigTest {

    @Test
    @DisplayName("Test constructor creates config with valid values")
    void validConfig() {
        AppConfig config = new AppConfig("jdbc:h2:mem:test", "scripts/run.sql", "sa", "secret", 5000);

        assertEquals("jdbc:h2:mem:test", config.getJdbcUrl());
        assertEquals(Path.of("scripts/run.sql"), config.getScriptPath());
        assertEquals("sa", config.getDbUser());
        assertEquals("secret", config.getDbPassword());
        assertEquals(5000, config.getConnectTimeoutMs());
    }

    @Test
    @DisplayName("Credentials are optional")
    void credentialsOptional() {
        AppConfig config = new AppConfig("jdbc:sqlite:hr.db", "queries.sql", null, null, 30000);

        assertNull(config.getDbUser());
        assertNull(config.getDbPassword());
    }

    @Test
    @DisplayName("Throws when the JDBC URL is missing")
    void missingUrl_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("", "queries.sql", null, null, 30000));

        assertTrue(ex.getMessage().contains("HRDB_JDBC_URL"));
    }

    @Test
    @DisplayName("Throws when the JDBC URL has no jdbc: prefix")
    void nonJdbcUrl_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("hr_database.db", "queries.sql", null, null, 30000));

        assertTrue(ex.getMessage().contains("HRDB_JDBC_URL"));
    }

    @Test
    @DisplayName("Throws when the script path is blank")
    void blankScript_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("jdbc:sqlite:hr.db", "  ", null, null, 30000));

        assertTrue(ex.getMessage().contains("HRDB_SCRIPT_PATH"));
    }

    @Test
    @DisplayName("Throws when the connect timeout is below Hikari's minimum")
    void shortTimeout_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("jdbc:sqlite:hr.db", "queries.sql", null, null, 100));

        assertTrue(ex.getMessage().contains("HRDB_CONNECT_TIMEOUT_MS"));
    }

    @Test
    @DisplayName("Throws with all invalid keys listed in message")
    void allInvalid_listsAllKeys() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig(null, null, null, null, 0));

        String msg = ex.getMessage();
        assertTrue(msg.contains("HRDB_JDBC_URL"));
        assertTrue(msg.contains("HRDB_SCRIPT_PATH"));
        assertTrue(msg.contains("HRDB_CONNECT_TIMEOUT_MS"));
    }

    @Test
    @DisplayName("Defaults apply when nothing is configured")
    void defaults() {
        assumeTrue(System.getenv(AppConfig.KEY_JDBC_URL) == null
                && System.getenv(AppConfig.KEY_SCRIPT_PATH) == null
                && System.getenv(AppConfig.KEY_CONNECT_TIMEOUT_MS) == null
                && !java.nio.file.Files.exists(Path.of(".env")));

        AppConfig config = new AppConfig();

        assertEquals(AppConfig.DEFAULT_JDBC_URL, config.getJdbcUrl());
        assertEquals(Path.of(AppConfig.DEFAULT_SCRIPT_PATH), config.getScriptPath());
        assertEquals(AppConfig.DEFAULT_CONNECT_TIMEOUT_MS, config.getConnectTimeoutMs());
    }
}
