package com.hrdb.runner.store;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;

/**
 * Keeps the run's connection in the pool whatever a statement throws.
 * Hikari would otherwise close it on timeouts and connection-class SQL
 * states, and every later statement would fail with "Connection is closed".
 *
 * <p>Instantiated by Hikari through its class name, so it needs a public
 * no-argument constructor.
 */
public class NonEvictingExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public Override adjudicate(SQLException sqlException) {
        return Override.DO_NOT_EVICT;
    }
}
