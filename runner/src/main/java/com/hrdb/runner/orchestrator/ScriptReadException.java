package com.hrdb.runner.orchestrator;

/**
 * Thrown when the script file is missing or unreadable. No statement is
 * attempted.
 */
public class ScriptReadException extends RuntimeException {

    public ScriptReadException(String message) {
        super(message);
    }

    public ScriptReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
