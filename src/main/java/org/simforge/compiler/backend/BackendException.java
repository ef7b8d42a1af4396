package org.simforge.compiler.backend;

/**
 * Thrown when the simulation engine rejects or cannot execute an operation.
 */
public class BackendException extends Exception {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
