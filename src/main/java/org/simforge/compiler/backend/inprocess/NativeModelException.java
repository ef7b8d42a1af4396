package org.simforge.compiler.backend.inprocess;

/**
 * Raised by an {@link INativeObjectModel} when an operation on the object tree fails.
 */
public class NativeModelException extends Exception {

    public NativeModelException(String message) {
        super(message);
    }

    public NativeModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
