package org.simforge.compiler.frontend.parser;

/**
 * Thrown when a layout document cannot be read: it is not well-formed markup or a
 * required section is missing. Fatal for the pipeline run.
 */
public class ParseException extends Exception {

    /**
     * Constructs a new parse exception with the specified detail message.
     * @param message The detail message.
     */
    public ParseException(String message) {
        super(message);
    }

    /**
     * Constructs a new parse exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
