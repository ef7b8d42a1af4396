package org.simforge.compiler.ir;

/**
 * A directed material-flow connection between two resources.
 */
public record Connection(String identifier, String fromResourceId, String toResourceId, String description) {

    /**
     * Builds the identifier used when the document does not name a connection.
     */
    public static String syntheticIdentifier(String fromResourceId, String toResourceId) {
        return "conn_" + fromResourceId + "_to_" + toResourceId;
    }
}
