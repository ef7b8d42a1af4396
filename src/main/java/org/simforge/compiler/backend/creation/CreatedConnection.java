package org.simforge.compiler.backend.creation;

/**
 * A connection that was created between the objects of two resources.
 */
public record CreatedConnection(String fromResourceId, String toResourceId) {

    @Override
    public String toString() {
        return "(" + fromResourceId + ", " + toResourceId + ")";
    }
}
