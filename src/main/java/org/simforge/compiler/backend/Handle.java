package org.simforge.compiler.backend;

/**
 * Reference to an object in the simulation model, identified by its absolute path
 * (e.g. {@code .Models.Model.Drill_1}).
 */
public record Handle(String path) {

    public Handle {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Object path must not be empty");
        }
    }

    /**
     * @return The handle of the child object {@code name} of this object.
     */
    public Handle child(String name) {
        return new Handle(path + "." + name);
    }

    /**
     * @return The last path segment.
     */
    public String name() {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }

    @Override
    public String toString() {
        return path;
    }
}
