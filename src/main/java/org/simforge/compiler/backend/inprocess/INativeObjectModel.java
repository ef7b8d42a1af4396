package org.simforge.compiler.backend.inprocess;

/**
 * Binding to an object model that lives in the same process, addressed by absolute object paths.
 */
public interface INativeObjectModel {

    boolean exists(String path);

    /**
     * Creates {@code parentPath.name} as an instance of {@code templatePath}.
     *
     * @return The path of the new object.
     */
    String derive(String templatePath, String parentPath, String name) throws NativeModelException;

    /**
     * Sets an attribute; object references are passed as their paths.
     */
    void setAttribute(String objectPath, String attributePath, Object value) throws NativeModelException;

    void connect(String connectorPath, String fromPath, String toPath) throws NativeModelException;
}
