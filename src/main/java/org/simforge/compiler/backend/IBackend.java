package org.simforge.compiler.backend;

/**
 * The operations the creation stage needs from a simulation engine.
 * Implementations are used from a single thread.
 */
public interface IBackend {

    /**
     * Resolves a template by name.
     *
     * @param name The template name from the mapping rule.
     * @return The template handle.
     * @throws BackendException if the template does not exist or cannot be looked up.
     */
    Handle resolveTemplate(String name) throws BackendException;

    /**
     * Creates a new object from a template.
     *
     * @param template The template to derive from.
     * @param parent   The frame or folder the new object is placed in.
     * @param name     The name of the new object, unique within {@code parent}.
     * @return The handle of the new object.
     * @throws BackendException if the object could not be created.
     */
    Handle derive(Handle template, Handle parent, String name) throws BackendException;

    /**
     * Sets an attribute. {@code path} may be nested (e.g. {@code _3D.Rotation}).
     * The value is a String, Number, Boolean, List or {@link Handle}.
     *
     * @throws BackendException if the attribute could not be set.
     */
    void setProperty(Handle object, String path, Object value) throws BackendException;

    /**
     * Connects two objects using the given connector.
     *
     * @throws BackendException if the connection could not be created.
     */
    void connect(Handle connector, Handle from, Handle to) throws BackendException;

    /**
     * @return The handle of a framework object at an absolute path (model frame, connector, folders).
     */
    Handle scope(String path);

    /**
     * @return The settings this backend was created with.
     */
    BackendSettings settings();
}
