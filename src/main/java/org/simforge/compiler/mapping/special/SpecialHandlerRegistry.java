package org.simforge.compiler.mapping.special;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping special handler names, as used in property rules, to handler instances.
 */
public final class SpecialHandlerRegistry {

    private final Map<String, ISpecialHandler> byName = new HashMap<>();

    private SpecialHandlerRegistry() {
    }

    /**
     * Registers a handler, replacing any handler previously registered under the same name.
     *
     * @param name    The name property rules refer to.
     * @param handler The handler instance.
     */
    public void register(String name, ISpecialHandler handler) {
        byName.put(name, handler);
    }

    /**
     * @param name The handler name from a property rule.
     * @return The handler, or empty if none is registered under that name.
     */
    public Optional<ISpecialHandler> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * Creates an empty registry. Callers register their own handlers after construction.
     */
    public static SpecialHandlerRegistry initialize() {
        return new SpecialHandlerRegistry();
    }

    /**
     * Creates a registry with all built-in handlers registered.
     */
    public static SpecialHandlerRegistry initializeWithDefaults() {
        SpecialHandlerRegistry reg = initialize();
        reg.register(MaterialUnitHandler.NAME, new MaterialUnitHandler());
        return reg;
    }
}
