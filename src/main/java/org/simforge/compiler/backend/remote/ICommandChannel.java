package org.simforge.compiler.backend.remote;

import org.simforge.compiler.backend.BackendException;

/**
 * Transport for SimTalk commands to a running simulation engine.
 */
public interface ICommandChannel {

    /**
     * Executes one command and returns the engine's textual result.
     *
     * @param command The SimTalk command.
     * @return The result, empty if the command yields none.
     * @throws BackendException if the command could not be delivered or was rejected.
     */
    String execute(String command) throws BackendException;
}
