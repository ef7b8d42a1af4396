package org.simforge.compiler.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Compiles layout documents into objects and connections of a simulation model.
 */
public interface ILayoutCompiler {

    /**
     * Compiles a layout document given as XML text.
     *
     * @param xml The document.
     * @return The report of the run.
     * @throws CompilationException if the document cannot be parsed, is invalid, or creation was aborted.
     */
    CompilationReport compile(String xml) throws CompilationException;

    /**
     * Compiles a layout document file.
     *
     * @param document The path of the document.
     * @return The report of the run.
     * @throws CompilationException if the document cannot be parsed, is invalid, or creation was aborted.
     * @throws IOException if the file cannot be read.
     */
    default CompilationReport compile(Path document) throws CompilationException, IOException {
        return compile(Files.readString(document));
    }
}
