package org.simforge.compiler.backend.recording;

import java.util.List;

/**
 * One backend call. Arguments are object paths, names, or values rendered as SimTalk literals.
 *
 * @param operation The operation performed.
 * @param arguments The call arguments in signature order.
 */
public record RecordedCall(Operation operation, List<String> arguments) {

    public enum Operation {
        RESOLVE_TEMPLATE,
        DERIVE,
        SET_PROPERTY,
        CONNECT
    }

    public RecordedCall {
        arguments = List.copyOf(arguments);
    }

    public static RecordedCall of(Operation operation, String... arguments) {
        return new RecordedCall(operation, List.of(arguments));
    }

    @Override
    public String toString() {
        return operation + "(" + String.join(", ", arguments) + ")";
    }
}
