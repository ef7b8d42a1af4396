package org.simforge.compiler.backend.recording;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes recorded call logs as JSON arrays.
 */
public final class CallLogCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<List<RecordedCall>> CALL_LIST = new TypeReference<>() {};

    private CallLogCodec() {
        // Private constructor to prevent instantiation
    }

    public static String toJson(List<RecordedCall> calls) throws JsonProcessingException {
        return MAPPER.writeValueAsString(calls);
    }

    public static List<RecordedCall> fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, CALL_LIST);
    }

    public static void write(Path file, List<RecordedCall> calls) throws IOException {
        MAPPER.writeValue(file.toFile(), calls);
    }

    public static List<RecordedCall> read(Path file) throws IOException {
        return MAPPER.readValue(Files.readAllBytes(file), CALL_LIST);
    }
}
