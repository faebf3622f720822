package com.actguard.execution;

import com.actguard.execution.model.ActionExecution;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON (de)serialization of execution records and of arbitrary result values.
 * Values are read as plain Java structures: {@code Map} (insertion-ordered), {@code List},
 * {@code String}, {@code Number}, {@code Boolean} or {@code null}.
 */
public final class ActionExecutionJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<ActionExecution> EXECUTION_TYPE = new TypeReference<>() {};

    private ActionExecutionJson() {
    }

    /**
     * Deserializes an execution record. Unknown fields are ignored.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static ActionExecution fromJson(String json) {
        try {
            return MAPPER.readValue(json, EXECUTION_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(ActionExecution execution) {
        return valueToJson(execution);
    }

    /**
     * Parses any JSON document into plain Java values. {@code "null"} yields {@code null}.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static Object valueFromJson(String json) {
        try {
            return MAPPER.readValue(json, Object.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes a value (map, list, scalar, null or a model object) to compact JSON.
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String valueToJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Shared mapper for modules that need tree conversion. Do not reconfigure. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
