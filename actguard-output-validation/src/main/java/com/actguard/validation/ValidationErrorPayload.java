package com.actguard.validation;

import com.actguard.execution.ActionExecutionJson;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the result that replaces an execution's output when validation fails:
 * {@code {"error": <diagnostic>, "message": "Error validating output. See error output for more details."}}.
 * Unexpected failures additionally carry {@code traceback}.
 */
public final class ValidationErrorPayload {

    public static final String ERROR_KEY = "error";
    public static final String MESSAGE_KEY = "message";
    public static final String TRACEBACK_KEY = "traceback";
    public static final String MESSAGE = "Error validating output. See error output for more details.";

    private static final String INDENT = "    ";

    private ValidationErrorPayload() {
    }

    /** Two-key payload for a schema violation. */
    public static Map<String, Object> forViolation(SchemaViolation violation, Object schema, Object instance) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ERROR_KEY, describe(violation, schema, instance));
        payload.put(MESSAGE_KEY, MESSAGE);
        return payload;
    }

    /** Payload for a failure of the validation machinery itself (schema not compilable, etc.). */
    public static Map<String, Object> forUnexpectedFailure(Throwable failure) {
        Map<String, Object> payload = new LinkedHashMap<>();
        StringWriter trace = new StringWriter();
        failure.printStackTrace(new PrintWriter(trace));
        payload.put(TRACEBACK_KEY, trace.toString());
        payload.put(ERROR_KEY, String.valueOf(failure.getMessage()));
        payload.put(MESSAGE_KEY, MESSAGE);
        return payload;
    }

    /**
     * Diagnostic text: the engine message, the failing keyword with the layer schema, and the instance.
     * Only the engine message is stable enough to match on.
     */
    static String describe(SchemaViolation violation, Object schema, Object instance) {
        return violation.message()
                + "\n\nFailed validating '" + violation.keyword() + "' in schema:\n" + indent(render(schema))
                + "\n\nOn instance:\n" + indent(render(instance));
    }

    private static String render(Object value) {
        try {
            return ActionExecutionJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String indent(String text) {
        return INDENT + text.replace("\n", "\n" + INDENT);
    }
}
