package com.actguard.validation;

import com.actguard.execution.ActionExecutionJson;
import com.actguard.execution.ExecutionStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputSchemaValidatorTest {

    private static final String OUTPUT_KEY = "output";

    private static final String ACTION_RESULT = """
            {
              "output": {
                "output_1": "Bobby",
                "output_2": 5,
                "output_3": "shhh!",
                "deep_output": {
                  "deep_item_1": "Jindal"
                }
              }
            }
            """;

    private static final String RUNNER_OUTPUT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "output": {"type": "object"},
                "error": {"type": "array"}
              },
              "additionalProperties": false
            }
            """;

    private static final String ACTION_OUTPUT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "output_1": {"type": "string"},
                "output_2": {"type": "integer"},
                "output_3": {"type": "string", "secret": true},
                "deep_output": {
                  "type": "object",
                  "parameters": {
                    "deep_item_1": {"type": "string"}
                  }
                }
              },
              "additionalProperties": false
            }
            """;

    private static final String SCHEMA_FAIL = """
            {
              "type": "object",
              "properties": {
                "not_a_key_you_have": {"type": "string"}
              },
              "additionalProperties": false
            }
            """;

    private final OutputSchemaValidator validator = new OutputSchemaValidator();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> schema(String json) {
        return (Map<String, Object>) ActionExecutionJson.valueFromJson(json);
    }

    private static Object value(String json) {
        return ActionExecutionJson.valueFromJson(json);
    }

    @Test
    void validateOutput_conformingResultIsReturnedUnchanged() {
        Object result = value(ACTION_RESULT);

        OutputValidationResult out = validator.validateOutput(
                schema(RUNNER_OUTPUT_SCHEMA), schema(ACTION_OUTPUT_SCHEMA), result, ExecutionStatus.SUCCEEDED, OUTPUT_KEY);

        assertSame(result, out.result());
        assertSame(ExecutionStatus.SUCCEEDED, out.status());
        assertEquals(value(ACTION_RESULT), out.result());
        assertFalse(out.isFailed());
    }

    @Test
    void validateOutput_runnerViolationFailsWithTwoKeyPayload() {
        OutputValidationResult out = validator.validateOutput(
                schema(SCHEMA_FAIL), schema(ACTION_OUTPUT_SCHEMA), value(ACTION_RESULT), ExecutionStatus.SUCCEEDED, OUTPUT_KEY);

        assertEquals(ExecutionStatus.FAILED, out.status());
        assertTrue(out.isFailed());
        Map<?, ?> payload = (Map<?, ?>) out.result();
        assertEquals(Set.of("error", "message"), payload.keySet());
        assertEquals("Error validating output. See error output for more details.", payload.get("message"));
        String error = (String) payload.get("error");
        assertTrue(error.contains("does not allow additional properties"), error);
        assertTrue(error.contains("Failed validating 'additionalProperties' in schema:"), error);
        assertTrue(error.contains("not_a_key_you_have"), error);
        assertTrue(error.contains("On instance:"), error);
        assertTrue(error.contains("\"Bobby\""), error);
    }

    @Test
    void validateOutput_runnerViolationDoesNotConsultActionSchema() {
        List<Object> seenSchemas = new ArrayList<>();
        SchemaValidationEngine recording = (schema, instance) -> {
            seenSchemas.add(schema);
            return Optional.of(new SchemaViolation("required", "$: required property 'stdout' not found", "$"));
        };
        Map<String, Object> runnerSchema = schema(RUNNER_OUTPUT_SCHEMA);

        OutputValidationResult out = new OutputSchemaValidator(recording).validateOutput(
                runnerSchema, schema(ACTION_OUTPUT_SCHEMA), value(ACTION_RESULT), ExecutionStatus.SUCCEEDED, OUTPUT_KEY);

        assertEquals(List.of(runnerSchema), seenSchemas);
        assertEquals(ExecutionStatus.FAILED, out.status());
        assertTrue(((String) ((Map<?, ?>) out.result()).get("error")).startsWith("$: required property 'stdout' not found"));
    }

    @Test
    void validateOutput_actionViolationFailsWithTwoKeyPayload() {
        OutputValidationResult out = validator.validateOutput(
                schema(RUNNER_OUTPUT_SCHEMA), schema(SCHEMA_FAIL), value(ACTION_RESULT), ExecutionStatus.SUCCEEDED, OUTPUT_KEY);

        assertEquals(ExecutionStatus.FAILED, out.status());
        Map<?, ?> payload = (Map<?, ?>) out.result();
        assertEquals(Set.of("error", "message"), payload.keySet());
        assertTrue(((String) payload.get("error")).contains("does not allow additional properties"));
        assertEquals(ValidationErrorPayload.MESSAGE, payload.get("message"));
    }

    @Test
    void validateOutput_actionTypeMismatchIsReported() {
        Object result = value("""
                {"output": {"output_1": "Bobby", "output_2": "five", "output_3": "shhh!", "deep_output": {}}}
                """);

        OutputValidationResult out = validator.validateOutput(
                schema(RUNNER_OUTPUT_SCHEMA), schema(ACTION_OUTPUT_SCHEMA), result, ExecutionStatus.SUCCEEDED, OUTPUT_KEY);

        assertEquals(ExecutionStatus.FAILED, out.status());
        String error = (String) ((Map<?, ?>) out.result()).get("error");
        assertTrue(error.contains("integer"), error);
        assertTrue(error.contains("Failed validating 'type'"), error);
    }

    @Test
    void validateOutput_missingOutputKeyValidatesNull() {
        OutputValidationResult out = validator.validateOutput(
                schema(RUNNER_OUTPUT_SCHEMA), schema(ACTION_OUTPUT_SCHEMA), value("{\"error\": []}"),
                ExecutionStatus.SUCCEEDED, OUTPUT_KEY);

        assertEquals(ExecutionStatus.FAILED, out.status());
        assertTrue(((String) ((Map<?, ?>) out.result()).get("error")).contains("Failed validating 'type'"));
    }

    @Test
    void validateOutput_emptySchemasSkipLayers() {
        Object result = value(ACTION_RESULT);

        OutputValidationResult noRunner = validator.validateOutput(
                Map.of(), schema(SCHEMA_FAIL), result, ExecutionStatus.SUCCEEDED, OUTPUT_KEY);
        OutputValidationResult noAction = validator.validateOutput(
                schema(RUNNER_OUTPUT_SCHEMA), null, result, ExecutionStatus.RUNNING, OUTPUT_KEY);

        assertSame(result, noRunner.result());
        assertSame(ExecutionStatus.SUCCEEDED, noRunner.status());
        assertSame(result, noAction.result());
        assertSame(ExecutionStatus.RUNNING, noAction.status());
    }

    @Test
    void validateOutput_engineFailureBecomesFailedResultWithTraceback() {
        SchemaValidationEngine broken = (schema, instance) -> {
            throw new OutputValidationException("Schema could not be evaluated: bad $ref", new IllegalStateException("bad $ref"));
        };

        OutputValidationResult out = new OutputSchemaValidator(broken).validateOutput(
                schema(RUNNER_OUTPUT_SCHEMA), schema(ACTION_OUTPUT_SCHEMA), value(ACTION_RESULT), ExecutionStatus.SUCCEEDED, OUTPUT_KEY);

        assertEquals(ExecutionStatus.FAILED, out.status());
        Map<?, ?> payload = (Map<?, ?>) out.result();
        assertEquals(Set.of("error", "message", "traceback"), payload.keySet());
        assertEquals("Schema could not be evaluated: bad $ref", payload.get("error"));
        assertTrue(((String) payload.get("traceback")).contains("OutputValidationException"));
    }

    @Test
    void validateOutput_doesNotModifyInputs() {
        Object result = value(ACTION_RESULT);
        Map<String, Object> runnerSchema = schema(SCHEMA_FAIL);

        validator.validateOutput(runnerSchema, schema(ACTION_OUTPUT_SCHEMA), result, ExecutionStatus.SUCCEEDED, OUTPUT_KEY);

        assertEquals(value(ACTION_RESULT), result);
        assertEquals(schema(SCHEMA_FAIL), runnerSchema);
    }

    @Test
    void validateOutput_isSafeToCallConcurrently() throws Exception {
        Map<String, Object> runnerSchema = schema(RUNNER_OUTPUT_SCHEMA);
        Map<String, Object> actionSchema = schema(SCHEMA_FAIL);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<OutputValidationResult>> calls = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                calls.add(() -> validator.validateOutput(runnerSchema, actionSchema, value(ACTION_RESULT),
                        ExecutionStatus.SUCCEEDED, OUTPUT_KEY));
            }
            for (Future<OutputValidationResult> f : pool.invokeAll(calls)) {
                assertEquals(ExecutionStatus.FAILED, f.get().status());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
