package com.actguard.validation;

import com.actguard.execution.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates the output of a completed action execution against two layered schemas:
 * the runner's envelope schema (whole result), then the action's schema (the value at the output key).
 * <p>
 * A violation does not throw: the result is replaced by {@link ValidationErrorPayload} and the status
 * becomes {@link ExecutionStatus#FAILED}, so the failed execution can be stored with its diagnostic.
 * When both layers pass, the given result and status are returned as-is (same references).
 * <p>
 * Layer skipping: a null or empty runner schema means the runner declares no envelope, and neither
 * layer runs; a null or empty action schema skips only the content layer.
 * <p>
 * Stateless apart from the engine; safe to share across threads.
 */
public final class OutputSchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(OutputSchemaValidator.class);

    private final SchemaValidationEngine engine;

    public OutputSchemaValidator(SchemaValidationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /** Validator using the draft 4 networknt engine. */
    public OutputSchemaValidator() {
        this(JsonSchemaValidationEngine.draft4());
    }

    /**
     * Validates {@code result} against {@code runnerSchema}, then {@code result[outputKey]} against {@code actionSchema}.
     *
     * @param runnerSchema envelope schema for the whole result
     * @param actionSchema schema for the action's own output
     * @param result       execution result (usually a mapping)
     * @param status       current execution status
     * @param outputKey    result field holding the action output
     * @return the unchanged result and status, or the error payload and {@link ExecutionStatus#FAILED}
     */
    public OutputValidationResult validateOutput(Map<String, Object> runnerSchema,
                                                 Map<String, Object> actionSchema,
                                                 Object result,
                                                 ExecutionStatus status,
                                                 String outputKey) {
        Objects.requireNonNull(status, "status");
        log.debug("Validating action output (outputKey={})", outputKey);
        try {
            if (runnerSchema == null || runnerSchema.isEmpty()) {
                log.debug("No runner output schema; skipping output validation");
                return new OutputValidationResult(result, status);
            }
            Optional<SchemaViolation> envelopeViolation = engine.firstViolation(runnerSchema, result);
            if (envelopeViolation.isPresent()) {
                return failed(envelopeViolation.get(), runnerSchema, result, "runner", outputKey);
            }

            if (actionSchema == null || actionSchema.isEmpty()) {
                return new OutputValidationResult(result, status);
            }
            Object output = outputOf(result, outputKey);
            Optional<SchemaViolation> contentViolation = engine.firstViolation(actionSchema, output);
            if (contentViolation.isPresent()) {
                return failed(contentViolation.get(), actionSchema, output, "action", outputKey);
            }
        } catch (RuntimeException e) {
            log.error("Failed to validate output (outputKey={})", outputKey, e);
            return new OutputValidationResult(ValidationErrorPayload.forUnexpectedFailure(e), ExecutionStatus.FAILED);
        }
        return new OutputValidationResult(result, status);
    }

    private static OutputValidationResult failed(SchemaViolation violation, Map<String, Object> schema, Object instance,
                                                 String layer, String outputKey) {
        log.warn("Output failed {} schema validation: keyword={}, location={}, outputKey={}",
                layer, violation.keyword(), violation.instanceLocation(), outputKey);
        return new OutputValidationResult(
                ValidationErrorPayload.forViolation(violation, schema, instance),
                ExecutionStatus.FAILED);
    }

    private static Object outputOf(Object result, String outputKey) {
        if (outputKey == null || !(result instanceof Map)) {
            return null;
        }
        return ((Map<?, ?>) result).get(outputKey);
    }
}
