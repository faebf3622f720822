package com.actguard.worker.service;

import com.actguard.config.ActguardConfig;
import com.actguard.execution.ExecutionStatus;
import com.actguard.execution.model.ActionExecution;
import com.actguard.masking.SecretOutputMasker;
import com.actguard.validation.JsonSchemaValidationEngine;
import com.actguard.validation.OutputSchemaValidator;
import com.actguard.validation.OutputValidationResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Post-execution output handling for action executions.
 * <ul>
 *   <li>{@link #finalizeOutput} – validates a successful result against the runner and action output schemas
 *       when ACTGUARD_VALIDATE_OUTPUT_SCHEMA is on; a violation turns the execution into a failed one</li>
 *   <li>{@link #presentOutput} – masks secret output fields before a result is shown, unless masking is off
 *       or the caller asked for secrets</li>
 * </ul>
 * Counters: {@code actguard.output.validations} (tag {@code outcome}: passed, failed, skipped) and
 * {@code actguard.output.masked} (tag {@code masked}: true, false).
 */
public final class ExecutionOutputService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionOutputService.class);

    public static final String VALIDATIONS_METER = "actguard.output.validations";
    public static final String MASKED_METER = "actguard.output.masked";

    private final ActguardConfig config;
    private final OutputSchemaValidator validator;
    private final MeterRegistry meterRegistry;

    public ExecutionOutputService(ActguardConfig config, OutputSchemaValidator validator, MeterRegistry meterRegistry) {
        this.config = Objects.requireNonNull(config, "config");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    /** Service with the configured schema dialect and an in-memory meter registry. */
    public static ExecutionOutputService create(ActguardConfig config) {
        Objects.requireNonNull(config, "config");
        OutputSchemaValidator validator = new OutputSchemaValidator(
                JsonSchemaValidationEngine.forSpecVersion(config.getSchemaSpecVersion()));
        return new ExecutionOutputService(config, validator, new SimpleMeterRegistry());
    }

    /**
     * Validates the result of a finished execution. Only {@link ExecutionStatus#SUCCEEDED} results are
     * validated; anything else, or any result while validation is disabled, is returned unchanged.
     */
    public OutputValidationResult finalizeOutput(ActionExecution execution, Object result, ExecutionStatus status) {
        Objects.requireNonNull(execution, "execution");
        Objects.requireNonNull(status, "status");
        if (!config.isValidateOutputSchema() || status != ExecutionStatus.SUCCEEDED) {
            countValidation("skipped");
            return new OutputValidationResult(result, status);
        }
        OutputValidationResult validated = validator.validateOutput(
                execution.getRunner().getOutputSchema(),
                execution.getAction().getOutputSchema(),
                result,
                status,
                execution.getRunner().getOutputKey());
        if (validated.isFailed()) {
            log.info("Execution {} (action {}) failed output validation", execution.getId(), execution.getAction().getRef());
            countValidation("failed");
        } else {
            countValidation("passed");
        }
        return validated;
    }

    /**
     * Returns the result as it may be shown to a caller.
     *
     * @param showSecrets true when the caller is allowed to and asked to see secret values
     */
    public Object presentOutput(ActionExecution execution, Object result, boolean showSecrets) {
        Objects.requireNonNull(execution, "execution");
        if (!config.isMaskSecrets() || showSecrets) {
            return result;
        }
        Object masked = SecretOutputMasker.maskSecretOutput(execution, result);
        boolean changed = masked != result;
        meterRegistry.counter(MASKED_METER, "masked", Boolean.toString(changed)).increment();
        if (changed) {
            log.debug("Masked secret output of execution {}", execution.getId());
        }
        return masked;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    private void countValidation(String outcome) {
        meterRegistry.counter(VALIDATIONS_METER, "outcome", outcome).increment();
    }
}
