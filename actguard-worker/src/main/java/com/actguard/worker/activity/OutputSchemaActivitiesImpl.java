package com.actguard.worker.activity;

import com.actguard.execution.ActionExecutionJson;
import com.actguard.execution.ExecutionStatus;
import com.actguard.execution.model.ActionExecution;
import com.actguard.validation.OutputValidationResult;
import com.actguard.worker.service.ExecutionOutputService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Temporal activity implementation; parses the JSON payloads and delegates to {@link ExecutionOutputService}.
 * Unparseable payloads and unknown statuses raise {@link IllegalArgumentException}.
 */
public class OutputSchemaActivitiesImpl implements OutputSchemaActivities {

    private static final Logger log = LoggerFactory.getLogger(OutputSchemaActivitiesImpl.class);

    static final String RESULT_KEY = "result";
    static final String STATUS_KEY = "status";

    private final ExecutionOutputService outputService;

    public OutputSchemaActivitiesImpl(ExecutionOutputService outputService) {
        this.outputService = Objects.requireNonNull(outputService, "outputService");
    }

    @Override
    public String validateOutput(String executionJson, String resultJson, String status) {
        ActionExecution execution = parseExecution(executionJson);
        Object result = parseResult(resultJson);
        ExecutionStatus current = ExecutionStatus.fromValue(status);

        OutputValidationResult validated = outputService.finalizeOutput(execution, result, current);
        log.info("Output validation for execution {}: status {} -> {}", execution.getId(), current.toValue(),
                validated.status().toValue());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put(RESULT_KEY, validated.result());
        response.put(STATUS_KEY, validated.status().toValue());
        return ActionExecutionJson.valueToJson(response);
    }

    @Override
    public String maskSecretOutput(String executionJson, String resultJson, boolean showSecrets) {
        ActionExecution execution = parseExecution(executionJson);
        Object result = parseResult(resultJson);
        return ActionExecutionJson.valueToJson(outputService.presentOutput(execution, result, showSecrets));
    }

    private static ActionExecution parseExecution(String executionJson) {
        if (executionJson == null || executionJson.isBlank()) {
            throw new IllegalArgumentException("Execution JSON is required");
        }
        ActionExecution execution;
        try {
            execution = ActionExecutionJson.fromJson(executionJson);
        } catch (UncheckedIOException e) {
            throw new IllegalArgumentException("Invalid execution JSON: " + e.getMessage(), e);
        }
        if (execution == null) {
            throw new IllegalArgumentException("Execution JSON must be an object");
        }
        return execution;
    }

    private static Object parseResult(String resultJson) {
        if (resultJson == null || resultJson.isBlank()) {
            return null;
        }
        try {
            return ActionExecutionJson.valueFromJson(resultJson);
        } catch (UncheckedIOException e) {
            throw new IllegalArgumentException("Invalid result JSON: " + e.getMessage(), e);
        }
    }
}
