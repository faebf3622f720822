package com.actguard.worker.activity;

import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/** Output-schema activities. Payloads are JSON strings so any workflow language can call them. */
@ActivityInterface
public interface OutputSchemaActivities {

    /**
     * Validates a finished execution's result against its runner and action output schemas.
     *
     * @param executionJson execution record JSON ({@code action.output_schema}, {@code runner.output_key},
     *                      {@code runner.output_schema})
     * @param resultJson    execution result JSON
     * @param status        current status (e.g. {@code succeeded})
     * @return JSON object {@code {"result": <result or error payload>, "status": "<status>"}}
     */
    @ActivityMethod
    String validateOutput(String executionJson, String resultJson, String status);

    /**
     * Masks secret output fields of a result for display.
     *
     * @param executionJson execution record JSON
     * @param resultJson    execution result JSON
     * @param showSecrets   true to return the result unmasked
     * @return result JSON, masked unless secrets were requested or masking is disabled
     */
    @ActivityMethod
    String maskSecretOutput(String executionJson, String resultJson, boolean showSecrets);
}
