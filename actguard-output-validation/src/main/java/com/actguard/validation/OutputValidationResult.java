package com.actguard.validation;

import com.actguard.execution.ExecutionStatus;

import java.util.Objects;

/**
 * Outcome of {@link OutputSchemaValidator#validateOutput}: the (possibly replaced) result and status.
 * On success both are the exact references that were passed in.
 */
public record OutputValidationResult(Object result, ExecutionStatus status) {
    public OutputValidationResult {
        Objects.requireNonNull(status, "status");
    }

    public boolean isFailed() {
        return status == ExecutionStatus.FAILED;
    }
}
