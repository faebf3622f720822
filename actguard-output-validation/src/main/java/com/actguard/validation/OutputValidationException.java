package com.actguard.validation;

/**
 * Thrown by a {@link SchemaValidationEngine} when a schema cannot be compiled or evaluated.
 * {@link OutputSchemaValidator} converts it into a failed result; it does not escape validation.
 */
public class OutputValidationException extends RuntimeException {

    public OutputValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
