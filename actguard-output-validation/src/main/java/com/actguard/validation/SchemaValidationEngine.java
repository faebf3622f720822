package com.actguard.validation;

import java.util.Optional;

/**
 * JSON Schema validation capability. Implementations validate a plain JSON-like value
 * ({@code Map}/{@code List}/scalars/{@code null}) against a schema of the same form.
 * Which violation is "first" when several exist is implementation-defined.
 */
@FunctionalInterface
public interface SchemaValidationEngine {

    /**
     * @param schema   schema as a JSON-like mapping
     * @param instance value to validate (may be null)
     * @return the first violation, or empty when the instance conforms
     * @throws OutputValidationException when the schema cannot be compiled or evaluated
     */
    Optional<SchemaViolation> firstViolation(Object schema, Object instance);
}
