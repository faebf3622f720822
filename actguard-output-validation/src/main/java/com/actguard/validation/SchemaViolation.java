package com.actguard.validation;

import java.util.Objects;

/**
 * One schema violation reported by a {@link SchemaValidationEngine}.
 *
 * @param keyword          failing keyword (e.g. {@code additionalProperties}, {@code type})
 * @param message          engine message
 * @param instanceLocation JSON path of the offending instance node (e.g. {@code $.output})
 */
public record SchemaViolation(String keyword, String message, String instanceLocation) {
    public SchemaViolation {
        Objects.requireNonNull(message, "message");
        keyword = keyword != null ? keyword : "";
        instanceLocation = instanceLocation != null ? instanceLocation : "$";
    }
}
