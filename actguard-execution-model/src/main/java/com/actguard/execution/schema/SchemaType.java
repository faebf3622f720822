package com.actguard.execution.schema;

import java.util.Optional;

/** JSON Schema primitive type names accepted in the {@code type} keyword. */
public enum SchemaType {
    OBJECT("object"),
    ARRAY("array"),
    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    NULL("null");

    private final String value;

    SchemaType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** Exact (case-sensitive) lookup, as JSON Schema does. Empty when the name is not a JSON Schema type. */
    public static Optional<SchemaType> fromValue(String value) {
        if (value == null) return Optional.empty();
        for (SchemaType t : values()) {
            if (t.value.equals(value)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
