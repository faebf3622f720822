package com.actguard.execution.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Action (task definition) side of an execution record: reference and declared output schema.
 * The output schema is kept raw; use {@link com.actguard.execution.schema.SchemaClassifier} to interpret it.
 */
public final class ActionDefinition {

    private final String ref;
    private final Map<String, Object> outputSchema;

    @JsonCreator
    public ActionDefinition(
            @JsonProperty("ref") String ref,
            @JsonProperty("output_schema") Map<String, Object> outputSchema) {
        this.ref = ref;
        this.outputSchema = outputSchema != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputSchema)) : Map.of();
    }

    /** Action reference (e.g. {@code core.http}). May be null. */
    @JsonProperty("ref")
    public String getRef() {
        return ref;
    }

    /** Declared output schema of the action. Empty when none. Unmodifiable. */
    @JsonProperty("output_schema")
    public Map<String, Object> getOutputSchema() {
        return outputSchema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionDefinition that = (ActionDefinition) o;
        return Objects.equals(ref, that.ref) && Objects.equals(outputSchema, that.outputSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ref, outputSchema);
    }
}
