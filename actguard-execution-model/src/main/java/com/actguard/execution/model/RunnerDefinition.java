package com.actguard.execution.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runner (execution engine) side of an execution record: the envelope schema the runner
 * guarantees and the key of the result field that holds the action's own output.
 */
public final class RunnerDefinition {

    private final String name;
    private final String outputKey;
    private final Map<String, Object> outputSchema;

    @JsonCreator
    public RunnerDefinition(
            @JsonProperty("name") String name,
            @JsonProperty("output_key") String outputKey,
            @JsonProperty("output_schema") Map<String, Object> outputSchema) {
        this.name = name;
        this.outputKey = outputKey;
        this.outputSchema = outputSchema != null ? Collections.unmodifiableMap(new LinkedHashMap<>(outputSchema)) : Map.of();
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    /** Result field holding the action output (e.g. {@code "output"}, {@code "result"}). May be null. */
    @JsonProperty("output_key")
    public String getOutputKey() {
        return outputKey;
    }

    /** Envelope schema for the whole result. Empty when the runner declares none. */
    @JsonProperty("output_schema")
    public Map<String, Object> getOutputSchema() {
        return outputSchema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunnerDefinition that = (RunnerDefinition) o;
        return Objects.equals(name, that.name) && Objects.equals(outputKey, that.outputKey)
                && Objects.equals(outputSchema, that.outputSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, outputKey, outputSchema);
    }
}
