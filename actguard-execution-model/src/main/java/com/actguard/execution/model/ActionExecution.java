package com.actguard.execution.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One run of an action: {@code { id, action: { ref, output_schema }, runner: { name, output_key, output_schema } }}.
 * Transient; built per call and never persisted here. Missing sections deserialize as empty definitions.
 */
public final class ActionExecution {

    private final String id;
    private final ActionDefinition action;
    private final RunnerDefinition runner;

    @JsonCreator
    public ActionExecution(
            @JsonProperty("id") String id,
            @JsonProperty("action") ActionDefinition action,
            @JsonProperty("runner") RunnerDefinition runner) {
        this.id = id;
        this.action = action != null ? action : new ActionDefinition(null, null);
        this.runner = runner != null ? runner : new RunnerDefinition(null, null, null);
    }

    public ActionExecution(ActionDefinition action, RunnerDefinition runner) {
        this(null, action, runner);
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("action")
    public ActionDefinition getAction() {
        return action;
    }

    @JsonProperty("runner")
    public RunnerDefinition getRunner() {
        return runner;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ActionExecution that = (ActionExecution) o;
        return Objects.equals(id, that.id) && Objects.equals(action, that.action) && Objects.equals(runner, that.runner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, action, runner);
    }
}
