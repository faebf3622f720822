package com.actguard.execution.schema;

/**
 * Result of classifying a raw output schema once per call: either a {@link WellFormedSchema}
 * tree or the {@link MalformedSchema} marker. Consumers dispatch on {@link #isWellFormed()}
 * instead of re-inspecting raw maps during traversal.
 *
 * @see SchemaClassifier#classify(Object)
 */
public interface OutputSchema {

    boolean isWellFormed();

    /** Returns this schema as a well-formed tree. */
    default WellFormedSchema asWellFormed() {
        if (!isWellFormed()) {
            throw new IllegalStateException("Schema is malformed: " + this);
        }
        return (WellFormedSchema) this;
    }
}
