package com.actguard.execution.schema;

import java.util.Objects;

/**
 * Schema that cannot be interpreted: not a mapping, a legacy flat-properties shape without a
 * {@code type} wrapper, or a tree with a descriptor that is not a mapping. Carries the reason for logging.
 */
public final class MalformedSchema implements OutputSchema {

    private final String reason;

    private MalformedSchema(String reason) {
        this.reason = reason;
    }

    public static MalformedSchema because(String reason) {
        return new MalformedSchema(Objects.requireNonNull(reason, "reason"));
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean isWellFormed() {
        return false;
    }

    @Override
    public String toString() {
        return "MalformedSchema{" + reason + "}";
    }
}
