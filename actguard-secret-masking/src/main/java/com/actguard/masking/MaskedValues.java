package com.actguard.masking;

/** Shared masking constants. Display and alerting layers compare against this exact literal. */
public final class MaskedValues {

    /** Replacement for every redacted value. */
    public static final String MASKED_ATTRIBUTE_VALUE = "********";

    private MaskedValues() {
    }
}
