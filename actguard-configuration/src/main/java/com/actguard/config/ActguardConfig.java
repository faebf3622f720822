package com.actguard.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the actguard output worker.
 * <p>
 * Queue names: ACTGUARD_QUEUE (comma-separated). Temporal: ACTGUARD_TEMPORAL_TARGET, ACTGUARD_TEMPORAL_NAMESPACE.
 * <p>
 * Output handling: ACTGUARD_VALIDATE_OUTPUT_SCHEMA turns on validation of successful results against the
 * runner and action output schemas; ACTGUARD_MASK_SECRETS masks secret output fields when results are presented.
 * ACTGUARD_SCHEMA_SPEC_VERSION selects the JSON Schema dialect (V4, V6, V7, V201909, V202012).
 */
public final class ActguardConfig {

    private static final String ENV_QUEUE = "ACTGUARD_QUEUE";
    private static final String ENV_TEMPORAL_TARGET = "ACTGUARD_TEMPORAL_TARGET";
    private static final String ENV_TEMPORAL_NAMESPACE = "ACTGUARD_TEMPORAL_NAMESPACE";
    private static final String ENV_VALIDATE_OUTPUT_SCHEMA = "ACTGUARD_VALIDATE_OUTPUT_SCHEMA";
    private static final String ENV_MASK_SECRETS = "ACTGUARD_MASK_SECRETS";
    private static final String ENV_SCHEMA_SPEC_VERSION = "ACTGUARD_SCHEMA_SPEC_VERSION";
    private static final String ENV_MAX_CONCURRENT_ACTIVITIES = "ACTGUARD_MAX_CONCURRENT_ACTIVITIES";

    private static final String DEFAULT_QUEUE = "actguard-output-queue";
    private static final String DEFAULT_TEMPORAL_TARGET = "localhost:7233";
    private static final String DEFAULT_TEMPORAL_NAMESPACE = "default";
    private static final boolean DEFAULT_VALIDATE_OUTPUT_SCHEMA = false;
    private static final boolean DEFAULT_MASK_SECRETS = true;
    private static final String DEFAULT_SCHEMA_SPEC_VERSION = "V4";
    private static final int DEFAULT_MAX_CONCURRENT_ACTIVITIES = 10;

    private static final Set<String> SUPPORTED_SPEC_VERSIONS = Set.of("V4", "V6", "V7", "V201909", "V202012");

    private final List<String> taskQueues;
    private final String temporalTarget;
    private final String temporalNamespace;
    private final boolean validateOutputSchema;
    private final boolean maskSecrets;
    private final String schemaSpecVersion;
    private final int maxConcurrentActivities;

    private ActguardConfig(Builder b) {
        this.taskQueues = Collections.unmodifiableList(new ArrayList<>(b.taskQueues));
        this.temporalTarget = b.temporalTarget;
        this.temporalNamespace = b.temporalNamespace;
        this.validateOutputSchema = b.validateOutputSchema;
        this.maskSecrets = b.maskSecrets;
        this.schemaSpecVersion = b.schemaSpecVersion;
        this.maxConcurrentActivities = b.maxConcurrentActivities;
    }

    /** Task queues this worker polls. Never empty when built from the environment. */
    public List<String> getTaskQueues() {
        return taskQueues;
    }

    public String getTemporalTarget() {
        return temporalTarget;
    }

    public String getTemporalNamespace() {
        return temporalNamespace;
    }

    /** Whether successful results are validated against the runner and action output schemas. Default false. */
    public boolean isValidateOutputSchema() {
        return validateOutputSchema;
    }

    /** Whether secret output fields are masked when results are presented. Default true. */
    public boolean isMaskSecrets() {
        return maskSecrets;
    }

    /** JSON Schema dialect name (e.g. V4). Default {@code V4}. */
    public String getSchemaSpecVersion() {
        return schemaSpecVersion;
    }

    public int getMaxConcurrentActivities() {
        return maxConcurrentActivities;
    }

    public static ActguardConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /**
     * Builds the config from an environment-like map. Unparseable values fall back to defaults.
     */
    public static ActguardConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> queues = parseCommaSeparated(env.get(ENV_QUEUE));
        if (queues.isEmpty()) {
            queues = List.of(DEFAULT_QUEUE);
        }
        return builder()
                .taskQueues(queues)
                .temporalTarget(getEnv(env, ENV_TEMPORAL_TARGET, DEFAULT_TEMPORAL_TARGET))
                .temporalNamespace(getEnv(env, ENV_TEMPORAL_NAMESPACE, DEFAULT_TEMPORAL_NAMESPACE))
                .validateOutputSchema(parseBoolean(env.get(ENV_VALIDATE_OUTPUT_SCHEMA), DEFAULT_VALIDATE_OUTPUT_SCHEMA))
                .maskSecrets(parseBoolean(env.get(ENV_MASK_SECRETS), DEFAULT_MASK_SECRETS))
                .schemaSpecVersion(parseSpecVersion(env.get(ENV_SCHEMA_SPEC_VERSION)))
                .maxConcurrentActivities(parseInt(env.get(ENV_MAX_CONCURRENT_ACTIVITIES), DEFAULT_MAX_CONCURRENT_ACTIVITIES))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String parseSpecVersion(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_SCHEMA_SPEC_VERSION;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return SUPPORTED_SPEC_VERSIONS.contains(normalized) ? normalized : DEFAULT_SCHEMA_SPEC_VERSION;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private List<String> taskQueues = List.of(DEFAULT_QUEUE);
        private String temporalTarget = DEFAULT_TEMPORAL_TARGET;
        private String temporalNamespace = DEFAULT_TEMPORAL_NAMESPACE;
        private boolean validateOutputSchema = DEFAULT_VALIDATE_OUTPUT_SCHEMA;
        private boolean maskSecrets = DEFAULT_MASK_SECRETS;
        private String schemaSpecVersion = DEFAULT_SCHEMA_SPEC_VERSION;
        private int maxConcurrentActivities = DEFAULT_MAX_CONCURRENT_ACTIVITIES;

        public Builder taskQueues(List<String> taskQueues) {
            this.taskQueues = Objects.requireNonNull(taskQueues, "taskQueues");
            return this;
        }

        public Builder temporalTarget(String temporalTarget) {
            this.temporalTarget = temporalTarget != null ? temporalTarget : DEFAULT_TEMPORAL_TARGET;
            return this;
        }

        public Builder temporalNamespace(String temporalNamespace) {
            this.temporalNamespace = temporalNamespace != null ? temporalNamespace : DEFAULT_TEMPORAL_NAMESPACE;
            return this;
        }

        public Builder validateOutputSchema(boolean validateOutputSchema) {
            this.validateOutputSchema = validateOutputSchema;
            return this;
        }

        public Builder maskSecrets(boolean maskSecrets) {
            this.maskSecrets = maskSecrets;
            return this;
        }

        public Builder schemaSpecVersion(String schemaSpecVersion) {
            this.schemaSpecVersion = schemaSpecVersion != null ? schemaSpecVersion : DEFAULT_SCHEMA_SPEC_VERSION;
            return this;
        }

        public Builder maxConcurrentActivities(int maxConcurrentActivities) {
            this.maxConcurrentActivities = maxConcurrentActivities;
            return this;
        }

        public ActguardConfig build() {
            return new ActguardConfig(this);
        }
    }
}
