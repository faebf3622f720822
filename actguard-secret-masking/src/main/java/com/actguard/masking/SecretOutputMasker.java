package com.actguard.masking;

import com.actguard.execution.model.ActionExecution;
import com.actguard.execution.schema.MalformedSchema;
import com.actguard.execution.schema.OutputSchema;
import com.actguard.execution.schema.SchemaClassifier;
import com.actguard.execution.schema.SchemaType;
import com.actguard.execution.schema.WellFormedSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Replaces output values marked {@code secret} in the action's output schema with
 * {@link MaskedValues#MASKED_ATTRIBUTE_VALUE}.
 * <p>
 * The schema is classified once per call. Anything that cannot be interpreted safely (malformed or legacy
 * schema, missing output key, value shape not matching the schema) leaves the result untouched: masking
 * never fails and never drops a result. Only values positively identified as secret are replaced.
 * <p>
 * Inputs are never mutated. Containers are copied along the paths that change; when nothing changes
 * the original result reference is returned.
 */
public final class SecretOutputMasker {

    private static final Logger log = LoggerFactory.getLogger(SecretOutputMasker.class);

    private SecretOutputMasker() {
    }

    /**
     * Masks secret fields of {@code result[runner.output_key]} using {@code action.output_schema}.
     *
     * @param execution execution record (action output schema, runner output key)
     * @param result    execution result; may be null
     * @return masked copy, or {@code result} itself when there is nothing to mask
     */
    public static Object maskSecretOutput(ActionExecution execution, Object result) {
        Objects.requireNonNull(execution, "execution");
        return maskSecretOutput(execution.getAction().getOutputSchema(), execution.getRunner().getOutputKey(), result);
    }

    /**
     * Same as {@link #maskSecretOutput(ActionExecution, Object)} with the schema and output key given directly.
     */
    public static Object maskSecretOutput(Map<String, Object> outputSchema, String outputKey, Object result) {
        if (!(result instanceof Map)) {
            return result;
        }
        Map<?, ?> resultMap = (Map<?, ?>) result;
        if (resultMap.isEmpty() || outputKey == null || outputKey.isBlank() || !resultMap.containsKey(outputKey)) {
            return result;
        }
        if (outputSchema == null || outputSchema.isEmpty()) {
            return result;
        }
        OutputSchema schema = SchemaClassifier.classify(outputSchema);
        if (!schema.isWellFormed()) {
            log.debug("Output schema not usable for masking, leaving output as is: {}", ((MalformedSchema) schema).getReason());
            return result;
        }

        Object value = resultMap.get(outputKey);
        Object masked = maskValue(schema.asWellFormed(), value);
        if (masked == value) {
            return result;
        }
        Map<Object, Object> copy = new LinkedHashMap<>(resultMap);
        copy.put(outputKey, masked);
        return copy;
    }

    /**
     * Walks {@code node} and {@code value} together and returns the masked value.
     * Returns {@code value} itself when nothing under it is secret.
     */
    static Object maskValue(WellFormedSchema node, Object value) {
        if (node.isSecret()) {
            return MaskedValues.MASKED_ATTRIBUTE_VALUE;
        }
        if (node.hasType(SchemaType.OBJECT) && value instanceof Map) {
            return maskObject(node, (Map<?, ?>) value);
        }
        if (node.hasType(SchemaType.ARRAY) && value instanceof List) {
            return maskArray(node, (List<?>) value);
        }
        return value;
    }

    private static Object maskObject(WellFormedSchema node, Map<?, ?> value) {
        Map<Object, Object> copy = null;
        for (Map.Entry<?, ?> e : value.entrySet()) {
            WellFormedSchema propertySpec = schemaForKey(node, String.valueOf(e.getKey()));
            if (propertySpec == null) continue;
            Object original = e.getValue();
            Object masked = maskValue(propertySpec, original);
            if (masked != original) {
                if (copy == null) copy = new LinkedHashMap<>(value);
                copy.put(e.getKey(), masked);
            }
        }
        return copy != null ? copy : value;
    }

    private static Object maskArray(WellFormedSchema node, List<?> value) {
        List<Object> copy = null;
        for (int i = 0; i < value.size(); i++) {
            WellFormedSchema itemSpec = schemaForIndex(node, i);
            if (itemSpec == null) continue;
            Object original = value.get(i);
            Object masked = maskValue(itemSpec, original);
            if (masked != original) {
                if (copy == null) copy = new ArrayList<>(value);
                copy.set(i, masked);
            }
        }
        return copy != null ? copy : value;
    }

    /** Declared property, else first matching pattern property, else the additionalProperties schema. */
    private static WellFormedSchema schemaForKey(WellFormedSchema node, String key) {
        WellFormedSchema declared = node.getProperties().get(key);
        if (declared != null) return declared;
        for (WellFormedSchema.PatternProperty p : node.getPatternProperties()) {
            if (p.matches(key)) return p.schema();
        }
        return node.getAdditionalPropertiesSchema();
    }

    private static WellFormedSchema schemaForIndex(WellFormedSchema node, int index) {
        if (node.getItemsSchema() != null) return node.getItemsSchema();
        List<WellFormedSchema> positional = node.getPositionalItems();
        if (positional == null) return null;
        return index < positional.size() ? positional.get(index) : node.getAdditionalItemsSchema();
    }
}
