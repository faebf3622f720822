package com.actguard.execution.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Typed view of one schema node: {@code type}, {@code properties}, {@code patternProperties},
 * {@code additionalProperties}, {@code items}, {@code additionalItems} and the custom {@code secret} flag.
 * Nested nodes may have no type. Instances are immutable and built only by {@link SchemaClassifier}.
 */
public final class WellFormedSchema implements OutputSchema {

    private final Set<SchemaType> types;
    private final Map<String, WellFormedSchema> properties;
    private final List<PatternProperty> patternProperties;
    private final Boolean additionalPropertiesAllowed;
    private final WellFormedSchema additionalPropertiesSchema;
    private final WellFormedSchema itemsSchema;
    private final List<WellFormedSchema> positionalItems;
    private final WellFormedSchema additionalItemsSchema;
    private final boolean secret;

    private WellFormedSchema(Builder b) {
        this.types = b.types.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(b.types));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
        this.patternProperties = List.copyOf(b.patternProperties);
        this.additionalPropertiesAllowed = b.additionalPropertiesAllowed;
        this.additionalPropertiesSchema = b.additionalPropertiesSchema;
        this.itemsSchema = b.itemsSchema;
        this.positionalItems = b.positionalItems != null ? List.copyOf(b.positionalItems) : null;
        this.additionalItemsSchema = b.additionalItemsSchema;
        this.secret = b.secret;
    }

    @Override
    public boolean isWellFormed() {
        return true;
    }

    /** Declared types; empty when the node has no {@code type} keyword. */
    public Set<SchemaType> getTypes() {
        return types;
    }

    public boolean hasType(SchemaType type) {
        return types.contains(type);
    }

    public boolean isSecret() {
        return secret;
    }

    /** Declared properties by name. Unmodifiable, never null. */
    public Map<String, WellFormedSchema> getProperties() {
        return properties;
    }

    /** Declared pattern properties in declaration order. */
    public List<PatternProperty> getPatternProperties() {
        return patternProperties;
    }

    /** Boolean form of {@code additionalProperties}; null when absent or given as a schema. */
    public Boolean getAdditionalPropertiesAllowed() {
        return additionalPropertiesAllowed;
    }

    /** Schema form of {@code additionalProperties}; null when absent or boolean. */
    public WellFormedSchema getAdditionalPropertiesSchema() {
        return additionalPropertiesSchema;
    }

    /** Single {@code items} schema applying to every element; null when absent or positional. */
    public WellFormedSchema getItemsSchema() {
        return itemsSchema;
    }

    /** Positional {@code items} schemas; null unless {@code items} was given as a list. */
    public List<WellFormedSchema> getPositionalItems() {
        return positionalItems;
    }

    /** Schema for elements past the positional items; null when absent. */
    public WellFormedSchema getAdditionalItemsSchema() {
        return additionalItemsSchema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WellFormedSchema that = (WellFormedSchema) o;
        return secret == that.secret
                && Objects.equals(types, that.types)
                && Objects.equals(properties, that.properties)
                && Objects.equals(patternProperties, that.patternProperties)
                && Objects.equals(additionalPropertiesAllowed, that.additionalPropertiesAllowed)
                && Objects.equals(additionalPropertiesSchema, that.additionalPropertiesSchema)
                && Objects.equals(itemsSchema, that.itemsSchema)
                && Objects.equals(positionalItems, that.positionalItems)
                && Objects.equals(additionalItemsSchema, that.additionalItemsSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(types, properties, patternProperties, additionalPropertiesAllowed,
                additionalPropertiesSchema, itemsSchema, positionalItems, additionalItemsSchema, secret);
    }

    @Override
    public String toString() {
        return "WellFormedSchema{types=" + types + ", secret=" + secret + ", properties=" + properties.keySet() + "}";
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * A {@code patternProperties} entry. Pattern equality is by source text.
     */
    public record PatternProperty(Pattern pattern, WellFormedSchema schema) {
        public PatternProperty {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(schema, "schema");
        }

        /** True when the key contains a match for the pattern (JSON Schema uses unanchored regexes). */
        public boolean matches(String key) {
            return pattern.matcher(key).find();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PatternProperty)) return false;
            PatternProperty that = (PatternProperty) o;
            return pattern.pattern().equals(that.pattern.pattern()) && schema.equals(that.schema);
        }

        @Override
        public int hashCode() {
            return Objects.hash(pattern.pattern(), schema);
        }
    }

    static final class Builder {
        private final Set<SchemaType> types = EnumSet.noneOf(SchemaType.class);
        private final Map<String, WellFormedSchema> properties = new LinkedHashMap<>();
        private final List<PatternProperty> patternProperties = new ArrayList<>();
        private Boolean additionalPropertiesAllowed;
        private WellFormedSchema additionalPropertiesSchema;
        private WellFormedSchema itemsSchema;
        private List<WellFormedSchema> positionalItems;
        private WellFormedSchema additionalItemsSchema;
        private boolean secret;

        Builder type(SchemaType type) {
            types.add(type);
            return this;
        }

        Builder property(String name, WellFormedSchema schema) {
            properties.put(name, schema);
            return this;
        }

        Builder patternProperty(Pattern pattern, WellFormedSchema schema) {
            patternProperties.add(new PatternProperty(pattern, schema));
            return this;
        }

        Builder additionalPropertiesAllowed(boolean allowed) {
            this.additionalPropertiesAllowed = allowed;
            return this;
        }

        Builder additionalPropertiesSchema(WellFormedSchema schema) {
            this.additionalPropertiesSchema = schema;
            return this;
        }

        Builder itemsSchema(WellFormedSchema schema) {
            this.itemsSchema = schema;
            return this;
        }

        Builder positionalItems(List<WellFormedSchema> items) {
            this.positionalItems = items;
            return this;
        }

        Builder additionalItemsSchema(WellFormedSchema schema) {
            this.additionalItemsSchema = schema;
            return this;
        }

        Builder secret(boolean secret) {
            this.secret = secret;
            return this;
        }

        WellFormedSchema build() {
            return new WellFormedSchema(this);
        }
    }
}
