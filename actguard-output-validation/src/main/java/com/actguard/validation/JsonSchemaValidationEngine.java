package com.actguard.validation;

import com.actguard.execution.ActionExecutionJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link SchemaValidationEngine} backed by networknt json-schema-validator. Values are converted to
 * Jackson trees and validated against the configured dialect (draft 4 by default). The custom
 * {@code secret} keyword carries no validation semantics and is ignored by the engine.
 * Thread-safe: the factory is shared, schemas are compiled per call.
 */
public final class JsonSchemaValidationEngine implements SchemaValidationEngine {

    private final SpecVersion.VersionFlag specVersion;
    private final JsonSchemaFactory factory;
    private final ObjectMapper mapper;

    public JsonSchemaValidationEngine(SpecVersion.VersionFlag specVersion) {
        this.specVersion = Objects.requireNonNull(specVersion, "specVersion");
        this.factory = JsonSchemaFactory.getInstance(specVersion);
        this.mapper = ActionExecutionJson.mapper();
    }

    /** Draft 4 engine. */
    public static JsonSchemaValidationEngine draft4() {
        return new JsonSchemaValidationEngine(SpecVersion.VersionFlag.V4);
    }

    /**
     * Engine for a dialect name as configured (V4, V6, V7, V201909, V202012; case-insensitive).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static JsonSchemaValidationEngine forSpecVersion(String name) {
        Objects.requireNonNull(name, "name");
        return new JsonSchemaValidationEngine(SpecVersion.VersionFlag.valueOf(name.trim().toUpperCase(Locale.ROOT)));
    }

    public SpecVersion.VersionFlag getSpecVersion() {
        return specVersion;
    }

    @Override
    public Optional<SchemaViolation> firstViolation(Object schema, Object instance) {
        Set<ValidationMessage> messages;
        try {
            JsonNode schemaNode = mapper.valueToTree(schema);
            JsonNode instanceNode = instance == null ? NullNode.getInstance() : mapper.valueToTree(instance);
            JsonSchema compiled = factory.getSchema(schemaNode);
            messages = compiled.validate(instanceNode);
        } catch (JsonSchemaException | IllegalArgumentException e) {
            throw new OutputValidationException("Schema could not be evaluated: " + e.getMessage(), e);
        }
        if (messages == null || messages.isEmpty()) {
            return Optional.empty();
        }
        ValidationMessage first = messages.iterator().next();
        String location = first.getInstanceLocation() != null ? first.getInstanceLocation().toString() : null;
        return Optional.of(new SchemaViolation(first.getType(), first.getMessage(), location));
    }
}
