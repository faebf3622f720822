package com.actguard.validation;

import com.actguard.execution.ActionExecutionJson;
import com.networknt.schema.SpecVersion;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonSchemaValidationEngineTest {

    private static Object json(String json) {
        return ActionExecutionJson.valueFromJson(json);
    }

    @Test
    void forSpecVersion_resolvesConfiguredNames() {
        assertEquals(SpecVersion.VersionFlag.V4, JsonSchemaValidationEngine.forSpecVersion("v4").getSpecVersion());
        assertEquals(SpecVersion.VersionFlag.V202012, JsonSchemaValidationEngine.forSpecVersion(" V202012 ").getSpecVersion());
        assertEquals(SpecVersion.VersionFlag.V4, JsonSchemaValidationEngine.draft4().getSpecVersion());
        assertThrows(IllegalArgumentException.class, () -> JsonSchemaValidationEngine.forSpecVersion("draft-99"));
    }

    @Test
    void firstViolation_emptyForConformingValue() {
        Object schema = json("""
                {"type": "object", "properties": {"token": {"type": "string", "secret": true}}, "additionalProperties": false}
                """);

        Optional<SchemaViolation> violation = JsonSchemaValidationEngine.draft4()
                .firstViolation(schema, json("{\"token\": \"abc\"}"));

        assertTrue(violation.isEmpty());
    }

    @Test
    void firstViolation_reportsKeywordAndLocation() {
        Object schema = json("""
                {"type": "object", "properties": {"count": {"type": "integer"}}}
                """);

        SchemaViolation violation = JsonSchemaValidationEngine.draft4()
                .firstViolation(schema, json("{\"count\": \"three\"}"))
                .orElseThrow();

        assertEquals("type", violation.keyword());
        assertEquals("$.count", violation.instanceLocation());
        assertTrue(violation.message().contains("integer"), violation.message());
    }

    @Test
    void firstViolation_nullInstanceAgainstScalarSchemas() {
        SchemaValidationEngine engine = JsonSchemaValidationEngine.draft4();

        assertTrue(engine.firstViolation(json("{\"type\": \"null\"}"), null).isEmpty());
        assertTrue(engine.firstViolation(json("{\"type\": \"string\"}"), null).isPresent());
        assertTrue(engine.firstViolation(json("{\"type\": \"number\"}"), 1.234).isEmpty());
        assertTrue(engine.firstViolation(json("{\"type\": \"boolean\"}"), Boolean.FALSE).isEmpty());
    }
}
