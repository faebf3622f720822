package com.actguard.worker.activity;

import com.actguard.config.ActguardConfig;
import com.actguard.execution.ActionExecutionJson;
import com.actguard.worker.service.ExecutionOutputService;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputSchemaActivitiesImplTest {

    private static final String EXECUTION = """
            {
              "id": "exec-7",
              "action": {
                "ref": "aws.get_credentials",
                "output_schema": {
                  "type": "object",
                  "properties": {
                    "key_id": {"type": "string"},
                    "secret_key": {"type": "string", "secret": true}
                  }
                }
              },
              "runner": {
                "output_key": "result",
                "output_schema": {
                  "type": "object",
                  "properties": {"result": {"type": "object"}},
                  "additionalProperties": false
                }
              }
            }
            """;

    private final OutputSchemaActivities activities = new OutputSchemaActivitiesImpl(
            ExecutionOutputService.create(ActguardConfig.builder().validateOutputSchema(true).maskSecrets(true).build()));

    private static Map<?, ?> parse(String json) {
        return (Map<?, ?>) ActionExecutionJson.valueFromJson(json);
    }

    @Test
    void validateOutput_returnsResultAndStatus() {
        Map<?, ?> ok = parse(activities.validateOutput(EXECUTION,
                "{\"result\": {\"key_id\": \"AKIA\", \"secret_key\": \"s3cr3t\"}}", "succeeded"));
        Map<?, ?> failed = parse(activities.validateOutput(EXECUTION,
                "{\"result\": {}, \"stderr\": \"boom\"}", "succeeded"));

        assertEquals("succeeded", ok.get("status"));
        assertEquals("AKIA", ((Map<?, ?>) ((Map<?, ?>) ok.get("result")).get("result")).get("key_id"));
        assertEquals("failed", failed.get("status"));
        assertEquals("Error validating output. See error output for more details.",
                ((Map<?, ?>) failed.get("result")).get("message"));
    }

    @Test
    void validateOutput_leavesOtherStatusesAlone() {
        Map<?, ?> response = parse(activities.validateOutput(EXECUTION, "{\"stderr\": \"boom\"}", "FAILED"));

        assertEquals("failed", response.get("status"));
        assertEquals("boom", ((Map<?, ?>) response.get("result")).get("stderr"));
    }

    @Test
    void validateOutput_blankResultIsNull() {
        Map<?, ?> response = parse(activities.validateOutput(EXECUTION, "", "running"));

        assertTrue(response.containsKey("result"));
        assertNull(response.get("result"));
        assertEquals("running", response.get("status"));
    }

    @Test
    void maskSecretOutput_masksUnlessSecretsRequested() {
        String result = "{\"result\": {\"key_id\": \"AKIA\", \"secret_key\": \"s3cr3t\"}}";

        Map<?, ?> masked = (Map<?, ?>) parse(activities.maskSecretOutput(EXECUTION, result, false)).get("result");
        Map<?, ?> shown = (Map<?, ?>) parse(activities.maskSecretOutput(EXECUTION, result, true)).get("result");

        assertEquals("********", masked.get("secret_key"));
        assertEquals("AKIA", masked.get("key_id"));
        assertEquals("s3cr3t", shown.get("secret_key"));
    }

    @Test
    void invalidPayloadsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> activities.validateOutput("{not json", "{}", "succeeded"));
        assertThrows(IllegalArgumentException.class, () -> activities.validateOutput(EXECUTION, "[1,", "succeeded"));
        assertThrows(IllegalArgumentException.class, () -> activities.validateOutput(EXECUTION, "{}", "done"));
        assertThrows(IllegalArgumentException.class, () -> activities.maskSecretOutput(" ", "{}", false));
        assertThrows(IllegalArgumentException.class, () -> activities.maskSecretOutput("null", "{}", false));
    }
}
