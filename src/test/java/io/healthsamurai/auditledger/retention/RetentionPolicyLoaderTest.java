package io.healthsamurai.auditledger.retention;

import static org.junit.jupiter.api.Assertions.*;

import io.healthsamurai.auditledger.model.EventType;
import io.healthsamurai.auditledger.model.Sensitivity;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

/**
 * Tests for RetentionPolicyLoader.
 * Tests YAML loading and parsing of retention tiers.
 */
class RetentionPolicyLoaderTest {

    @Test
    void loadRetentionPolicy_LoadsBundledFile() {
        RetentionPolicy policy = RetentionPolicyLoader.loadRetentionPolicy();

        assertNotNull(policy);
        assertEquals(2, policy.rules().size());

        RetentionRule protectedData = policy.rules().get(0);
        assertEquals("protected-data", protectedData.name());
        assertEquals(2555, protectedData.days());
        assertTrue(protectedData.sensitivities().contains(Sensitivity.RESTRICTED));
        assertTrue(protectedData.sensitivities().contains(Sensitivity.CONFIDENTIAL));
        assertTrue(protectedData.eventTypes().isEmpty());

        RetentionRule securityAndAuth = policy.rules().get(1);
        assertEquals(1095, securityAndAuth.days());
        assertEquals(2, securityAndAuth.eventTypes().size());

        assertEquals(365, policy.defaultDays());
    }

    @Test
    void loadRetentionPolicy_MatchesCompiledDefaults() {
        RetentionPolicyResolver fromFile = new RetentionPolicyResolver(RetentionPolicyLoader.loadRetentionPolicy());
        RetentionPolicyResolver fromDefaults = new RetentionPolicyResolver(RetentionPolicy.defaults());

        for (Sensitivity sensitivity : Sensitivity.values()) {
            for (EventType eventType : EventType.values()) {
                assertEquals(fromDefaults.retentionDays(sensitivity, eventType),
                        fromFile.retentionDays(sensitivity, eventType),
                        sensitivity + "/" + eventType);
            }
        }
    }

    @Test
    void parse_IndefiniteDays() {
        RetentionPolicy policy = RetentionPolicyLoader.parse(yaml(
                "rules:\n"
                        + "  - name: legal-hold\n"
                        + "    eventTypes: [compliance_event]\n"
                        + "    days: indefinite\n"
                        + "defaultDays: 90\n"));

        assertEquals(RetentionPolicyResolver.INDEFINITE, policy.rules().get(0).days());
        assertTrue(policy.rules().get(0).eventTypes().contains(EventType.COMPLIANCE_EVENT));
        assertEquals(90, policy.defaultDays());
    }

    @Test
    void parse_NoRules_OnlyDefault() {
        RetentionPolicy policy = RetentionPolicyLoader.parse(yaml("defaultDays: 30\n"));

        assertTrue(policy.rules().isEmpty());
        assertEquals(30, policy.defaultDays());
    }

    @Test
    void parse_UnknownSensitivity_Throws() {
        assertThrows(IllegalArgumentException.class, () -> RetentionPolicyLoader.parse(yaml(
                "rules:\n"
                        + "  - name: bad\n"
                        + "    sensitivities: [TOP_SECRET]\n"
                        + "    days: 10\n"
                        + "defaultDays: 30\n")));
    }

    @Test
    void parse_MissingDays_Throws() {
        assertThrows(IllegalArgumentException.class, () -> RetentionPolicyLoader.parse(yaml(
                "rules:\n"
                        + "  - name: incomplete\n"
                        + "defaultDays: 30\n")));
    }

    @Test
    void parse_ZeroDays_Throws() {
        assertThrows(IllegalArgumentException.class, () -> RetentionPolicyLoader.parse(yaml("defaultDays: 0\n")));
    }

    @Test
    void parse_EmptyDocument_Throws() {
        assertThrows(IllegalArgumentException.class, () -> RetentionPolicyLoader.parse(yaml("")));
    }

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
