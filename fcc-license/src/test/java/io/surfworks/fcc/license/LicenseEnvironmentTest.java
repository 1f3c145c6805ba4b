package io.surfworks.fcc.license;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LicenseEnvironmentTest {

    private static LicensePayload payload(String key, String client, String email) {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        return new LicensePayload(key, email, client, 1, 3, "fp", now, now.plusSeconds(3600), false, Map.of());
    }

    @Test
    @DisplayName("first payload publishes key, email, client, tag and signature")
    void apply_publishesProperties() {
        var properties = new Properties();
        var environment = new LicenseEnvironment(properties);

        assertTrue(environment.apply(payload("ABCD-1234-5678-WXYZ", "Acme", "me@example.com"), "fp"));

        assertEquals("ABCD-1234-5678-WXYZ", properties.getProperty(LicenseEnvironment.PROP_KEY));
        assertEquals("me@example.com", properties.getProperty(LicenseEnvironment.PROP_EMAIL));
        assertEquals("Acme", properties.getProperty(LicenseEnvironment.PROP_CLIENT));
        assertEquals("Acme::ABCD12…WXYZ", properties.getProperty(LicenseEnvironment.PROP_TAG));
        assertEquals(MachineFingerprint.sha256Hex("ABCD-1234-5678-WXYZ|fp|Acme"),
            properties.getProperty(LicenseEnvironment.PROP_SIGNATURE));
    }

    @Test
    @DisplayName("only the first payload is applied")
    void apply_onlyOnce() {
        var environment = new LicenseEnvironment(new Properties());
        LicensePayload first = payload("KEY-ONE", "Acme", null);

        assertTrue(environment.apply(first, "fp"));
        assertFalse(environment.apply(payload("KEY-TWO", "Other", null), "fp"));

        assertSame(first, environment.applied().orElseThrow());
        assertEquals("KEY-ONE", environment.property(LicenseEnvironment.PROP_KEY));
    }

    @Test
    @DisplayName("existing properties are not overwritten")
    void apply_keepsExistingValues() {
        var properties = new Properties();
        properties.setProperty(LicenseEnvironment.PROP_KEY, "PRESET");
        var environment = new LicenseEnvironment(properties);

        environment.apply(payload("KEY-ONE", null, ""), "fp");

        assertEquals("PRESET", properties.getProperty(LicenseEnvironment.PROP_KEY));
        assertNull(properties.getProperty(LicenseEnvironment.PROP_EMAIL));
        assertNull(properties.getProperty(LicenseEnvironment.PROP_CLIENT));
        assertEquals("unknown::KEYONE", properties.getProperty(LicenseEnvironment.PROP_TAG));
    }

    @Test
    @DisplayName("null payload is ignored")
    void apply_null() {
        var environment = new LicenseEnvironment(new Properties());

        assertFalse(environment.apply(null, "fp"));
        assertTrue(environment.applied().isEmpty());
    }
}
