package com.chatgateway;

import com.chatgateway.models.AccessLevel;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GatewayConfigTest {

    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @TempDir
    Path dir;

    @Test
    void bundledDefaultsLoad() throws IOException {
        GatewayConfig config = GatewayConfig.load(mapper, null);
        assertEquals(10000, config.getMaxTokens());
        assertEquals(100, config.getMaxTurns());
        assertEquals(100_000L, config.getRequestTimeoutMs());
        assertEquals(105_000L, config.getResponseTimeoutMs());
        assertTrue(config.isRestrictToAuthorizedUsers());
        assertEquals("gpt-4o-mini", config.getDefaultModel());
        assertTrue(config.getProviders().containsKey("anthropic"));
        assertEquals(AccessLevel.ULTIMATE, config.getModels().stream()
            .filter(m -> m.getName().equals("claude-sonnet")).findFirst().orElseThrow().getMinAccessLevel());
    }

    @Test
    void responseTimeoutDefaultsToRequestTimeoutPlusGrace() {
        GatewayConfig config = new GatewayConfig();
        config.setRequestTimeoutMs(2000);
        assertEquals(7000, config.getResponseTimeoutMs());
        config.setResponseTimeoutMs(500);
        assertEquals(500, config.getResponseTimeoutMs());
        assertFalse(config.isRestrictToAuthorizedUsers());
    }

    @Test
    void operatorFileOverridesSelectedFields() throws IOException {
        Path file = dir.resolve("override.json");
        Files.writeString(file, "{\"maxTokens\": 500, \"perUserQueueDepth\": 0, \"adminKey\": \"s3cret\"}");

        GatewayConfig config = GatewayConfig.load(mapper, file);
        assertEquals(500, config.getMaxTokens());
        assertEquals(0, config.getPerUserQueueDepth());
        assertEquals("s3cret", config.getAdminKey());
        assertEquals(100, config.getMaxTurns());
    }

    @Test
    void missingOverrideFileIsAnError() {
        assertThrows(IOException.class, () -> GatewayConfig.load(mapper, dir.resolve("nope.json")));
    }

    @Test
    void invalidValuesAreRejected() throws IOException {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"globalConcurrencyLimit\": 0}");
        assertThrows(IllegalArgumentException.class, () -> GatewayConfig.load(mapper, file));
    }

    @Test
    void samplingSettingsAreClamped() {
        GatewayConfig.ProviderSettings settings = new GatewayConfig.ProviderSettings();
        settings.setTemperature(5.0);
        settings.setTopP(-1.0);
        assertEquals(2.0, settings.getTemperature());
        assertEquals(0.0, settings.getTopP());
    }

    @Test
    void defaultModelFallsBackToFirstConfigured() {
        GatewayConfig config = new GatewayConfig();
        assertNull(config.getDefaultModel());
        config.setModels(java.util.List.of(
            new com.chatgateway.models.ModelDescriptor("a", "openai", 1, AccessLevel.BASIC)));
        assertEquals("a", config.getDefaultModel());
    }

    @Test
    void accessLevelsParseNamesAndTiers() {
        assertEquals(AccessLevel.ADVANCED, AccessLevel.parse("advanced"));
        assertEquals(AccessLevel.ULTIMATE, AccessLevel.parse("2"));
        assertEquals(AccessLevel.BASIC, AccessLevel.parse(null));
        assertThrows(IllegalArgumentException.class, () -> AccessLevel.parse("9"));
        assertThrows(IllegalArgumentException.class, () -> AccessLevel.parse("root"));
        assertTrue(AccessLevel.OWNER.isAtLeast(AccessLevel.ULTIMATE));
    }
}
