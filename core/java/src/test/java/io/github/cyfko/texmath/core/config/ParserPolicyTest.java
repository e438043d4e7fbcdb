package io.github.cyfko.texmath.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParserPolicy Tests")
class ParserPolicyTest {

    @Test
    @DisplayName("Presets carry their documented limits")
    void presets() {
        assertEquals(new ParserPolicy("DEFAULT_POLICY", 1000, 10000), ParserPolicy.defaults());
        assertEquals(new ParserPolicy("STRICT_POLICY", 500, 2000), ParserPolicy.strict());
        assertEquals(new ParserPolicy("RELAXED_POLICY", 10000, 100000), ParserPolicy.relaxed());
    }

    @Test
    @DisplayName("Builder starts from the default limits")
    void builderDefaults() {
        ParserPolicy policy = ParserPolicy.builder().maxExpand(42).build();

        assertEquals("CUSTOM_POLICY", policy.policyName());
        assertEquals(42, policy.maxExpand());
        assertEquals(10000, policy.maxExpressionLength());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Non-positive limits are rejected")
    void invalidLimits(int value) {
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxExpand(value).build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxExpressionLength(value).build());
    }

    @Test
    @DisplayName("Policy name is required")
    void blankName() {
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().policyName(" ").build());
    }

    @Test
    @DisplayName("Encode presets")
    void encodePresets() {
        assertEquals(NonStrictMode.WARN, EncodePolicy.defaults().nonStrictMode());
        assertEquals(NonStrictMode.ERROR, EncodePolicy.strict().nonStrictMode());
        assertThrows(NullPointerException.class, () -> new EncodePolicy(null));
    }
}
