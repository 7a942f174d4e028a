package org.vaultprep.engine.compiler;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CompilerOptionsTest {

    @Test
    void testDefaults() {
        CompilerOptions options = CompilerOptions.fromEnvironment(Map.of());

        assertEquals(LinkReferencePolicy.PLACEHOLDER, options.linkReferencePolicy());
        assertFalse(options.implicitSatellite());
    }

    @Test
    void testEnvironmentOverrides() {
        CompilerOptions options = CompilerOptions.fromEnvironment(Map.of(
                CompilerOptions.LINK_POLICY_ENV, "SKIP",
                CompilerOptions.IMPLICIT_SATELLITE_ENV, " true "));

        assertEquals(LinkReferencePolicy.SKIP, options.linkReferencePolicy());
        assertTrue(options.implicitSatellite());
    }

    @Test
    void testBlankValuesAreIgnored() {
        CompilerOptions options = CompilerOptions.fromEnvironment(Map.of(CompilerOptions.LINK_POLICY_ENV, ""));

        assertEquals(CompilerOptions.defaults(), options);
    }

    @Test
    void testUnknownPolicyIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CompilerOptions.fromEnvironment(Map.of(CompilerOptions.LINK_POLICY_ENV, "drop")));

        assertTrue(e.getMessage().contains("drop"));
    }
}
