package io.clusterprobe.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EnvironmentUtils
 */
class EnvironmentUtilsTest {

    @Test
    void testGetEnvWithValidValue() {
        // PATH is set in every test environment
        String path = EnvironmentUtils.getEnv("PATH", "default-value");
        assertNotNull(path);
        assertFalse(path.trim().isEmpty());
        assertNotEquals("default-value", path);
    }

    @Test
    void testGetEnvWithMissingValue() {
        String result = EnvironmentUtils.getEnv("NON_EXISTENT_ENV_VAR_12345", "my-default");
        assertEquals("my-default", result);
    }

    @Test
    void testGetEnvWithNullDefault() {
        String result = EnvironmentUtils.getEnv("NON_EXISTENT_ENV_VAR_12345", null);
        assertNull(result);
    }

    @Test
    void testResolveTrimsValue() {
        assertEquals("aggregator-0", EnvironmentUtils.resolve("  aggregator-0 \n", "default"));
    }

    @Test
    void testResolveFallsBackOnBlankValue() {
        assertEquals("default", EnvironmentUtils.resolve("   ", "default"));
        assertEquals("default", EnvironmentUtils.resolve("", "default"));
        assertEquals("default", EnvironmentUtils.resolve(null, "default"));
    }
}
