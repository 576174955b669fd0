package io.clusterprobe.util;

/**
 * Utility class for environment variable lookups.
 */
public final class EnvironmentUtils {

    private EnvironmentUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Get environment variable with default value
     *
     * @param name the environment variable name
     * @param defaultValue the value to return if the variable is unset or blank
     * @return the trimmed environment variable value or the default
     */
    public static String getEnv(String name, String defaultValue) {
        return resolve(System.getenv(name), defaultValue);
    }

    static String resolve(String value, String defaultValue) {
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }
}
