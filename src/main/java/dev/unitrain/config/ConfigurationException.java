package dev.unitrain.config;

import java.util.List;

/**
 * Raised while a run is being configured: a required key is missing, a value
 * cannot be parsed, or settings contradict each other. Never retried.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Builds the exception reported when required keys are absent, naming every one of them.
     */
    public static ConfigurationException missingKeys(List<String> keys) {
        return new ConfigurationException(
            (keys.size() == 1 ? "Missing required configuration key: " : "Missing required configuration keys: ")
                + String.join(", ", keys));
    }
}
