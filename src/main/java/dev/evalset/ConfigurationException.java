package dev.evalset;

import javax.annotation.Nullable;

/**
 * Thrown when an eval set cannot be planned: duplicate task identities, an empty task or model
 * list, an unknown model provider, an unresolvable log location or an invalid config value.
 *
 * <p>Configuration errors are always raised before any task runs or any log is written.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    public ConfigurationException(Throwable cause) {
        super(cause);
    }
}
