package dev.evalset.config;

import dev.evalset.ConfigurationException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Resolves settings from environment variables, with per-instance overrides taking precedence.
 *
 * <p>Every value looked up is remembered so two configs compare equal iff they resolved the same
 * settings.
 */
abstract class BaseConfig {
    /** override value which forces a setting to null regardless of the environment */
    static final String NULL_OVERRIDE = "__EVALSET_NULL_OVERRIDE__";

    private final Map<String, String> envOverrides;
    private final Map<String, String> resolved = new LinkedHashMap<>();

    BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    protected String getConfig(String key, String defaultValue) {
        return getConfig(key, defaultValue, String.class);
    }

    protected boolean getConfig(String key, boolean defaultValue) {
        return getConfig(key, defaultValue, Boolean.class);
    }

    protected int getConfig(String key, int defaultValue) {
        return getConfig(key, defaultValue, Integer.class);
    }

    protected long getConfig(String key, long defaultValue) {
        return getConfig(key, defaultValue, Long.class);
    }

    protected <T> T getConfig(String key, @Nullable T defaultValue, Class<T> type) {
        var raw = lookup(key);
        resolved.put(key, raw);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return parse(raw.trim(), type);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    "invalid value for %s: '%s' is not a %s"
                            .formatted(key, raw, type.getSimpleName()),
                    e);
        }
    }

    @Nullable
    private String lookup(String key) {
        if (envOverrides.containsKey(key)) {
            var value = envOverrides.get(key);
            return NULL_OVERRIDE.equals(value) ? null : value;
        }
        return System.getenv(key);
    }

    private static <T> T parse(String raw, Class<T> type) {
        if (type == String.class) {
            return type.cast(raw);
        } else if (type == Boolean.class) {
            if (!raw.equalsIgnoreCase("true") && !raw.equalsIgnoreCase("false")) {
                throw new IllegalArgumentException("not a boolean: " + raw);
            }
            return type.cast(Boolean.parseBoolean(raw));
        } else if (type == Integer.class) {
            return type.cast(Integer.parseInt(raw));
        } else if (type == Long.class) {
            return type.cast(Long.parseLong(raw));
        } else if (type == Double.class) {
            return type.cast(Double.parseDouble(raw));
        }
        throw new IllegalArgumentException("unsupported config type: " + type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return resolved.equals(((BaseConfig) o).resolved);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), resolved);
    }
}
