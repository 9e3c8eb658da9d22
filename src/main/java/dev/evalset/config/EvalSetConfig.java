package dev.evalset.config;

import dev.evalset.ConfigurationException;
import dev.evalset.EvalSetUtils;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Configuration for eval sets with sane defaults.
 *
 * <p>Every setting can be supplied through an environment variable. Any of them may also be
 * overridden during config construction, which is what most tests and embedding applications do.
 */
@Getter
@Accessors(fluent = true)
public final class EvalSetConfig extends BaseConfig {
    /** log location: a directory, a {@code file:} uri or an {@code http(s)://} object store */
    private final String logDir = getConfig("EVALSET_LOG_DIR", "./logs");

    /** models to evaluate when the caller names none */
    private final List<String> defaultModels =
            EvalSetUtils.parseCsv(getConfig("EVALSET_MODELS", ""));

    /** additional rounds after the first one */
    private final int retryAttempts = getConfig("EVALSET_RETRY_ATTEMPTS", 10);

    private final Duration retryWait =
            Duration.ofMillis(getConfig("EVALSET_RETRY_WAIT_MILLIS", 30_000L));

    /** upper bound on concurrently running tasks. Empty means one slot per model */
    private final Optional<Integer> maxTasks =
            Optional.ofNullable(getConfig("EVALSET_MAX_TASKS", null, Integer.class));

    private final boolean failOnError = getConfig("EVALSET_FAIL_ON_ERROR", true);

    /** delete superseded logs once a newer completed log exists for the same task and model */
    private final boolean logCleanup = getConfig("EVALSET_LOG_CLEANUP", true);

    /** bearer token sent to http log stores */
    private final Optional<String> logStoreToken =
            Optional.ofNullable(getConfig("EVALSET_LOG_STORE_TOKEN", null, String.class));

    private final Duration requestTimeout =
            Duration.ofSeconds(getConfig("EVALSET_REQUEST_TIMEOUT", 30));

    public static EvalSetConfig fromEnvironment() {
        return of();
    }

    public static EvalSetConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new ConfigurationException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new EvalSetConfig(overridesMap);
    }

    private EvalSetConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (retryAttempts < 0) {
            throw new ConfigurationException(
                    "EVALSET_RETRY_ATTEMPTS must not be negative: " + retryAttempts);
        }
        if (retryWait.isNegative()) {
            throw new ConfigurationException("EVALSET_RETRY_WAIT_MILLIS must not be negative");
        }
        if (maxTasks.isPresent() && maxTasks.get() < 1) {
            throw new ConfigurationException(
                    "EVALSET_MAX_TASKS must be at least 1: " + maxTasks.get());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder logDir(String value) {
            envOverrides.put("EVALSET_LOG_DIR", value);
            return this;
        }

        public Builder defaultModels(String... models) {
            envOverrides.put("EVALSET_MODELS", String.join(",", models));
            return this;
        }

        public Builder retryAttempts(int value) {
            envOverrides.put("EVALSET_RETRY_ATTEMPTS", String.valueOf(value));
            return this;
        }

        public Builder retryWait(Duration value) {
            envOverrides.put("EVALSET_RETRY_WAIT_MILLIS", String.valueOf(value.toMillis()));
            return this;
        }

        public Builder maxTasks(Integer value) {
            if (value != null) {
                envOverrides.put("EVALSET_MAX_TASKS", String.valueOf(value));
            } else {
                envOverrides.put("EVALSET_MAX_TASKS", NULL_OVERRIDE);
            }
            return this;
        }

        public Builder failOnError(boolean value) {
            envOverrides.put("EVALSET_FAIL_ON_ERROR", String.valueOf(value));
            return this;
        }

        public Builder logCleanup(boolean value) {
            envOverrides.put("EVALSET_LOG_CLEANUP", String.valueOf(value));
            return this;
        }

        public Builder logStoreToken(String value) {
            if (value != null) {
                envOverrides.put("EVALSET_LOG_STORE_TOKEN", value);
            } else {
                envOverrides.put("EVALSET_LOG_STORE_TOKEN", NULL_OVERRIDE);
            }
            return this;
        }

        public Builder requestTimeout(Duration value) {
            envOverrides.put("EVALSET_REQUEST_TIMEOUT", String.valueOf(value.getSeconds()));
            return this;
        }

        public EvalSetConfig build() {
            return new EvalSetConfig(envOverrides);
        }
    }
}
