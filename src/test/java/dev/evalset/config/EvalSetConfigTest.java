package dev.evalset.config;

import static org.junit.jupiter.api.Assertions.*;

import dev.evalset.ConfigurationException;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class EvalSetConfigTest {
    @Test
    void defaults() {
        var config =
                EvalSetConfig.of(
                        "EVALSET_LOG_DIR", EvalSetConfig.NULL_OVERRIDE,
                        "EVALSET_MODELS", EvalSetConfig.NULL_OVERRIDE,
                        "EVALSET_RETRY_ATTEMPTS", EvalSetConfig.NULL_OVERRIDE,
                        "EVALSET_RETRY_WAIT_MILLIS", EvalSetConfig.NULL_OVERRIDE,
                        "EVALSET_MAX_TASKS", EvalSetConfig.NULL_OVERRIDE,
                        "EVALSET_FAIL_ON_ERROR", EvalSetConfig.NULL_OVERRIDE,
                        "EVALSET_LOG_CLEANUP", EvalSetConfig.NULL_OVERRIDE);
        assertEquals("./logs", config.logDir());
        assertEquals(List.of(), config.defaultModels());
        assertEquals(10, config.retryAttempts());
        assertEquals(Duration.ofSeconds(30), config.retryWait());
        assertEquals(Optional.empty(), config.maxTasks());
        assertTrue(config.failOnError());
        assertTrue(config.logCleanup());
    }

    @Test
    void overridesAreParsed() {
        var config =
                EvalSetConfig.of(
                        "EVALSET_MODELS", "mockllm/a, mockllm/b",
                        "EVALSET_RETRY_ATTEMPTS", "3",
                        "EVALSET_RETRY_WAIT_MILLIS", "250",
                        "EVALSET_MAX_TASKS", "4",
                        "EVALSET_FAIL_ON_ERROR", "false",
                        "EVALSET_LOG_STORE_TOKEN", "secret");
        assertEquals(List.of("mockllm/a", "mockllm/b"), config.defaultModels());
        assertEquals(3, config.retryAttempts());
        assertEquals(Duration.ofMillis(250), config.retryWait());
        assertEquals(Optional.of(4), config.maxTasks());
        assertFalse(config.failOnError());
        assertEquals(Optional.of("secret"), config.logStoreToken());
    }

    @Test
    void invalidValuesAreConfigurationErrors() {
        assertThrows(
                ConfigurationException.class,
                () -> EvalSetConfig.of("EVALSET_RETRY_ATTEMPTS", "lots"));
        assertThrows(
                ConfigurationException.class,
                () -> EvalSetConfig.of("EVALSET_RETRY_ATTEMPTS", "-1"));
        assertThrows(
                ConfigurationException.class, () -> EvalSetConfig.of("EVALSET_MAX_TASKS", "0"));
        assertThrows(
                ConfigurationException.class, () -> EvalSetConfig.of("EVALSET_LOG_CLEANUP", "yes"));
        assertThrows(ConfigurationException.class, () -> EvalSetConfig.of("EVALSET_LOG_DIR"));
    }

    @Test
    public void testBuilderEqualsEnv() {
        var fromEnv =
                EvalSetConfig.of(
                        "EVALSET_LOG_DIR", "/tmp/evals",
                        "EVALSET_RETRY_ATTEMPTS", "2");
        var fromBuilder = EvalSetConfig.builder().logDir("/tmp/evals").retryAttempts(2).build();
        var otherBuilder = EvalSetConfig.builder().logDir("/tmp/other").retryAttempts(2).build();
        assertEquals(fromEnv, fromBuilder);
        assertNotEquals(fromEnv, otherBuilder);
    }

    @Test
    public void testBuilderHasMethodForEveryField() {
        Field[] configFields = EvalSetConfig.class.getDeclaredFields();
        Method[] builderMethods = EvalSetConfig.Builder.class.getDeclaredMethods();
        Set<String> builderMethodNames =
                Arrays.stream(builderMethods).map(Method::getName).collect(Collectors.toSet());

        for (Field field : configFields) {
            assertTrue(
                    builderMethodNames.contains(field.getName()),
                    "Builder is missing method for field: " + field.getName());
        }
    }
}
