package dev.evalset.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.evalset.json.EvalSetJsonMapper;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Resolved parameters of a logical task: string keys mapped to scalars.
 *
 * <p>Keys are kept sorted, null values dropped and numbers normalised ({@code Long} for integral
 * values, {@code Double} otherwise) so that equality and {@link #canonicalJson()} do not depend on
 * insertion order or on the boxed type a caller happened to use.
 */
@Immutable
public final class TaskParams {
    private static final TaskParams EMPTY = new TaskParams(new TreeMap<>());

    private final Map<String, Object> values;

    private TaskParams(TreeMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static TaskParams empty() {
        return EMPTY;
    }

    /**
     * Null values are dropped, so a parameter set to null is the same as an absent one.
     *
     * @throws IllegalArgumentException if a value is not a string, boolean or finite number
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TaskParams of(@Nullable Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        var sorted = new TreeMap<String, Object>();
        values.forEach(
                (key, value) -> {
                    if (value != null) {
                        sorted.put(Objects.requireNonNull(key), normalise(key, value));
                    }
                });
        return new TaskParams(sorted);
    }

    /** key-value pairs, e.g. {@code TaskParams.of("lang", "en", "shots", 5)} */
    public static TaskParams of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "task params require key-value pairs. Found dangling key: %s"
                            .formatted(keyValues[keyValues.length - 1]));
        }
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return of(map);
    }

    public TaskParams with(String key, @Nullable Object value) {
        var map = new LinkedHashMap<String, Object>(values);
        map.put(key, value);
        return of(map);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** sorted-key json rendering used for identity hashing */
    public String canonicalJson() {
        return EvalSetJsonMapper.toJson(values);
    }

    private static Object normalise(String key, Object value) {
        if (value instanceof String || value instanceof Boolean) {
            return value;
        } else if (value instanceof Byte
                || value instanceof Short
                || value instanceof Integer
                || value instanceof Long) {
            return ((Number) value).longValue();
        } else if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        } else if (value instanceof Float || value instanceof Double) {
            return finite(key, ((Number) value).doubleValue());
        } else if (value instanceof BigDecimal decimal) {
            return finite(key, decimal.doubleValue());
        } else if (value instanceof Character || value instanceof Enum<?>) {
            return value.toString();
        }
        throw new IllegalArgumentException(
                "task param '%s' must be a scalar but was %s"
                        .formatted(key, value.getClass().getName()));
    }

    // json has no NaN or infinity, so such a value would not read back as a number
    private static double finite(String key, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    "task param '%s' must be a finite number but was %s".formatted(key, value));
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof TaskParams other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
