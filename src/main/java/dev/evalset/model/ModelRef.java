package dev.evalset.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Opaque identifier of a model backend, conventionally {@code provider/name} (e.g. {@code
 * mockllm/model}). Equality is by identifier and the natural ordering is lexicographic.
 */
public record ModelRef(@Nonnull String id) implements Comparable<ModelRef> {
    public ModelRef {
        Objects.requireNonNull(id, "model id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("model id must not be blank");
        }
    }

    @JsonCreator
    public static ModelRef of(String id) {
        return new ModelRef(id);
    }

    /** provider prefix of the identifier. The whole identifier when it has no slash */
    public String provider() {
        int slash = id.indexOf('/');
        return slash < 0 ? id : id.substring(0, slash);
    }

    /** model name within the provider. Empty when the identifier has no slash */
    public String modelName() {
        int slash = id.indexOf('/');
        return slash < 0 ? "" : id.substring(slash + 1);
    }

    @Override
    public int compareTo(ModelRef other) {
        return id.compareTo(other.id);
    }

    @JsonValue
    @Override
    public String toString() {
        return id;
    }
}
