package dev.evalset.log;

import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Outcome of one sample within a task execution. */
public record SampleOutcome(
        @Nonnull String id,
        @Nullable Object input,
        @Nullable Object expected,
        @Nullable Object output,
        /** score name to value. Empty when the sample failed before scoring */
        @Nonnull Map<String, Double> scores,
        @Nonnull Optional<EvalError> error) {

    public SampleOutcome {
        scores = scores == null ? Map.of() : Map.copyOf(scores);
        error = error == null ? Optional.empty() : error;
    }

    public boolean failed() {
        return error.isPresent();
    }
}
