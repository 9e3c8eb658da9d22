package dev.evalset.eval;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;

/** A single sample in a dataset. */
public record DatasetCase<INPUT, OUTPUT>(
        /** sample id. When empty the sample's 1-based position in its dataset is used */
        Optional<String> id,
        INPUT input,
        OUTPUT expected,
        @Nonnull List<String> tags,
        @Nonnull Map<String, Object> metadata) {

    public static <INPUT, OUTPUT> DatasetCase<INPUT, OUTPUT> of(INPUT input, OUTPUT expected) {
        return new DatasetCase<>(Optional.empty(), input, expected, List.of(), Map.of());
    }

    public static <INPUT, OUTPUT> DatasetCase<INPUT, OUTPUT> of(
            String id, INPUT input, OUTPUT expected) {
        return new DatasetCase<>(Optional.of(id), input, expected, List.of(), Map.of());
    }

    public static <INPUT, OUTPUT> DatasetCase<INPUT, OUTPUT> of(
            INPUT input,
            OUTPUT expected,
            @Nonnull List<String> tags,
            @Nonnull Map<String, Object> metadata) {
        return new DatasetCase<>(Optional.empty(), input, expected, tags, metadata);
    }
}
