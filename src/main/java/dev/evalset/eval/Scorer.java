package dev.evalset.eval;

import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A scorer evaluates the result of a sample with a score between 0 (inclusive) and 1 (inclusive).
 *
 * @param <INPUT> type of the input data
 * @param <OUTPUT> type of the output data
 */
public interface Scorer<INPUT, OUTPUT> {
    String getName();

    List<Score> score(TaskResult<INPUT, OUTPUT> taskResult);

    static <INPUT, OUTPUT> Scorer<INPUT, OUTPUT> of(
            String scorerName, Function<TaskResult<INPUT, OUTPUT>, Double> scorerFn) {
        return new Scorer<>() {
            @Override
            public String getName() {
                return scorerName;
            }

            @Override
            public List<Score> score(TaskResult<INPUT, OUTPUT> taskResult) {
                return List.of(new Score(scorerName, scorerFn.apply(taskResult)));
            }
        };
    }

    /** scorer function receives (expected, actual) */
    static <INPUT, OUTPUT> Scorer<INPUT, OUTPUT> of(
            String scorerName, BiFunction<OUTPUT, OUTPUT, Double> scorerFn) {
        return of(
                scorerName,
                (TaskResult<INPUT, OUTPUT> taskResult) ->
                        scorerFn.apply(taskResult.datasetCase().expected(), taskResult.result()));
    }

    /** 1.0 when the output contains the expected text, ignoring case. */
    static <INPUT> Scorer<INPUT, String> includes() {
        return of(
                "includes",
                (String expected, String actual) ->
                        actual != null
                                        && expected != null
                                        && actual.toLowerCase(Locale.ROOT)
                                                .contains(expected.toLowerCase(Locale.ROOT))
                                ? 1.0
                                : 0.0);
    }

    /** 1.0 when the trimmed output ends with the trimmed expected text, ignoring case. */
    static <INPUT> Scorer<INPUT, String> match() {
        return of(
                "match",
                (String expected, String actual) ->
                        actual != null
                                        && expected != null
                                        && actual.trim()
                                                .toLowerCase(Locale.ROOT)
                                                .endsWith(expected.trim().toLowerCase(Locale.ROOT))
                                ? 1.0
                                : 0.0);
    }
}
