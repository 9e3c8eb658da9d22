package dev.evalset.eval;

import dev.evalset.model.Model;

/**
 * Produces an output for a single sample using the model the task is being evaluated against.
 *
 * <p>A solver that throws marks its sample as failed. Whether that aborts the rest of the task is
 * decided by the eval set's {@code failOnError} setting.
 *
 * @param <INPUT> type of the input data
 * @param <OUTPUT> type of the output data
 */
@FunctionalInterface
public interface Solver<INPUT, OUTPUT> {
    TaskResult<INPUT, OUTPUT> apply(DatasetCase<INPUT, OUTPUT> datasetCase, Model model)
            throws Exception;

    /** A solver which sends the sample input to the model and returns the completion. */
    static <INPUT> Solver<INPUT, String> generate() {
        return (datasetCase, model) ->
                new TaskResult<>(model.generate(String.valueOf(datasetCase.input())), datasetCase);
    }

    /** Run {@code before} on each sample, then this solver. */
    default Solver<INPUT, OUTPUT> precededBy(SolverStep<INPUT, OUTPUT> before) {
        return (datasetCase, model) -> {
            before.accept(datasetCase, model);
            return apply(datasetCase, model);
        };
    }

    /** A side-effecting step run ahead of a solver, e.g. to inject failures in tests. */
    @FunctionalInterface
    interface SolverStep<INPUT, OUTPUT> {
        void accept(DatasetCase<INPUT, OUTPUT> datasetCase, Model model) throws Exception;
    }
}
