package dev.evalset.eval;

/** Result of solving a single sample. */
public record TaskResult<INPUT, OUTPUT>(
        /** solver output */
        OUTPUT result,
        /** The sample the solver ran against to produce the result */
        DatasetCase<INPUT, OUTPUT> datasetCase) {}
