package dev.evalset.log;

import dev.evalset.model.ModelRef;
import dev.evalset.task.SandboxSpec;
import dev.evalset.task.TaskIdentity;
import dev.evalset.task.TaskParams;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Metadata written at the front of every log file. Enough to identify the execution (task
 * identity, model, sequence, attempt) and its outcome without reading the samples.
 */
public record EvalLogHeader(
        int version,
        @Nonnull String taskName,
        @Nonnull TaskParams taskParams,
        @Nonnull String taskHash,
        @Nonnull ModelRef model,
        int sequence,
        int attempt,
        @Nonnull EvalStatus status,
        @Nonnull Instant created,
        @Nonnull Optional<Instant> completed,
        @Nonnull Optional<EvalError> error,
        @Nonnull Optional<SandboxSpec> sandbox,
        int totalSamples,
        int failedSamples,
        /** mean of every score across the samples that were scored */
        @Nonnull Map<String, Double> scores) {
    public static final int CURRENT_VERSION = 1;

    public EvalLogHeader {
        taskParams = taskParams == null ? TaskParams.empty() : taskParams;
        completed = completed == null ? Optional.empty() : completed;
        error = error == null ? Optional.empty() : error;
        sandbox = sandbox == null ? Optional.empty() : sandbox;
        scores = scores == null ? Map.of() : Map.copyOf(scores);
    }

    public TaskIdentity identity() {
        return new TaskIdentity(taskName, taskParams);
    }

    public EvalLogKey key() {
        return new EvalLogKey(identity(), model);
    }

    /** completion time, or creation time for logs that never completed */
    public Instant timestamp() {
        return completed.orElse(created);
    }
}
