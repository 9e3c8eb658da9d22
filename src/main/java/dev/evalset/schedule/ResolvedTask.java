package dev.evalset.schedule;

import dev.evalset.log.EvalLogKey;
import dev.evalset.model.ModelRef;
import dev.evalset.task.LogicalTask;
import dev.evalset.task.SandboxSpec;
import dev.evalset.task.TaskIdentity;
import dev.evalset.task.TaskParams;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * One concrete unit of work: a logical task bound to a model.
 *
 * @param args resolved task parameters, recorded in every log of this task
 * @param sequence submission order, starting at 1. Used for log naming and result ordering, never
 *     for scheduling priority
 */
public record ResolvedTask(
        @Nonnull LogicalTask<?, ?> task,
        @Nonnull ModelRef model,
        @Nonnull TaskParams args,
        @Nonnull Optional<SandboxSpec> sandbox,
        int sequence) {

    public ResolvedTask {
        Objects.requireNonNull(task);
        Objects.requireNonNull(model);
        Objects.requireNonNull(args);
        Objects.requireNonNull(sandbox);
    }

    public static ResolvedTask of(LogicalTask<?, ?> task, ModelRef model, int sequence) {
        return new ResolvedTask(task, model, task.params(), task.sandbox(), sequence);
    }

    public TaskIdentity identity() {
        return new TaskIdentity(task.name(), args);
    }

    public EvalLogKey key() {
        return new EvalLogKey(identity(), model);
    }

    @Override
    public String toString() {
        return "#%d %s @ %s".formatted(sequence, identity(), model);
    }
}
