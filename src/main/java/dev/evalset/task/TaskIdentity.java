package dev.evalset.task;

import dev.evalset.EvalSetUtils;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Identity of a logical task instance: its name plus its resolved parameters. Two tasks with the
 * same identity are the same instance, which is what lets logs written by one process be matched
 * by the next.
 */
public record TaskIdentity(@Nonnull String name, @Nonnull TaskParams params) {
    private static final int HASH_BYTES = 8;

    public TaskIdentity {
        Objects.requireNonNull(name, "task name");
        Objects.requireNonNull(params, "task params");
    }

    /** stable short hash of name and canonical params, safe for use in file names */
    public String hash() {
        return EvalSetUtils.sha256Hex(name + "\n" + params.canonicalJson(), HASH_BYTES);
    }

    @Override
    public String toString() {
        return params.isEmpty() ? name : name + params;
    }
}
