package dev.evalset.task;

import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Opaque handle to the execution environment a task's solver expects, e.g. {@code ("docker",
 * {"image": "python:3.12"})}. Carried with the task and recorded in its logs; its lifecycle belongs
 * to whoever runs the solver.
 */
public record SandboxSpec(@Nonnull String type, @Nonnull Map<String, Object> config) {
    public SandboxSpec {
        config = Map.copyOf(config);
    }

    public static SandboxSpec of(String type) {
        return new SandboxSpec(type, Map.of());
    }
}
