package dev.evalset.log;

import dev.evalset.model.ModelRef;
import dev.evalset.task.TaskIdentity;

/** Key under which logs are matched: one logical task instance evaluated against one model. */
public record EvalLogKey(TaskIdentity identity, ModelRef model) {
    @Override
    public String toString() {
        return identity + " @ " + model;
    }
}
