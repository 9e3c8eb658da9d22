package dev.evalset.schedule;

import dev.evalset.ConfigurationException;
import dev.evalset.log.EvalLog;
import dev.evalset.log.EvalLogKey;
import dev.evalset.log.EvalStatus;
import dev.evalset.log.LogIndex;
import dev.evalset.model.ModelRef;
import dev.evalset.task.LogicalTask;
import dev.evalset.task.TaskIdentity;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Every (logical task, model) pairing of an eval set, in submission order: task-major,
 * model-minor, numbered from 1.
 */
@Slf4j
public final class ResolvedTaskSet {
    private final List<ResolvedTask> tasks;
    private final List<ModelRef> models;

    private ResolvedTaskSet(List<ResolvedTask> tasks, List<ModelRef> models) {
        this.tasks = List.copyOf(tasks);
        this.models = List.copyOf(models);
    }

    /**
     * @throws ConfigurationException if there are no tasks or models, or two tasks share an
     *     identity
     */
    public static ResolvedTaskSet of(
            List<? extends LogicalTask<?, ?>> tasks, List<ModelRef> models) {
        if (tasks.isEmpty()) {
            throw new ConfigurationException("an eval set needs at least one task");
        }
        if (models.isEmpty()) {
            throw new ConfigurationException("an eval set needs at least one model");
        }
        var seen = new HashMap<TaskIdentity, LogicalTask<?, ?>>();
        for (var task : tasks) {
            var previous = seen.putIfAbsent(task.identity(), task);
            if (previous != null) {
                throw new ConfigurationException(
                        ("more than one task has the identity %s. Give each task a distinct name"
                                        + " or distinct params")
                                .formatted(task.identity()));
            }
        }
        var distinctModels = new LinkedHashSet<>(models);
        if (distinctModels.size() != models.size()) {
            log.warn("ignoring duplicate models in {}", models);
        }
        var resolved = new ArrayList<ResolvedTask>();
        int sequence = 1;
        for (var task : tasks) {
            for (var model : distinctModels) {
                resolved.add(ResolvedTask.of(task, model, sequence++));
            }
        }
        return new ResolvedTaskSet(resolved, new ArrayList<>(distinctModels));
    }

    /** all resolved tasks, ordered by sequence */
    public List<ResolvedTask> tasks() {
        return tasks;
    }

    public List<ModelRef> models() {
        return models;
    }

    public int size() {
        return tasks.size();
    }

    /** Resolved tasks whose authoritative log, if any, did not succeed. */
    public List<ResolvedTask> pending(Map<EvalLogKey, EvalLog> authoritative) {
        return tasks.stream()
                .filter(
                        task ->
                                LogIndex.matchPrevious(task.key(), authoritative)
                                        .map(previous -> previous.status() != EvalStatus.SUCCESS)
                                        .orElse(true))
                .toList();
    }
}
