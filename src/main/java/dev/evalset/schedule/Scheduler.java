package dev.evalset.schedule;

import dev.evalset.model.ModelRef;
import dev.evalset.task.TaskIdentity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/** Partitions resolved tasks into an ordered plan of batches keyed by the models they need. */
public final class Scheduler {
    private Scheduler() {}

    /** Resolved tasks which run together against a group of models. */
    public record Batch(ModelGroup models, List<ResolvedTask> tasks) {
        public Batch {
            tasks = List.copyOf(tasks);
        }

        @Override
        public String toString() {
            return "%d task(s) on %s".formatted(tasks.size(), models);
        }
    }

    /**
     * Plan for the first round. Each logical task is keyed by the group of models it still has to
     * run against; tasks with equal groups share a batch. Batches are ordered by ascending group
     * size, ties by first occurrence in {@code tasks}, so single-model work starts first.
     */
    public static List<Batch> scheduleFirstPass(List<ResolvedTask> tasks) {
        Map<TaskIdentity, List<ResolvedTask>> byIdentity = new LinkedHashMap<>();
        for (var task : tasks) {
            byIdentity.computeIfAbsent(task.identity(), k -> new ArrayList<>()).add(task);
        }

        // equal groups merge into the first encountered key, keeping its model order
        Map<ModelGroup, List<ResolvedTask>> byGroup = new LinkedHashMap<>();
        for (var identityTasks : byIdentity.values()) {
            var group = ModelGroup.from(identityTasks.stream().map(ResolvedTask::model).toList());
            byGroup.computeIfAbsent(group, k -> new ArrayList<>()).addAll(identityTasks);
        }

        // List.sort is stable
        var batches = new ArrayList<Batch>();
        byGroup.forEach((group, groupTasks) -> batches.add(new Batch(group, groupTasks)));
        batches.sort(Comparator.comparingInt((Batch batch) -> batch.models().size()));
        return batches;
    }

    /**
     * Plan for retry rounds: one batch per model holding every task pending on it, ordered by model
     * identifier.
     */
    public static List<Batch> scheduleRetryPass(List<ResolvedTask> tasks) {
        Map<ModelRef, List<ResolvedTask>> byModel =
                tasks.stream()
                        .collect(
                                Collectors.groupingBy(
                                        ResolvedTask::model, TreeMap::new, Collectors.toList()));
        return byModel.entrySet().stream()
                .map(entry -> new Batch(ModelGroup.of(entry.getKey()), entry.getValue()))
                .toList();
    }
}
