package dev.evalset.run;

import dev.evalset.eval.DatasetCase;
import dev.evalset.log.EvalError;
import dev.evalset.log.EvalLog;
import dev.evalset.log.EvalLogCodec;
import dev.evalset.log.EvalLogHeader;
import dev.evalset.log.EvalStatus;
import dev.evalset.log.LogStore;
import dev.evalset.log.LogStoreException;
import dev.evalset.log.SampleOutcome;
import dev.evalset.model.Model;
import dev.evalset.model.ModelRegistry;
import dev.evalset.schedule.ResolvedTask;
import dev.evalset.task.LogicalTask;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/** Runs one resolved task and records it in the log store. */
public interface TaskExecutor {
    /**
     * Execute a task: write a {@link EvalStatus#STARTED} log, solve and score every sample, then
     * overwrite the log with the final status. Sample and task failures end up in the log, never
     * as exceptions.
     *
     * @param attempt 1-based attempt number recorded in the log
     * @return the final log, or empty if the task was abandoned because the token was cancelled.
     *     An abandoned task leaves its started log behind
     * @throws LogStoreException if the started or final log cannot be written
     */
    Optional<EvalLog> execute(ResolvedTask task, int attempt, CancellationToken token);

    static TaskExecutor of(
            LogStore store, ModelRegistry registry, boolean failOnError, Tracer tracer) {
        return new DefaultImpl(store, registry, failOnError, tracer);
    }

    @Slf4j
    class DefaultImpl implements TaskExecutor {
        private final LogStore store;
        private final ModelRegistry registry;
        private final boolean failOnError;
        private final Tracer tracer;

        DefaultImpl(LogStore store, ModelRegistry registry, boolean failOnError, Tracer tracer) {
            this.store = Objects.requireNonNull(store);
            this.registry = Objects.requireNonNull(registry);
            this.failOnError = failOnError;
            this.tracer = Objects.requireNonNull(tracer);
        }

        private record SampleRun(
                List<SampleOutcome> samples, Optional<EvalError> error, boolean abandoned) {}

        @Override
        public Optional<EvalLog> execute(ResolvedTask task, int attempt, CancellationToken token) {
            var created = Instant.now();
            var name =
                    EvalLogCodec.fileName(
                            task.identity(), task.model(), task.sequence(), attempt, created);
            var started = header(task, attempt, created, EvalStatus.STARTED, null, List.of());
            var location = store.write(name, EvalLogCodec.encode(started, List.of()));
            log.debug("started {} (attempt {}) -> {}", task, attempt, location);

            var span =
                    tracer.spanBuilder("task")
                            .setAttribute(TraceAttributes.TASK, task.identity().toString())
                            .setAttribute(TraceAttributes.MODEL, task.model().id())
                            .setAttribute(TraceAttributes.SEQUENCE, (long) task.sequence())
                            .setAttribute(TraceAttributes.ATTEMPT, (long) attempt)
                            .startSpan();
            try (var unused = span.makeCurrent()) {
                var outcomes = new ArrayList<SampleOutcome>();
                SampleRun run;
                try {
                    run = runSamples(task.task(), task, token, outcomes);
                } catch (Exception e) {
                    log.debug("task {} failed", task, e);
                    span.recordException(e);
                    run = new SampleRun(outcomes, Optional.of(EvalError.from(e)), false);
                }

                if (run.abandoned()) {
                    span.setAttribute(TraceAttributes.STATUS, EvalStatus.STARTED.name());
                    log.info(
                            "abandoned {} after {} sample(s), leaving started log {}",
                            task,
                            run.samples().size(),
                            location);
                    return Optional.empty();
                }

                var status = run.error().isPresent() ? EvalStatus.ERROR : EvalStatus.SUCCESS;
                var header =
                        header(
                                task,
                                attempt,
                                created,
                                status,
                                run.error().orElse(null),
                                run.samples());
                store.write(name, EvalLogCodec.encode(header, run.samples()));
                span.setAttribute(TraceAttributes.STATUS, status.name());
                if (status == EvalStatus.ERROR) {
                    span.setStatus(StatusCode.ERROR, run.error().get().message());
                }
                log.debug("finished {} with status {}", task, status);
                return Optional.of(new EvalLog(location, header, run.samples()));
            } finally {
                span.end();
            }
        }

        private <INPUT, OUTPUT> SampleRun runSamples(
                LogicalTask<INPUT, OUTPUT> logicalTask,
                ResolvedTask task,
                CancellationToken token,
                List<SampleOutcome> outcomes) {
            var model = registry.resolve(task.model());
            try (var cursor = logicalTask.dataset().openCursor()) {
                int position = 0;
                for (var next = cursor.next(); next.isPresent(); next = cursor.next()) {
                    if (token.isCancelled()) {
                        return new SampleRun(outcomes, Optional.empty(), true);
                    }
                    position++;
                    var outcome = runSample(logicalTask, next.get(), position, model);
                    outcomes.add(outcome);
                    if (outcome.failed() && failOnError) {
                        return new SampleRun(outcomes, outcome.error(), false);
                    }
                }
            }
            long failed = outcomes.stream().filter(SampleOutcome::failed).count();
            if (failed == 0) {
                return new SampleRun(outcomes, Optional.empty(), false);
            }
            var error =
                    EvalError.of(
                            "%d of %d samples failed".formatted(failed, outcomes.size()),
                            "SampleErrors");
            return new SampleRun(outcomes, Optional.of(error), false);
        }

        private <INPUT, OUTPUT> SampleOutcome runSample(
                LogicalTask<INPUT, OUTPUT> logicalTask,
                DatasetCase<INPUT, OUTPUT> datasetCase,
                int position,
                Model model) {
            var id = datasetCase.id().orElse(String.valueOf(position));
            try {
                var result = logicalTask.solver().apply(datasetCase, model);
                var scores = new LinkedHashMap<String, Double>();
                for (var scorer : logicalTask.scorers()) {
                    for (var score : scorer.score(result)) {
                        if (score.value() < 0.0 || score.value() > 1.0) {
                            throw new IllegalStateException(
                                    "score must be between 0 and 1: %s : %s"
                                            .formatted(scorer.getName(), score));
                        }
                        scores.put(score.name(), score.value());
                    }
                }
                return new SampleOutcome(
                        id,
                        datasetCase.input(),
                        datasetCase.expected(),
                        result.result(),
                        scores,
                        Optional.empty());
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                log.debug("sample {} of {} failed", id, logicalTask.identity(), e);
                return new SampleOutcome(
                        id,
                        datasetCase.input(),
                        datasetCase.expected(),
                        null,
                        Map.of(),
                        Optional.of(EvalError.from(e)));
            }
        }

        private static EvalLogHeader header(
                ResolvedTask task,
                int attempt,
                Instant created,
                EvalStatus status,
                @Nullable EvalError error,
                List<SampleOutcome> samples) {
            var identity = task.identity();
            int failed = (int) samples.stream().filter(SampleOutcome::failed).count();
            return new EvalLogHeader(
                    EvalLogHeader.CURRENT_VERSION,
                    identity.name(),
                    identity.params(),
                    identity.hash(),
                    task.model(),
                    task.sequence(),
                    attempt,
                    status,
                    created,
                    status.isCompleted() ? Optional.of(Instant.now()) : Optional.empty(),
                    Optional.ofNullable(error),
                    task.sandbox(),
                    samples.size(),
                    failed,
                    meanScores(samples));
        }

        private static Map<String, Double> meanScores(List<SampleOutcome> samples) {
            var totals = new LinkedHashMap<String, double[]>();
            for (var sample : samples) {
                sample.scores()
                        .forEach(
                                (name, value) -> {
                                    var total = totals.computeIfAbsent(name, k -> new double[2]);
                                    total[0] += value;
                                    total[1]++;
                                });
            }
            var means = new LinkedHashMap<String, Double>();
            totals.forEach((name, total) -> means.put(name, total[0] / total[1]));
            return means;
        }
    }
}
