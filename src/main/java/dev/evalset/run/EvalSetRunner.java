package dev.evalset.run;

import dev.evalset.log.EvalLog;
import dev.evalset.log.EvalLogKey;
import dev.evalset.log.EvalStatus;
import dev.evalset.log.LogIndex;
import dev.evalset.log.LogStoreException;
import dev.evalset.schedule.ResolvedTask;
import dev.evalset.schedule.ResolvedTaskSet;
import dev.evalset.schedule.Scheduler;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.concurrent.NotThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives an eval set to completion.
 *
 * <p>Each round rescans the log store, computes which resolved tasks still lack a successful log
 * and runs them batch by batch, with at most {@code maxTasks} tasks in flight. The first round
 * uses {@link Scheduler#scheduleFirstPass}, retry rounds use {@link
 * Scheduler#scheduleRetryPass}. The run converges when nothing is pending and is exhausted after
 * {@code 1 + retryAttempts} rounds.
 *
 * <p>Because pending work is always derived from the logs, a run that was interrupted (or a
 * process that died) is resumed by running the same eval set against the same log location.
 */
@Slf4j
@NotThreadSafe
public final class EvalSetRunner {
    private static final AtomicInteger WORKER_THREADS = new AtomicInteger();

    /**
     * @param retryAttempts rounds allowed after the first one
     * @param retryWait pause before every retry round
     * @param maxTasks maximum number of tasks executing at once
     * @param logCleanup delete superseded logs while scanning
     */
    public record Options(int retryAttempts, Duration retryWait, int maxTasks, boolean logCleanup) {
        public Options {
            if (retryAttempts < 0) {
                throw new IllegalArgumentException("retryAttempts must not be negative");
            }
            if (maxTasks < 1) {
                throw new IllegalArgumentException("maxTasks must be at least 1");
            }
            Objects.requireNonNull(retryWait);
        }
    }

    /** logs found by one scan of the store */
    private record LogScan(List<EvalLog> all, Map<EvalLogKey, EvalLog> authoritative) {
        int nextAttempt(EvalLogKey key) {
            return all.stream()
                            .filter(l -> l.key().equals(key))
                            .mapToInt(l -> l.header().attempt())
                            .max()
                            .orElse(0)
                    + 1;
        }
    }

    private final ResolvedTaskSet taskSet;
    private final LogIndex index;
    private final TaskExecutor executor;
    private final Options options;
    private final Tracer tracer;
    private final CancellationToken token;
    private final Semaphore permits;
    private boolean threadInterrupted = false;

    public EvalSetRunner(
            ResolvedTaskSet taskSet,
            LogIndex index,
            TaskExecutor executor,
            Options options,
            Tracer tracer,
            CancellationToken token) {
        this.taskSet = Objects.requireNonNull(taskSet);
        this.index = Objects.requireNonNull(index);
        this.executor = Objects.requireNonNull(executor);
        this.options = Objects.requireNonNull(options);
        this.tracer = Objects.requireNonNull(tracer);
        this.token = Objects.requireNonNull(token);
        this.permits = new Semaphore(options.maxTasks());
    }

    /**
     * Run rounds until every task succeeded or the retry attempts are used up.
     *
     * @throws EvalSetInterruptedException if the token is cancelled or the thread interrupted
     * @throws LogStoreException if the log store cannot be scanned
     */
    public EvalSetResult run() {
        var rootSpan =
                tracer.spanBuilder("eval_set")
                        .setAttribute(TraceAttributes.LOG_DIR, index.store().location())
                        .startSpan();
        ExecutorService workers = Executors.newCachedThreadPool(workerThreadFactory());
        try (var unused = rootSpan.makeCurrent()) {
            var scan = scan();
            int round = 0;
            while (true) {
                throwIfCancelled();
                var pending = taskSet.pending(scan.authoritative());
                if (pending.isEmpty()) {
                    log.info("all {} task(s) complete after {} round(s)", taskSet.size(), round);
                    break;
                }
                if (round > options.retryAttempts()) {
                    log.warn(
                            "giving up after {} round(s): {} of {} task(s) incomplete",
                            round,
                            pending.size(),
                            taskSet.size());
                    break;
                }
                if (round > 0) {
                    waitBeforeRetry(round);
                }
                var plan =
                        round == 0
                                ? Scheduler.scheduleFirstPass(pending)
                                : Scheduler.scheduleRetryPass(pending);
                runRound(round, plan, scan, workers);
                round++;
                scan = scan();
            }
            var result = result(scan);
            rootSpan.setAttribute(
                    TraceAttributes.STATUS,
                    (result.success() ? EvalStatus.SUCCESS : EvalStatus.ERROR).name());
            log.info(result.createReportString());
            return result;
        } catch (EvalSetInterruptedException e) {
            rootSpan.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            workers.shutdown();
            rootSpan.end();
        }
    }

    private LogScan scan() {
        var all = index.listAllLogs();
        var authoritative = index.latestCompleted(all, options.logCleanup());
        log.debug("scanned {} log(s), {} completed task(s)", all.size(), authoritative.size());
        return new LogScan(all, authoritative);
    }

    private void runRound(
            int round, List<Scheduler.Batch> plan, LogScan scan, ExecutorService workers) {
        var roundSpan =
                tracer.spanBuilder("round")
                        .setAttribute(TraceAttributes.ROUND, (long) round)
                        .startSpan();
        try (var unused = roundSpan.makeCurrent()) {
            for (int i = 0; i < plan.size(); i++) {
                var batch = plan.get(i);
                log.info("round {} batch {}/{}: {}", round + 1, i + 1, plan.size(), batch);
                runBatch(batch, scan, workers);
            }
        } finally {
            roundSpan.end();
        }
    }

    private void runBatch(Scheduler.Batch batch, LogScan scan, ExecutorService workers) {
        var inFlight = new ArrayList<Future<?>>();
        var context = Context.current();
        try {
            for (var task : batch.tasks()) {
                if (token.isCancelled()) {
                    break;
                }
                permits.acquire();
                if (token.isCancelled()) {
                    permits.release();
                    break;
                }
                int attempt = scan.nextAttempt(task.key());
                inFlight.add(
                        workers.submit(context.wrap(() -> executeAndRelease(task, attempt))));
            }
        } catch (InterruptedException e) {
            log.warn("interrupted while dispatching, cancelling eval set");
            threadInterrupted = true;
            token.cancel();
        }
        awaitAll(inFlight);
        throwIfCancelled();
    }

    private void executeAndRelease(ResolvedTask task, int attempt) {
        try {
            executor.execute(task, attempt, token);
        } catch (RuntimeException e) {
            // the task keeps no completed log and stays pending
            log.warn("failed to record {} (attempt {})", task, attempt, e);
        } finally {
            permits.release();
        }
    }

    private void awaitAll(List<Future<?>> inFlight) {
        for (var future : inFlight) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    // keep waiting: running tasks stop at their next sample boundary
                    threadInterrupted = true;
                    token.cancel();
                } catch (ExecutionException e) {
                    log.warn("task execution failed", e.getCause());
                    break;
                }
            }
        }
    }

    private void waitBeforeRetry(int round) {
        log.info("waiting {} before retry round {}", options.retryWait(), round + 1);
        try {
            token.sleep(options.retryWait());
        } catch (InterruptedException e) {
            threadInterrupted = true;
            token.cancel();
        }
        throwIfCancelled();
    }

    private void throwIfCancelled() {
        if (!token.isCancelled()) {
            return;
        }
        if (threadInterrupted) {
            Thread.currentThread().interrupt();
        }
        throw new EvalSetInterruptedException(
                "eval set cancelled. Run it again with log location %s to resume"
                        .formatted(index.store().location()));
    }

    private EvalSetResult result(LogScan scan) {
        var fallback = LogIndex.latestAny(scan.all());
        var logs = new ArrayList<EvalLog>();
        boolean success = true;
        for (var task : taskSet.tasks()) {
            var key = task.key();
            var chosen =
                    Optional.ofNullable(scan.authoritative().get(key))
                            .or(() -> Optional.ofNullable(fallback.get(key)));
            if (chosen.isEmpty()) {
                log.warn("no log recorded for {}", task);
                success = false;
                continue;
            }
            var evalLog = load(chosen.get());
            logs.add(evalLog);
            success &= evalLog.status() == EvalStatus.SUCCESS;
        }
        return new EvalSetResult(success, logs);
    }

    private EvalLog load(EvalLog headerOnly) {
        try {
            return index.readLog(headerOnly.location());
        } catch (LogStoreException e) {
            log.warn("returning header only for unreadable log {}", headerOnly.location(), e);
            return headerOnly;
        }
    }

    private static ThreadFactory workerThreadFactory() {
        return runnable -> {
            var thread = new Thread(runnable, "evalset-task-" + WORKER_THREADS.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
