package dev.evalset;

import dev.evalset.config.EvalSetConfig;
import dev.evalset.log.EvalLog;
import dev.evalset.log.EvalLogKey;
import dev.evalset.log.LogIndex;
import dev.evalset.log.LogStore;
import dev.evalset.model.ModelRef;
import dev.evalset.model.ModelRegistry;
import dev.evalset.run.CancellationToken;
import dev.evalset.run.EvalSetInterruptedException;
import dev.evalset.run.EvalSetResult;
import dev.evalset.run.EvalSetRunner;
import dev.evalset.run.TaskExecutor;
import dev.evalset.schedule.ResolvedTaskSet;
import dev.evalset.task.LogicalTask;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a set of tasks against a set of models, retrying failures and resuming from the logs of
 * earlier runs.
 *
 * <pre>{@code
 * var result =
 *         EvalSet.builder()
 *                 .tasks(addition, spelling)
 *                 .models("mockllm/model-a", "mockllm/model-b")
 *                 .logDir("./logs")
 *                 .build()
 *                 .run();
 * }</pre>
 *
 * <p>All configuration problems are reported by {@link Builder#build()}, before any log is
 * written.
 */
@Slf4j
public final class EvalSet {
    public static final String INSTRUMENTATION_NAME = "dev.evalset";

    @Getter
    @Accessors(fluent = true)
    private final @Nonnull ResolvedTaskSet taskSet;

    @Getter
    @Accessors(fluent = true)
    private final @Nonnull LogStore logStore;

    private final @Nonnull EvalSetRunner runner;

    private EvalSet(ResolvedTaskSet taskSet, LogStore logStore, EvalSetRunner runner) {
        this.taskSet = taskSet;
        this.logStore = logStore;
        this.runner = runner;
    }

    /**
     * Run every task which has no successful log yet, retrying until all succeed or the retry
     * attempts are exhausted.
     *
     * @throws EvalSetInterruptedException if the run was cancelled. Running the same eval set
     *     again resumes it
     */
    public EvalSetResult run() {
        log.info(
                "running {} task(s) across {} model(s), logs at {}",
                taskSet.size(),
                taskSet.models().size(),
                logStore.location());
        return runner.run();
    }

    /** Header-only view of every log under a location. */
    public static List<EvalLog> listAllLogs(String location) {
        return listAllLogs(location, EvalSetConfig.fromEnvironment());
    }

    public static List<EvalLog> listAllLogs(String location, EvalSetConfig config) {
        return new LogIndex(LogStore.of(location, config)).listAllLogs();
    }

    /**
     * The most recent completed log for each (task, model) under a location.
     *
     * @param cleanup delete every other log of a (task, model) which has a completed log
     */
    public static Map<EvalLogKey, EvalLog> latestCompleted(String location, boolean cleanup) {
        var index = new LogIndex(LogStore.of(location, EvalSetConfig.fromEnvironment()));
        return index.latestCompleted(index.listAllLogs(), cleanup);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<LogicalTask<?, ?>> tasks = new ArrayList<>();
        private final List<ModelRef> models = new ArrayList<>();
        private @Nullable EvalSetConfig config;
        private @Nullable String logDir;
        private @Nullable LogStore logStore;
        private @Nullable Integer retryAttempts;
        private @Nullable Duration retryWait;
        private @Nullable Integer maxTasks;
        private @Nullable Boolean failOnError;
        private @Nullable Boolean logCleanup;
        private @Nullable ModelRegistry modelRegistry;
        private @Nullable TaskExecutor taskExecutor;
        private @Nullable Tracer tracer;
        private @Nullable CancellationToken cancellationToken;

        /**
         * @throws ConfigurationException if the tasks, models or log location are invalid
         */
        public EvalSet build() {
            // defaults are resolved into locals so the builder can be built again
            var config = this.config != null ? this.config : EvalSetConfig.fromEnvironment();
            var models =
                    !this.models.isEmpty()
                            ? List.copyOf(this.models)
                            : config.defaultModels().stream().map(ModelRef::of).toList();
            var taskSet = ResolvedTaskSet.of(tasks, models);
            var modelRegistry =
                    this.modelRegistry != null ? this.modelRegistry : ModelRegistry.withDefaults();
            // fail fast on unknown providers
            taskSet.models().forEach(modelRegistry::resolve);
            var logStore =
                    this.logStore != null
                            ? this.logStore
                            : LogStore.of(logDir != null ? logDir : config.logDir(), config);
            int retryAttempts =
                    this.retryAttempts != null ? this.retryAttempts : config.retryAttempts();
            var retryWait = this.retryWait != null ? this.retryWait : config.retryWait();
            int maxTasks =
                    this.maxTasks != null
                            ? this.maxTasks
                            : config.maxTasks().orElse(taskSet.models().size());
            boolean failOnError =
                    this.failOnError != null ? this.failOnError : config.failOnError();
            boolean logCleanup = this.logCleanup != null ? this.logCleanup : config.logCleanup();
            var tracer =
                    this.tracer != null
                            ? this.tracer
                            : GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME);
            var cancellationToken =
                    this.cancellationToken != null
                            ? this.cancellationToken
                            : new CancellationToken();
            if (retryAttempts < 0) {
                throw new ConfigurationException("retryAttempts must not be negative");
            }
            if (retryWait.isNegative()) {
                throw new ConfigurationException("retryWait must not be negative");
            }
            if (maxTasks < 1) {
                throw new ConfigurationException("maxTasks must be at least 1: " + maxTasks);
            }
            var executor =
                    taskExecutor != null
                            ? taskExecutor
                            : TaskExecutor.of(logStore, modelRegistry, failOnError, tracer);
            var runner =
                    new EvalSetRunner(
                            taskSet,
                            new LogIndex(logStore),
                            executor,
                            new EvalSetRunner.Options(
                                    retryAttempts, retryWait, maxTasks, logCleanup),
                            tracer,
                            cancellationToken);
            return new EvalSet(taskSet, logStore, runner);
        }

        public Builder config(EvalSetConfig config) {
            this.config = config;
            return this;
        }

        public Builder task(@Nonnull LogicalTask<?, ?> task) {
            this.tasks.add(Objects.requireNonNull(task));
            return this;
        }

        public Builder tasks(LogicalTask<?, ?>... tasks) {
            return tasks(Arrays.asList(tasks));
        }

        public Builder tasks(List<? extends LogicalTask<?, ?>> tasks) {
            tasks.forEach(this::task);
            return this;
        }

        /** models as {@code provider/name} strings */
        public Builder models(String... models) {
            Arrays.stream(models).map(ModelRef::of).forEach(this.models::add);
            return this;
        }

        public Builder models(ModelRef... models) {
            return models(Arrays.asList(models));
        }

        public Builder models(List<ModelRef> models) {
            models.forEach(model -> this.models.add(Objects.requireNonNull(model)));
            return this;
        }

        /** log location: a directory, a {@code file:} uri or an {@code http(s)://} base url */
        public Builder logDir(String logDir) {
            this.logDir = logDir;
            return this;
        }

        /** use an already opened store. Takes precedence over {@link #logDir(String)} */
        public Builder logStore(LogStore logStore) {
            this.logStore = logStore;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryWait(Duration retryWait) {
            this.retryWait = Objects.requireNonNull(retryWait);
            return this;
        }

        public Builder maxTasks(int maxTasks) {
            this.maxTasks = maxTasks;
            return this;
        }

        public Builder failOnError(boolean failOnError) {
            this.failOnError = failOnError;
            return this;
        }

        public Builder logCleanup(boolean logCleanup) {
            this.logCleanup = logCleanup;
            return this;
        }

        public Builder modelRegistry(ModelRegistry modelRegistry) {
            this.modelRegistry = modelRegistry;
            return this;
        }

        public Builder taskExecutor(TaskExecutor taskExecutor) {
            this.taskExecutor = taskExecutor;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }
    }
}
