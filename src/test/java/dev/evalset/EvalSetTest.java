package dev.evalset;

import static dev.evalset.TestTasks.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.evalset.config.EvalSetConfig;
import dev.evalset.eval.DatasetCase;
import dev.evalset.eval.Scorer;
import dev.evalset.eval.Solver;
import dev.evalset.eval.TaskResult;
import dev.evalset.log.EvalLog;
import dev.evalset.log.EvalStatus;
import dev.evalset.run.CancellationToken;
import dev.evalset.run.EvalSetInterruptedException;
import dev.evalset.task.LogicalTask;
import dev.evalset.task.TaskParams;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EvalSetTest {
    @TempDir Path logDir;

    private InMemorySpanExporter spanExporter;
    private SdkTracerProvider tracerProvider;
    private Tracer tracer;

    @BeforeEach
    void beforeEach() {
        spanExporter = InMemorySpanExporter.create();
        tracerProvider =
                SdkTracerProvider.builder()
                        .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                        .build();
        tracer = tracerProvider.get("test");
    }

    @AfterEach
    void afterEach() {
        tracerProvider.close();
    }

    private EvalSet.Builder evalSet() {
        return EvalSet.builder()
                .config(EvalSetConfig.builder().defaultModels().build())
                .logDir(logDir.toString())
                .retryWait(Duration.ZERO)
                .tracer(tracer);
    }

    private long filesOnDisk() throws IOException {
        try (Stream<Path> files = Files.walk(logDir)) {
            return files.filter(Files::isRegularFile).count();
        }
    }

    @Test
    void allTasksSucceedOnFirstRound() throws IOException {
        var result =
                evalSet()
                        .tasks(TestTasks.simple("addition"), TestTasks.simple("spelling"))
                        .models(MODEL_A, MODEL_B)
                        .build()
                        .run();

        assertTrue(result.success());
        assertEquals(4, result.logs().size());
        assertEquals(4, result.countWithStatus(EvalStatus.SUCCESS));
        assertEquals(
                List.of(1, 2, 3, 4),
                result.logs().stream().map(l -> l.header().sequence()).toList());
        assertEquals(1, result.logs().get(0).samples().size());
        assertEquals(4, filesOnDisk());
    }

    @Test
    void dynamicTasksWithParamsProduceOneLogPerTaskAndModel() {
        var tasks = new ArrayList<LogicalTask<String, String>>();
        for (var lang : List.of("en", "fr")) {
            tasks.add(TestTasks.simple("translate", TaskParams.of("lang", lang)));
        }

        var result =
                evalSet().tasks(tasks).models("mockllm/model-a", "mockllm/model-b").build().run();

        assertTrue(result.success());
        assertEquals(4, result.logs().size());
        assertEquals(
                Set.of("en", "fr"),
                result.logs().stream()
                        .map(l -> l.header().taskParams().asMap().get("lang"))
                        .collect(Collectors.toSet()));
        assertEquals(4, result.logs().stream().map(EvalLog::location).distinct().count());
    }

    @Test
    void flakyTasksEventuallySucceedWithEnoughRetries() {
        var tasks = new ArrayList<LogicalTask<String, String>>();
        for (int i = 0; i < 5; i++) {
            tasks.add(TestTasks.flaky("flaky-" + i, 0.1, 42 + i));
        }

        var result =
                evalSet().tasks(tasks).models(MODEL_A, MODEL_B).retryAttempts(1000).build().run();

        assertTrue(result.success());
        assertEquals(10, result.countWithStatus(EvalStatus.SUCCESS));
    }

    @Test
    void alwaysFailingTasksExhaustRetries() throws IOException {
        var result =
                evalSet()
                        .tasks(TestTasks.flaky("doomed", 1.0, 7))
                        .models(MODEL_A, MODEL_B)
                        .retryAttempts(1)
                        .build()
                        .run();

        assertFalse(result.success());
        assertEquals(2, result.logs().size());
        for (var evalLog : result.logs()) {
            assertEquals(EvalStatus.ERROR, evalLog.status());
            assertEquals(2, evalLog.header().attempt());
            assertEquals("injected failure", evalLog.header().error().orElseThrow().message());
        }
        // first attempts were superseded and cleaned up
        assertEquals(2, filesOnDisk());
    }

    @Test
    void zeroRetriesRunsEachTaskOnce() {
        var invocations = new AtomicInteger();
        var task =
                LogicalTask.<String, String>builder()
                        .name("doomed")
                        .cases(DatasetCase.of("q", "a"))
                        .solver(
                                (datasetCase, model) -> {
                                    invocations.incrementAndGet();
                                    throw new IllegalStateException("always");
                                })
                        .build();

        var result = evalSet().tasks(task).models(MODEL_A).retryAttempts(0).build().run();

        assertFalse(result.success());
        assertEquals(1, invocations.get());
        assertEquals(1, result.logs().get(0).header().attempt());
    }

    @Test
    void unboundedRetryAttemptsStopOnceEverythingSucceeds() throws IOException {
        var invocations = new AtomicInteger();

        var result =
                evalSet()
                        .tasks(TestTasks.counting("once", invocations, 1))
                        .models(MODEL_A)
                        .retryAttempts(Integer.MAX_VALUE)
                        .build()
                        .run();

        assertTrue(result.success());
        assertEquals(1, invocations.get());
        assertEquals(1, result.logs().size());
        assertEquals(1, filesOnDisk());
    }

    @Test
    void unboundedRetryAttemptsKeepRetryingAFlakyTask() {
        var result =
                evalSet()
                        .tasks(TestTasks.flaky("flaky", 0.5, 7))
                        .models(MODEL_A)
                        .retryAttempts(Integer.MAX_VALUE)
                        .build()
                        .run();

        assertTrue(result.success());
        assertEquals(EvalStatus.SUCCESS, result.logs().get(0).status());
    }

    @Test
    void rerunningACompletedSetDoesNoWork() {
        var invocations = new AtomicInteger();
        var tasks =
                List.of(
                        TestTasks.counting("first", invocations, 1),
                        TestTasks.counting("second", invocations, 1));

        var first = evalSet().tasks(tasks).models(MODEL_A, MODEL_B).build().run();
        var second = evalSet().tasks(tasks).models(MODEL_A, MODEL_B).build().run();

        assertTrue(first.success());
        assertTrue(second.success());
        assertEquals(4, invocations.get());
        assertEquals(
                first.logs().stream().map(EvalLog::location).toList(),
                second.logs().stream().map(EvalLog::location).toList());
    }

    @Test
    void resumeRetriesOnlyFailedTasks() {
        var broken = new AtomicBoolean(true);
        var calls = new AtomicInteger();
        var task =
                LogicalTask.<String, String>builder()
                        .name("sometimes")
                        .cases(DatasetCase.of("q", "Default output"))
                        .solver(
                                Solver.<String>generate()
                                        .precededBy(
                                                (datasetCase, model) -> {
                                                    calls.incrementAndGet();
                                                    if (broken.get()
                                                            && model.ref().equals(MODEL_B)) {
                                                        throw new RuntimeException("model b down");
                                                    }
                                                }))
                        .scorers(Scorer.includes())
                        .build();

        var first = evalSet().tasks(task).models(MODEL_A, MODEL_B).retryAttempts(0).build().run();
        broken.set(false);
        var second = evalSet().tasks(task).models(MODEL_A, MODEL_B).retryAttempts(0).build().run();

        assertFalse(first.success());
        assertEquals(1, first.countWithStatus(EvalStatus.ERROR));
        assertTrue(second.success());
        assertEquals(3, calls.get());
        assertEquals(first.logs().get(0).location(), second.logs().get(0).location());
        assertEquals(2, second.logs().get(1).header().attempt());
    }

    @Test
    void sampleErrorsAreCountedWhenNotFailingFast() {
        var task =
                LogicalTask.<String, String>builder()
                        .name("partial")
                        .cases(
                                DatasetCase.of("ok", "Default output"),
                                DatasetCase.of("bad", "Default output"),
                                DatasetCase.of("ok", "Default output"))
                        .solver(
                                Solver.<String>generate()
                                        .precededBy(
                                                (datasetCase, model) -> {
                                                    if (datasetCase.input().equals("bad")) {
                                                        throw new RuntimeException("bad input");
                                                    }
                                                }))
                        .build();

        var result =
                evalSet()
                        .tasks(task)
                        .models(MODEL_A)
                        .failOnError(false)
                        .retryAttempts(0)
                        .build()
                        .run();

        var evalLog = result.logs().get(0);
        assertFalse(result.success());
        assertEquals(3, evalLog.samples().size());
        assertEquals(1, evalLog.header().failedSamples());
        assertEquals("1 of 3 samples failed", evalLog.header().error().orElseThrow().message());
    }

    @Test
    void duplicateIdentitiesFailBeforeAnyLogIsWritten() {
        var dir = logDir.resolve("never-created");
        var builder =
                evalSet()
                        .logDir(dir.toString())
                        .tasks(
                                TestTasks.simple("same", TaskParams.of("n", 1)),
                                TestTasks.simple("same", TaskParams.of("n", 1)))
                        .models(MODEL_A);

        assertThrows(ConfigurationException.class, builder::build);
        assertFalse(Files.exists(dir));
    }

    @Test
    void unknownModelProviderIsAConfigurationError() {
        var builder = evalSet().tasks(TestTasks.simple("t")).models("nope/model");

        assertThrows(ConfigurationException.class, builder::build);
    }

    @Test
    void missingModelsIsAConfigurationError() {
        var builder = evalSet().tasks(TestTasks.simple("t"));

        assertThrows(ConfigurationException.class, builder::build);
    }

    @Test
    void defaultModelsComeFromConfig() {
        var result =
                evalSet()
                        .config(EvalSetConfig.builder().defaultModels("mockllm/model-c").build())
                        .tasks(TestTasks.simple("t"))
                        .build()
                        .run();

        assertTrue(result.success());
        assertEquals(MODEL_C, result.logs().get(0).header().model());
    }

    @Test
    void builderCanBeBuiltTwiceWithConfigDefaults() {
        var builder =
                evalSet()
                        .config(EvalSetConfig.builder().defaultModels("mockllm/model-c").build())
                        .tasks(TestTasks.simple("t"));

        var first = builder.build();
        var second = builder.build();

        assertEquals(1, first.taskSet().size());
        assertEquals(1, second.taskSet().size());
        assertEquals(List.of(MODEL_C), second.taskSet().models());

        var explicit = builder.models(MODEL_A).build();
        assertEquals(List.of(MODEL_A), explicit.taskSet().models());
    }

    @Test
    void concurrencyIsBoundedByMaxTasks() {
        var running = new AtomicInteger();
        var maxRunning = new AtomicInteger();
        var tasks = new ArrayList<LogicalTask<String, String>>();
        for (int i = 0; i < 6; i++) {
            tasks.add(
                    LogicalTask.<String, String>builder()
                            .name("slow-" + i)
                            .cases(DatasetCase.of("q", "a"))
                            .solver(
                                    (datasetCase, model) -> {
                                        maxRunning.accumulateAndGet(
                                                running.incrementAndGet(), Math::max);
                                        try {
                                            Thread.sleep(20);
                                        } finally {
                                            running.decrementAndGet();
                                        }
                                        return new TaskResult<>("done", datasetCase);
                                    })
                            .build());
        }

        var result = evalSet().tasks(tasks).models(MODEL_A, MODEL_B).maxTasks(3).build().run();

        assertTrue(result.success());
        assertTrue(maxRunning.get() <= 3, "max concurrent tasks: " + maxRunning.get());
    }

    @Test
    void interruptedRunResumesWhereItStopped() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var token = new CancellationToken();
        var solved = new AtomicInteger();
        var blocking =
                LogicalTask.<String, String>builder()
                        .name("blocking")
                        .cases(
                                DatasetCase.of("first", "Default output"),
                                DatasetCase.of("second", "Default output"))
                        .solver(
                                Solver.<String>generate()
                                        .precededBy(
                                                (datasetCase, model) -> {
                                                    solved.incrementAndGet();
                                                    if (datasetCase.input().equals("first")) {
                                                        started.countDown();
                                                        release.await();
                                                    }
                                                }))
                        .build();
        var other = TestTasks.counting("other", solved, 1);

        var firstRun = Executors.newSingleThreadExecutor();
        try {
            var future =
                    firstRun.submit(
                            () ->
                                    evalSet()
                                            .tasks(blocking, other)
                                            .models(MODEL_A)
                                            .maxTasks(1)
                                            .cancellationToken(token)
                                            .build()
                                            .run());
            assertTrue(started.await(10, TimeUnit.SECONDS));
            token.cancel();
            release.countDown();

            var thrown =
                    assertThrows(
                            ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
            assertInstanceOf(EvalSetInterruptedException.class, thrown.getCause());
        } finally {
            firstRun.shutdownNow();
        }

        var leftover = EvalSet.listAllLogs(logDir.toString());
        assertEquals(1, leftover.size());
        assertEquals(EvalStatus.STARTED, leftover.get(0).status());
        assertEquals("blocking", leftover.get(0).header().taskName());

        var resumed = evalSet().tasks(blocking, other).models(MODEL_A).build().run();

        assertTrue(resumed.success());
        assertEquals(2, resumed.logs().get(0).header().attempt());
        assertEquals(1, resumed.logs().get(1).header().attempt());
        assertEquals(2, EvalSet.listAllLogs(logDir.toString()).size());
        assertEquals(2, EvalSet.latestCompleted(logDir.toString(), false).size());

        int solvedBeforeRerun = solved.get();
        var rerun = evalSet().tasks(blocking, other).models(MODEL_A).build().run();

        assertTrue(rerun.success());
        assertEquals(solvedBeforeRerun, solved.get());
        assertEquals(
                resumed.logs().stream().map(EvalLog::location).toList(),
                rerun.logs().stream().map(EvalLog::location).toList());
        assertEquals(2, EvalSet.listAllLogs(logDir.toString()).size());
    }

    @Test
    void cancellingDuringRetryWaitStopsPromptly() throws Exception {
        var failed = new CountDownLatch(1);
        var token = new CancellationToken();
        var task =
                LogicalTask.<String, String>builder()
                        .name("doomed")
                        .cases(DatasetCase.of("q", "a"))
                        .solver(
                                (datasetCase, model) -> {
                                    failed.countDown();
                                    throw new IllegalStateException("always");
                                })
                        .build();

        var runner = Executors.newSingleThreadExecutor();
        try {
            var future =
                    runner.submit(
                            () ->
                                    evalSet()
                                            .tasks(task)
                                            .models(MODEL_A)
                                            .retryAttempts(5)
                                            .retryWait(Duration.ofMinutes(10))
                                            .cancellationToken(token)
                                            .build()
                                            .run());
            assertTrue(failed.await(10, TimeUnit.SECONDS));
            token.cancel();

            var thrown =
                    assertThrows(
                            ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
            assertInstanceOf(EvalSetInterruptedException.class, thrown.getCause());
        } finally {
            runner.shutdownNow();
        }
    }

    @Test
    void spansNestTasksUnderRoundsUnderTheEvalSet() {
        var result =
                evalSet().tasks(TestTasks.simple("traced")).models(MODEL_A, MODEL_B).build().run();
        assertTrue(result.success());

        List<SpanData> spans = spanExporter.getFinishedSpanItems();
        var root = single(spans, "eval_set");
        var round = single(spans, "round");
        var taskSpans = spans.stream().filter(s -> s.getName().equals("task")).toList();

        assertEquals(root.getSpanId(), round.getParentSpanId());
        assertEquals(0L, round.getAttributes().get(AttributeKey.longKey("evalset.round")));
        assertEquals("SUCCESS", root.getAttributes().get(AttributeKey.stringKey("evalset.status")));
        assertEquals(2, taskSpans.size());
        for (var taskSpan : taskSpans) {
            assertEquals(round.getSpanId(), taskSpan.getParentSpanId());
            assertEquals(root.getTraceId(), taskSpan.getTraceId());
            var attributes = taskSpan.getAttributes();
            assertEquals("traced", attributes.get(AttributeKey.stringKey("evalset.task")));
            assertEquals("SUCCESS", attributes.get(AttributeKey.stringKey("evalset.status")));
        }
        assertEquals(
                Set.of("mockllm/model-a", "mockllm/model-b"),
                taskSpans.stream()
                        .map(s -> s.getAttributes().get(AttributeKey.stringKey("evalset.model")))
                        .collect(Collectors.toSet()));
    }

    private static SpanData single(List<SpanData> spans, String name) {
        var matching = spans.stream().filter(s -> s.getName().equals(name)).toList();
        assertEquals(1, matching.size(), "spans named " + name);
        return matching.get(0);
    }
}
