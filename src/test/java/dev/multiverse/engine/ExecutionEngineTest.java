package dev.multiverse.engine;

import dev.multiverse.export.JsonArtifacts;
import dev.multiverse.export.ResultsExporter;
import dev.multiverse.model.Condition;
import dev.multiverse.model.Dataset;
import dev.multiverse.model.EngineSettings;
import dev.multiverse.model.ExecutionResult;
import dev.multiverse.model.ExecutionSummary;
import dev.multiverse.model.Option;
import dev.multiverse.model.ResultRecord;
import dev.multiverse.model.Universe;
import dev.multiverse.pipeline.Pipeline;
import dev.multiverse.pipeline.StepAction;
import dev.multiverse.pipeline.StepContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExecutionEngineTest {

    private static final Dataset DATA = dataset();

    private BranchRegistry registry;

    @BeforeEach
    void declare() {
        registry = new BranchRegistry();
        registry.declare("cutoff", Option.of("all", Double.POSITIVE_INFINITY), Option.of("below10", 10.0));
        registry.declare("summary",
            Option.of("mean"),
            Option.of("trimmed").when(Condition.equalTo("cutoff", "all")));
    }

    @Test
    void branchedStepsRunTheChosenVariant() {
        Multiverse multiverse = Multiverse.of(registry, meanPipeline(ctx -> {}));
        var engine = new ExecutionEngine(registry, settings(1));

        ExecutionSummary summary = engine.runAll(multiverse, DATA);

        assertThat(summary.total()).isEqualTo(3);
        assertThat(summary.succeeded()).isEqualTo(3);
        // all rows: y = 1, 2, 3, 4, 40
        ResultRecord allMean = records(summary, 1).get(0);
        assertThat(allMean.term()).isEqualTo("y");
        assertThat(allMean.estimate()).isCloseTo(10.0, within(1e-12));
        // trimmed drops the largest value
        assertThat(records(summary, 2).get(0).estimate()).isCloseTo(2.5, within(1e-12));
        // x < 10 removes the last row
        assertThat(records(summary, 3).get(0).estimate()).isCloseTo(2.5, within(1e-12));
    }

    @Test
    void failingUniverseDoesNotStopOthers() {
        Multiverse multiverse = Multiverse.of(registry, meanPipeline(ctx -> {
            if (ctx.choice("summary").equals("trimmed")) {
                throw new IllegalStateException("model did not converge");
            }
        }));
        var engine = new ExecutionEngine(registry, settings(2));

        ExecutionSummary summary = engine.runAll(multiverse, DATA);

        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        ExecutionResult.Failure failure = summary.failures().get(0);
        assertThat(failure.universe().id()).isEqualTo(2);
        assertThat(failure.failedStep()).isEqualTo("check");
        assertThat(failure.errorType()).isEqualTo("IllegalStateException");
        assertThat(failure.cause()).hasMessage("model did not converge");
        assertThat(summary.causes()).containsOnlyKeys(2);

        var exported = ResultsExporter.export(summary);
        assertThat(exported).hasSize(2);
        assertThat(exported.get(0).get(ResultsExporter.UNIVERSE).asInt()).isEqualTo(1);
        assertThat(exported.get(1).get(ResultsExporter.UNIVERSE).asInt()).isEqualTo(3);
    }

    @Test
    void errorThrownByStepIsRecordedAsFailure() {
        Multiverse multiverse = Multiverse.of(registry, meanPipeline(ctx -> {
            if (ctx.universe().id() == 1) {
                throw new AssertionError("singular matrix");
            }
        }));
        var engine = new ExecutionEngine(registry, settings(1));

        ExecutionSummary summary = engine.runAll(multiverse, DATA);

        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.skipped()).isZero();
        ExecutionResult.Failure failure = summary.failures().get(0);
        assertThat(failure.universe().id()).isEqualTo(1);
        assertThat(failure.failedStep()).isEqualTo("check");
        assertThat(failure.errorType()).isEqualTo("AssertionError");
        assertThat(failure.message()).isEqualTo("singular matrix");
    }

    @Test
    void executeReturnsFailureForStackOverflow() {
        var engine = new ExecutionEngine(registry, settings(1));
        Universe universe = UniverseExpander.expand(registry).get(0);

        ExecutionResult result = engine.execute(meanPipeline(ctx -> {
            throw new StackOverflowError();
        }), universe, DATA);

        assertThat(result).isInstanceOf(ExecutionResult.Failure.class);
        var failure = (ExecutionResult.Failure) result;
        assertThat(failure.errorType()).isEqualTo("StackOverflowError");
        assertThat(failure.message()).isEqualTo("StackOverflowError");
    }

    @Test
    void summarizationErrorsFailOnlyThatUniverse() {
        Pipeline pipeline = Pipeline.builder()
            .branched("emit", "summary", Map.of(
                "mean", ctx -> ctx.emit("y", 1.0, 0.5),
                "trimmed", ctx -> ctx.emit("y", 1.0, 0.0)))
            .build();
        var engine = new ExecutionEngine(registry, settings(1));

        ExecutionSummary summary = engine.runAll(Multiverse.of(registry, pipeline), DATA);

        assertThat(summary.failed()).isEqualTo(1);
        ExecutionResult.Failure failure = summary.failures().get(0);
        assertThat(failure.failedStep()).isEqualTo(ExecutionEngine.SUMMARIZE_STAGE);
        assertThat(failure.errorType()).isEqualTo("DistributionSummaryException");
    }

    @Test
    void sharedDatasetIsNeverMutated() {
        Multiverse multiverse = Multiverse.of(registry, meanPipeline(ctx ->
            ctx.replaceDataset(ctx.dataset().withColumn("y", List.of(0, 0, 0, 0, 0)))));
        var engine = new ExecutionEngine(registry, settings(3));

        engine.runAll(multiverse, DATA);

        assertThat(DATA).isEqualTo(dataset());
        assertThat(DATA.column("y")).containsExactly(1, 2, 3, 4, 40);
    }

    @Test
    void executeRunsOneUniverseOnTheCallingThread() {
        var engine = new ExecutionEngine(registry, settings(1));
        Universe universe = UniverseExpander.expand(registry).get(2);

        ExecutionResult result = engine.execute(meanPipeline(ctx -> {}), universe, DATA);

        assertThat(result).isInstanceOf(ExecutionResult.Success.class);
        assertThat(((ExecutionResult.Success) result).records()).hasSize(1);
    }

    @Test
    void aggregatedOutputIsIndependentOfParallelism() {
        Pipeline pipeline = meanPipeline(ctx -> Thread.sleep(ctx.universe().id() == 1 ? 50 : 0));

        ExecutionSummary serial = new ExecutionEngine(registry, settings(1))
            .runAll(Multiverse.of(registry, pipeline), DATA);
        ExecutionSummary parallel = new ExecutionEngine(registry, settings(4))
            .runAll(Multiverse.of(registry, pipeline), DATA);

        assertThat(serial.results()).extracting(r -> r.universe().id()).containsExactly(1, 2, 3);
        assertThat(JsonArtifacts.renderString(ResultsExporter.export(parallel)))
            .isEqualTo(JsonArtifacts.renderString(ResultsExporter.export(serial)));
    }

    @Test
    void timedOutUniverseIsMarkedFailed() {
        Multiverse multiverse = Multiverse.of(registry, meanPipeline(ctx -> {
            if (ctx.universe().id() == 1) {
                Thread.sleep(10_000);
            }
        }));
        var engine = new ExecutionEngine(registry,
            new EngineSettings(2, Duration.ofMillis(200), 9));

        ExecutionSummary summary = engine.runAll(multiverse, DATA);

        assertThat(summary.succeeded()).isEqualTo(2);
        ExecutionResult.Failure failure = summary.failures().get(0);
        assertThat(failure.universe().id()).isEqualTo(1);
        assertThat(failure.errorType()).isEqualTo(ExecutionResult.Failure.TIMEOUT);
        assertThat(failure.failedStep()).isEqualTo("check");
    }

    @Test
    void cancellationSkipsUnstartedUniversesAndKeepsCompletedOnes() {
        RunControl control = RunControl.create();
        Multiverse multiverse = Multiverse.of(registry, meanPipeline(ctx -> control.cancel()));
        var engine = new ExecutionEngine(registry, settings(1));

        ExecutionSummary summary = engine.runAll(multiverse, DATA, control);

        assertThat(summary.results().get(0)).isInstanceOf(ExecutionResult.Success.class);
        assertThat(summary.results().subList(1, 3)).allMatch(r -> r instanceof ExecutionResult.Skipped);
        assertThat(summary.skipped()).isEqualTo(2);
        assertThat(control.completed()).isEqualTo(1);
        assertThat(ResultsExporter.export(summary)).hasSize(1);
    }

    /**
     * filter by cutoff, run {@code check}, then summarize y by mean or trimmed mean.
     */
    private static Pipeline meanPipeline(StepAction check) {
        return Pipeline.builder()
            .branched("filter", "cutoff", Map.of(
                "all", ctx -> {},
                "below10", ctx -> {
                    double limit = (Double) ctx.optionValue("cutoff");
                    ctx.replaceDataset(ctx.dataset().filterRows(row -> ((Number) row.get("x")).doubleValue() < limit));
                }))
            .fixed("check", check)
            .branched("estimate", "summary", Map.of(
                "mean", ctx -> ctx.put("values", ctx.dataset().numericColumn("y")),
                "trimmed", ctx -> {
                    double[] y = ctx.dataset().numericColumn("y").clone();
                    java.util.Arrays.sort(y);
                    ctx.put("values", java.util.Arrays.copyOf(y, y.length - 1));
                }))
            .fixed("report", ExecutionEngineTest::emitMean)
            .build();
    }

    private static void emitMean(StepContext ctx) {
        double[] values = ctx.get("values", double[].class);
        double mean = java.util.Arrays.stream(values).average().orElseThrow();
        double ss = java.util.Arrays.stream(values).map(v -> (v - mean) * (v - mean)).sum();
        double se = Math.sqrt(ss / (values.length - 1)) / Math.sqrt(values.length);
        ctx.emit("y", mean, se);
    }

    private static List<ResultRecord> records(ExecutionSummary summary, int universeId) {
        return ((ExecutionResult.Success) summary.results().get(universeId - 1)).records();
    }

    private static EngineSettings settings(int concurrency) {
        return new EngineSettings(concurrency, null, 19);
    }

    private static Dataset dataset() {
        var columns = new LinkedHashMap<String, List<?>>();
        columns.put("x", List.of(1, 2, 3, 4, 50));
        columns.put("y", List.of(1, 2, 3, 4, 40));
        return Dataset.of(columns);
    }
}
