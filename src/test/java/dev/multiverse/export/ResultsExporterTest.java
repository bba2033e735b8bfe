package dev.multiverse.export;

import com.fasterxml.jackson.databind.JsonNode;
import dev.multiverse.engine.DistributionSummarizer;
import dev.multiverse.model.CdfGrid;
import dev.multiverse.model.CdfSample;
import dev.multiverse.model.ExecutionResult;
import dev.multiverse.model.ExecutionSummary;
import dev.multiverse.model.NamedOutcome;
import dev.multiverse.model.ResultRecord;
import dev.multiverse.model.Universe;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ResultsExporterTest {

    private static final Universe U1 = new Universe(1, Map.of("A", "a1"));
    private static final Universe U2 = new Universe(2, Map.of("A", "a2"));

    @TempDir
    Path tmp;

    @Test
    void singleUniverseSingleTerm() {
        CdfSample cdf = new DistributionSummarizer(new CdfGrid(3)).summarize("x", 0.0, 1.0);
        ResultRecord record = ResultRecord.of("x", 0.0, 1.0, cdf, NamedOutcome.Statistics.NONE);
        var summary = new ExecutionSummary(List.of(new ExecutionResult.Success(U1, List.of(record), Duration.ZERO)));

        JsonNode root = ResultsExporter.export(summary);

        assertThat(root.isArray()).isTrue();
        assertThat(root).hasSize(1);
        JsonNode universe = root.get(0);
        assertThat(universe.get(".universe").asInt()).isEqualTo(1);
        assertThat(universe.get("results")).hasSize(1);

        JsonNode entry = universe.get("results").get(0);
        assertThat(entry.get("term").asText()).isEqualTo("x");
        assertThat(entry.get("estimate").asDouble()).isEqualTo(0.0);
        assertThat(entry.get("std.error").asDouble()).isEqualTo(1.0);
        assertThat(entry.get("cdf.x")).hasSize(3);
        assertThat(entry.get("cdf.x").get(0).asDouble()).isCloseTo(-0.674, within(1e-3));
        assertThat(entry.get("cdf.y").get(2).asDouble()).isEqualTo(0.75);
        assertThat(entry.has("p.value")).isFalse();
    }

    @Test
    void optionalStatisticsAreWrittenWhenPresent() {
        var record = new ResultRecord("slope", 1.2, 0.3, List.of(0.9, 1.5), List.of(0.25, 0.75),
            4.0, 0.001, 0.6, 1.8);

        JsonNode entry = ResultsExporter.export(List.of(success(U1, record))).get(0).get("results").get(0);

        assertThat(entry.get("statistic").asDouble()).isEqualTo(4.0);
        assertThat(entry.get("p.value").asDouble()).isEqualTo(0.001);
        assertThat(entry.get("conf.low").asDouble()).isEqualTo(0.6);
        assertThat(entry.get("conf.high").asDouble()).isEqualTo(1.8);
    }

    @Test
    void failedUniversesAreOmitted() {
        var record = new ResultRecord("x", 1.0, 0.1, List.of(0.9), List.of(0.5), null, null, null, null);
        var failure = new ExecutionResult.Failure(U1, "fit", "ArithmeticException", "/ by zero", null, Duration.ZERO);

        JsonNode root = ResultsExporter.export(List.of(failure, success(U2, record)));

        assertThat(root).hasSize(1);
        assertThat(root.get(0).get(".universe").asInt()).isEqualTo(2);
    }

    @Test
    void fileAndMemoryModesAreByteIdentical() throws IOException {
        var record = new ResultRecord("x", 1.0, 0.1, List.of(0.9, 1.1), List.of(0.25, 0.75), null, null, null, null);
        List<ExecutionResult> results = List.of(success(U1, record), success(U2, record));
        Path file = tmp.resolve("out/results.json");

        ResultsExporter.export(results, file);

        assertThat(Files.readAllBytes(file)).isEqualTo(JsonArtifacts.render(ResultsExporter.export(results)));
    }

    @Test
    void mismatchedCdfLengthsFailWithFieldAndUniverse() {
        var bad = new ResultRecord("x", 1.0, 0.1, List.of(0.9, 1.1), List.of(0.5), null, null, null, null);
        var good = new ResultRecord("x", 1.0, 0.1, List.of(0.9), List.of(0.5), null, null, null, null);
        Path file = tmp.resolve("results.json");

        assertThatThrownBy(() -> ResultsExporter.export(List.of(success(U1, good), success(U2, bad)), file))
            .isInstanceOf(ExportValidationException.class)
            .satisfies(e -> {
                var ex = (ExportValidationException) e;
                assertThat(ex.field()).isEqualTo("cdf.y");
                assertThat(ex.universeId()).isEqualTo(2);
            });
        assertThat(file).doesNotExist();
    }

    @Test
    void missingRequiredFieldsFail() {
        var noEstimate = new ResultRecord("x", null, 0.1, List.of(0.9), List.of(0.5), null, null, null, null);
        var noCdf = new ResultRecord("x", 1.0, 0.1, null, List.of(0.5), null, null, null, null);
        var nanError = new ResultRecord("x", 1.0, Double.NaN, List.of(0.9), List.of(0.5), null, null, null, null);

        assertThatThrownBy(() -> ResultsExporter.export(List.of(success(U1, noEstimate))))
            .isInstanceOf(ExportValidationException.class)
            .hasMessageContaining("Universe 1, field 'estimate'");
        assertThatThrownBy(() -> ResultsExporter.export(List.of(success(U1, noCdf))))
            .isInstanceOf(ExportValidationException.class)
            .hasMessageContaining("'cdf.x'");
        assertThatThrownBy(() -> ResultsExporter.export(List.of(success(U1, nanError))))
            .isInstanceOf(ExportValidationException.class)
            .hasMessageContaining("'std.error'");
    }

    @Test
    void existingFileIsLeftUntouchedOnValidationFailure() throws IOException {
        Path file = tmp.resolve("results.json");
        Files.writeString(file, "[]");
        var bad = new ResultRecord(null, 1.0, 0.1, List.of(0.9), List.of(0.5), null, null, null, null);

        assertThatThrownBy(() -> ResultsExporter.export(List.of(success(U1, bad)), file))
            .isInstanceOf(ExportValidationException.class);
        assertThat(file).hasContent("[]");
    }

    private static ExecutionResult success(Universe universe, ResultRecord record) {
        return new ExecutionResult.Success(universe, List.of(record), Duration.ZERO);
    }
}
