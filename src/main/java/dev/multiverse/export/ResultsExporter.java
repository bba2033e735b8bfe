package dev.multiverse.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.multiverse.model.ExecutionResult;
import dev.multiverse.model.ExecutionSummary;
import dev.multiverse.model.ResultRecord;
import dev.multiverse.model.Universe;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes results.json: one object per successful universe, in universe order.
 *
 * <pre>
 * [{".universe": 1, "results": [{"term": ..., "estimate": ..., "std.error": ...,
 *                                "cdf.x": [...], "cdf.y": [...]}]}]
 * </pre>
 *
 * Failed and skipped universes are left out.
 */
public final class ResultsExporter {

    public static final String UNIVERSE = Universe.ID_FIELD;
    public static final String RESULTS = "results";

    private ResultsExporter() {}

    public static JsonNode export(ExecutionSummary summary) {
        return export(summary.results());
    }

    public static JsonNode export(List<? extends ExecutionResult> results) {
        ArrayNode root = JsonArtifacts.MAPPER.createArrayNode();
        for (ExecutionResult result : results) {
            if (!(result instanceof ExecutionResult.Success success)) {
                continue;
            }
            int id = success.universe().id();
            ObjectNode universe = root.addObject();
            universe.put(UNIVERSE, id);
            ArrayNode entries = universe.putArray(RESULTS);
            for (ResultRecord record : success.records()) {
                entries.add(toJson(record, id));
            }
        }
        return root;
    }

    public static void export(ExecutionSummary summary, Path destination) throws IOException {
        JsonArtifacts.write(export(summary), destination);
    }

    public static void export(List<? extends ExecutionResult> results, Path destination) throws IOException {
        JsonArtifacts.write(export(results), destination);
    }

    private static ObjectNode toJson(ResultRecord record, int universeId) {
        if (record.term() == null || record.term().isBlank()) {
            throw new ExportValidationException("term", universeId, "missing term name");
        }
        ObjectNode node = JsonArtifacts.MAPPER.createObjectNode();
        node.put("term", record.term());
        node.put("estimate", required(record.estimate(), "estimate", universeId));
        node.put("std.error", required(record.stdError(), "std.error", universeId));

        List<Double> x = record.cdfX();
        List<Double> y = record.cdfY();
        if (x == null) {
            throw new ExportValidationException("cdf.x", universeId, "missing for term '" + record.term() + "'");
        }
        if (y == null) {
            throw new ExportValidationException("cdf.y", universeId, "missing for term '" + record.term() + "'");
        }
        if (x.size() != y.size()) {
            throw new ExportValidationException("cdf.y", universeId,
                "length %d does not match cdf.x length %d for term '%s'".formatted(y.size(), x.size(), record.term()));
        }
        ArrayNode xs = node.putArray("cdf.x");
        ArrayNode ys = node.putArray("cdf.y");
        for (int i = 0; i < x.size(); i++) {
            xs.add(required(x.get(i), "cdf.x", universeId));
            ys.add(required(y.get(i), "cdf.y", universeId));
        }

        optional(node, "statistic", record.statistic(), universeId);
        optional(node, "p.value", record.pValue(), universeId);
        optional(node, "conf.low", record.confLow(), universeId);
        optional(node, "conf.high", record.confHigh(), universeId);
        return node;
    }

    private static double required(Double value, String field, int universeId) {
        if (value == null) {
            throw new ExportValidationException(field, universeId, "missing value");
        }
        if (!Double.isFinite(value)) {
            throw new ExportValidationException(field, universeId, "not a finite number: " + value);
        }
        return value;
    }

    private static void optional(ObjectNode node, String field, Double value, int universeId) {
        if (value != null) {
            node.put(field, required(value, field, universeId));
        }
    }
}
