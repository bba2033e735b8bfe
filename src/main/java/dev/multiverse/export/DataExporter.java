package dev.multiverse.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.multiverse.model.Dataset;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes data.json: one object per column, in column order, with row order preserved.
 *
 * <pre>
 * [{"field": "x", "values": [1, 2, 3]}, {"field": "y", "values": ["a", "b", "c"]}]
 * </pre>
 */
public final class DataExporter {

    private DataExporter() {}

    public static JsonNode export(Dataset dataset) {
        ArrayNode root = JsonArtifacts.MAPPER.createArrayNode();
        for (var column : dataset.columns().entrySet()) {
            ObjectNode field = root.addObject();
            field.put("field", column.getKey());
            ArrayNode values = field.putArray("values");
            List<Object> cells = column.getValue();
            for (int row = 0; row < cells.size(); row++) {
                Object cell = cells.get(row);
                if ((cell instanceof Double d && !Double.isFinite(d)) || (cell instanceof Float f && !Float.isFinite(f))) {
                    throw new ExportValidationException(column.getKey(), null,
                        "row %d is not a finite number: %s".formatted(row, cell));
                }
                values.add(JsonArtifacts.MAPPER.valueToTree(cell));
            }
        }
        return root;
    }

    public static void export(Dataset dataset, Path destination) throws IOException {
        JsonArtifacts.write(export(dataset), destination);
    }

    /**
     * Read a data.json artifact back into a dataset.
     */
    public static Dataset read(Path source) throws IOException {
        return fromJson(JsonArtifacts.MAPPER.readTree(source.toFile()));
    }

    public static Dataset fromJson(JsonNode root) throws IOException {
        if (root == null || !root.isArray()) {
            throw new ExportValidationException("data", null, "expected an array of {field, values} objects");
        }
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        int rows = -1;
        for (JsonNode column : root) {
            JsonNode field = column.get("field");
            JsonNode values = column.get("values");
            if (field == null || !field.isTextual()) {
                throw new ExportValidationException("field", null, "missing or non-string column name");
            }
            if (values == null || !values.isArray()) {
                throw new ExportValidationException(field.asText(), null, "missing values array");
            }
            if (rows >= 0 && values.size() != rows) {
                throw new ExportValidationException(field.asText(), null,
                    "has %d values, expected %d".formatted(values.size(), rows));
            }
            rows = values.size();
            var cells = new ArrayList<Object>(rows);
            for (JsonNode value : values) {
                cells.add(JsonArtifacts.MAPPER.treeToValue(value, Object.class));
            }
            columns.put(field.asText(), cells);
        }
        return Dataset.of(columns);
    }
}
