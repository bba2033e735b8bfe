package dev.multiverse.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.multiverse.model.Universe;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The expanded universes as rows: {@code [{".universe": 1, "A": "a1", "B": "b1"}, ...]}.
 */
public final class UniverseTable {

    private UniverseTable() {}

    public static JsonNode export(List<Universe> universes) {
        ArrayNode root = JsonArtifacts.MAPPER.createArrayNode();
        for (Universe universe : universes) {
            ObjectNode row = root.addObject();
            row.put(ResultsExporter.UNIVERSE, universe.id());
            universe.assignment().forEach(row::put);
        }
        return root;
    }

    public static void export(List<Universe> universes, Path destination) throws IOException {
        JsonArtifacts.write(export(universes), destination);
    }
}
