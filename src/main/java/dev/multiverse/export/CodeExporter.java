package dev.multiverse.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.multiverse.engine.BranchRegistry;
import dev.multiverse.pipeline.Pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes code.json: the pipeline source as ordered fragments plus each parameter's option names.
 *
 * <pre>
 * {"code": ["...", "..."], "parameters": {"A": ["a1", "a2"]}}
 * </pre>
 */
public final class CodeExporter {

    private CodeExporter() {}

    public static JsonNode export(Pipeline pipeline, BranchRegistry registry) {
        return export(CodeRenderer.render(pipeline, registry), registry);
    }

    public static JsonNode export(List<String> fragments, BranchRegistry registry) {
        ObjectNode root = JsonArtifacts.MAPPER.createObjectNode();
        ArrayNode code = root.putArray("code");
        for (int i = 0; i < fragments.size(); i++) {
            String fragment = fragments.get(i);
            if (fragment == null) {
                throw new ExportValidationException("code", null, "fragment #%d is missing".formatted(i + 1));
            }
            code.add(fragment);
        }
        ObjectNode parameters = root.putObject("parameters");
        registry.optionNames().forEach((name, options) -> {
            ArrayNode list = parameters.putArray(name);
            options.forEach(list::add);
        });
        return root;
    }

    public static void export(Pipeline pipeline, BranchRegistry registry, Path destination) throws IOException {
        JsonArtifacts.write(export(pipeline, registry), destination);
    }

    public static void export(List<String> fragments, BranchRegistry registry, Path destination) throws IOException {
        JsonArtifacts.write(export(fragments, registry), destination);
    }
}
