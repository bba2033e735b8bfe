package dev.multiverse.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.multiverse.model.Condition;
import dev.multiverse.model.EngineSettings;
import dev.multiverse.model.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads parameter declarations from JSON. Every parameter goes through
 * {@link BranchRegistry#declare}, so all declaration errors apply.
 */
public final class DeclarationLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DeclarationLoader() {}

    /**
     * Load a declaration from a JSON file.
     */
    public static Declaration loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseDeclaration(root);
    }

    /**
     * Load a declaration from a JSON string.
     */
    public static Declaration loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseDeclaration(root);
    }

    private static Declaration parseDeclaration(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DeclarationException("Declaration must be a JSON object");
        }
        EngineSettings settings = parseSettings(root.get("settings"));

        BranchRegistry registry = new BranchRegistry();
        JsonNode parameters = root.get("parameters");
        if (parameters != null) {
            if (!parameters.isArray()) {
                throw new DeclarationException("'parameters' must be an array");
            }
            for (JsonNode parameter : parameters) {
                String name = requiredText(parameter, "name", "parameter");
                registry.declare(name, parseOptions(name, parameter.get("options")));
            }
        }

        List<String> code = new ArrayList<>();
        if (root.has("code")) {
            root.get("code").forEach(fragment -> code.add(fragment.asText()));
        }
        return new Declaration(registry, settings, code);
    }

    private static EngineSettings parseSettings(JsonNode node) {
        if (node == null) {
            return EngineSettings.defaults();
        }
        int concurrency = node.has("concurrency")
            ? node.get("concurrency").asInt() : EngineSettings.DEFAULT_CONCURRENCY;
        Duration timeout = node.has("universeTimeoutMs")
            ? Duration.ofMillis(node.get("universeTimeoutMs").asLong()) : EngineSettings.DEFAULT_UNIVERSE_TIMEOUT;
        int gridResolution = node.has("gridResolution")
            ? node.get("gridResolution").asInt() : EngineSettings.DEFAULT_GRID_RESOLUTION;
        try {
            return new EngineSettings(concurrency, timeout, gridResolution);
        } catch (IllegalArgumentException e) {
            throw new DeclarationException("Invalid settings: " + e.getMessage(), e);
        }
    }

    private static List<Option> parseOptions(String parameter, JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new DeclarationException("Parameter '%s' must have an 'options' array".formatted(parameter));
        }
        var options = new ArrayList<Option>();
        for (JsonNode option : node) {
            if (option.isTextual()) {
                options.add(Option.of(option.asText()));
                continue;
            }
            String name = requiredText(option, "name", "option of '" + parameter + "'");
            Object value = option.has("value") ? MAPPER.convertValue(option.get("value"), Object.class) : null;
            String code = option.has("code") ? option.get("code").asText() : name;
            Condition condition = option.has("condition") ? parseCondition(option.get("condition")) : null;
            options.add(new Option(name, value, code, condition));
        }
        return options;
    }

    static Condition parseCondition(JsonNode node) {
        if (node.isTextual()) {
            return ConditionParser.parse(node.asText());
        }
        if (node.has("parameter") && node.has("equals")) {
            return new Condition.Equals(node.get("parameter").asText(), node.get("equals").asText());
        } else if (node.has("all")) {
            return new Condition.All(parseConditions(node.get("all")));
        } else if (node.has("any")) {
            return new Condition.Any(parseConditions(node.get("any")));
        } else if (node.has("not")) {
            return new Condition.Not(parseCondition(node.get("not")));
        }
        throw new DeclarationException("Unknown condition format: " + node);
    }

    private static List<Condition> parseConditions(JsonNode array) {
        var conditions = new ArrayList<Condition>();
        array.forEach(c -> conditions.add(parseCondition(c)));
        return conditions;
    }

    private static String requiredText(JsonNode node, String field, String what) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new DeclarationException("Missing or empty '%s' for %s: %s".formatted(field, what, node));
        }
        return value.asText();
    }
}
