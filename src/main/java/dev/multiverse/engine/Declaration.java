package dev.multiverse.engine;

import dev.multiverse.model.EngineSettings;

import java.util.List;

/**
 * A declaration file after loading: the parameters it declared, its run settings,
 * and any display code fragments it carries for code.json.
 */
public record Declaration(
    BranchRegistry registry,
    EngineSettings settings,
    List<String> code
) {
    public Declaration {
        code = List.copyOf(code);
    }
}
