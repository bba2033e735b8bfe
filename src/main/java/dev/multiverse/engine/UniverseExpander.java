package dev.multiverse.engine;

import dev.multiverse.model.Option;
import dev.multiverse.model.Parameter;
import dev.multiverse.model.Universe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands declared parameters into every universe that satisfies its conditions.
 *
 * <p>Parameters are processed in declaration order over a frontier of partial assignments,
 * so the first-declared parameter varies slowest. An assignment for which every option of
 * a parameter is invalid is dropped; this is pruning, not an error.
 */
public final class UniverseExpander {

    private static final Logger log = LoggerFactory.getLogger(UniverseExpander.class);

    private UniverseExpander() {}

    public static List<Universe> expand(BranchRegistry registry) {
        List<Map<String, String>> frontier = new ArrayList<>();
        frontier.add(new LinkedHashMap<>());

        for (Parameter parameter : registry.parameters()) {
            List<Map<String, String>> next = new ArrayList<>();
            for (Map<String, String> partial : frontier) {
                int extended = 0;
                for (Option option : parameter.options()) {
                    if (ConditionEvaluator.evaluate(option.condition(), partial)) {
                        var assignment = new LinkedHashMap<>(partial);
                        assignment.put(parameter.name(), option.name());
                        next.add(assignment);
                        extended++;
                    }
                }
                if (extended == 0) {
                    log.debug("Pruned {}: no option of {} is valid", partial, parameter.name());
                }
            }
            frontier = next;
        }

        var universes = new ArrayList<Universe>(frontier.size());
        for (int i = 0; i < frontier.size(); i++) {
            universes.add(new Universe(i + 1, frontier.get(i)));
        }
        log.info("Expanded {} parameters into {} universes (unconditioned product {})",
            registry.size(), universes.size(), registry.unconditionedSize());
        return List.copyOf(universes);
    }
}
