package dev.multiverse.engine;

import dev.multiverse.model.Universe;
import dev.multiverse.pipeline.Pipeline;

import java.util.List;
import java.util.Optional;

/**
 * The explicit context of one analysis: its declared parameters, the shared pipeline,
 * and the universes expanded from them. Immutable once created.
 */
public final class Multiverse {

    private final BranchRegistry registry;
    private final Pipeline pipeline;
    private final List<Universe> universes;

    private Multiverse(BranchRegistry registry, Pipeline pipeline, List<Universe> universes) {
        this.registry = registry;
        this.pipeline = pipeline;
        this.universes = universes;
    }

    /**
     * Validate {@code pipeline} against {@code registry} and expand every universe.
     *
     * @throws PipelineValidationException if the pipeline does not fit the declared parameters
     */
    public static Multiverse of(BranchRegistry registry, Pipeline pipeline) {
        List<String> errors = PipelineValidator.validate(pipeline, registry);
        if (!errors.isEmpty()) {
            throw new PipelineValidationException(errors);
        }
        return new Multiverse(registry, pipeline, UniverseExpander.expand(registry));
    }

    public BranchRegistry registry() {
        return registry;
    }

    public Pipeline pipeline() {
        return pipeline;
    }

    public List<Universe> universes() {
        return universes;
    }

    public Optional<Universe> universe(int id) {
        return id >= 1 && id <= universes.size() ? Optional.of(universes.get(id - 1)) : Optional.empty();
    }

    public int size() {
        return universes.size();
    }
}
