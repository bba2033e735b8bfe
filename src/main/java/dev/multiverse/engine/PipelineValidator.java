package dev.multiverse.engine;

import dev.multiverse.model.Parameter;
import dev.multiverse.pipeline.Pipeline;
import dev.multiverse.pipeline.Step;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * Validates a pipeline against the declared parameters before any universe runs.
 */
public final class PipelineValidator {

    private PipelineValidator() {}

    /**
     * Validate a pipeline. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(Pipeline pipeline, BranchRegistry registry) {
        var errors = new ArrayList<String>();
        var labels = new HashSet<String>();

        for (int i = 0; i < pipeline.steps().size(); i++) {
            Step step = pipeline.steps().get(i);
            String where = "Step #%d".formatted(i + 1);

            if (step.label() == null || step.label().isBlank()) {
                errors.add(where + " has a missing or empty label");
            } else {
                where = "Step '%s'".formatted(step.label());
                if (!labels.add(step.label())) {
                    errors.add(where + " is declared more than once");
                }
            }

            if (step instanceof Step.Branched branched) {
                Optional<Parameter> parameter = registry.parameter(branched.parameter());
                if (parameter.isEmpty()) {
                    errors.add("%s branches on undeclared parameter '%s'".formatted(where, branched.parameter()));
                    continue;
                }

                // every option needs a variant
                for (String option : parameter.get().optionNames()) {
                    if (!branched.variants().containsKey(option)) {
                        errors.add("%s: option '%s' of parameter '%s' has no variant"
                            .formatted(where, option, branched.parameter()));
                    } else if (branched.variants().get(option) == null) {
                        errors.add("%s: variant for option '%s' is null".formatted(where, option));
                    }
                }

                // and no variant may name an unknown option
                for (String key : branched.variants().keySet()) {
                    if (!parameter.get().hasOption(key)) {
                        errors.add("%s: variant '%s' is not an option of parameter '%s' %s"
                            .formatted(where, key, branched.parameter(), parameter.get().optionNames()));
                    }
                }
            }
        }

        return errors;
    }
}
