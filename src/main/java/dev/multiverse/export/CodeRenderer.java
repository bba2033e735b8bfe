package dev.multiverse.export;

import dev.multiverse.engine.BranchRegistry;
import dev.multiverse.model.Option;
import dev.multiverse.model.Parameter;
import dev.multiverse.pipeline.Pipeline;
import dev.multiverse.pipeline.Step;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a pipeline as display-sized source fragments, one per step.
 * Branched steps without explicit source are shown as a {@code branch(...)} block.
 */
public final class CodeRenderer {

    private CodeRenderer() {}

    public static List<String> render(Pipeline pipeline, BranchRegistry registry) {
        var fragments = new ArrayList<String>();
        for (Step step : pipeline.steps()) {
            fragments.add(renderStep(step, registry));
        }
        return fragments;
    }

    static String renderStep(Step step, BranchRegistry registry) {
        if (step.source() != null) {
            return step.source();
        }
        if (step instanceof Step.Branched branched) {
            Parameter parameter = registry.parameter(branched.parameter()).orElseThrow(() ->
                new ExportValidationException("code", null,
                    "step '%s' branches on undeclared parameter '%s'".formatted(step.label(), branched.parameter())));
            return renderBranch(parameter);
        }
        return "# " + step.label();
    }

    /**
     * {@code branch(P, "o1" ~ code1, "o2" ~ code2 %when% (A == a1))}
     */
    public static String renderBranch(Parameter parameter) {
        var sb = new StringBuilder();
        sb.append("branch(").append(parameter.name());
        for (Option option : parameter.options()) {
            sb.append(",\n  \"").append(option.name()).append("\" ~ ").append(option.code());
            if (option.isConditional()) {
                sb.append(" %when% (").append(option.condition().describe()).append(")");
            }
        }
        sb.append("\n)");
        return sb.toString();
    }
}
