package dev.multiverse.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * An ordered sequence of steps shared by every universe.
 */
public record Pipeline(List<Step> steps) {

    public Pipeline {
        steps = List.copyOf(steps);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Step> steps = new ArrayList<>();

        private Builder() {}

        public Builder step(Step step) {
            steps.add(step);
            return this;
        }

        public Builder fixed(String label, StepAction action) {
            return step(Step.fixed(label, action));
        }

        public Builder fixed(String label, String source, StepAction action) {
            return step(Step.fixed(label, source, action));
        }

        public Builder branched(String label, String parameter, Map<String, StepAction> variants) {
            return step(Step.branched(label, parameter, variants));
        }

        public Builder branched(String label, String parameter, String source, Map<String, StepAction> variants) {
            return step(Step.branched(label, parameter, source, variants));
        }

        public Pipeline build() {
            return new Pipeline(steps);
        }
    }
}
