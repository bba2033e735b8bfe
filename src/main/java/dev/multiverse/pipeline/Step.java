package dev.multiverse.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single pipeline step. Exactly one of two forms: fixed, or branched on one parameter.
 */
public sealed interface Step {

    String label();

    /** Display source for code.json, nullable. */
    String source();

    /** Runs identically in every universe. */
    record Fixed(String label, String source, StepAction action) implements Step {
        public Fixed {
            Objects.requireNonNull(action, "action must not be null");
        }
    }

    /** Runs the variant registered for the option the universe chose at {@code parameter}. */
    record Branched(String label, String parameter, String source, Map<String, StepAction> variants) implements Step {
        public Branched {
            Objects.requireNonNull(parameter, "parameter must not be null");
            variants = Collections.unmodifiableMap(new LinkedHashMap<>(variants));
        }
    }

    static Step fixed(String label, StepAction action) {
        return new Fixed(label, null, action);
    }

    static Step fixed(String label, String source, StepAction action) {
        return new Fixed(label, source, action);
    }

    static Step branched(String label, String parameter, Map<String, StepAction> variants) {
        return new Branched(label, parameter, null, variants);
    }

    static Step branched(String label, String parameter, String source, Map<String, StepAction> variants) {
        return new Branched(label, parameter, source, variants);
    }
}
