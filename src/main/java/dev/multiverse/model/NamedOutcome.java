package dev.multiverse.model;

import java.util.Objects;

/**
 * The value a pipeline step emits when its output is to be exported as a result:
 * a term name plus either an estimate with standard error, or an explicit distribution.
 */
public sealed interface NamedOutcome {

    String term();

    Statistics statistics();

    /** Point estimate and standard error, summarized under a normal assumption. */
    record Parametric(String term, double estimate, double stdError, Statistics statistics) implements NamedOutcome {
        public Parametric {
            Objects.requireNonNull(term, "term must not be null");
            if (statistics == null) {
                statistics = Statistics.NONE;
            }
        }

        public Parametric(String term, double estimate, double stdError) {
            this(term, estimate, stdError, Statistics.NONE);
        }
    }

    /** An explicit distribution; no parametric form is assumed. */
    record Distributional(String term, Distribution distribution, Statistics statistics) implements NamedOutcome {
        public Distributional {
            Objects.requireNonNull(term, "term must not be null");
            Objects.requireNonNull(distribution, "distribution must not be null");
            if (statistics == null) {
                statistics = Statistics.NONE;
            }
        }

        public Distributional(String term, Distribution distribution) {
            this(term, distribution, Statistics.NONE);
        }
    }

    /**
     * Optional test statistics carried through to results.json. Any field may be null.
     */
    record Statistics(Double statistic, Double pValue, Double confLow, Double confHigh) {
        public static final Statistics NONE = new Statistics(null, null, null, null);
    }
}
