package dev.multiverse.engine;

import dev.multiverse.model.CdfGrid;
import dev.multiverse.model.CdfSample;
import dev.multiverse.model.Distribution;

import java.util.Objects;

/**
 * Reduces an outcome to a {@link CdfSample} over a fixed grid of cumulative-probability levels.
 *
 * <p>{@code cdf.y} holds the grid levels and {@code cdf.x} the distribution's quantiles at those
 * levels. The CDF is evaluated at each quantile only to check that it yields a probability;
 * inverse-CDF solvers are accurate in x, not in p, so narrow distributions miss the level itself.
 */
public final class DistributionSummarizer {

    private final CdfGrid grid;

    public DistributionSummarizer(CdfGrid grid) {
        this.grid = Objects.requireNonNull(grid, "grid must not be null");
    }

    public CdfGrid grid() {
        return grid;
    }

    /**
     * Summarize a point estimate and standard error, assuming a normal distribution.
     */
    public CdfSample summarize(String term, double estimate, double stdError) {
        if (!Double.isFinite(estimate)) {
            throw new DistributionSummaryException(term, "estimate is not finite: " + estimate);
        }
        if (!Double.isFinite(stdError) || stdError <= 0) {
            throw new DistributionSummaryException(term, "standard error must be positive and finite, got " + stdError);
        }
        return summarize(term, Distribution.normal(estimate, stdError));
    }

    /**
     * Summarize an explicit distribution through its quantile and CDF functions.
     */
    public CdfSample summarize(String term, Distribution distribution) {
        double[] levels = grid.levels();
        double[] x = new double[levels.length];

        for (int i = 0; i < levels.length; i++) {
            double q;
            double p;
            try {
                q = distribution.quantile(levels[i]);
                p = distribution.cdf(q);
            } catch (RuntimeException e) {
                throw new DistributionSummaryException(term,
                    "distribution %s failed at level %s: %s".formatted(distribution, levels[i], e.getMessage()), e);
            }
            if (!Double.isFinite(q)) {
                throw new DistributionSummaryException(term, "quantile at level %s is not finite".formatted(levels[i]));
            }
            if (i > 0 && q <= x[i - 1]) {
                throw new DistributionSummaryException(term,
                    "quantiles are not strictly increasing at level %s (%s after %s)".formatted(levels[i], q, x[i - 1]));
            }
            if (!(p >= 0 && p <= 1)) {
                throw new DistributionSummaryException(term, "cdf(%s) = %s is not a probability".formatted(q, p));
            }
            x[i] = q;
        }
        return new CdfSample(x, levels);
    }
}
