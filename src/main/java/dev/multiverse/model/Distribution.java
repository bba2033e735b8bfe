package dev.multiverse.model;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.RealDistribution;

/**
 * A univariate outcome distribution. The summarizer only relies on the quantile and
 * cumulative-distribution functions; nothing here assumes normality.
 */
public interface Distribution {

    /** Inverse CDF at cumulative probability {@code p} in (0, 1). */
    double quantile(double p);

    /** Cumulative probability at {@code x}. */
    double cdf(double x);

    double mean();

    double standardDeviation();

    /**
     * Adapt any Commons Math distribution (t, gamma, beta, empirical, ...).
     */
    static Distribution of(RealDistribution distribution) {
        return new Distribution() {
            @Override
            public double quantile(double p) {
                return distribution.inverseCumulativeProbability(p);
            }

            @Override
            public double cdf(double x) {
                return distribution.cumulativeProbability(x);
            }

            @Override
            public double mean() {
                return distribution.getNumericalMean();
            }

            @Override
            public double standardDeviation() {
                return Math.sqrt(distribution.getNumericalVariance());
            }

            @Override
            public String toString() {
                return distribution.getClass().getSimpleName();
            }
        };
    }

    static Distribution normal(double mean, double standardDeviation) {
        return of(new NormalDistribution(null, mean, standardDeviation));
    }
}
