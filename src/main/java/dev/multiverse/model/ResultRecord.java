package dev.multiverse.model;

import java.util.Arrays;
import java.util.List;

/**
 * One exported outcome term of one universe. Optional statistics may be null.
 */
public record ResultRecord(
    String term,
    Double estimate,
    Double stdError,
    List<Double> cdfX,
    List<Double> cdfY,
    Double statistic,
    Double pValue,
    Double confLow,
    Double confHigh
) {

    public ResultRecord {
        cdfX = cdfX == null ? null : List.copyOf(cdfX);
        cdfY = cdfY == null ? null : List.copyOf(cdfY);
    }

    public static ResultRecord of(String term, double estimate, double stdError, CdfSample cdf,
                                  NamedOutcome.Statistics statistics) {
        return new ResultRecord(
            term, estimate, stdError,
            Arrays.stream(cdf.x()).boxed().toList(),
            Arrays.stream(cdf.y()).boxed().toList(),
            statistics.statistic(), statistics.pValue(), statistics.confLow(), statistics.confHigh()
        );
    }
}
