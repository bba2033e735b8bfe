package dev.multiverse.engine;

import dev.multiverse.model.CdfSample;
import dev.multiverse.model.Distribution;
import dev.multiverse.model.NamedOutcome;
import dev.multiverse.model.ResultRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the outcomes a universe emitted into result records, keeping emission order.
 * A distribution reports its mean and standard deviation, or its median and a quartile-based
 * scale when it has no finite moments.
 */
public final class ResultAggregator {

    /** Upper quartile of the standard normal. */
    private static final double NORMAL_Q3 = 0.6744897501960817;

    private final DistributionSummarizer summarizer;

    public ResultAggregator(DistributionSummarizer summarizer) {
        this.summarizer = summarizer;
    }

    public List<ResultRecord> aggregate(List<NamedOutcome> outcomes) {
        var records = new ArrayList<ResultRecord>(outcomes.size());
        for (NamedOutcome outcome : outcomes) {
            records.add(toRecord(outcome));
        }
        return records;
    }

    public ResultRecord toRecord(NamedOutcome outcome) {
        if (outcome instanceof NamedOutcome.Parametric p) {
            CdfSample cdf = summarizer.summarize(p.term(), p.estimate(), p.stdError());
            return ResultRecord.of(p.term(), p.estimate(), p.stdError(), cdf, p.statistics());
        } else if (outcome instanceof NamedOutcome.Distributional d) {
            Distribution distribution = d.distribution();
            CdfSample cdf = summarizer.summarize(d.term(), distribution);
            double estimate = distribution.mean();
            double stdError = distribution.standardDeviation();
            if (!Double.isFinite(estimate) || !Double.isFinite(stdError)) {
                // no moments (e.g. Cauchy): median and the normal-equivalent interquartile scale
                estimate = distribution.quantile(0.5);
                stdError = (distribution.quantile(0.75) - distribution.quantile(0.25)) / (2 * NORMAL_Q3);
                if (!Double.isFinite(estimate) || !Double.isFinite(stdError)) {
                    throw new DistributionSummaryException(d.term(),
                        "distribution %s has neither finite moments nor finite quartiles".formatted(distribution));
                }
            }
            return ResultRecord.of(d.term(), estimate, stdError, cdf, d.statistics());
        }
        throw new IllegalStateException("Unknown outcome: " + outcome);
    }
}
