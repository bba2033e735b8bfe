package dev.multiverse.engine;

/**
 * An outcome could not be reduced to a well-formed CDF sample.
 */
public class DistributionSummaryException extends RuntimeException {

    private final String term;

    public DistributionSummaryException(String term, String message) {
        super("Cannot summarize term '%s': %s".formatted(term, message));
        this.term = term;
    }

    public DistributionSummaryException(String term, String message, Throwable cause) {
        super("Cannot summarize term '%s': %s".formatted(term, message), cause);
        this.term = term;
    }

    public String term() {
        return term;
    }
}
