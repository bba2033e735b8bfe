package dev.multiverse.model;

import java.time.Duration;
import java.util.List;

/**
 * Result of running one universe's pipeline: its records, a captured failure, or never started.
 */
public sealed interface ExecutionResult {

    Universe universe();

    record Success(Universe universe, List<ResultRecord> records, Duration elapsed) implements ExecutionResult {
        public Success {
            records = List.copyOf(records);
        }
    }

    /**
     * The pipeline halted at {@code failedStep}. {@code cause} is null for timeouts.
     */
    record Failure(
        Universe universe,
        String failedStep,
        String errorType,
        String message,
        Throwable cause,
        Duration elapsed
    ) implements ExecutionResult {

        public static final String TIMEOUT = "timeout";

        public String describe() {
            String where = failedStep == null ? "" : " at step '" + failedStep + "'";
            return errorType + where + ": " + message;
        }
    }

    /** Not scheduled because the run was cancelled first. */
    record Skipped(Universe universe, String reason) implements ExecutionResult {}

    default boolean succeeded() {
        return this instanceof Success;
    }
}
