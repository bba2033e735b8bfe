package dev.multiverse.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a whole multiverse run, ordered by universe id.
 */
public record ExecutionSummary(List<ExecutionResult> results) {

    public ExecutionSummary {
        results = List.copyOf(results);
    }

    public List<ExecutionResult.Success> successes() {
        return results.stream()
            .filter(r -> r instanceof ExecutionResult.Success)
            .map(r -> (ExecutionResult.Success) r)
            .toList();
    }

    public List<ExecutionResult.Failure> failures() {
        return results.stream()
            .filter(r -> r instanceof ExecutionResult.Failure)
            .map(r -> (ExecutionResult.Failure) r)
            .toList();
    }

    public int total() {
        return results.size();
    }

    public int succeeded() {
        return successes().size();
    }

    public int failed() {
        return failures().size();
    }

    public int skipped() {
        return (int) results.stream().filter(r -> r instanceof ExecutionResult.Skipped).count();
    }

    /**
     * Failure descriptions keyed by universe id.
     */
    public Map<Integer, String> causes() {
        var causes = new LinkedHashMap<Integer, String>();
        failures().forEach(f -> causes.put(f.universe().id(), f.describe()));
        return causes;
    }

    public String describe() {
        return "%d universes: %d succeeded, %d failed, %d skipped"
            .formatted(total(), succeeded(), failed(), skipped());
    }
}
