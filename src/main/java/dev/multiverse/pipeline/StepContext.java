package dev.multiverse.pipeline;

import dev.multiverse.model.Dataset;
import dev.multiverse.model.NamedOutcome;
import dev.multiverse.model.Option;
import dev.multiverse.model.Universe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable working state for one universe's pipeline run. Never shared between universes.
 *
 * <p>The working dataset starts as the shared input; steps derive a private dataset with
 * {@link #replaceDataset(Dataset)} rather than changing the shared one.
 */
public final class StepContext {
    private final Universe universe;
    private final Map<String, Option> chosen;
    private final Dataset input;
    private Dataset dataset;
    private final Map<String, Object> values;
    private final List<NamedOutcome> outcomes;
    private String currentStep;
    private int stepCount;

    public StepContext(Universe universe, Map<String, Option> chosen, Dataset input) {
        this.universe = Objects.requireNonNull(universe, "universe must not be null");
        this.chosen = Map.copyOf(chosen);
        this.input = Objects.requireNonNull(input, "input dataset must not be null");
        this.dataset = input;
        this.values = new HashMap<>();
        this.outcomes = new ArrayList<>();
        this.stepCount = 0;
    }

    public Universe universe() { return universe; }
    public Dataset input() { return input; }
    public Dataset dataset() { return dataset; }
    public String currentStep() { return currentStep; }
    public int stepCount() { return stepCount; }

    /** Chosen option name at {@code parameter}. */
    public String choice(String parameter) {
        return universe.choice(parameter);
    }

    public Option option(String parameter) {
        Option option = chosen.get(parameter);
        if (option == null) {
            throw new IllegalArgumentException("Unknown parameter: " + parameter);
        }
        return option;
    }

    /** The value attached to the chosen option at {@code parameter}, or null. */
    public Object optionValue(String parameter) {
        return option(parameter).value();
    }

    public void replaceDataset(Dataset dataset) {
        this.dataset = Objects.requireNonNull(dataset, "dataset must not be null");
    }

    public void put(String name, Object value) {
        values.put(name, value);
    }

    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalStateException(
                "No working value '%s' (set by an earlier step?) in universe %d".formatted(name, universe.id()));
        }
        return values.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        return type.cast(get(name));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public void emit(NamedOutcome outcome) {
        outcomes.add(Objects.requireNonNull(outcome, "outcome must not be null"));
    }

    public void emit(String term, double estimate, double stdError) {
        emit(new NamedOutcome.Parametric(term, estimate, stdError));
    }

    /** Outcomes in emission order. */
    public List<NamedOutcome> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    /**
     * Record entry into the next step.
     */
    public void enterStep(String label) {
        this.currentStep = label;
        this.stepCount++;
    }
}
