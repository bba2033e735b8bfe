package dev.multiverse.engine;

import dev.multiverse.model.Condition;

import java.util.Map;

/**
 * Resolves a condition against a (partial) choice assignment. Pure and deterministic.
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {}

    /**
     * Evaluate {@code condition} against {@code assignment} (parameter name to chosen option name).
     * A null condition is unconditionally true.
     *
     * @throws IllegalStateException if the condition references a parameter missing from the assignment
     */
    public static boolean evaluate(Condition condition, Map<String, String> assignment) {
        if (condition == null) {
            return true;
        }
        if (condition instanceof Condition.Equals eq) {
            String chosen = assignment.get(eq.parameter());
            if (chosen == null) {
                throw new IllegalStateException(
                    "Condition references parameter '%s' which has no choice yet in %s"
                        .formatted(eq.parameter(), assignment));
            }
            return chosen.equals(eq.option());
        } else if (condition instanceof Condition.All all) {
            for (Condition c : all.conditions()) {
                if (!evaluate(c, assignment)) {
                    return false;
                }
            }
            return true;
        } else if (condition instanceof Condition.Any any) {
            for (Condition c : any.conditions()) {
                if (evaluate(c, assignment)) {
                    return true;
                }
            }
            return false;
        } else if (condition instanceof Condition.Not not) {
            return !evaluate(not.condition(), assignment);
        }
        throw new IllegalStateException("Unknown condition: " + condition);
    }
}
