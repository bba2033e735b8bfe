package dev.multiverse.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A validity predicate over options chosen at earlier-declared parameters.
 * Exactly one of four forms: equality test, conjunction, disjunction, or negation.
 */
public sealed interface Condition {

    /** The chosen option of {@code parameter} must be {@code option}. */
    record Equals(String parameter, String option) implements Condition {}

    /** Every nested condition must hold. Empty is true. */
    record All(List<Condition> conditions) implements Condition {
        public All {
            conditions = List.copyOf(conditions);
        }
    }

    /** At least one nested condition must hold. Empty is false. */
    record Any(List<Condition> conditions) implements Condition {
        public Any {
            conditions = List.copyOf(conditions);
        }
    }

    record Not(Condition condition) implements Condition {}

    static Condition equalTo(String parameter, String option) {
        return new Equals(parameter, option);
    }

    static Condition all(Condition... conditions) {
        return new All(List.of(conditions));
    }

    static Condition any(Condition... conditions) {
        return new Any(List.of(conditions));
    }

    static Condition not(Condition condition) {
        return new Not(condition);
    }

    /**
     * Every equality test in this condition, in left-to-right order.
     */
    default List<Equals> tests() {
        if (this instanceof Equals eq) {
            return List.of(eq);
        } else if (this instanceof All all) {
            return all.conditions().stream().flatMap(c -> c.tests().stream()).toList();
        } else if (this instanceof Any any) {
            return any.conditions().stream().flatMap(c -> c.tests().stream()).toList();
        } else if (this instanceof Not not) {
            return not.condition().tests();
        }
        throw new IllegalStateException("Unknown condition: " + this);
    }

    default Set<String> referencedParameters() {
        return tests().stream().map(Equals::parameter).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Render in the textual form accepted by the condition parser.
     */
    default String describe() {
        if (this instanceof Equals eq) {
            return quote(eq.parameter()) + " == " + quote(eq.option());
        } else if (this instanceof All all) {
            return all.conditions().isEmpty() ? "true" : all.conditions().stream()
                .map(c -> c instanceof Any ? "(" + c.describe() + ")" : c.describe())
                .collect(Collectors.joining(" && "));
        } else if (this instanceof Any any) {
            return any.conditions().isEmpty() ? "false" : any.conditions().stream()
                .map(Condition::describe)
                .collect(Collectors.joining(" || "));
        } else if (this instanceof Not not) {
            return "!(" + not.condition().describe() + ")";
        }
        throw new IllegalStateException("Unknown condition: " + this);
    }

    /** Characters a name may use without quotes in the textual form. */
    static boolean isBareNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-';
    }

    private static String quote(String name) {
        boolean bare = !name.isEmpty();
        for (int i = 0; bare && i < name.length(); i++) {
            bare = isBareNameChar(name.charAt(i));
        }
        return bare ? name : '"' + name + '"';
    }
}
