package dev.multiverse.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One fully-resolved combination of parameter choices.
 * The assignment maps every declared parameter, in declaration order, to its chosen option name.
 */
public record Universe(
    int id,
    Map<String, String> assignment
) {

    /** Column that carries the universe id in exported tables; not usable as a parameter name. */
    public static final String ID_FIELD = ".universe";

    public Universe {
        if (id < 1) {
            throw new IllegalArgumentException("Universe id must be 1-based, got " + id);
        }
        assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    public String choice(String parameter) {
        String option = assignment.get(parameter);
        if (option == null) {
            throw new IllegalArgumentException(
                "Universe %d has no choice for parameter '%s'".formatted(id, parameter));
        }
        return option;
    }

    /** Short form used in logs and listings, e.g. {@code A=a1, B=b2}. */
    public String label() {
        if (assignment.isEmpty()) {
            return "(no parameters)";
        }
        return assignment.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
    }
}
