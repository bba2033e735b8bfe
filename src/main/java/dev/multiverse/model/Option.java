package dev.multiverse.model;

import java.util.Objects;

/**
 * A named, selectable alternative for a parameter.
 */
public record Option(
    String name,
    Object value,     // nullable, what a branched step reads when this option is chosen
    String code,      // human-readable fragment shown in code.json
    Condition condition // nullable, unconditionally valid when absent
) {

    public Option {
        Objects.requireNonNull(name, "option name must not be null");
        if (code == null) {
            code = name;
        }
    }

    public static Option of(String name) {
        return new Option(name, null, name, null);
    }

    public static Option of(String name, Object value) {
        return new Option(name, value, name, null);
    }

    public Option withCode(String code) {
        return new Option(name, value, code, condition);
    }

    public Option when(Condition condition) {
        return new Option(name, value, code, condition);
    }

    public boolean isConditional() {
        return condition != null;
    }
}
