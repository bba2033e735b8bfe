package dev.multiverse.engine;

public class DuplicateOptionException extends DeclarationException {

    private final String parameter;
    private final String option;

    public DuplicateOptionException(String parameter, String option) {
        super("Parameter '%s' declares option '%s' more than once".formatted(parameter, option));
        this.parameter = parameter;
        this.option = option;
    }

    public String parameter() {
        return parameter;
    }

    public String option() {
        return option;
    }
}
