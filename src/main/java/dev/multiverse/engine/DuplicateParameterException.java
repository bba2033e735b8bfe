package dev.multiverse.engine;

public class DuplicateParameterException extends DeclarationException {

    private final String parameter;

    public DuplicateParameterException(String parameter) {
        super("Parameter '%s' is already declared".formatted(parameter));
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }
}
