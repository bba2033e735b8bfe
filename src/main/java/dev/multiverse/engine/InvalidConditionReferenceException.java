package dev.multiverse.engine;

/**
 * A condition references a parameter that is not declared before the option carrying it,
 * or an option that parameter does not have.
 */
public class InvalidConditionReferenceException extends DeclarationException {

    private final String parameter;
    private final String option;
    private final String reference;

    public InvalidConditionReferenceException(String parameter, String option, String reference, String reason) {
        super("Condition on option '%s' of parameter '%s' references '%s': %s"
            .formatted(option, parameter, reference, reason));
        this.parameter = parameter;
        this.option = option;
        this.reference = reference;
    }

    public String parameter() {
        return parameter;
    }

    public String option() {
        return option;
    }

    public String reference() {
        return reference;
    }
}
