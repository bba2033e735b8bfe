package dev.multiverse.engine;

import java.util.List;

public class PipelineValidationException extends DeclarationException {

    private final List<String> errors;

    public PipelineValidationException(List<String> errors) {
        super("Invalid pipeline:\n  - " + String.join("\n  - ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
