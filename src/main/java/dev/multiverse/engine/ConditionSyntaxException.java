package dev.multiverse.engine;

public class ConditionSyntaxException extends DeclarationException {

    private final int position;

    public ConditionSyntaxException(String expression, int position, String message) {
        super("%s at position %d in condition \"%s\"".formatted(message, position, expression));
        this.position = position;
    }

    public int position() {
        return position;
    }
}
