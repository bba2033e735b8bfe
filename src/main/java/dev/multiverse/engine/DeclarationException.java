package dev.multiverse.engine;

/**
 * A parameter, option or condition declaration is invalid. Always fatal for the run.
 */
public class DeclarationException extends RuntimeException {

    public DeclarationException(String message) {
        super(message);
    }

    public DeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
