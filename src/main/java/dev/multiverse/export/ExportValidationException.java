package dev.multiverse.export;

/**
 * Export input is malformed; nothing was written for this export call.
 */
public class ExportValidationException extends RuntimeException {

    private final String field;
    private final Integer universeId;

    public ExportValidationException(String field, Integer universeId, String message) {
        super(universeId == null
            ? "Field '%s': %s".formatted(field, message)
            : "Universe %d, field '%s': %s".formatted(universeId, field, message));
        this.field = field;
        this.universeId = universeId;
    }

    public String field() {
        return field;
    }

    /** Offending universe, or null when the export is not per-universe. */
    public Integer universeId() {
        return universeId;
    }
}
