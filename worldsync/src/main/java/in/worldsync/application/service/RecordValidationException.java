package in.worldsync.application.service;

/**
 * An ingestion record is missing required fields or carries an unusable value.
 */
public class RecordValidationException extends RuntimeException {

    private final String reason;

    public RecordValidationException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * Short machine-readable reason, used as a metrics label.
     */
    public String getReason() {
        return reason;
    }
}
