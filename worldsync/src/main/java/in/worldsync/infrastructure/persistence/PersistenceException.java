package in.worldsync.infrastructure.persistence;

/**
 * A datastore write or read failed.
 */
public class PersistenceException extends RuntimeException {

    private final String operation;

    public PersistenceException(String operation, Throwable cause) {
        super("Failed to " + operation + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
