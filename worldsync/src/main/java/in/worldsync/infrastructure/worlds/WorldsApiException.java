package in.worldsync.infrastructure.worlds;

/**
 * A call to the Worlds data service failed.
 */
public class WorldsApiException extends RuntimeException {

    private final String operation;

    public WorldsApiException(String operation, String message) {
        super(String.format("[%s] %s", operation, message));
        this.operation = operation;
    }

    public WorldsApiException(String operation, String message, Throwable cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    /**
     * Query or subscription name the failure belongs to.
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Short label for metrics.
     */
    public String failureType() {
        return "unknown";
    }
}
