package in.worldsync.infrastructure.worlds;

/**
 * Transport failure: I/O error, timeout, non-2xx status or a dropped WebSocket.
 */
public class WorldsConnectionException extends WorldsApiException {

    private final int statusCode;

    public WorldsConnectionException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
        this.statusCode = -1;
    }

    public WorldsConnectionException(String operation, int statusCode, String message) {
        super(operation, "HTTP " + statusCode + ": " + message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status, or -1 when the failure happened below HTTP.
     */
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public String failureType() {
        return "transport";
    }
}
