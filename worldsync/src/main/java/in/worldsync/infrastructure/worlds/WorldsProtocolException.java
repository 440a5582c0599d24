package in.worldsync.infrastructure.worlds;

/**
 * The remote side answered, but with something we cannot use: unparsable JSON,
 * GraphQL errors without data, or an unexpected message shape.
 */
public class WorldsProtocolException extends WorldsApiException {

    public WorldsProtocolException(String operation, String message) {
        super(operation, message);
    }

    public WorldsProtocolException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }

    @Override
    public String failureType() {
        return "protocol";
    }
}
