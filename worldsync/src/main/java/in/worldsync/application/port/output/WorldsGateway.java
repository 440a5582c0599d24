package in.worldsync.application.port.output;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Remote query and subscription interface of the Worlds data service.
 */
public interface WorldsGateway {

    /**
     * Execute a named query.
     *
     * @param name      query document name (e.g. "tracks")
     * @param variables request variables; serialized as JSON
     * @return the full response document ({@code data}, optional {@code errors})
     * @throws in.worldsync.infrastructure.worlds.WorldsConnectionException on transport failure
     * @throws in.worldsync.infrastructure.worlds.WorldsProtocolException on a malformed response
     */
    JsonNode query(String name, Map<String, Object> variables);

    /**
     * Open a subscription. Events are delivered one decoded {@code data} object per
     * callback, on the transport's thread, until the connection ends.
     *
     * @return a handle whose termination future completes normally on a graceful end
     *         and exceptionally on any error
     */
    SubscriptionHandle subscribe(String name, Map<String, Object> variables, Consumer<JsonNode> onEvent);

    /**
     * A live subscription.
     */
    interface SubscriptionHandle {

        CompletableFuture<Void> termination();

        /**
         * Close the connection. Idempotent.
         */
        void cancel();
    }
}
