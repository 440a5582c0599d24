package in.worldsync.infrastructure.worlds;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.worldsync.application.port.output.WorldsGateway.SubscriptionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * GraphQL subscriptions over WebSocket ({@code graphql-transport-ws} sub-protocol).
 *
 * Protocol:
 *   client: connection_init {token pair}   server: connection_ack
 *   client: subscribe {query, variables}   server: next* then complete | error
 *   server: ping                           client: pong
 *   client: ping                           server: pong
 *
 * One WebSocket per subscription. The returned handle's termination future is the
 * only signal of the connection ending: normal on "complete" or a 1000 close,
 * exceptional on anything else, including a server that stays silent for longer
 * than the idle timeout.
 */
public final class WorldsSubscriptionClient {
    private static final Logger log = LoggerFactory.getLogger(WorldsSubscriptionClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SUBPROTOCOL = "graphql-transport-ws";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(30);
    static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(60);

    private final URI wsUri;
    private final String tokenId;
    private final String tokenValue;
    private final HttpClient httpClient;
    private final GraphqlDocuments documents;
    private final Duration pingInterval;
    private final Duration idleTimeout;
    private final AtomicLong idSequence = new AtomicLong(0);

    public WorldsSubscriptionClient(String wsUrl, String tokenId, String tokenValue,
                                    HttpClient httpClient, GraphqlDocuments documents) {
        this(wsUrl, tokenId, tokenValue, httpClient, documents, DEFAULT_PING_INTERVAL, DEFAULT_IDLE_TIMEOUT);
    }

    WorldsSubscriptionClient(String wsUrl, String tokenId, String tokenValue,
                             HttpClient httpClient, GraphqlDocuments documents,
                             Duration pingInterval, Duration idleTimeout) {
        this.wsUri = URI.create(wsUrl);
        this.tokenId = tokenId;
        this.tokenValue = tokenValue;
        this.httpClient = httpClient;
        this.documents = documents;
        this.pingInterval = pingInterval;
        this.idleTimeout = idleTimeout;
    }

    public SubscriptionHandle subscribe(String name, Map<String, Object> variables, Consumer<JsonNode> onEvent) {
        String query = documents.load(name);
        String subscriptionId = String.valueOf(idSequence.incrementAndGet());
        LiveSubscription subscription = new LiveSubscription(name, subscriptionId, query, variables, onEvent);

        log.info("[SUBSCRIPTION] Connecting {} (id={}) to {}", name, subscriptionId, wsUri);

        httpClient.newWebSocketBuilder()
            .subprotocols(SUBPROTOCOL)
            .connectTimeout(CONNECT_TIMEOUT)
            .buildAsync(wsUri, subscription)
            .whenComplete((ws, error) -> {
                if (error != null) {
                    subscription.fail(new WorldsConnectionException(name,
                        "Connect failed: " + error.getMessage(), error));
                } else if (subscription.termination.isDone()) {
                    // cancelled while the handshake was in flight
                    ws.abort();
                }
            });

        return subscription;
    }

    private final class LiveSubscription implements WebSocket.Listener, SubscriptionHandle {
        private final String name;
        private final String subscriptionId;
        private final String query;
        private final Map<String, Object> variables;
        private final Consumer<JsonNode> onEvent;

        private final CompletableFuture<Void> termination = new CompletableFuture<>();
        private final AtomicReference<WebSocket> wsRef = new AtomicReference<>();
        private final StringBuilder buf = new StringBuilder();
        private final SubscriptionHeartbeat heartbeat;
        private CompletableFuture<?> sendChain = CompletableFuture.completedFuture(null);

        LiveSubscription(String name, String subscriptionId, String query,
                         Map<String, Object> variables, Consumer<JsonNode> onEvent) {
            this.name = name;
            this.subscriptionId = subscriptionId;
            this.query = query;
            this.variables = variables == null ? Map.of() : variables;
            this.onEvent = onEvent;
            this.heartbeat = new SubscriptionHeartbeat(name + "-" + subscriptionId, pingInterval, idleTimeout,
                this::sendPing,
                silence -> fail(new WorldsConnectionException(name,
                    "No frames for " + silence.toMillis() + "ms", null)));
            termination.whenComplete((ignored, error) -> heartbeat.stop());
        }

        @Override
        public CompletableFuture<Void> termination() {
            return termination;
        }

        @Override
        public void cancel() {
            if (termination.complete(null)) {
                log.info("[SUBSCRIPTION] Cancelling {} (id={})", name, subscriptionId);
            }
            WebSocket ws = wsRef.getAndSet(null);
            if (ws != null) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "cancelled")
                    .exceptionally(e -> {
                        ws.abort();
                        return null;
                    });
            }
        }

        void fail(WorldsApiException error) {
            if (termination.completeExceptionally(error)) {
                log.warn("[SUBSCRIPTION] {} (id={}) failed: {}", name, subscriptionId, error.getMessage());
            }
            WebSocket ws = wsRef.getAndSet(null);
            if (ws != null) {
                ws.abort();
            }
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            wsRef.set(webSocket);
            ObjectNode init = MAPPER.createObjectNode();
            init.put("type", "connection_init");
            ObjectNode payload = init.putObject("payload");
            payload.put("x-token-id", tokenId);
            payload.put("x-token-value", tokenValue);
            send(webSocket, init);
            heartbeat.start();
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            heartbeat.recordFrame();
            buf.append(data);
            if (last) {
                String msg = buf.toString();
                buf.setLength(0);
                handleMessage(webSocket, msg);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            heartbeat.recordFrame();
            return WebSocket.Listener.super.onPing(webSocket, message);
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            heartbeat.recordFrame();
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            wsRef.set(null);
            if (statusCode == WebSocket.NORMAL_CLOSURE) {
                if (termination.complete(null)) {
                    log.info("[SUBSCRIPTION] {} (id={}) closed by server", name, subscriptionId);
                }
            } else {
                fail(new WorldsConnectionException(name,
                    "Closed with status " + statusCode + " " + reason, null));
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            wsRef.set(null);
            fail(new WorldsConnectionException(name, "WebSocket error: " + error.getMessage(), error));
        }

        private void handleMessage(WebSocket webSocket, String raw) {
            JsonNode msg;
            try {
                msg = MAPPER.readTree(raw);
            } catch (Exception e) {
                fail(new WorldsProtocolException(name, "Unparsable frame", e));
                return;
            }

            String type = msg.path("type").asText("");
            switch (type) {
                case "connection_ack" -> {
                    ObjectNode subscribe = MAPPER.createObjectNode();
                    subscribe.put("id", subscriptionId);
                    subscribe.put("type", "subscribe");
                    ObjectNode payload = subscribe.putObject("payload");
                    payload.put("query", query);
                    payload.set("variables", MAPPER.valueToTree(variables));
                    send(webSocket, subscribe);
                    log.info("[SUBSCRIPTION] {} (id={}) acknowledged, streaming", name, subscriptionId);
                }
                case "next" -> {
                    JsonNode data = msg.path("payload").path("data");
                    if (data.isMissingNode() || data.isNull()) {
                        log.warn("[SUBSCRIPTION] {} event without data: {}", name, msg.path("payload"));
                        return;
                    }
                    try {
                        onEvent.accept(data);
                    } catch (Exception e) {
                        log.error("[SUBSCRIPTION] Event handler failed for {}: {}", name, e.getMessage(), e);
                    }
                }
                case "error" -> fail(new WorldsProtocolException(name,
                    "Subscription error: " + msg.path("payload")));
                case "complete" -> {
                    if (termination.complete(null)) {
                        log.info("[SUBSCRIPTION] {} (id={}) completed by server", name, subscriptionId);
                    }
                    cancel();
                }
                case "ping" -> {
                    ObjectNode pong = MAPPER.createObjectNode();
                    pong.put("type", "pong");
                    send(webSocket, pong);
                }
                case "pong" -> { }
                default -> log.debug("[SUBSCRIPTION] Ignoring frame type '{}'", type);
            }
        }

        private void sendPing() {
            WebSocket ws = wsRef.get();
            if (ws == null) {
                return;
            }
            ObjectNode ping = MAPPER.createObjectNode();
            ping.put("type", "ping");
            send(ws, ping);
        }

        // WebSocket allows one outstanding send at a time
        private synchronized void send(WebSocket webSocket, ObjectNode message) {
            String text = message.toString();
            sendChain = sendChain
                .thenCompose(ignored -> webSocket.sendText(text, true))
                .exceptionally(e -> {
                    fail(new WorldsConnectionException(name, "Send failed: " + e.getMessage(), e));
                    return null;
                });
        }
    }
}
