package in.worldsync.infrastructure.worlds;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.worldsync.application.port.output.WorldsGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Worlds API client.
 *
 * Queries are POSTed as GraphQL documents over HTTP; subscriptions are delegated to
 * {@link WorldsSubscriptionClient}. Both carry the token pair the service expects:
 * {@code x-token-id} and {@code x-token-value}.
 */
public final class WorldsApiClient implements WorldsGateway {
    private static final Logger log = LoggerFactory.getLogger(WorldsApiClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);
    private static final int MAX_ERROR_BODY = 500;

    private final URI apiUri;
    private final String tokenId;
    private final String tokenValue;
    private final HttpClient httpClient;
    private final GraphqlDocuments documents;
    private final WorldsSubscriptionClient subscriptions;

    public WorldsApiClient(String apiUrl, String wsUrl, String tokenId, String tokenValue) {
        this(apiUrl, wsUrl, tokenId, tokenValue,
            HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(),
            new GraphqlDocuments());
    }

    public WorldsApiClient(String apiUrl, String wsUrl, String tokenId, String tokenValue,
                           HttpClient httpClient, GraphqlDocuments documents) {
        this.apiUri = apiUrl == null ? null : URI.create(apiUrl);
        this.tokenId = tokenId;
        this.tokenValue = tokenValue;
        this.httpClient = httpClient;
        this.documents = documents;
        this.subscriptions = wsUrl == null ? null
            : new WorldsSubscriptionClient(wsUrl, tokenId, tokenValue, httpClient, documents);

        log.info("[WORLDS] Client created (api: {}, ws: {})", apiUrl, wsUrl);
    }

    @Override
    public JsonNode query(String name, Map<String, Object> variables) {
        if (apiUri == null) {
            throw new IllegalStateException("Query API URL is not configured");
        }

        String body;
        try {
            ObjectNode payload = MAPPER.createObjectNode();
            payload.put("query", documents.load(name));
            if (variables != null && !variables.isEmpty()) {
                payload.set("variables", MAPPER.valueToTree(variables));
            }
            body = MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new WorldsProtocolException(name, "Failed to encode request variables", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(apiUri)
            .timeout(REQUEST_TIMEOUT)
            .header("x-token-id", tokenId)
            .header("x-token-value", tokenValue)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response;
        long startTime = System.currentTimeMillis();
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WorldsConnectionException(name, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorldsConnectionException(name, "Interrupted while waiting for response", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new WorldsConnectionException(name, status, truncate(response.body()));
        }

        log.debug("[WORLDS] {} answered in {}ms ({} bytes)",
            name, System.currentTimeMillis() - startTime, response.body().length());

        try {
            return MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new WorldsProtocolException(name, "Response is not valid JSON", e);
        }
    }

    @Override
    public SubscriptionHandle subscribe(String name, Map<String, Object> variables, Consumer<JsonNode> onEvent) {
        if (subscriptions == null) {
            throw new IllegalStateException("Subscription WebSocket URL is not configured");
        }
        return subscriptions.subscribe(name, variables, onEvent);
    }

    private static String truncate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
