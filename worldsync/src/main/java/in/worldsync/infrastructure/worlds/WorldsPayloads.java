package in.worldsync.infrastructure.worlds;

import com.fasterxml.jackson.databind.JsonNode;
import in.worldsync.domain.model.Detection;
import in.worldsync.domain.model.DetectionActivityEvent;
import in.worldsync.domain.model.Device;
import in.worldsync.domain.model.Page;
import in.worldsync.domain.model.PageInfo;
import in.worldsync.domain.model.TrackRecord;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Decoding of Worlds API payloads into domain records.
 *
 * The API returns nested objects where almost every key is optional. Presence checks
 * live here and nowhere else: downstream code only sees known-shape records whose
 * absent values are null.
 */
public final class WorldsPayloads {

    /**
     * Decode a connection response ({@code data.<key>.edges[].node} plus
     * {@code data.<key>.pageInfo}) into a page.
     *
     * @throws WorldsProtocolException when the document carries errors without data,
     *                                 or has no connection under {@code data}
     */
    public static Page decodePage(String operation, JsonNode response) {
        if (response == null || !response.isObject()) {
            throw new WorldsProtocolException(operation, "Response is not a JSON object");
        }

        JsonNode data = response.get("data");
        JsonNode errors = response.get("errors");
        boolean hasErrors = errors != null && errors.isArray() && errors.size() > 0;

        if (data == null || !data.isObject() || data.size() == 0) {
            if (hasErrors) {
                throw new WorldsProtocolException(operation, "GraphQL errors: " + errors);
            }
            throw new WorldsProtocolException(operation, "Response has no data");
        }

        // Connection lives under the single top-level data key
        Iterator<JsonNode> values = data.elements();
        JsonNode connection = values.next();
        if (connection == null || !connection.isObject()) {
            throw new WorldsProtocolException(operation,
                hasErrors ? "GraphQL errors: " + errors : "Connection is missing from data");
        }

        List<JsonNode> nodes = new ArrayList<>();
        for (JsonNode edge : connection.path("edges")) {
            JsonNode node = edge.get("node");
            if (node != null && node.isObject()) {
                nodes.add(node);
            }
        }

        JsonNode pageInfo = connection.get("pageInfo");
        if (pageInfo == null || !pageInfo.isObject()) {
            return new Page(nodes, PageInfo.last());
        }
        return new Page(nodes, new PageInfo(
            pageInfo.path("hasNextPage").asBoolean(false),
            text(pageInfo, "endCursor")));
    }

    /**
     * Decode one node of a tracks page.
     */
    public static TrackRecord decodeTrack(JsonNode node) {
        List<Detection> detections = new ArrayList<>();
        for (JsonNode d : node.path("detections")) {
            List<String> zoneNames = new ArrayList<>();
            for (JsonNode zone : d.path("zones")) {
                String zoneName = text(zone, "name");
                if (zoneName != null && !zoneName.isEmpty()) {
                    zoneNames.add(zoneName);
                }
            }
            detections.add(new Detection(number(d.path("metadata"), "track_confidence"), zoneNames));
        }

        return new TrackRecord(
            text(node, "id"),
            text(node, "tag"),
            text(node, "startTime"),
            text(node, "endTime"),
            detections,
            text(node.path("video"), "thumbnailUrl"));
    }

    /**
     * Decode one subscription event ({@code {detectionActivity: {timestamp, track: {tag, dataSource}}}}).
     */
    public static DetectionActivityEvent decodeDetectionActivity(JsonNode data) {
        JsonNode activity = data == null ? null : data.path("detectionActivity");
        if (activity == null) {
            return new DetectionActivityEvent(null, null, null, null);
        }
        JsonNode track = activity.path("track");
        JsonNode dataSource = track.path("dataSource");
        return new DetectionActivityEvent(
            text(activity, "timestamp"),
            text(track, "tag"),
            text(dataSource, "id"),
            text(dataSource, "name"));
    }

    /**
     * Decode one node of a devices page, flattening its data source.
     */
    public static Device decodeDevice(JsonNode node) {
        JsonNode dataSource = node.path("dataSource");
        return new Device(
            text(node, "id"),
            text(node, "name"),
            text(node, "address"),
            text(dataSource, "id"),
            text(dataSource, "name"));
    }

    private static String text(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    private static Double number(JsonNode parent, String field) {
        JsonNode value = parent.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private WorldsPayloads() {}
}
