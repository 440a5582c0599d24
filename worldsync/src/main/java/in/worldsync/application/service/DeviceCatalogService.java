package in.worldsync.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import in.worldsync.application.port.output.ActivityStore;
import in.worldsync.application.port.output.WorldsGateway;
import in.worldsync.domain.model.Device;
import in.worldsync.infrastructure.metrics.IngestMetrics;
import in.worldsync.infrastructure.persistence.PersistenceException;
import in.worldsync.infrastructure.worlds.WorldsApiException;
import in.worldsync.infrastructure.worlds.WorldsPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps the stored device list in step with the remote service.
 *
 * Devices are listed with an address filter and flattened with their data source.
 * An empty or failed listing leaves the stored list untouched.
 */
public final class DeviceCatalogService {
    private static final Logger log = LoggerFactory.getLogger(DeviceCatalogService.class);

    static final String DEVICES_QUERY = "devices";

    private final WorldsGateway gateway;
    private final ActivityStore store;
    private final IngestMetrics metrics;
    private final String addressFilter;
    private final int pageSize;
    private final int maxPages;

    public DeviceCatalogService(WorldsGateway gateway, ActivityStore store, IngestMetrics metrics,
                                String addressFilter, int pageSize, int maxPages) {
        this.gateway = gateway;
        this.store = store;
        this.metrics = metrics;
        this.addressFilter = addressFilter;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
    }

    /**
     * List devices and store them.
     *
     * @return the devices listed this time; empty when the listing failed
     */
    public List<Device> refresh() {
        List<Device> devices = new ArrayList<>();
        PageCursorTraversal traversal = new PageCursorTraversal(
            gateway, DEVICES_QUERY, filter(), pageSize, maxPages, metrics);
        try {
            while (traversal.hasNext()) {
                for (JsonNode node : traversal.next().nodes()) {
                    devices.add(WorldsPayloads.decodeDevice(node));
                }
            }
        } catch (WorldsApiException e) {
            log.error("[DEVICES] Listing failed after {} pages: {}", traversal.pagesFetched(), e.getMessage());
            return List.of();
        }

        if (devices.isEmpty()) {
            log.warn("[DEVICES] No devices matched '{}', keeping stored list", addressFilter);
            return List.of();
        }

        try {
            store.replaceDeviceList(devices);
            log.info("[DEVICES] Stored {} devices", devices.size());
        } catch (PersistenceException e) {
            metrics.recordPersistenceFailure(e.getOperation());
            log.error("[DEVICES] Failed to store device list: {}", e.getMessage());
        }
        return devices;
    }

    private Map<String, Object> filter() {
        if (addressFilter == null || addressFilter.isBlank()) {
            return Map.of();
        }
        return Map.of("address", Map.of("like", addressFilter));
    }
}
