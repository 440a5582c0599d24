package in.worldsync.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One page of raw record objects as returned by a single remote call.
 */
public record Page(List<JsonNode> nodes, PageInfo pageInfo) {

    public Page {
        nodes = List.copyOf(nodes);
        if (pageInfo == null) {
            pageInfo = PageInfo.last();
        }
    }

    public int size() {
        return nodes.size();
    }
}
