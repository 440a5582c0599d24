package in.worldsync.domain.model;

/**
 * Device as listed by the remote service, flattened with its data source.
 */
public record Device(
    String id,
    String name,
    String address,
    String dataSourceId,
    String dataSourceName
) {}
