package in.worldsync.domain.model;

/**
 * Pagination metadata returned alongside one page of a connection.
 *
 * @param hasNext   whether the remote side reports another page
 * @param endCursor opaque token for the next request, null when absent
 */
public record PageInfo(boolean hasNext, String endCursor) {

    public static PageInfo last() {
        return new PageInfo(false, null);
    }
}
