package in.worldsync.domain.model;

/**
 * Why a page traversal stopped.
 */
public enum TraversalOutcome {
    /** The remote side reported no further page. */
    EXHAUSTED,
    /** A next page was reported without a cursor to request it. */
    END_CURSOR_MISSING,
    /** The remote side returned a cursor already seen in this traversal. */
    CYCLE_DETECTED,
    /** The configured page bound was reached. */
    PAGE_LIMIT_REACHED,
    /** A remote call failed; pages before it were consumed. */
    FETCH_FAILED;

    public boolean isComplete() {
        return this == EXHAUSTED;
    }
}
