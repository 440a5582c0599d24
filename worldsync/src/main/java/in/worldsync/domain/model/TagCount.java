package in.worldsync.domain.model;

import java.util.Comparator;

/**
 * Occurrence count of one tag within a window.
 */
public record TagCount(String tag, int count) {

    /**
     * Count descending, then tag name ascending.
     */
    public static final Comparator<TagCount> BY_COUNT_DESC =
        Comparator.comparingInt(TagCount::count).reversed()
            .thenComparing(TagCount::tag);
}
