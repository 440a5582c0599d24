package in.worldsync.domain.model;

import java.util.List;

/**
 * A single detection nested inside a track.
 *
 * @param confidence per-detection track confidence, null when the detection carries none
 * @param zoneNames  names of the zones the detection fell in
 */
public record Detection(Double confidence, List<String> zoneNames) {

    public Detection {
        zoneNames = zoneNames == null ? List.of() : List.copyOf(zoneNames);
    }
}
