package io.github.jakubt4.constellation.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Look angles from every station to every satellite at one instant.
 *
 * @param timestamp      snapshot instant
 * @param elapsedSeconds seconds since the tracker epoch
 * @param stations       station name to entries ordered by satellite index; stations keep input order
 * @param failures       entries left out under {@link NumericalFailurePolicy#EXCLUDE}
 */
public record TrackingSnapshot(Instant timestamp,
                               double elapsedSeconds,
                               Map<String, List<TrackingEntry>> stations,
                               List<TrackingFailure> failures) {

    public List<TrackingEntry> entriesFor(final String stationName) {
        return stations.getOrDefault(stationName, List.of());
    }
}
