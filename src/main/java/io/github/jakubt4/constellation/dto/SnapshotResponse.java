package io.github.jakubt4.constellation.dto;

import io.github.jakubt4.constellation.model.TrackingSnapshot;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a snapshot query.
 *
 * @param status   {@code "OK"}, {@code "REJECTED"} for invalid input or {@code "FAILED"} for an aborted computation
 * @param message  detail for non-OK outcomes
 * @param stations station name to look angles ordered by satellite index; {@code null} unless OK
 */
public record SnapshotResponse(String status,
                               String message,
                               Instant timestamp,
                               Double elapsedSeconds,
                               Map<String, List<LookAngleResponse>> stations,
                               List<FailureResponse> failures) {

    public static SnapshotResponse ok(final TrackingSnapshot snapshot) {
        final var stations = new LinkedHashMap<String, List<LookAngleResponse>>();
        snapshot.stations().forEach((name, entries) ->
                stations.put(name, entries.stream().map(LookAngleResponse::of).toList()));
        return new SnapshotResponse("OK", null, snapshot.timestamp(), snapshot.elapsedSeconds(), stations,
                snapshot.failures().stream().map(FailureResponse::of).toList());
    }

    public static SnapshotResponse rejected(final String message) {
        return new SnapshotResponse("REJECTED", message, null, null, null, null);
    }

    public static SnapshotResponse failed(final String message) {
        return new SnapshotResponse("FAILED", message, null, null, null, null);
    }
}
