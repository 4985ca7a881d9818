package io.github.jakubt4.constellation.dto;

import io.github.jakubt4.constellation.model.SatellitePosition;

import java.time.Instant;
import java.util.List;

/**
 * @param status {@code "OK"}, {@code "REJECTED"} or {@code "FAILED"}, as for {@link SnapshotResponse}
 */
public record PositionsResponse(String status, String message, Instant timestamp, List<PositionResponse> satellites) {

    public static PositionsResponse ok(final Instant timestamp, final List<SatellitePosition> positions) {
        return new PositionsResponse("OK", null, timestamp, positions.stream().map(PositionResponse::of).toList());
    }

    public static PositionsResponse rejected(final String message) {
        return new PositionsResponse("REJECTED", message, null, null);
    }

    public static PositionsResponse failed(final String message) {
        return new PositionsResponse("FAILED", message, null, null);
    }
}
