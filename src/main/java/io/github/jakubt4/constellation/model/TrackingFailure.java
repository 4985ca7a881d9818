package io.github.jakubt4.constellation.model;

/**
 * A satellite, or satellite/station pair, left out of a snapshot after a numerical failure.
 *
 * @param stationName {@code null} when every station lost the satellite
 */
public record TrackingFailure(SatelliteId satelliteId, String stationName, String message) {
}
