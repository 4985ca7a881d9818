package io.github.jakubt4.constellation.model;

/**
 * One satellite as seen from one station.
 *
 * @param visible whether the elevation clears the visibility mask
 */
public record TrackingEntry(SatelliteId satelliteId, LookAngles lookAngles, boolean visible) {
}
