package io.github.jakubt4.constellation.model;

/**
 * Propagated state of one satellite at a snapshot instant.
 */
public record SatellitePosition(SatelliteId satelliteId,
                                OrbitalElements elements,
                                CartesianCoordinates ecef,
                                GeodeticCoordinates geodetic) {
}
