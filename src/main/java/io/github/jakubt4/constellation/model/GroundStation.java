package io.github.jakubt4.constellation.model;

import io.github.jakubt4.constellation.exception.ConfigurationException;

/**
 * Fixed tracking site on the ellipsoid.
 *
 * @param name   unique station name, used as the snapshot key
 * @param latDeg geodetic latitude in [-90, 90]
 * @param lonDeg longitude in [-180, 180]
 * @param altKm  height above the ellipsoid
 */
public record GroundStation(String name, double latDeg, double lonDeg, double altKm) {

    public GroundStation {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Ground station name is required");
        }
        if (!(latDeg >= -90.0 && latDeg <= 90.0)) {
            throw new ConfigurationException("Ground station [" + name + "] latitude out of range: " + latDeg);
        }
        if (!(lonDeg >= -180.0 && lonDeg <= 180.0)) {
            throw new ConfigurationException("Ground station [" + name + "] longitude out of range: " + lonDeg);
        }
        if (!Double.isFinite(altKm)) {
            throw new ConfigurationException("Ground station [" + name + "] altitude must be finite");
        }
    }

    public GeodeticCoordinates position() {
        return new GeodeticCoordinates(latDeg, lonDeg, altKm);
    }
}
