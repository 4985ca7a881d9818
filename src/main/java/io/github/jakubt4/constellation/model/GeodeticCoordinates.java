package io.github.jakubt4.constellation.model;

/**
 * WGS-84 geodetic position.
 *
 * @param latDeg latitude in [-90, 90]
 * @param lonDeg longitude in (-180, 180]
 * @param altKm  height above the ellipsoid
 */
public record GeodeticCoordinates(double latDeg, double lonDeg, double altKm) {
}
