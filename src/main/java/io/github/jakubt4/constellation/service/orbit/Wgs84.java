package io.github.jakubt4.constellation.service.orbit;

import org.orekit.utils.Constants;

/**
 * WGS-84 constants in kilometre units, derived from Orekit's SI values.
 */
public final class Wgs84 {

    /** Equatorial radius a, 6378.137 km. */
    public static final double EQUATORIAL_RADIUS_KM = Constants.WGS84_EARTH_EQUATORIAL_RADIUS / 1000.0;

    /** Flattening f = 1 / 298.257223563. */
    public static final double FLATTENING = Constants.WGS84_EARTH_FLATTENING;

    /** First eccentricity squared, e² = 2f - f². */
    public static final double ECCENTRICITY_SQUARED = 2 * FLATTENING - FLATTENING * FLATTENING;

    /** Gravitational parameter μ, 398600.4418 km³/s². */
    public static final double MU_KM3_PER_S2 = Constants.WGS84_EARTH_MU / 1.0e9;

    private Wgs84() {
    }
}
