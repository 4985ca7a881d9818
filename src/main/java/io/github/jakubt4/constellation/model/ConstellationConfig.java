package io.github.jakubt4.constellation.model;

import io.github.jakubt4.constellation.exception.ConfigurationException;

/**
 * Walker Delta constellation definition.
 *
 * @param totalSatellites    number of satellites T, must equal {@code planes * satellitesPerPlane}
 * @param planes             number of equally spaced orbital planes P
 * @param satellitesPerPlane satellites per plane
 * @param altitudeKm         circular orbit altitude above the equatorial radius
 * @param inclinationDeg     orbit inclination shared by all planes
 * @param phasing            Walker phasing factor F
 */
public record ConstellationConfig(int totalSatellites,
                                  int planes,
                                  int satellitesPerPlane,
                                  double altitudeKm,
                                  double inclinationDeg,
                                  int phasing) {

    /**
     * Builds a configuration from Walker notation {@code i:T/P/F}.
     */
    public static ConstellationConfig walkerDelta(final int totalSatellites,
                                                  final int planes,
                                                  final int phasing,
                                                  final double altitudeKm,
                                                  final double inclinationDeg) {
        if (planes <= 0) {
            throw new ConfigurationException("Plane count must be positive, got " + planes);
        }
        if (totalSatellites % planes != 0) {
            throw new ConfigurationException(
                    "Total satellites " + totalSatellites + " not divisible by plane count " + planes);
        }
        return new ConstellationConfig(totalSatellites, planes, totalSatellites / planes,
                altitudeKm, inclinationDeg, phasing).validate();
    }

    /**
     * Checks every structural invariant.
     *
     * @return this configuration, for chaining
     * @throws ConfigurationException on the first violated invariant
     */
    public ConstellationConfig validate() {
        if (planes <= 0) {
            throw new ConfigurationException("Plane count must be positive, got " + planes);
        }
        if (satellitesPerPlane <= 0) {
            throw new ConfigurationException("Satellites per plane must be positive, got " + satellitesPerPlane);
        }
        if (!(altitudeKm > 0) || Double.isInfinite(altitudeKm)) {
            throw new ConfigurationException("Altitude must be positive and finite, got " + altitudeKm + " km");
        }
        if (!Double.isFinite(inclinationDeg)) {
            throw new ConfigurationException("Inclination must be finite, got " + inclinationDeg);
        }
        if (totalSatellites <= 0) {
            throw new ConfigurationException("Total satellites must be positive, got " + totalSatellites);
        }
        if (totalSatellites != (long) planes * satellitesPerPlane) {
            throw new ConfigurationException("Total satellites " + totalSatellites
                    + " does not match " + planes + " planes x " + satellitesPerPlane + " per plane");
        }
        return this;
    }
}
