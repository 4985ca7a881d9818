package io.github.jakubt4.constellation.model;

/**
 * Topocentric pointing from a ground station to a satellite.
 *
 * @param azimuthDeg     clockwise from true north, in [0, 360)
 * @param elevationDeg   above the local horizon, in [-90, 90]
 * @param rangeKm        slant range
 * @param declinationDeg angle from zenith, {@code 90 - elevationDeg}
 * @param slew           antenna steering decision
 */
public record LookAngles(double azimuthDeg,
                         double elevationDeg,
                         double rangeKm,
                         double declinationDeg,
                         Slew slew) {

    /**
     * @param azimuthRateDegPerSec   azimuth rate, currently always 0
     * @param elevationRateDegPerSec elevation rate, currently always 0
     * @param required               whether the elevation clears the slew mask
     */
    public record Slew(double azimuthRateDegPerSec, double elevationRateDegPerSec, boolean required) {}
}
