package io.github.jakubt4.constellation.model;

/**
 * Classical Keplerian elements. Angles in degrees, normalized to [0, 360).
 *
 * @param semiMajorAxisKm  semi-major axis, larger than the Earth radius
 * @param eccentricity     in [0, 1); only circular orbits (0) are propagated
 * @param inclinationDeg   inclination i
 * @param raanDeg          right ascension of the ascending node
 * @param argPeriapsisDeg  argument of periapsis
 * @param meanAnomalyDeg   mean anomaly
 */
public record OrbitalElements(double semiMajorAxisKm,
                              double eccentricity,
                              double inclinationDeg,
                              double raanDeg,
                              double argPeriapsisDeg,
                              double meanAnomalyDeg) {

    public OrbitalElements withMeanAnomalyDeg(final double meanAnomalyDeg) {
        return new OrbitalElements(semiMajorAxisKm, eccentricity, inclinationDeg,
                raanDeg, argPeriapsisDeg, meanAnomalyDeg);
    }

    public boolean isCircular() {
        return eccentricity == 0.0;
    }
}
