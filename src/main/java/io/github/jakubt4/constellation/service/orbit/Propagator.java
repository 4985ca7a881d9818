package io.github.jakubt4.constellation.service.orbit;

import io.github.jakubt4.constellation.model.OrbitalElements;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

/**
 * Two-body mean-motion propagation for circular orbits.
 *
 * <p>Only the mean anomaly advances; it is later used directly as the true
 * anomaly, which holds for e = 0 alone. Eccentric orbits would need a Kepler
 * equation solver (Newton-Raphson on M = E - e·sin E) and are rejected.
 * No drag, J2 or third-body terms.
 */
@Component
public class Propagator {

    /**
     * Kepler's third law, T = 2π·√(a³ / μ).
     */
    public double periodSeconds(final OrbitalElements elements) {
        final var a = elements.semiMajorAxisKm();
        return 2 * FastMath.PI * FastMath.sqrt(a * a * a / Wgs84.MU_KM3_PER_S2);
    }

    /**
     * Advances the mean anomaly by {@code elapsedSeconds}, which may be negative.
     *
     * @return new elements; the input is left untouched
     * @throws IllegalArgumentException for non-circular orbits
     */
    public OrbitalElements propagate(final OrbitalElements elements, final double elapsedSeconds) {
        if (!elements.isCircular()) {
            throw new IllegalArgumentException(
                    "Only circular orbits are supported, eccentricity=" + elements.eccentricity());
        }
        final var meanMotionDegPerSec = 360.0 / periodSeconds(elements);
        final var meanAnomalyDeg = Angles.normalizeDegrees(
                elements.meanAnomalyDeg() + meanMotionDegPerSec * elapsedSeconds);
        return elements.withMeanAnomalyDeg(meanAnomalyDeg);
    }
}
