package io.github.jakubt4.constellation.service.orbit;

import io.github.jakubt4.constellation.model.ConstellationConfig;
import io.github.jakubt4.constellation.model.OrbitalElements;
import org.springframework.stereotype.Component;

/**
 * Maps a (plane, slot) position of a Walker Delta pattern to its epoch elements.
 *
 * <pre>
 *   a = R_earth + altitude
 *   Ω = plane · 360 / P                              (mod 360)
 *   M = slot · 360 / S + plane · F · 360 / T         (mod 360)
 *   e = 0, ω = 0, i = config inclination
 * </pre>
 */
@Component
public class ElementsGenerator {

    /**
     * @throws io.github.jakubt4.constellation.exception.ConfigurationException if the configuration is invalid
     * @throws IllegalArgumentException if plane or slot lies outside the configuration
     */
    public OrbitalElements generate(final int plane, final int slot, final ConstellationConfig config) {
        config.validate();
        if (plane < 0 || plane >= config.planes()) {
            throw new IllegalArgumentException("Plane " + plane + " outside [0, " + config.planes() + ")");
        }
        if (slot < 0 || slot >= config.satellitesPerPlane()) {
            throw new IllegalArgumentException("Slot " + slot + " outside [0, " + config.satellitesPerPlane() + ")");
        }

        final var semiMajorAxisKm = Wgs84.EQUATORIAL_RADIUS_KM + config.altitudeKm();
        final var raanDeg = Angles.normalizeDegrees(plane * 360.0 / config.planes());
        final var meanAnomalyDeg = Angles.normalizeDegrees(
                slot * 360.0 / config.satellitesPerPlane()
                        + (double) plane * config.phasing() * 360.0 / config.totalSatellites());

        return new OrbitalElements(semiMajorAxisKm, 0.0, config.inclinationDeg(),
                raanDeg, 0.0, meanAnomalyDeg);
    }
}
