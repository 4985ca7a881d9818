package io.github.jakubt4.constellation.dto;

import io.github.jakubt4.constellation.exception.ConfigurationException;
import io.github.jakubt4.constellation.model.GroundStation;

/**
 * Ground station supplied in an ad-hoc snapshot request.
 */
public record GroundStationRequest(String name, Double latDeg, Double lonDeg, Double altKm) {

    /**
     * @throws ConfigurationException if a field is missing or out of range
     */
    public GroundStation toGroundStation() {
        if (latDeg == null || lonDeg == null) {
            throw new ConfigurationException(
                    "Ground station [" + name + "] requires latDeg and lonDeg");
        }
        return new GroundStation(name, latDeg, lonDeg, altKm == null ? 0.0 : altKm);
    }
}
