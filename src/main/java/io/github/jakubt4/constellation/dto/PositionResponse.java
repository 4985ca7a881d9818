package io.github.jakubt4.constellation.dto;

import io.github.jakubt4.constellation.model.SatellitePosition;

public record PositionResponse(String satellite,
                               int plane,
                               int slot,
                               double latDeg,
                               double lonDeg,
                               double altKm,
                               double raanDeg,
                               double meanAnomalyDeg) {

    public static PositionResponse of(final SatellitePosition position) {
        final var id = position.satelliteId();
        final var geo = position.geodetic();
        return new PositionResponse(id.name(), id.plane(), id.slot(),
                geo.latDeg(), geo.lonDeg(), geo.altKm(),
                position.elements().raanDeg(), position.elements().meanAnomalyDeg());
    }
}
