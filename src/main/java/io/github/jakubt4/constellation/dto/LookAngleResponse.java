package io.github.jakubt4.constellation.dto;

import io.github.jakubt4.constellation.model.TrackingEntry;

public record LookAngleResponse(String satellite,
                                int index,
                                double azimuthDeg,
                                double elevationDeg,
                                double rangeKm,
                                double declinationDeg,
                                boolean slewRequired,
                                boolean visible) {

    public static LookAngleResponse of(final TrackingEntry entry) {
        final var angles = entry.lookAngles();
        return new LookAngleResponse(
                entry.satelliteId().name(),
                entry.satelliteId().index(),
                angles.azimuthDeg(),
                angles.elevationDeg(),
                angles.rangeKm(),
                angles.declinationDeg(),
                angles.slew().required(),
                entry.visible());
    }
}
