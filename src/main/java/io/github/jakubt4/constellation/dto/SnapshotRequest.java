package io.github.jakubt4.constellation.dto;

import io.github.jakubt4.constellation.model.ConstellationConfig;
import io.github.jakubt4.constellation.model.NumericalFailurePolicy;

import java.util.List;

/**
 * Ad-hoc snapshot query. Every {@code null} field falls back to the configured default.
 *
 * @param timestamp ISO-8601 instant, e.g. {@code 2026-03-01T12:00:00Z}
 */
public record SnapshotRequest(ConstellationConfig constellation,
                              List<GroundStationRequest> groundStations,
                              String timestamp,
                              Double visibilityMaskDeg,
                              Double slewMaskDeg,
                              NumericalFailurePolicy onNumericalFailure) {
}
