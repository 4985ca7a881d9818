package io.github.jakubt4.constellation.controller;

import io.github.jakubt4.constellation.config.TrackingProperties;
import io.github.jakubt4.constellation.dto.GroundStationRequest;
import io.github.jakubt4.constellation.dto.PositionsResponse;
import io.github.jakubt4.constellation.dto.SnapshotRequest;
import io.github.jakubt4.constellation.dto.SnapshotResponse;
import io.github.jakubt4.constellation.exception.ConfigurationException;
import io.github.jakubt4.constellation.exception.NumericalException;
import io.github.jakubt4.constellation.model.ConstellationConfig;
import io.github.jakubt4.constellation.model.TrackingPolicy;
import io.github.jakubt4.constellation.service.ConstellationTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * REST endpoints exposing constellation positions and ground-station look angles.
 *
 * <p>{@code GET} queries use the configured constellation, stations and masks;
 * {@code POST /api/tracking/snapshot} overrides any of them per request. A missing
 * timestamp resolves to the current instant of the injected {@link Clock}.
 */
@Slf4j
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
public class TrackingController {

    private final ConstellationTracker constellationTracker;
    private final TrackingProperties trackingProperties;
    private final Clock clock;

    /**
     * Snapshot of the configured constellation for every configured station.
     *
     * @param timestamp optional ISO-8601 instant
     * @return {@code 200 OK} with look angles, {@code 400 Bad Request} for an invalid timestamp or
     *         configuration, {@code 422 Unprocessable Entity} when a numerical failure aborts the snapshot
     */
    @GetMapping("/snapshot")
    public ResponseEntity<SnapshotResponse> snapshot(@RequestParam(required = false) final String timestamp) {
        return snapshot(new SnapshotRequest(null, null, timestamp, null, null, null));
    }

    /**
     * Snapshot for a request-supplied constellation, station list, timestamp and masks.
     */
    @PostMapping("/snapshot")
    public ResponseEntity<SnapshotResponse> snapshot(@RequestBody final SnapshotRequest request) {
        try {
            final var instant = resolveTimestamp(request.timestamp());
            final var config = resolveConstellation(request.constellation());
            final var stations = request.groundStations() == null
                    ? trackingProperties.groundStations()
                    : request.groundStations().stream().map(GroundStationRequest::toGroundStation).toList();
            final var defaults = trackingProperties.defaultPolicy();
            final var policy = new TrackingPolicy(
                    request.visibilityMaskDeg() == null ? defaults.visibilityMaskDeg() : request.visibilityMaskDeg(),
                    request.slewMaskDeg() == null ? defaults.slewMaskDeg() : request.slewMaskDeg(),
                    request.onNumericalFailure() == null ? defaults.onNumericalFailure() : request.onNumericalFailure());

            final var snapshot = constellationTracker.snapshot(config, stations, instant, policy);
            return ResponseEntity.ok(SnapshotResponse.ok(snapshot));
        } catch (final DateTimeParseException e) {
            log.error("Rejected snapshot request, bad timestamp [{}]", request.timestamp());
            return ResponseEntity.badRequest().body(SnapshotResponse.rejected("Invalid timestamp: " + e.getMessage()));
        } catch (final ConfigurationException | IllegalArgumentException e) {
            log.error("Rejected snapshot request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(SnapshotResponse.rejected("Invalid configuration: " + e.getMessage()));
        } catch (final NumericalException e) {
            log.error("Snapshot aborted at satellite [{}]: {}", e.getSatelliteId(), e.getMessage());
            return ResponseEntity.unprocessableEntity().body(SnapshotResponse.failed(e.getMessage()));
        }
    }

    /**
     * Geodetic position of every satellite of the configured constellation.
     */
    @GetMapping("/positions")
    public ResponseEntity<PositionsResponse> positions(@RequestParam(required = false) final String timestamp) {
        try {
            final var instant = resolveTimestamp(timestamp);
            final var positions = constellationTracker.positions(resolveConstellation(null), instant);
            return ResponseEntity.ok(PositionsResponse.ok(instant, positions));
        } catch (final DateTimeParseException e) {
            log.error("Rejected positions request, bad timestamp [{}]", timestamp);
            return ResponseEntity.badRequest().body(PositionsResponse.rejected("Invalid timestamp: " + e.getMessage()));
        } catch (final ConfigurationException e) {
            log.error("Rejected positions request: {}", e.getMessage());
            return ResponseEntity.badRequest().body(PositionsResponse.rejected("Invalid configuration: " + e.getMessage()));
        } catch (final NumericalException e) {
            log.error("Positions aborted at satellite [{}]: {}", e.getSatelliteId(), e.getMessage());
            return ResponseEntity.unprocessableEntity().body(PositionsResponse.failed(e.getMessage()));
        }
    }

    private Instant resolveTimestamp(final String timestamp) {
        return timestamp == null || timestamp.isBlank() ? clock.instant() : Instant.parse(timestamp);
    }

    private ConstellationConfig resolveConstellation(final ConstellationConfig requested) {
        final var config = requested != null ? requested : trackingProperties.constellation();
        if (config == null) {
            throw new ConfigurationException("No constellation configured");
        }
        return config;
    }
}
