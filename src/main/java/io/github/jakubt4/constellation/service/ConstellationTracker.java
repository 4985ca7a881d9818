package io.github.jakubt4.constellation.service;

import io.github.jakubt4.constellation.exception.ConfigurationException;
import io.github.jakubt4.constellation.exception.NumericalException;
import io.github.jakubt4.constellation.model.ConstellationConfig;
import io.github.jakubt4.constellation.model.GroundStation;
import io.github.jakubt4.constellation.model.NumericalFailurePolicy;
import io.github.jakubt4.constellation.model.OrbitalElements;
import io.github.jakubt4.constellation.model.SatelliteId;
import io.github.jakubt4.constellation.model.SatellitePosition;
import io.github.jakubt4.constellation.model.TrackingEntry;
import io.github.jakubt4.constellation.model.TrackingFailure;
import io.github.jakubt4.constellation.model.TrackingPolicy;
import io.github.jakubt4.constellation.model.TrackingSnapshot;
import io.github.jakubt4.constellation.service.orbit.ElementsGenerator;
import io.github.jakubt4.constellation.service.orbit.FrameTransformer;
import io.github.jakubt4.constellation.service.orbit.Propagator;
import io.github.jakubt4.constellation.service.tracking.LookAngleCalculator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Computes constellation positions and per-station look angles for one instant.
 *
 * <p>Pipeline per satellite: {@link ElementsGenerator} → {@link Propagator} →
 * {@link FrameTransformer} → {@link LookAngleCalculator} for every station.
 * Satellites are processed independently on the supplied {@link Executor}
 * and reassembled by satellite index, so the output does not depend on the
 * executor or on completion order.
 *
 * <p>Timestamps are always explicit and measured from a fixed {@code epoch};
 * the tracker never reads the wall clock.
 */
@Slf4j
public class ConstellationTracker {

    private final ElementsGenerator elementsGenerator;
    private final Propagator propagator;
    private final FrameTransformer frameTransformer;
    private final LookAngleCalculator lookAngleCalculator;
    private final Executor executor;
    private final Instant epoch;

    public ConstellationTracker(final ElementsGenerator elementsGenerator,
                                final Propagator propagator,
                                final FrameTransformer frameTransformer,
                                final LookAngleCalculator lookAngleCalculator,
                                final Executor executor,
                                final Instant epoch) {
        this.elementsGenerator = elementsGenerator;
        this.propagator = propagator;
        this.frameTransformer = frameTransformer;
        this.lookAngleCalculator = lookAngleCalculator;
        this.executor = executor;
        this.epoch = epoch;
    }

    public Instant getEpoch() {
        return epoch;
    }

    /**
     * Seconds from the tracker epoch to {@code timestamp}; negative before the epoch.
     */
    public double elapsedSeconds(final Instant timestamp) {
        final var elapsed = Duration.between(epoch, timestamp);
        return elapsed.getSeconds() + elapsed.getNano() / 1.0e9;
    }

    /**
     * Instant lying {@code elapsedSeconds} after the tracker epoch, to nanosecond precision.
     */
    public Instant timestampAt(final double elapsedSeconds) {
        if (!Double.isFinite(elapsedSeconds)) {
            throw new IllegalArgumentException("Elapsed seconds must be finite, got " + elapsedSeconds);
        }
        final var seconds = (long) Math.floor(elapsedSeconds);
        final var nanos = Math.round((elapsedSeconds - seconds) * 1.0e9);
        return epoch.plusSeconds(seconds).plusNanos(nanos);
    }

    /**
     * Propagated position of every satellite, ordered by satellite index.
     *
     * @throws ConfigurationException if the configuration is invalid
     * @throws NumericalException     for the lowest-index satellite whose position cannot be computed
     */
    public List<SatellitePosition> positions(final ConstellationConfig config, final Instant timestamp) {
        return positions(config, elapsedSeconds(timestamp));
    }

    /**
     * Same as {@link #positions(ConstellationConfig, Instant)} with the time given as seconds since the epoch.
     */
    public List<SatellitePosition> positions(final ConstellationConfig config, final double elapsedSeconds) {
        final var epochElements = generateAll(config);

        final var futures = epochElements.entrySet().stream()
                .map(entry -> CompletableFuture.supplyAsync(
                        () -> position(entry.getKey(), entry.getValue(), elapsedSeconds), executor))
                .toList();

        return futures.stream()
                .map(ConstellationTracker::await)
                .toList();
    }

    /**
     * Look angles from every station to every satellite at {@code timestamp}.
     *
     * <p>An invalid configuration aborts before any satellite is processed. Numerical
     * failures are handled as {@link TrackingPolicy#onNumericalFailure()} dictates.
     *
     * @throws ConfigurationException if the configuration is invalid or station names repeat
     * @throws NumericalException     under {@link NumericalFailurePolicy#ABORT}, for the first failure by satellite index
     */
    public TrackingSnapshot snapshot(final ConstellationConfig config,
                                     final List<GroundStation> stations,
                                     final Instant timestamp,
                                     final TrackingPolicy policy) {
        return snapshot(config, stations, timestamp, elapsedSeconds(timestamp), policy);
    }

    /**
     * Same as {@link #snapshot(ConstellationConfig, List, Instant, TrackingPolicy)} with the time
     * given as seconds since the epoch; the snapshot timestamp is {@link #timestampAt(double)}.
     */
    public TrackingSnapshot snapshot(final ConstellationConfig config,
                                     final List<GroundStation> stations,
                                     final double elapsedSeconds,
                                     final TrackingPolicy policy) {
        return snapshot(config, stations, timestampAt(elapsedSeconds), elapsedSeconds, policy);
    }

    private TrackingSnapshot snapshot(final ConstellationConfig config,
                                      final List<GroundStation> stations,
                                      final Instant timestamp,
                                      final double elapsed,
                                      final TrackingPolicy policy) {
        requireUniqueNames(stations);
        final var epochElements = generateAll(config);
        final var futures = epochElements.entrySet().stream()
                .map(entry -> CompletableFuture.supplyAsync(
                        () -> track(entry.getKey(), entry.getValue(), stations, elapsed, policy), executor))
                .toList();
        final var tracks = futures.stream()
                .map(ConstellationTracker::await)
                .toList();

        final var byStation = new LinkedHashMap<String, List<TrackingEntry>>();
        stations.forEach(station -> byStation.put(station.name(), new ArrayList<>()));
        final var failures = new ArrayList<TrackingFailure>();

        for (final var track : tracks) {
            if (!track.failures().isEmpty() && policy.onNumericalFailure() == NumericalFailurePolicy.ABORT) {
                throw track.failures().get(0);
            }
            for (final var failure : track.failures()) {
                log.warn("[{}] Excluded from snapshot at t={}s, station={}: {}",
                        track.satelliteId().name(), elapsed,
                        failure.getStationName() == null ? "ALL" : failure.getStationName(),
                        failure.getMessage());
                failures.add(new TrackingFailure(track.satelliteId(), failure.getStationName(), failure.getMessage()));
            }
            track.entries().forEach((stationName, entry) -> byStation.get(stationName).add(entry));
        }

        final var frozen = new LinkedHashMap<String, List<TrackingEntry>>();
        byStation.forEach((name, entries) -> frozen.put(name, List.copyOf(entries)));

        log.debug("Snapshot at {} (t={}s) | satellites={} | stations={} | failures={}",
                timestamp, elapsed, tracks.size(), stations.size(), failures.size());

        return new TrackingSnapshot(timestamp, elapsed, Collections.unmodifiableMap(frozen), List.copyOf(failures));
    }

    private Map<SatelliteId, OrbitalElements> generateAll(final ConstellationConfig config) {
        config.validate();
        final var elements = new LinkedHashMap<SatelliteId, OrbitalElements>();
        for (var plane = 0; plane < config.planes(); plane++) {
            for (var slot = 0; slot < config.satellitesPerPlane(); slot++) {
                elements.put(SatelliteId.of(plane, slot, config), elementsGenerator.generate(plane, slot, config));
            }
        }
        return elements;
    }

    private SatellitePosition position(final SatelliteId id, final OrbitalElements epochElements, final double elapsed) {
        try {
            final var current = propagator.propagate(epochElements, elapsed);
            final var ecef = frameTransformer.toEcef(current);
            final var geodetic = frameTransformer.ecefToGeodetic(ecef);
            return new SatellitePosition(id, current, ecef, geodetic);
        } catch (final NumericalException e) {
            throw e.scopedTo(id.name(), null);
        }
    }

    private SatelliteTrack track(final SatelliteId id,
                                 final OrbitalElements epochElements,
                                 final List<GroundStation> stations,
                                 final double elapsed,
                                 final TrackingPolicy policy) {
        final SatellitePosition position;
        try {
            position = position(id, epochElements, elapsed);
        } catch (final NumericalException e) {
            return new SatelliteTrack(id, Map.of(), List.of(e));
        }

        final var entries = new LinkedHashMap<String, TrackingEntry>();
        final var failures = new ArrayList<NumericalException>();
        for (final var station : stations) {
            try {
                final var angles = lookAngleCalculator.lookAngles(station, position.geodetic(), policy.slewMaskDeg());
                final var visible = angles.elevationDeg() > policy.visibilityMaskDeg();
                entries.put(station.name(), new TrackingEntry(id, angles, visible));
            } catch (final NumericalException e) {
                failures.add(e.scopedTo(id.name(), station.name()));
            }
        }
        return new SatelliteTrack(id, entries, failures);
    }

    private static void requireUniqueNames(final List<GroundStation> stations) {
        final var seen = new HashSet<String>();
        for (final var station : stations) {
            if (!seen.add(station.name())) {
                throw new ConfigurationException("Duplicate ground station name [" + station.name() + "]");
            }
        }
    }

    private static <T> T await(final CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (final CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private record SatelliteTrack(SatelliteId satelliteId,
                                  Map<String, TrackingEntry> entries,
                                  List<NumericalException> failures) {}
}
