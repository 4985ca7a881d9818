package io.github.jakubt4.constellation.config;

import io.github.jakubt4.constellation.service.ConstellationTracker;
import io.github.jakubt4.constellation.service.orbit.ElementsGenerator;
import io.github.jakubt4.constellation.service.orbit.FrameTransformer;
import io.github.jakubt4.constellation.service.orbit.Propagator;
import io.github.jakubt4.constellation.service.tracking.LookAngleCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the tracking engine: a fixed worker pool for snapshot fan-out and the
 * {@link ConstellationTracker} anchored at the configured epoch.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TrackingProperties.class)
public class TrackingConfig {

    @Bean(destroyMethod = "shutdown")
    ExecutorService trackingExecutor(final TrackingProperties properties) {
        final var threads = Math.max(1, properties.parallelism());
        final var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            final var thread = new Thread(runnable, "tracking-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    ConstellationTracker constellationTracker(final ElementsGenerator elementsGenerator,
                                              final Propagator propagator,
                                              final FrameTransformer frameTransformer,
                                              final LookAngleCalculator lookAngleCalculator,
                                              final ExecutorService trackingExecutor,
                                              final TrackingProperties properties) {
        log.info("Constellation tracker initialized | epoch={} | parallelism={} | constellation={} | stations={}",
                properties.epoch(), properties.parallelism(), properties.constellation(),
                properties.groundStations().size());
        return new ConstellationTracker(elementsGenerator, propagator, frameTransformer,
                lookAngleCalculator, trackingExecutor, properties.epoch());
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
