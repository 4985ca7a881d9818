package io.github.jakubt4.constellation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Constellation tracker: orbital propagation and ground-station visibility for a
 * Walker Delta satellite pattern.
 *
 * <p>Generates circular-orbit elements per plane and slot, propagates them to an
 * explicit timestamp, converts them to WGS-84 geodetic positions and computes
 * azimuth, elevation and range from each configured ground station.
 *
 * @see io.github.jakubt4.constellation.service.ConstellationTracker
 * @see io.github.jakubt4.constellation.controller.TrackingController
 */
@SpringBootApplication
public class ConstellationTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConstellationTrackerApplication.class, args);
    }
}
