package io.github.jakubt4.constellation.config;

import io.github.jakubt4.constellation.model.ConstellationConfig;
import io.github.jakubt4.constellation.model.GroundStation;
import io.github.jakubt4.constellation.model.NumericalFailurePolicy;
import io.github.jakubt4.constellation.model.TrackingPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Instant;
import java.util.List;

/**
 * Settings bound from the {@code tracking.*} namespace.
 *
 * @param epoch              instant at which the generated elements are valid
 * @param visibilityMaskDeg  default elevation above which a satellite counts as visible
 * @param slewMaskDeg        default elevation above which the antenna steers
 * @param parallelism        worker threads for snapshot fan-out
 * @param onNumericalFailure default handling of per-satellite numerical failures
 * @param constellation      constellation served by the REST endpoints
 * @param groundStations     station catalogue served by the REST endpoints
 */
@ConfigurationProperties("tracking")
public record TrackingProperties(@DefaultValue("1970-01-01T00:00:00Z") Instant epoch,
                                 @DefaultValue("10.0") double visibilityMaskDeg,
                                 @DefaultValue("5.0") double slewMaskDeg,
                                 @DefaultValue("4") int parallelism,
                                 @DefaultValue("EXCLUDE") NumericalFailurePolicy onNumericalFailure,
                                 ConstellationConfig constellation,
                                 List<GroundStation> groundStations) {

    public TrackingProperties {
        groundStations = groundStations == null ? List.of() : List.copyOf(groundStations);
    }

    public TrackingPolicy defaultPolicy() {
        return new TrackingPolicy(visibilityMaskDeg, slewMaskDeg, onNumericalFailure);
    }
}
