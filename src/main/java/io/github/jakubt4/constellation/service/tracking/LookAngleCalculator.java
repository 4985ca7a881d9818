package io.github.jakubt4.constellation.service.tracking;

import io.github.jakubt4.constellation.exception.NumericalException;
import io.github.jakubt4.constellation.model.GeodeticCoordinates;
import io.github.jakubt4.constellation.model.GroundStation;
import io.github.jakubt4.constellation.model.LookAngles;
import io.github.jakubt4.constellation.service.orbit.Angles;
import io.github.jakubt4.constellation.service.orbit.FrameTransformer;
import lombok.RequiredArgsConstructor;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

/**
 * Azimuth, elevation and range from a ground station to a satellite.
 *
 * <p>The station-to-satellite vector Δ is rotated into the station's
 * East-North-Up frame:
 * <pre>
 *   east  = -sin lon·Δx + cos lon·Δy
 *   north = -sin lat·cos lon·Δx - sin lat·sin lon·Δy + cos lat·Δz
 *   up    =  cos lat·cos lon·Δx + cos lat·sin lon·Δy + sin lat·Δz
 * </pre>
 * then {@code azimuth = atan2(east, north)} and {@code elevation = asin(up / range)}.
 */
@Component
@RequiredArgsConstructor
public class LookAngleCalculator {

    private final FrameTransformer frameTransformer;

    /**
     * @param slewMaskDeg elevation above which the antenna should steer; supplied by the caller
     * @throws NumericalException if the satellite coincides with the station or a result is not finite
     */
    public LookAngles lookAngles(final GroundStation station,
                                 final GeodeticCoordinates satellite,
                                 final double slewMaskDeg) {
        final var stationEcef = frameTransformer.geodeticToEcef(station.position());
        final var satelliteEcef = frameTransformer.geodeticToEcef(satellite);

        final var delta = new Vector3D(satelliteEcef.x(), satelliteEcef.y(), satelliteEcef.z())
                .subtract(new Vector3D(stationEcef.x(), stationEcef.y(), stationEcef.z()));
        final var range = delta.getNorm();
        if (!(range > 0) || Double.isInfinite(range)) {
            throw new NumericalException("Undefined look angles from [" + station.name()
                    + "], range=" + range + " km");
        }

        final var lat = FastMath.toRadians(station.latDeg());
        final var lon = FastMath.toRadians(station.lonDeg());
        final var sinLat = FastMath.sin(lat);
        final var cosLat = FastMath.cos(lat);
        final var sinLon = FastMath.sin(lon);
        final var cosLon = FastMath.cos(lon);

        final var east = -sinLon * delta.getX() + cosLon * delta.getY();
        final var north = -sinLat * cosLon * delta.getX() - sinLat * sinLon * delta.getY() + cosLat * delta.getZ();
        final var up = cosLat * cosLon * delta.getX() + cosLat * sinLon * delta.getY() + sinLat * delta.getZ();

        final var azimuthDeg = Angles.normalizeDegrees(FastMath.toDegrees(FastMath.atan2(east, north)));
        // rounding can push |up / range| just past 1
        final var sinElevation = FastMath.max(-1.0, FastMath.min(1.0, up / range));
        final var elevationDeg = FastMath.toDegrees(FastMath.asin(sinElevation));

        // TODO: derive azimuth/elevation rates by finite differences over a short time step
        //  or by projecting the satellite velocity onto the ENU frame
        final var slew = new LookAngles.Slew(0.0, 0.0, elevationDeg > slewMaskDeg);

        return new LookAngles(azimuthDeg, elevationDeg, range, 90.0 - elevationDeg, slew);
    }
}
