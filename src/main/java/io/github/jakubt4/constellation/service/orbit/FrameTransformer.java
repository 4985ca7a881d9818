package io.github.jakubt4.constellation.service.orbit;

import io.github.jakubt4.constellation.exception.NumericalException;
import io.github.jakubt4.constellation.model.CartesianCoordinates;
import io.github.jakubt4.constellation.model.GeodeticCoordinates;
import io.github.jakubt4.constellation.model.OrbitalElements;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Component;

/**
 * Conversions between orbital elements, Earth-fixed Cartesian and geodetic coordinates
 * on the WGS-84 ellipsoid.
 *
 * <p>The orbit frame is taken as Earth-fixed: no sidereal rotation is applied.
 */
@Component
public class FrameTransformer {

    /** Fixed iteration count of the latitude solver. */
    static final int GEODETIC_ITERATIONS = 5;

    /**
     * Rotates the perifocal position {@code (r·cosθ, r·sinθ, 0)} through
     * {@code R3(-Ω)·R1(-i)·R3(-ω)}, with θ the mean anomaly taken as true anomaly.
     *
     * <p>With the frame rotations {@code R3(a) = [[cos a, sin a, 0], [-sin a, cos a, 0], [0, 0, 1]]}
     * and {@code R1(a) = [[1, 0, 0], [0, cos a, sin a], [0, -sin a, cos a]]} the product is:
     * <pre>
     *   r11 =  cosΩ·cosω - sinΩ·sinω·cos i    r12 = -cosΩ·sinω - sinΩ·cosω·cos i    r13 =  sinΩ·sin i
     *   r21 =  sinΩ·cosω + cosΩ·sinω·cos i    r22 = -sinΩ·sinω + cosΩ·cosω·cos i    r23 = -cosΩ·sin i
     *   r31 =  sinω·sin i                     r32 =  cosω·sin i                     r33 =  cos i
     * </pre>
     * The perifocal z component is zero, so the third column does not contribute.
     */
    public CartesianCoordinates toEcef(final OrbitalElements elements) {
        if (!elements.isCircular()) {
            throw new IllegalArgumentException(
                    "Only circular orbits are supported, eccentricity=" + elements.eccentricity());
        }
        final var raan = FastMath.toRadians(elements.raanDeg());
        final var inc = FastMath.toRadians(elements.inclinationDeg());
        final var argPe = FastMath.toRadians(elements.argPeriapsisDeg());
        final var theta = FastMath.toRadians(elements.meanAnomalyDeg());

        final var r = elements.semiMajorAxisKm();
        final var xOrbit = r * FastMath.cos(theta);
        final var yOrbit = r * FastMath.sin(theta);

        final var cosRaan = FastMath.cos(raan);
        final var sinRaan = FastMath.sin(raan);
        final var cosInc = FastMath.cos(inc);
        final var sinInc = FastMath.sin(inc);
        final var cosArgPe = FastMath.cos(argPe);
        final var sinArgPe = FastMath.sin(argPe);

        final var r11 = cosRaan * cosArgPe - sinRaan * sinArgPe * cosInc;
        final var r12 = -cosRaan * sinArgPe - sinRaan * cosArgPe * cosInc;
        final var r21 = sinRaan * cosArgPe + cosRaan * sinArgPe * cosInc;
        final var r22 = -sinRaan * sinArgPe + cosRaan * cosArgPe * cosInc;
        final var r31 = sinArgPe * sinInc;
        final var r32 = cosArgPe * sinInc;

        return new CartesianCoordinates(
                r11 * xOrbit + r12 * yOrbit,
                r21 * xOrbit + r22 * yOrbit,
                r31 * xOrbit + r32 * yOrbit);
    }

    /**
     * Iterative Earth-fixed to geodetic conversion.
     *
     * <pre>
     *   lon = atan2(y, x),  p = √(x² + y²),  lat₀ = atan2(z, p·(1 - e²))
     *   repeat 5 times:
     *     N   = a / √(1 - e²·sin²lat)
     *     h   = p / cos(lat) - N
     *     lat = atan2(z, p·(1 - e²·N / (N + h)))
     * </pre>
     * The iteration count is fixed with no convergence test. It is sufficient for
     * |lat| &lt; 89°; closer to the poles {@code p / cos(lat)} loses precision in h.
     *
     * @throws NumericalException if the input or the result is not finite
     */
    public GeodeticCoordinates ecefToGeodetic(final CartesianCoordinates ecef) {
        if (!ecef.isFinite()) {
            throw new NumericalException("Non-finite ECEF position " + ecef);
        }
        final var x = ecef.x();
        final var y = ecef.y();
        final var z = ecef.z();
        final var a = Wgs84.EQUATORIAL_RADIUS_KM;
        final var e2 = Wgs84.ECCENTRICITY_SQUARED;

        final var lon = FastMath.atan2(y, x);
        final var p = FastMath.sqrt(x * x + y * y);

        var lat = FastMath.atan2(z, p * (1 - e2));
        var h = 0.0;
        for (var i = 0; i < GEODETIC_ITERATIONS; i++) {
            final var sinLat = FastMath.sin(lat);
            final var n = a / FastMath.sqrt(1 - e2 * sinLat * sinLat);
            h = p / FastMath.cos(lat) - n;
            lat = FastMath.atan2(z, p * (1 - e2 * n / (n + h)));
        }

        if (!Double.isFinite(lat) || !Double.isFinite(h)) {
            throw new NumericalException("Geodetic conversion diverged for ECEF position " + ecef);
        }

        var lonDeg = FastMath.toDegrees(lon);
        if (lonDeg <= -180.0) {
            lonDeg = 180.0;
        }
        return new GeodeticCoordinates(FastMath.toDegrees(lat), lonDeg, h);
    }

    /**
     * Direct geodetic to Earth-fixed conversion.
     *
     * <pre>
     *   N = a / √(1 - e²·sin²lat)
     *   x = (N + h)·cos lat·cos lon
     *   y = (N + h)·cos lat·sin lon
     *   z = (N·(1 - e²) + h)·sin lat
     * </pre>
     */
    public CartesianCoordinates geodeticToEcef(final GeodeticCoordinates geodetic) {
        final var e2 = Wgs84.ECCENTRICITY_SQUARED;
        final var lat = FastMath.toRadians(geodetic.latDeg());
        final var lon = FastMath.toRadians(geodetic.lonDeg());
        final var sinLat = FastMath.sin(lat);
        final var cosLat = FastMath.cos(lat);
        final var alt = geodetic.altKm();

        final var n = Wgs84.EQUATORIAL_RADIUS_KM / FastMath.sqrt(1 - e2 * sinLat * sinLat);

        return new CartesianCoordinates(
                (n + alt) * cosLat * FastMath.cos(lon),
                (n + alt) * cosLat * FastMath.sin(lon),
                (n * (1 - e2) + alt) * sinLat);
    }

    public CartesianCoordinates geodeticToEcef(final double latDeg, final double lonDeg, final double altKm) {
        return geodeticToEcef(new GeodeticCoordinates(latDeg, lonDeg, altKm));
    }
}
