package io.github.jakubt4.constellation.service.orbit;

import io.github.jakubt4.constellation.exception.NumericalException;
import io.github.jakubt4.constellation.model.CartesianCoordinates;
import io.github.jakubt4.constellation.model.GeodeticCoordinates;
import io.github.jakubt4.constellation.model.OrbitalElements;
import org.junit.jupiter.api.Test;
import org.orekit.bodies.GeodeticPoint;
import org.orekit.bodies.OneAxisEllipsoid;
import org.orekit.frames.FramesFactory;
import org.orekit.orbits.KeplerianOrbit;
import org.orekit.orbits.PositionAngleType;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FrameTransformerTest {

    private static final double ONE_METER_KM = 1.0e-3;

    private final FrameTransformer transformer = new FrameTransformer();

    @Test
    void equatorialOrbitQuarterTurnLiesOnYAxis() {
        final var elements = new OrbitalElements(7000.0, 0.0, 0.0, 0.0, 0.0, 90.0);

        final var ecef = transformer.toEcef(elements);

        assertThat(ecef.x()).isCloseTo(0.0, within(1e-9));
        assertThat(ecef.y()).isCloseTo(7000.0, within(1e-9));
        assertThat(ecef.z()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void ascendingNodeLiesAlongRaanDirection() {
        final var elements = new OrbitalElements(7000.0, 0.0, 55.0, 90.0, 0.0, 0.0);

        final var ecef = transformer.toEcef(elements);

        assertThat(ecef.x()).isCloseTo(0.0, within(1e-9));
        assertThat(ecef.y()).isCloseTo(7000.0, within(1e-9));
        assertThat(ecef.z()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void rotationMatchesOrekitKeplerianPosition() {
        final var cases = List.of(
                new OrbitalElements(21378.137, 0.0, 55.0, 120.0, 0.0, 30.0),
                new OrbitalElements(21378.137, 0.0, 55.0, 240.0, 0.0, 330.0),
                new OrbitalElements(7000.0, 0.0, 97.8, 15.0, 40.0, 200.0),
                new OrbitalElements(42164.0, 0.0, 0.1, 300.0, 75.0, 10.0));

        for (final var elements : cases) {
            final var orbit = new KeplerianOrbit(elements.semiMajorAxisKm() * 1000.0, 0.0,
                    Math.toRadians(elements.inclinationDeg()), Math.toRadians(elements.argPeriapsisDeg()),
                    Math.toRadians(elements.raanDeg()), Math.toRadians(elements.meanAnomalyDeg()),
                    PositionAngleType.MEAN, FramesFactory.getGCRF(), AbsoluteDate.J2000_EPOCH,
                    Constants.WGS84_EARTH_MU);
            final var expected = orbit.getPVCoordinates().getPosition();

            final var ecef = transformer.toEcef(elements);

            assertThat(ecef.x()).isCloseTo(expected.getX() / 1000.0, within(1e-6));
            assertThat(ecef.y()).isCloseTo(expected.getY() / 1000.0, within(1e-6));
            assertThat(ecef.z()).isCloseTo(expected.getZ() / 1000.0, within(1e-6));
        }
    }

    @Test
    void orbitRadiusIsPreserved() {
        final var elements = new OrbitalElements(21378.137, 0.0, 55.0, 240.0, 0.0, 123.4);

        final var ecef = transformer.toEcef(elements);

        final var radius = Math.sqrt(ecef.x() * ecef.x() + ecef.y() * ecef.y() + ecef.z() * ecef.z());
        assertThat(radius).isCloseTo(21378.137, within(1e-9));
    }

    @Test
    void geodeticToEcefMatchesOrekitEllipsoid() {
        final var earth = new OneAxisEllipsoid(Constants.WGS84_EARTH_EQUATORIAL_RADIUS,
                Constants.WGS84_EARTH_FLATTENING, FramesFactory.getGCRF());
        final var random = new Random(42);

        for (var n = 0; n < 200; n++) {
            final var lat = -90.0 + 180.0 * random.nextDouble();
            final var lon = -180.0 + 360.0 * random.nextDouble();
            final var alt = 40000.0 * random.nextDouble();

            final var expected = earth.transform(
                    new GeodeticPoint(Math.toRadians(lat), Math.toRadians(lon), alt * 1000.0));
            final var ecef = transformer.geodeticToEcef(lat, lon, alt);

            assertThat(ecef.x()).isCloseTo(expected.getX() / 1000.0, within(1e-6));
            assertThat(ecef.y()).isCloseTo(expected.getY() / 1000.0, within(1e-6));
            assertThat(ecef.z()).isCloseTo(expected.getZ() / 1000.0, within(1e-6));
        }
    }

    @Test
    void roundTripsRandomPointsWithinOneMeter() {
        final var random = new Random(20_261_018L);

        for (var n = 0; n < 1000; n++) {
            final var point = new GeodeticCoordinates(
                    -85.0 + 170.0 * random.nextDouble(),
                    -179.999 + 359.998 * random.nextDouble(),
                    -1.0 + 40001.0 * random.nextDouble());

            final var roundTrip = transformer.ecefToGeodetic(transformer.geodeticToEcef(point));

            final var back = transformer.geodeticToEcef(roundTrip);
            final var origin = transformer.geodeticToEcef(point);
            final var distance = Math.sqrt(
                    Math.pow(back.x() - origin.x(), 2)
                            + Math.pow(back.y() - origin.y(), 2)
                            + Math.pow(back.z() - origin.z(), 2));

            assertThat(distance).as("round trip of %s", point).isLessThan(ONE_METER_KM);
            assertThat(roundTrip.latDeg()).isCloseTo(point.latDeg(), within(1e-6));
            assertThat(roundTrip.lonDeg()).isCloseTo(point.lonDeg(), within(1e-9));
            assertThat(roundTrip.altKm()).isCloseTo(point.altKm(), within(ONE_METER_KM));
        }
    }

    @Test
    void equatorSurfacePointHasZeroAltitude() {
        final var geodetic = transformer.ecefToGeodetic(new CartesianCoordinates(6378.137, 0.0, 0.0));

        assertThat(geodetic.latDeg()).isCloseTo(0.0, within(1e-12));
        assertThat(geodetic.lonDeg()).isCloseTo(0.0, within(1e-12));
        assertThat(geodetic.altKm()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void antimeridianIsReportedAsPositive180() {
        final var geodetic = transformer.ecefToGeodetic(new CartesianCoordinates(-7000.0, -0.0, 0.0));

        assertThat(geodetic.lonDeg()).isEqualTo(180.0);
    }

    @Test
    void nonFiniteInputRaisesNumericalError() {
        assertThatThrownBy(() -> transformer.ecefToGeodetic(new CartesianCoordinates(Double.NaN, 0.0, 0.0)))
                .isInstanceOf(NumericalException.class)
                .hasMessageContaining("Non-finite");
        assertThatThrownBy(() -> transformer.ecefToGeodetic(
                new CartesianCoordinates(Double.POSITIVE_INFINITY, 1.0, 1.0)))
                .isInstanceOf(NumericalException.class);
    }

    @Test
    void earthCenterRaisesNumericalError() {
        assertThatThrownBy(() -> transformer.ecefToGeodetic(new CartesianCoordinates(0.0, 0.0, 0.0)))
                .isInstanceOf(NumericalException.class)
                .hasMessageContaining("diverged");
    }

    @Test
    void rejectsEccentricElements() {
        final var eccentric = new OrbitalElements(21378.137, 0.2, 55.0, 0.0, 0.0, 0.0);

        assertThatThrownBy(() -> transformer.toEcef(eccentric))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
