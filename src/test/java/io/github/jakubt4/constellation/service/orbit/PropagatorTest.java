package io.github.jakubt4.constellation.service.orbit;

import io.github.jakubt4.constellation.model.OrbitalElements;
import org.junit.jupiter.api.Test;
import org.orekit.frames.FramesFactory;
import org.orekit.orbits.KeplerianOrbit;
import org.orekit.orbits.PositionAngleType;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PropagatorTest {

    private static final OrbitalElements MEO = new OrbitalElements(21378.137, 0.0, 55.0, 120.0, 0.0, 45.0);

    private final Propagator propagator = new Propagator();

    @Test
    void zeroElapsedTimeReturnsEqualElements() {
        assertThat(propagator.propagate(MEO, 0.0)).isEqualTo(MEO);
    }

    @Test
    void onePeriodReturnsToStartingMeanAnomaly() {
        final var period = propagator.periodSeconds(MEO);

        final var propagated = propagator.propagate(MEO, period);

        assertThat(Angles.separationDegrees(propagated.meanAnomalyDeg(), MEO.meanAnomalyDeg()))
                .isLessThan(1e-6);
    }

    @Test
    void quarterPeriodAdvancesNinetyDegrees() {
        final var propagated = propagator.propagate(MEO, propagator.periodSeconds(MEO) / 4);

        assertThat(propagated.meanAnomalyDeg()).isCloseTo(135.0, within(1e-9));
    }

    @Test
    void negativeElapsedTimeLooksBackAndStaysInRange() {
        final var propagated = propagator.propagate(MEO, -propagator.periodSeconds(MEO) / 4);

        assertThat(propagated.meanAnomalyDeg()).isCloseTo(315.0, within(1e-9));
    }

    @Test
    void onlyMeanAnomalyChanges() {
        final var propagated = propagator.propagate(MEO, 12_345.0);

        assertThat(propagated.semiMajorAxisKm()).isEqualTo(MEO.semiMajorAxisKm());
        assertThat(propagated.inclinationDeg()).isEqualTo(MEO.inclinationDeg());
        assertThat(propagated.raanDeg()).isEqualTo(MEO.raanDeg());
        assertThat(propagated.argPeriapsisDeg()).isEqualTo(MEO.argPeriapsisDeg());
        assertThat(propagated.meanAnomalyDeg()).isBetween(0.0, 360.0).isNotEqualTo(360.0);
        assertThat(MEO.meanAnomalyDeg()).isEqualTo(45.0);
    }

    @Test
    void longPropagationStaysNormalized() {
        for (var t = -1.0e7; t <= 1.0e7; t += 77_777.7) {
            final var m = propagator.propagate(MEO, t).meanAnomalyDeg();
            assertThat(m).isGreaterThanOrEqualTo(0.0).isLessThan(360.0);
        }
    }

    @Test
    void periodMatchesOrekitKeplerianPeriod() {
        final var orbit = new KeplerianOrbit(MEO.semiMajorAxisKm() * 1000.0, 0.0,
                Math.toRadians(MEO.inclinationDeg()), 0.0, Math.toRadians(MEO.raanDeg()),
                Math.toRadians(MEO.meanAnomalyDeg()), PositionAngleType.MEAN,
                FramesFactory.getGCRF(), AbsoluteDate.J2000_EPOCH, Constants.WGS84_EARTH_MU);

        assertThat(propagator.periodSeconds(MEO)).isCloseTo(orbit.getKeplerianPeriod(), within(1e-6));
    }

    @Test
    void rejectsEccentricOrbits() {
        final var eccentric = new OrbitalElements(21378.137, 0.1, 55.0, 0.0, 0.0, 0.0);

        assertThatThrownBy(() -> propagator.propagate(eccentric, 10.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("circular");
    }
}
