package io.github.jakubt4.constellation.service.orbit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AnglesTest {

    @Test
    void wrapsIntoHalfOpenRange() {
        assertThat(Angles.normalizeDegrees(360.0)).isZero();
        assertThat(Angles.normalizeDegrees(725.0)).isCloseTo(5.0, within(1e-12));
        assertThat(Angles.normalizeDegrees(-90.0)).isEqualTo(270.0);
        assertThat(Angles.normalizeDegrees(-1e-15)).isZero();
    }

    @Test
    void separationIsShortestArc() {
        assertThat(Angles.separationDegrees(359.0, 1.0)).isCloseTo(2.0, within(1e-12));
        assertThat(Angles.separationDegrees(10.0, 190.0)).isCloseTo(180.0, within(1e-12));
    }
}
