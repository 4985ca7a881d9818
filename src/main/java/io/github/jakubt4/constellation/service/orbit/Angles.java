package io.github.jakubt4.constellation.service.orbit;

/**
 * Angle wrapping helpers.
 */
public final class Angles {

    private Angles() {
    }

    /**
     * Wraps an angle into [0, 360).
     */
    public static double normalizeDegrees(final double degrees) {
        var wrapped = degrees % 360.0;
        if (wrapped < 0) {
            wrapped += 360.0;
        }
        // -1e-15 + 360 rounds to 360; adding 0.0 turns -0.0 into 0.0
        return wrapped >= 360.0 ? 0.0 : wrapped + 0.0;
    }

    /**
     * Smallest absolute difference between two angles, in [0, 180].
     */
    public static double separationDegrees(final double a, final double b) {
        final var diff = normalizeDegrees(a - b);
        return Math.min(diff, 360.0 - diff);
    }
}
