package io.github.jakubt4.constellation.model;

/**
 * Earth-centered, Earth-fixed position in kilometres.
 */
public record CartesianCoordinates(double x, double y, double z) {

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }
}
