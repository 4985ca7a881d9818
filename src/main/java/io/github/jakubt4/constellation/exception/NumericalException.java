package io.github.jakubt4.constellation.exception;

/**
 * Raised when a coordinate conversion cannot produce finite results.
 *
 * <p>Scoped to one satellite, or to one satellite/station pair when
 * {@link #getStationName()} is non-null.
 */
public class NumericalException extends RuntimeException {

    private final String satelliteId;
    private final String stationName;

    public NumericalException(final String message) {
        this(null, null, message);
    }

    public NumericalException(final String satelliteId, final String stationName, final String message) {
        super(message);
        this.satelliteId = satelliteId;
        this.stationName = stationName;
    }

    /**
     * Returns a copy of this failure attributed to the given satellite and station.
     */
    public NumericalException scopedTo(final String satelliteId, final String stationName) {
        final var scoped = new NumericalException(satelliteId, stationName, getMessage());
        scoped.initCause(this);
        return scoped;
    }

    public String getSatelliteId() {
        return satelliteId;
    }

    public String getStationName() {
        return stationName;
    }
}
