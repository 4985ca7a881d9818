package io.github.jakubt4.constellation.dto;

import io.github.jakubt4.constellation.model.TrackingFailure;

/**
 * @param station {@code null} when the satellite was lost for every station
 */
public record FailureResponse(String satellite, String station, String message) {

    public static FailureResponse of(final TrackingFailure failure) {
        return new FailureResponse(failure.satelliteId().name(), failure.stationName(), failure.message());
    }
}
