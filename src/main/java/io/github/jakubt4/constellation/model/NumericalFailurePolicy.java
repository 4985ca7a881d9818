package io.github.jakubt4.constellation.model;

/**
 * What a snapshot does when a satellite position or look angle cannot be computed.
 */
public enum NumericalFailurePolicy {
    /** Rethrow the failure with the lowest satellite index. */
    ABORT,
    /** Leave the affected entries out and list them as {@link TrackingFailure}s. */
    EXCLUDE
}
