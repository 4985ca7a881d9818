package io.github.jakubt4.constellation.model;

/**
 * Caller-supplied thresholds for a snapshot. The two masks are independent.
 *
 * @param visibilityMaskDeg  minimum elevation for an entry to count as visible
 * @param slewMaskDeg        minimum elevation for the antenna to steer
 * @param onNumericalFailure handling of per-satellite numerical failures
 */
public record TrackingPolicy(double visibilityMaskDeg,
                             double slewMaskDeg,
                             NumericalFailurePolicy onNumericalFailure) {

    public TrackingPolicy {
        if (!Double.isFinite(visibilityMaskDeg) || !Double.isFinite(slewMaskDeg)) {
            throw new IllegalArgumentException("Elevation masks must be finite");
        }
        if (onNumericalFailure == null) {
            throw new IllegalArgumentException("Numerical failure policy is required");
        }
    }
}
