package com.wasteland.navigation;

/**
 * Outcome of a geofence check.
 *
 * @param accepted       whether the claim may proceed
 * @param distanceMeters measured distance, or {@code NaN} when no coordinate was reported
 * @param allowedMeters  the location's radius
 */
public record GeofenceResult(boolean accepted, double distanceMeters, double allowedMeters) {

    public static GeofenceResult skipped(double allowedMeters) {
        return new GeofenceResult(true, Double.NaN, allowedMeters);
    }

    public boolean isMeasured() {
        return !Double.isNaN(distanceMeters);
    }
}
