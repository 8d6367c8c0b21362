package com.wasteland.core;

/**
 * Categories of engine failures. None of them leave player state modified.
 */
public enum ErrorKind {

    /**
     * Required input missing or malformed.
     */
    VALIDATION(400),

    /**
     * Unknown location, recipe or item.
     */
    NOT_FOUND(404),

    /**
     * Claim cooldown still running.
     */
    RATE_LIMITED(429),

    /**
     * Reported position outside the location's geofence.
     */
    FORBIDDEN(403),

    /**
     * Not enough crafting materials.
     */
    INSUFFICIENT_RESOURCES(400);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
