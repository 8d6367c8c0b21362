package com.wasteland.core;

import lombok.Getter;

/**
 * The reported position is outside the location's geofence.
 */
@Getter
public class OutOfRangeException extends EngineException {

    private final double distanceMeters;
    private final double allowedMeters;

    public OutOfRangeException(double distanceMeters, double allowedMeters) {
        super(ErrorKind.FORBIDDEN, "Out of range");
        this.distanceMeters = distanceMeters;
        this.allowedMeters = allowedMeters;
    }
}
