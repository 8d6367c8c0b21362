package com.wasteland.core;

import com.wasteland.data.model.Coordinate;
import lombok.Builder;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * A player's request to claim rewards at a location.
 */
@Builder
public record ClaimRequest(
        String wallet,
        String locationId,
        /**
         * Reported position. Geofencing is skipped when absent.
         */
        @Nullable Coordinate coordinate,
        /**
         * Name of the world event the client believes is running.
         */
        @Nullable String eventName
) {
    public Optional<Coordinate> position() {
        return Optional.ofNullable(coordinate);
    }
}
