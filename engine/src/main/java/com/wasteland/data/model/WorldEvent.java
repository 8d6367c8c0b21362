package com.wasteland.data.model;

import lombok.Builder;

/**
 * A rotating world event that modifies claims at one location.
 */
@Builder
public record WorldEvent(
        String name,
        String locationId,
        /**
         * Extra caps for a claim at the event's location.
         */
        int bonusCaps,
        /**
         * Health lost on a claim at the event's location.
         */
        int healthRisk,
        /**
         * 0 if the event runs during even UTC hours, 1 for odd hours.
         */
        int hourParity
) {
    public boolean appliesTo(String locationId) {
        return this.locationId.equals(locationId);
    }
}
