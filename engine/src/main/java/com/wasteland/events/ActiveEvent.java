package com.wasteland.events;

import com.wasteland.data.model.WorldEvent;

import java.time.Instant;

/**
 * The event running now and when clients should ask again.
 */
public record ActiveEvent(WorldEvent active, Instant nextCheckAt) {
}
