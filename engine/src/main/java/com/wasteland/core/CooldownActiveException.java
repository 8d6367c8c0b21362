package com.wasteland.core;

import lombok.Getter;

import java.time.Duration;

/**
 * The wallet claimed too recently.
 */
@Getter
public class CooldownActiveException extends EngineException {

    private final Duration remaining;

    public CooldownActiveException(Duration remaining) {
        super(ErrorKind.RATE_LIMITED, "Cooldown active");
        this.remaining = remaining;
    }
}
