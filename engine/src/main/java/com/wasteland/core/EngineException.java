package com.wasteland.core;

import lombok.Getter;

/**
 * A request the engine refused. Thrown before any player state is changed.
 */
@Getter
public class EngineException extends RuntimeException {

    private final ErrorKind kind;

    public EngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static EngineException validation(String message) {
        return new EngineException(ErrorKind.VALIDATION, message);
    }

    public static EngineException notFound(String message) {
        return new EngineException(ErrorKind.NOT_FOUND, message);
    }
}
