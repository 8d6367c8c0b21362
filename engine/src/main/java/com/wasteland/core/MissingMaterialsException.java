package com.wasteland.core;

import lombok.Getter;

/**
 * A recipe input is short. Names the first missing material in recipe order.
 */
@Getter
public class MissingMaterialsException extends EngineException {

    private final String materialId;
    private final int shortfall;

    public MissingMaterialsException(String materialId, int shortfall) {
        super(ErrorKind.INSUFFICIENT_RESOURCES, "Missing " + materialId + " x" + shortfall);
        this.materialId = materialId;
        this.shortfall = shortfall;
    }
}
