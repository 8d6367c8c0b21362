package com.wasteland.config;

/**
 * How maximum health is re-derived when a defense-bearing item is equipped.
 */
public enum MaxHealthPolicy {

    /**
     * Maximum health becomes {@code 100 + defense} of the item just equipped.
     * Other equipped items and levels gained are not reflected.
     */
    LAST_EQUIPPED,

    /**
     * Maximum health becomes {@code 100 + 10 per level gained + sum of defense}
     * over every occupied gear slot.
     */
    CUMULATIVE
}
