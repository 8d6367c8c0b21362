package com.wasteland.state.stats;

import java.util.Map;

/**
 * Category-specific stats carried by an item.
 *
 * <p>Each category has its own record so callers read typed fields instead of
 * probing a key/value bag. {@link #asMap()} gives the flat view used for JSON output.
 */
public interface ItemStats {

    /**
     * Defense contributed when equipped. Zero for everything except armour.
     */
    default int defense() {
        return 0;
    }

    /**
     * Flat key to value view, omitting zero and false entries.
     */
    Map<String, Object> asMap();
}
