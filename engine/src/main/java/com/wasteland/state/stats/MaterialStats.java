package com.wasteland.state.stats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Crafting material stats.
 *
 * @param value trade value
 * @param intel research value of salvaged tech
 */
public record MaterialStats(int value, int intel) implements ItemStats {

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (value != 0) {
            map.put("value", value);
        }
        if (intel != 0) {
            map.put("intel", intel);
        }
        return map;
    }
}
