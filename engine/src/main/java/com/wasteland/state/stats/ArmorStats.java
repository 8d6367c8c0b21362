package com.wasteland.state.stats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stats for head and body armour.
 *
 * @param defense raises maximum health when equipped
 * @param carry   extra carry capacity
 */
public record ArmorStats(int defense, int carry) implements ItemStats {

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("defense", defense);
        if (carry != 0) {
            map.put("carry", carry);
        }
        return map;
    }
}
