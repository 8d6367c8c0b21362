package com.wasteland.state.stats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stats for accessories and artifacts.
 *
 * @param charisma social bonus
 */
public record TraitStats(int charisma) implements ItemStats {

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("charisma", charisma);
        return map;
    }
}
