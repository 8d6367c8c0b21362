package com.wasteland.state.stats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weapon stats.
 *
 * @param attack damage bonus
 * @param energy whether the weapon uses energy ammunition
 */
public record WeaponStats(int attack, boolean energy) implements ItemStats {

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("attack", attack);
        if (energy) {
            map.put("energy", true);
        }
        return map;
    }
}
