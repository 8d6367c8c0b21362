package com.wasteland.state.stats;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consumable stats.
 *
 * @param heal health restored on use
 * @param ammo rounds granted on use
 */
public record ConsumableStats(int heal, int ammo) implements ItemStats {

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (heal != 0) {
            map.put("heal", heal);
        }
        if (ammo != 0) {
            map.put("ammo", ammo);
        }
        return map;
    }
}
