package com.wasteland.state;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/**
 * The fixed set of gear slots every player has.
 */
public enum EquipmentSlot {

    @SerializedName("head")
    HEAD,

    @SerializedName("body")
    BODY,

    @SerializedName("weapon")
    WEAPON,

    @SerializedName("accessory")
    ACCESSORY;

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    // Gson writes map keys with toString()
    @Override
    public String toString() {
        return getId();
    }
}
