package com.wasteland.state;

import com.google.gson.annotations.SerializedName;

import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Optional;

/**
 * Item categories. Only head, body, weapon and accessory items can be equipped.
 */
public enum ItemCategory {

    @SerializedName("material")
    MATERIAL(null),

    @SerializedName("consumable")
    CONSUMABLE(null),

    @SerializedName("weapon")
    WEAPON(EquipmentSlot.WEAPON),

    @SerializedName("head")
    HEAD(EquipmentSlot.HEAD),

    @SerializedName("body")
    BODY(EquipmentSlot.BODY),

    @SerializedName("accessory")
    ACCESSORY(EquipmentSlot.ACCESSORY),

    @SerializedName("artifact")
    ARTIFACT(null);

    @Nullable
    private final EquipmentSlot slot;

    ItemCategory(@Nullable EquipmentSlot slot) {
        this.slot = slot;
    }

    /**
     * The gear slot items of this category occupy, if any.
     */
    public Optional<EquipmentSlot> getSlot() {
        return Optional.ofNullable(slot);
    }

    public boolean isEquippable() {
        return slot != null;
    }

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ItemCategory fromId(String id) {
        for (ItemCategory category : values()) {
            if (category.getId().equalsIgnoreCase(id)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown item category: " + id);
    }

    @Override
    public String toString() {
        return getId();
    }
}
