package com.caltrack.backend.nutrient;

/**
 * @param target       daily recommended intake (RDA/AI), in {@code unit}
 * @param upperLimit   tolerable upper intake level, null when none is defined
 * @param decimalPlaces display precision; the core never rounds
 */
public record NutrientDefinition(
        NutrientId id,
        String name,
        String shortName,
        String unit,
        double target,
        Double upperLimit,
        NutrientCategory category,
        int decimalPlaces
) {

    public String jsonKey() {
        return id.jsonKey();
    }

    public boolean hasUpperLimit() {
        return upperLimit != null;
    }
}
