package com.caltrack.backend.nutrient;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stable key for every vitamin/mineral value in the system.
 * The json key is shared by the AI exchange format and the backup document.
 */
public enum NutrientId {

    // vitamins
    VITAMIN_A("vitaminA"),
    VITAMIN_C("vitaminC"),
    VITAMIN_D("vitaminD"),
    VITAMIN_E("vitaminE"),
    VITAMIN_K("vitaminK"),
    VITAMIN_B1("vitaminB1"),
    VITAMIN_B2("vitaminB2"),
    VITAMIN_B3("vitaminB3"),
    VITAMIN_B5("vitaminB5"),
    VITAMIN_B6("vitaminB6"),
    VITAMIN_B7("vitaminB7"),
    VITAMIN_B12("vitaminB12"),
    FOLATE("folate"),

    // minerals
    CALCIUM("calcium"),
    IRON("iron"),
    ZINC("zinc"),
    MAGNESIUM("magnesium"),
    POTASSIUM("potassium"),
    PHOSPHORUS("phosphorus"),
    SELENIUM("selenium"),
    COPPER("copper"),
    MANGANESE("manganese"),
    CHROMIUM("chromium"),
    MOLYBDENUM("molybdenum"),
    IODINE("iodine"),
    CHLORIDE("chloride");

    private static final Map<String, NutrientId> BY_JSON_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NutrientId::jsonKey, Function.identity()));

    private final String jsonKey;

    NutrientId(String jsonKey) {
        this.jsonKey = jsonKey;
    }

    public String jsonKey() {
        return jsonKey;
    }

    public static Optional<NutrientId> fromJsonKey(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(BY_JSON_KEY.get(key.trim()));
    }
}
