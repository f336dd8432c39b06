package com.caltrack.backend.nutrient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.caltrack.backend.nutrient.NutrientCategory.MINERAL;
import static com.caltrack.backend.nutrient.NutrientCategory.VITAMIN;

/**
 * Static registry of tracked vitamins and minerals (adult daily targets).
 * Single source of truth: add a nutrient here and in {@link NutrientId}.
 */
public final class NutrientCatalog {

    private NutrientCatalog() {}

    private static final List<NutrientDefinition> VITAMINS = List.of(
            def(NutrientId.VITAMIN_A, "Vitamin A", "A", "mcg", 800, 3000.0, VITAMIN, 1),
            def(NutrientId.VITAMIN_C, "Vitamin C", "C", "mg", 80, 2000.0, VITAMIN, 1),
            def(NutrientId.VITAMIN_D, "Vitamin D", "D", "mcg", 10, 100.0, VITAMIN, 1),
            def(NutrientId.VITAMIN_E, "Vitamin E", "E", "mg", 12, 540.0, VITAMIN, 2),
            def(NutrientId.VITAMIN_K, "Vitamin K", "K", "mcg", 75, null, VITAMIN, 1),
            def(NutrientId.VITAMIN_B1, "Vitamin B1 (Thiamin)", "B1", "mg", 1.1, null, VITAMIN, 3),
            def(NutrientId.VITAMIN_B2, "Vitamin B2 (Riboflavin)", "B2", "mg", 1.4, null, VITAMIN, 3),
            def(NutrientId.VITAMIN_B3, "Vitamin B3 (Niacin)", "B3", "mg", 16, 35.0, VITAMIN, 1),
            def(NutrientId.VITAMIN_B5, "Vitamin B5 (Pantothenic Acid)", "B5", "mg", 5, null, VITAMIN, 2),
            def(NutrientId.VITAMIN_B6, "Vitamin B6", "B6", "mg", 1.4, 25.0, VITAMIN, 2),
            def(NutrientId.VITAMIN_B7, "Vitamin B7 (Biotin)", "B7", "mcg", 30, null, VITAMIN, 1),
            def(NutrientId.VITAMIN_B12, "Vitamin B12", "B12", "mcg", 2.5, null, VITAMIN, 2),
            def(NutrientId.FOLATE, "Folate (B9)", "Folate", "mcg", 400, 1000.0, VITAMIN, 1)
    );

    private static final List<NutrientDefinition> MINERALS = List.of(
            def(NutrientId.CALCIUM, "Calcium", "Calcium", "mg", 1000, 2500.0, MINERAL, 0),
            def(NutrientId.IRON, "Iron", "Iron", "mg", 14, 45.0, MINERAL, 1),
            def(NutrientId.ZINC, "Zinc", "Zinc", "mg", 10, 25.0, MINERAL, 1),
            def(NutrientId.MAGNESIUM, "Magnesium", "Magnes.", "mg", 375, 400.0, MINERAL, 0),
            def(NutrientId.POTASSIUM, "Potassium", "Potass.", "mg", 3500, 6000.0, MINERAL, 0),
            def(NutrientId.PHOSPHORUS, "Phosphorus", "Phosph.", "mg", 700, 4000.0, MINERAL, 0),
            def(NutrientId.SELENIUM, "Selenium", "Selenium", "mcg", 55, 400.0, MINERAL, 1),
            def(NutrientId.COPPER, "Copper", "Copper", "mg", 1, 5.0, MINERAL, 2),
            def(NutrientId.MANGANESE, "Manganese", "Mangan.", "mg", 2, 11.0, MINERAL, 2),
            def(NutrientId.CHROMIUM, "Chromium", "Chromium", "mcg", 35, null, MINERAL, 1),
            def(NutrientId.MOLYBDENUM, "Molybdenum", "Molyb.", "mcg", 45, 2000.0, MINERAL, 1),
            def(NutrientId.IODINE, "Iodine", "Iodine", "mcg", 150, 1100.0, MINERAL, 1),
            def(NutrientId.CHLORIDE, "Chloride", "Chloride", "mg", 2300, 3600.0, MINERAL, 0)
    );

    private static final List<NutrientDefinition> ALL;
    private static final Map<NutrientId, NutrientDefinition> BY_ID;

    static {
        List<NutrientDefinition> all = new ArrayList<>(VITAMINS);
        all.addAll(MINERALS);
        ALL = Collections.unmodifiableList(all);

        Map<NutrientId, NutrientDefinition> byId = new EnumMap<>(NutrientId.class);
        for (NutrientDefinition d : ALL) byId.put(d.id(), d);
        if (byId.size() != NutrientId.values().length) {
            throw new IllegalStateException("NUTRIENT_CATALOG_INCOMPLETE");
        }
        BY_ID = Collections.unmodifiableMap(byId);
    }

    public static List<NutrientDefinition> vitamins() {
        return VITAMINS;
    }

    public static List<NutrientDefinition> minerals() {
        return MINERALS;
    }

    public static List<NutrientDefinition> all() {
        return ALL;
    }

    public static NutrientDefinition get(NutrientId id) {
        return BY_ID.get(id);
    }

    public static Optional<NutrientDefinition> byJsonKey(String key) {
        return NutrientId.fromJsonKey(key).map(BY_ID::get);
    }

    /** value as a fraction of the daily target (1.0 = 100%) */
    public static double fractionOfTarget(NutrientId id, double value) {
        NutrientDefinition d = get(id);
        if (d.target() <= 0) return 0.0;
        return value / d.target();
    }

    public static boolean exceedsUpperLimit(NutrientId id, double value) {
        NutrientDefinition d = get(id);
        return d.hasUpperLimit() && value > d.upperLimit();
    }

    private static NutrientDefinition def(NutrientId id, String name, String shortName, String unit,
                                          double target, Double upperLimit, NutrientCategory category,
                                          int decimalPlaces) {
        return new NutrientDefinition(id, name, shortName, unit, target, upperLimit, category, decimalPlaces);
    }
}
