package com.caltrack.backend.scaling;

import com.caltrack.backend.nutrient.NutrientMap;

import java.util.function.DoubleUnaryOperator;

/**
 * Nutrition values for one basis (per 100 g, per serving, or an absolute consumed amount).
 * Null fields are unknown, never zero.
 */
public record NutritionSnapshot(
        Double calories,
        Double protein,
        Double carbohydrates,
        Double fat,
        Double sugar,
        Double naturalSugar,
        Double addedSugar,
        Double fibre,
        Double sodium,
        NutrientMap nutrients
) {

    public static final NutritionSnapshot EMPTY = new NutritionSnapshot(
            null, null, null, null, null, null, null, null, null, NutrientMap.EMPTY);

    public NutritionSnapshot {
        if (nutrients == null) nutrients = NutrientMap.EMPTY;
    }

    public static NutritionSnapshot nutrientsOnly(NutrientMap nutrients) {
        return new NutritionSnapshot(null, null, null, null, null, null, null, null, null, nutrients);
    }

    /** Applies {@code op} to every present value (macros and nutrient map); nulls stay null. */
    public NutritionSnapshot map(DoubleUnaryOperator op) {
        return new NutritionSnapshot(
                apply(calories, op),
                apply(protein, op),
                apply(carbohydrates, op),
                apply(fat, op),
                apply(sugar, op),
                apply(naturalSugar, op),
                apply(addedSugar, op),
                apply(fibre, op),
                apply(sodium, op),
                nutrients.map(op)
        );
    }

    public NutritionSnapshot withSugarSplit(Double naturalSugar, Double addedSugar) {
        return new NutritionSnapshot(calories, protein, carbohydrates, fat, sugar,
                naturalSugar, addedSugar, fibre, sodium, nutrients);
    }

    private static Double apply(Double v, DoubleUnaryOperator op) {
        return v == null ? null : op.applyAsDouble(v);
    }
}
