package com.caltrack.backend.template.dto;

import com.caltrack.backend.scaling.NutritionSnapshot;

/**
 * An accepted AI estimate: absolute nutrition for {@code amount unit}, weighing {@code weightInGrams}.
 */
public record AiFoodEstimate(
        String name,
        double amount,
        String unit,
        double weightInGrams,
        NutritionSnapshot nutrition,
        String aiPrompt
) {
    public AiFoodEstimate {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("ESTIMATE_NAME_REQUIRED");
        if (unit == null || unit.isBlank()) unit = "serving";
        if (nutrition == null) nutrition = NutritionSnapshot.EMPTY;
    }
}
