package com.caltrack.backend.dailylog.dto;

import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.supplement.entity.SupplementEntryEntity;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

/**
 * Derived day totals. Unknown values contribute nothing; a field with no known values is 0.
 * Micronutrient totals include supplement entries, macros come from food only.
 */
public record DailyTotals(
        LocalDate date,
        double calories,
        double protein,
        double carbohydrates,
        double fat,
        double sugar,
        double naturalSugar,
        double addedSugar,
        double fibre,
        double sodium,
        NutrientMap nutrients,
        double calorieTarget,
        double caloriesRemaining,
        double calorieProgress,
        int foodEntryCount,
        int supplementEntryCount
) {

    public static DailyTotals of(DailyLogEntity day,
                                 List<FoodEntryEntity> foods,
                                 List<SupplementEntryEntity> supplements) {
        NutrientMap micros = NutrientMap.EMPTY;
        for (FoodEntryEntity f : foods) micros = micros.plus(f.getNutrients());
        for (SupplementEntryEntity s : supplements) micros = micros.plus(s.getNutrients());

        double calories = sum(foods, FoodEntryEntity::getCalories);

        return new DailyTotals(
                day.getLogDate(),
                calories,
                sum(foods, FoodEntryEntity::getProtein),
                sum(foods, FoodEntryEntity::getCarbohydrates),
                sum(foods, FoodEntryEntity::getFat),
                sum(foods, FoodEntryEntity::getSugar),
                sum(foods, FoodEntryEntity::getNaturalSugar),
                sum(foods, FoodEntryEntity::getAddedSugar),
                sum(foods, FoodEntryEntity::getFibre),
                sum(foods, FoodEntryEntity::getSodium),
                micros,
                day.getCalorieTarget(),
                day.getCalorieTarget() - calories,
                progress(calories, day.getCalorieTarget()),
                foods.size(),
                supplements.size()
        );
    }

    /** min(total / target, 1); a non-positive target yields 0 */
    static double progress(double total, double target) {
        if (!(target > 0)) return 0;
        return Math.min(total / target, 1.0);
    }

    private static double sum(List<FoodEntryEntity> foods, Function<FoodEntryEntity, Double> field) {
        double acc = 0;
        for (FoodEntryEntity f : foods) {
            Double v = field.apply(f);
            if (v != null) acc += v;
        }
        return acc;
    }
}
