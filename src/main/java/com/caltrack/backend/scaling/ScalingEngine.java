package com.caltrack.backend.scaling;

import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.supplement.entity.SupplementEntity;
import org.springframework.stereotype.Component;

/**
 * Converts reference values (per 100 g / per serving) into amount-scaled snapshots.
 * Pure double arithmetic; rounding is left to the presentation layer.
 */
@Component
public class ScalingEngine {

    private final ScalingProperties props;

    public ScalingEngine(ScalingProperties props) {
        this.props = props;
    }

    /** v * grams / 100 for every present value */
    public NutritionSnapshot scaleFromPer100g(ProductEntity product, double grams) {
        requirePositive(grams);
        NutritionSnapshot base = props.getSugarSplitPolicy().apply(product.per100g());
        return base.map(v -> v * grams / 100.0);
    }

    public NutritionSnapshot scaleFromPortions(ProductEntity product, double portions) {
        if (!product.hasPortions()) {
            throw new InvalidAmountException("PORTION_SIZE_MISSING", portions);
        }
        requirePositive(portions);
        return scaleFromPer100g(product, gramsForPortions(product, portions));
    }

    public double gramsForPortions(ProductEntity product, double portions) {
        if (!product.hasPortions()) {
            throw new InvalidAmountException("PORTION_SIZE_MISSING", portions);
        }
        return product.getPortionGrams() * portions;
    }

    /** nutrients * (servings / servingSize); supplements carry no macros */
    public NutritionSnapshot scaleFromServings(SupplementEntity supplement, double servings) {
        requirePositive(servings);
        double perUnit = supplement.getServingSize();
        if (!(perUnit > 0) || !Double.isFinite(perUnit)) {
            throw new InvalidAmountException("SERVING_SIZE_NOT_POSITIVE", perUnit);
        }
        double ratio = servings / perUnit;
        return NutritionSnapshot.nutrientsOnly(supplement.getNutrientsPerServing().map(v -> v * ratio));
    }

    /**
     * Re-scales the entry's snapshot from its current amount to {@code newAmount}
     * (clamped to the minimum amount). Zero-valued fields are scaled too; absent ones stay absent.
     */
    public NutritionSnapshot rescale(FoodEntryEntity entry, double newAmount) {
        double current = entry.getAmount();
        if (!(current > 0) || !Double.isFinite(current)) {
            throw new InvalidAmountException("CURRENT_AMOUNT_ZERO", current);
        }
        double ratio = clampStepAmount(newAmount) / current;
        return entry.snapshot().map(v -> v * ratio);
    }

    /** Same as {@link #rescale} for amounts typed in directly: clamped to [min, maxDirect]. */
    public NutritionSnapshot rescaleDirect(FoodEntryEntity entry, double newAmount) {
        return rescale(entry, clampDirectAmount(newAmount));
    }

    public double clampStepAmount(double amount) {
        if (Double.isNaN(amount)) throw new InvalidAmountException("AMOUNT_NOT_A_NUMBER", amount);
        return Math.max(props.getMinAmount(), amount);
    }

    public double clampDirectAmount(double amount) {
        return Math.min(props.getMaxDirectAmount(), clampStepAmount(amount));
    }

    /**
     * Inverse of {@link #scaleFromPer100g}: turns an absolute snapshot for {@code weightGrams}
     * into a transient per-100g product (name and metadata left to the caller).
     */
    public ProductEntity derivePer100gFromWeight(NutritionSnapshot snapshot, double weightGrams) {
        double scale = 100.0 / Math.max(weightGrams, 1.0);
        ProductEntity p = new ProductEntity();
        p.applyPer100g(snapshot.map(v -> v * scale));
        return p;
    }

    private static void requirePositive(double amount) {
        if (!(amount > 0) || !Double.isFinite(amount)) {
            throw new InvalidAmountException("AMOUNT_NOT_POSITIVE", amount);
        }
    }
}
