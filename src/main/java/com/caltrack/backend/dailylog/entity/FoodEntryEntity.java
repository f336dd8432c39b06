package com.caltrack.backend.dailylog.entity;

import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.nutrient.NutrientMapConverter;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.scaling.NutritionSnapshot;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * One logged consumption. Nutrition is a frozen snapshot for {@code amount};
 * it is not recomputed when the source product changes or is deleted.
 */
@Getter
@Setter
@Entity
@Table(name = "food_entries", indexes = {
        @Index(name = "idx_food_entries_daily_log", columnList = "daily_log_id"),
        @Index(name = "idx_food_entries_product", columnList = "product_id"),
        @Index(name = "idx_food_entries_timestamp", columnList = "entry_timestamp")
})
public class FoodEntryEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    /** weak reference; nulled when the product is deleted */
    @Column(name = "product_id", length = 36)
    private String productId;

    /** product name captured at log time */
    @Column(name = "product_name")
    private String productName;

    /** for AI/custom entries without a product ("one apple") */
    @Column(name = "custom_food_name")
    private String customFoodName;

    @Column(name = "daily_log_id", length = 36)
    private String dailyLogId;

    @Column(nullable = false)
    private double amount;

    @Column(nullable = false, length = 64)
    private String unit = "g";

    @Column(name = "entry_timestamp", nullable = false)
    private Instant timestamp;

    private Double calories;
    private Double protein;
    private Double carbohydrates;
    private Double fat;
    private Double sugar;

    @Column(name = "natural_sugar")
    private Double naturalSugar;

    @Column(name = "added_sugar")
    private Double addedSugar;

    private Double fibre;

    /** mg */
    private Double sodium;

    @Convert(converter = NutrientMapConverter.class)
    @Column(name = "nutrients", columnDefinition = "TEXT")
    private NutrientMap nutrients = NutrientMap.EMPTY;

    @Column(name = "ai_generated", nullable = false)
    private boolean aiGenerated;

    @Column(name = "ai_prompt", columnDefinition = "TEXT")
    private String aiPrompt;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (timestamp == null) timestamp = Instant.now();
        if (nutrients == null) nutrients = NutrientMap.EMPTY;
    }

    public NutritionSnapshot snapshot() {
        return new NutritionSnapshot(calories, protein, carbohydrates, fat,
                sugar, naturalSugar, addedSugar, fibre, sodium, nutrients);
    }

    /** Replaces the frozen nutrition; amount is set by the caller. */
    public void applySnapshot(NutritionSnapshot s) {
        this.calories = s.calories();
        this.protein = s.protein();
        this.carbohydrates = s.carbohydrates();
        this.fat = s.fat();
        this.sugar = s.sugar();
        this.naturalSugar = s.naturalSugar();
        this.addedSugar = s.addedSugar();
        this.fibre = s.fibre();
        this.sodium = s.sodium();
        this.nutrients = s.nutrients();
    }

    /** live product name > captured name > custom name > fallback */
    public String displayName(ProductEntity liveProduct) {
        if (liveProduct != null && liveProduct.getId().equals(productId)) return liveProduct.getName();
        if (productName != null) return productName;
        return customFoodName != null ? customFoodName : "Unknown food";
    }
}
