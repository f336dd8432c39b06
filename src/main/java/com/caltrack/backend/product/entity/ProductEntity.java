package com.caltrack.backend.product.entity;

import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.nutrient.NutrientMapConverter;
import com.caltrack.backend.scaling.NutritionSnapshot;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Canonical nutrition reference. Every nutrition value is stored per 100 g (or 100 ml).
 */
@Getter
@Setter
@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_products_barcode", columnList = "barcode"),
        @Index(name = "idx_products_name", columnList = "name")
})
public class ProductEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(length = 64)
    private String barcode;

    private String brand;

    /** reference basis of the per-100 values; kept for backup compatibility */
    @Column(name = "serving_size", nullable = false)
    private Double servingSize = 100.0;

    @Column(name = "serving_size_unit", nullable = false, length = 64)
    private String servingSizeUnit = "g";

    /** grams per portion for multi-portion products */
    @Column(name = "portion_grams")
    private Double portionGrams;

    @Column(name = "portions_per_package")
    private Integer portionsPerPackage;

    @Column(name = "calories_per_100g")
    private Double caloriesPer100g;

    @Column(name = "protein_per_100g")
    private Double proteinPer100g;

    @Column(name = "carbs_per_100g")
    private Double carbsPer100g;

    @Column(name = "fat_per_100g")
    private Double fatPer100g;

    @Column(name = "saturated_fat_per_100g")
    private Double saturatedFatPer100g;

    @Column(name = "trans_fat_per_100g")
    private Double transFatPer100g;

    @Column(name = "fibre_per_100g")
    private Double fibrePer100g;

    @Column(name = "sugar_per_100g")
    private Double sugarPer100g;

    @Column(name = "natural_sugar_per_100g")
    private Double naturalSugarPer100g;

    @Column(name = "added_sugar_per_100g")
    private Double addedSugarPer100g;

    /** mg */
    @Column(name = "sodium_per_100g")
    private Double sodiumPer100g;

    /** mg */
    @Column(name = "cholesterol_per_100g")
    private Double cholesterolPer100g;

    @Convert(converter = NutrientMapConverter.class)
    @Column(name = "nutrients_per_100g", columnDefinition = "TEXT")
    private NutrientMap nutrientsPer100g = NutrientMap.EMPTY;

    @Lob
    @Column(name = "image_data")
    private byte[] imageData;

    @Lob
    @Column(name = "main_image_data")
    private byte[] mainImageData;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "is_custom", nullable = false)
    private boolean custom;

    @Column(name = "date_added", nullable = false)
    private Instant dateAdded;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (dateAdded == null) dateAdded = Instant.now();
        if (nutrientsPer100g == null) nutrientsPer100g = NutrientMap.EMPTY;
    }

    public boolean hasPortions() {
        return portionGrams != null && portionGrams > 0;
    }

    /** Per-100g values as a snapshot (the scaling source). */
    public NutritionSnapshot per100g() {
        return new NutritionSnapshot(
                caloriesPer100g,
                proteinPer100g,
                carbsPer100g,
                fatPer100g,
                sugarPer100g,
                naturalSugarPer100g,
                addedSugarPer100g,
                fibrePer100g,
                sodiumPer100g,
                nutrientsPer100g
        );
    }

    public void applyPer100g(NutritionSnapshot s) {
        this.caloriesPer100g = s.calories();
        this.proteinPer100g = s.protein();
        this.carbsPer100g = s.carbohydrates();
        this.fatPer100g = s.fat();
        this.sugarPer100g = s.sugar();
        this.naturalSugarPer100g = s.naturalSugar();
        this.addedSugarPer100g = s.addedSugar();
        this.fibrePer100g = s.fibre();
        this.sodiumPer100g = s.sodium();
        this.nutrientsPer100g = s.nutrients();
    }
}
