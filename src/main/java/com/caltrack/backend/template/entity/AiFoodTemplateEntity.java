package com.caltrack.backend.template.entity;

import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.nutrient.NutrientMapConverter;
import com.caltrack.backend.scaling.NutritionSnapshot;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Reusable AI estimate. Values are absolute for {@code amount unit} ({@code weightInGrams} grams).
 * Lives independently of products and entries; never deleted automatically.
 */
@Getter
@Setter
@Entity
@Table(name = "ai_food_templates")
public class AiFoodTemplateEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private double amount;

    @Column(nullable = false, length = 64)
    private String unit;

    @Column(name = "weight_in_grams", nullable = false)
    private double weightInGrams;

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
    private Double sodium;

    @Convert(converter = NutrientMapConverter.class)
    @Column(name = "nutrients", columnDefinition = "TEXT")
    private NutrientMap nutrients = NutrientMap.EMPTY;

    @Column(name = "ai_prompt", columnDefinition = "TEXT")
    private String aiPrompt;

    @Column(name = "date_created", nullable = false)
    private Instant dateCreated;

    @Column(name = "last_used", nullable = false)
    private Instant lastUsed;

    @Column(name = "use_count", nullable = false)
    private int useCount = 1;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        if (dateCreated == null) dateCreated = now;
        if (lastUsed == null) lastUsed = now;
        if (nutrients == null) nutrients = NutrientMap.EMPTY;
    }

    public NutritionSnapshot snapshot() {
        return new NutritionSnapshot(calories, protein, carbohydrates, fat,
                sugar, naturalSugar, addedSugar, fibre, sodium, nutrients);
    }

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

    public void recordUse(Instant now) {
        this.lastUsed = now;
        this.useCount++;
    }
}
