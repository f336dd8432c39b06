package com.caltrack.backend.supplement.entity;

import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.nutrient.NutrientMapConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Supplement reference; nutrients are per serving (e.g. per 2 tablets when servingSize = 2).
 */
@Getter
@Setter
@Entity
@Table(name = "supplements", indexes = @Index(name = "idx_supplements_name", columnList = "name"))
public class SupplementEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(nullable = false)
    private String name;

    private String brand;

    /** tablet, capsule, softgel, gummy, liquid, powder */
    @Column(name = "dosage_form", nullable = false, length = 64)
    private String dosageForm = "tablet";

    /** units (tablets/capsules/ml) per serving */
    @Column(name = "serving_size", nullable = false)
    private double servingSize = 1.0;

    @Column(name = "serving_size_unit", nullable = false, length = 64)
    private String servingSizeUnit = "tablet";

    @Convert(converter = NutrientMapConverter.class)
    @Column(name = "nutrients_per_serving", columnDefinition = "TEXT")
    private NutrientMap nutrientsPerServing = NutrientMap.EMPTY;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Lob
    @Column(name = "image_data")
    private byte[] imageData;

    @Column(name = "date_added", nullable = false)
    private Instant dateAdded;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (dateAdded == null) dateAdded = Instant.now();
        if (nutrientsPerServing == null) nutrientsPerServing = NutrientMap.EMPTY;
    }
}
