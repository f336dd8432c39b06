package com.caltrack.backend.supplement.entity;

import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.nutrient.NutrientMapConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "supplement_entries", indexes = {
        @Index(name = "idx_supplement_entries_daily_log", columnList = "daily_log_id"),
        @Index(name = "idx_supplement_entries_supplement", columnList = "supplement_id")
})
public class SupplementEntryEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "supplement_id", length = 36)
    private String supplementId;

    /** supplement name captured at log time */
    @Column(name = "supplement_name")
    private String supplementName;

    @Column(name = "daily_log_id", length = 36)
    private String dailyLogId;

    /** units taken (e.g. 2 tablets) */
    @Column(nullable = false)
    private double amount = 1.0;

    @Column(nullable = false, length = 64)
    private String unit = "tablet";

    @Column(name = "entry_timestamp", nullable = false)
    private Instant timestamp;

    @Convert(converter = NutrientMapConverter.class)
    @Column(name = "nutrients", columnDefinition = "TEXT")
    private NutrientMap nutrients = NutrientMap.EMPTY;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (timestamp == null) timestamp = Instant.now();
        if (nutrients == null) nutrients = NutrientMap.EMPTY;
    }

    public String displayName() {
        if (supplementName != null && !supplementName.isEmpty()) return supplementName;
        return "Unknown Supplement";
    }
}
