package com.caltrack.backend.dailylog.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One calendar day in the store zone. Owns its food/supplement entries (by daily_log_id).
 */
@Getter
@Setter
@Entity
@Table(name = "daily_logs",
        uniqueConstraints = @UniqueConstraint(name = "uq_daily_logs_day", columnNames = {"log_date"}))
public class DailyLogEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "log_date", nullable = false)
    private LocalDate logDate;

    @Column(name = "calorie_target", nullable = false)
    private double calorieTarget;

    @Column(name = "protein_target", nullable = false)
    private double proteinTarget;

    @Column(name = "carb_target", nullable = false)
    private double carbTarget;

    @Column(name = "fat_target", nullable = false)
    private double fatTarget;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAtUtc == null) createdAtUtc = Instant.now();
    }
}
