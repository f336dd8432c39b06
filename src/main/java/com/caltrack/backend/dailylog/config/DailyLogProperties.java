package com.caltrack.backend.dailylog.config;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * application.yml:
 * app.daily-log.*
 *
 * Targets applied to newly created days.
 */
@Validated
@ConfigurationProperties(prefix = "app.daily-log")
public class DailyLogProperties {

    @PositiveOrZero
    private double defaultCalorieTarget = 2000;
    @PositiveOrZero
    private double defaultProteinTarget = 50;
    @PositiveOrZero
    private double defaultCarbTarget = 250;
    @PositiveOrZero
    private double defaultFatTarget = 65;

    public double getDefaultCalorieTarget() { return defaultCalorieTarget; }
    public void setDefaultCalorieTarget(double v) { this.defaultCalorieTarget = v; }

    public double getDefaultProteinTarget() { return defaultProteinTarget; }
    public void setDefaultProteinTarget(double v) { this.defaultProteinTarget = v; }

    public double getDefaultCarbTarget() { return defaultCarbTarget; }
    public void setDefaultCarbTarget(double v) { this.defaultCarbTarget = v; }

    public double getDefaultFatTarget() { return defaultFatTarget; }
    public void setDefaultFatTarget(double v) { this.defaultFatTarget = v; }
}
