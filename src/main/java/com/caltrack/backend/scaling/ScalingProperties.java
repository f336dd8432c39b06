package com.caltrack.backend.scaling;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * application.yml:
 * app.scaling.*
 */
@Validated
@ConfigurationProperties(prefix = "app.scaling")
public class ScalingProperties {

    /** an entry never shrinks below this amount */
    @Positive
    private double minAmount = 1.0;

    /** upper clamp for amounts typed in directly */
    @Positive
    private double maxDirectAmount = 5000.0;

    @NotNull
    private SugarSplitPolicy sugarSplitPolicy = SugarSplitPolicy.NONE;

    public double getMinAmount() { return minAmount; }
    public void setMinAmount(double minAmount) { this.minAmount = minAmount; }

    public double getMaxDirectAmount() { return maxDirectAmount; }
    public void setMaxDirectAmount(double maxDirectAmount) { this.maxDirectAmount = maxDirectAmount; }

    public SugarSplitPolicy getSugarSplitPolicy() { return sugarSplitPolicy; }
    public void setSugarSplitPolicy(SugarSplitPolicy sugarSplitPolicy) { this.sugarSplitPolicy = sugarSplitPolicy; }
}
