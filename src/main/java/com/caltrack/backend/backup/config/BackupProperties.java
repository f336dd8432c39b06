package com.caltrack.backend.backup.config;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * application.yml:
 * app.backup.*
 */
@Validated
@ConfigurationProperties(prefix = "app.backup")
public class BackupProperties {

    /** food/supplement entries closer than this (and otherwise equal) are the same entry */
    @NotNull
    private Duration entryTimestampTolerance = Duration.ofSeconds(1);

    private boolean prettyPrint = true;

    public Duration getEntryTimestampTolerance() { return entryTimestampTolerance; }
    public void setEntryTimestampTolerance(Duration entryTimestampTolerance) { this.entryTimestampTolerance = entryTimestampTolerance; }

    public boolean isPrettyPrint() { return prettyPrint; }
    public void setPrettyPrint(boolean prettyPrint) { this.prettyPrint = prettyPrint; }
}
