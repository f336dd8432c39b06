package com.caltrack.backend.common.time;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Truncates instants to calendar days (local midnight) in the store zone.
 */
@Component
public class LocalDayResolver {

    private final ZoneId zone;
    private final Clock clock;

    public LocalDayResolver(StoreTimeProperties props, Clock clock) {
        String z = props.getZone();
        this.zone = (z == null || z.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(z.trim());
        this.clock = clock;
    }

    public ZoneId zone() {
        return zone;
    }

    public LocalDate dayOf(Instant instant) {
        return LocalDate.ofInstant(instant, zone);
    }

    public Instant startOfDay(LocalDate day) {
        return day.atStartOfDay(zone).toInstant();
    }

    public Instant now() {
        return Instant.now(clock);
    }
}
