package com.caltrack.backend.backup.reconcile;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Items keyed by timestamp; finds the first item inside [t - tolerance, t + tolerance] that passes a check.
 */
final class TimeWindowIndex<T> {

    private final TreeMap<Instant, List<T>> byTime = new TreeMap<>();

    void add(Instant at, T item) {
        if (at == null) return;
        byTime.computeIfAbsent(at, k -> new ArrayList<>()).add(item);
    }

    Optional<T> find(Instant at, Duration tolerance, Predicate<T> check) {
        if (at == null) return Optional.empty();
        for (List<T> bucket : byTime.subMap(at.minus(tolerance), true, at.plus(tolerance), true).values()) {
            for (T item : bucket) {
                if (check.test(item)) return Optional.of(item);
            }
        }
        return Optional.empty();
    }
}
