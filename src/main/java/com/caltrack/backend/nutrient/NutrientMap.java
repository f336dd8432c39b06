package com.caltrack.backend.nutrient;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Sparse, immutable vitamin/mineral values keyed by {@link NutrientId}.
 * A missing key means "unknown"; a present 0.0 means "known to be zero".
 * Iteration order follows the enum (stable for serialization).
 */
public final class NutrientMap implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final NutrientMap EMPTY = new NutrientMap(new EnumMap<>(NutrientId.class));

    private final Map<NutrientId, Double> values;

    private NutrientMap(EnumMap<NutrientId, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static NutrientMap of(Map<NutrientId, Double> source) {
        if (source == null || source.isEmpty()) return EMPTY;
        EnumMap<NutrientId, Double> copy = new EnumMap<>(NutrientId.class);
        source.forEach((k, v) -> {
            if (k != null && v != null) copy.put(k, v);
        });
        return copy.isEmpty() ? EMPTY : new NutrientMap(copy);
    }

    /** Builds from json-keyed values; unknown keys and null values are dropped. */
    public static NutrientMap fromJsonKeys(Map<String, ? extends Number> source) {
        if (source == null || source.isEmpty()) return EMPTY;
        EnumMap<NutrientId, Double> copy = new EnumMap<>(NutrientId.class);
        source.forEach((k, v) -> {
            if (v == null) return;
            NutrientId.fromJsonKey(k).ifPresent(id -> copy.put(id, v.doubleValue()));
        });
        return copy.isEmpty() ? EMPTY : new NutrientMap(copy);
    }

    public Optional<Double> get(NutrientId id) {
        return Optional.ofNullable(values.get(id));
    }

    public Double valueOrNull(NutrientId id) {
        return values.get(id);
    }

    public boolean contains(NutrientId id) {
        return values.containsKey(id);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /** json key -> value, in enum order */
    public Map<String, Double> toJsonKeys() {
        Map<String, Double> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k.jsonKey(), v));
        return out;
    }

    public NutrientMap with(NutrientId id, Double value) {
        EnumMap<NutrientId, Double> copy = copy();
        if (value == null) copy.remove(id);
        else copy.put(id, value);
        return copy.isEmpty() ? EMPTY : new NutrientMap(copy);
    }

    /** Applies {@code op} to present keys only; absent keys stay absent. */
    public NutrientMap map(DoubleUnaryOperator op) {
        if (values.isEmpty()) return EMPTY;
        EnumMap<NutrientId, Double> out = new EnumMap<>(NutrientId.class);
        values.forEach((k, v) -> out.put(k, op.applyAsDouble(v)));
        return new NutrientMap(out);
    }

    /** Key union; values present on both sides are summed. */
    public NutrientMap plus(NutrientMap other) {
        if (other == null || other.isEmpty()) return this;
        if (isEmpty()) return other;
        EnumMap<NutrientId, Double> out = copy();
        other.values.forEach((k, v) -> out.merge(k, v, Double::sum));
        return new NutrientMap(out);
    }

    private EnumMap<NutrientId, Double> copy() {
        EnumMap<NutrientId, Double> copy = new EnumMap<>(NutrientId.class);
        copy.putAll(values);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NutrientMap other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "NutrientMap" + toJsonKeys();
    }
}
