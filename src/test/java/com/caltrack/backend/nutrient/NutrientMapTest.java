package com.caltrack.backend.nutrient;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class NutrientMapTest {

    @Test
    void from_json_keys_drops_unknown_keys_and_nulls() {
        Map<String, Double> raw = new HashMap<>();
        raw.put("iron", 2.0);
        raw.put("vitaminC", null);
        raw.put("caffeine", 80.0);

        NutrientMap m = NutrientMap.fromJsonKeys(raw);

        assertThat(m.size()).isEqualTo(1);
        assertThat(m.valueOrNull(NutrientId.IRON)).isEqualTo(2.0);
        assertThat(m.contains(NutrientId.VITAMIN_C)).isFalse();
    }

    @Test
    void map_touches_present_keys_only_and_keeps_zero() {
        NutrientMap m = NutrientMap.EMPTY
                .with(NutrientId.IRON, 2.0)
                .with(NutrientId.ZINC, 0.0);

        NutrientMap doubled = m.map(v -> v * 2);

        assertThat(doubled.valueOrNull(NutrientId.IRON)).isEqualTo(4.0);
        assertThat(doubled.valueOrNull(NutrientId.ZINC)).isEqualTo(0.0);
        assertThat(doubled.contains(NutrientId.CALCIUM)).isFalse();
        assertThat(doubled.size()).isEqualTo(2);
    }

    @Test
    void plus_is_a_key_union() {
        NutrientMap a = NutrientMap.EMPTY.with(NutrientId.IRON, 2.0).with(NutrientId.ZINC, 1.0);
        NutrientMap b = NutrientMap.EMPTY.with(NutrientId.IRON, 3.0).with(NutrientId.VITAMIN_D, 25.0);

        NutrientMap sum = a.plus(b);

        assertThat(sum.valueOrNull(NutrientId.IRON)).isEqualTo(5.0);
        assertThat(sum.valueOrNull(NutrientId.ZINC)).isEqualTo(1.0);
        assertThat(sum.valueOrNull(NutrientId.VITAMIN_D)).isEqualTo(25.0);
        // operands untouched
        assertThat(a.size()).isEqualTo(2);
    }

    @Test
    void json_keys_follow_enum_order() {
        NutrientMap m = NutrientMap.EMPTY
                .with(NutrientId.CHLORIDE, 1.0)
                .with(NutrientId.VITAMIN_A, 2.0);

        assertThat(m.toJsonKeys().keySet()).containsExactly("vitaminA", "chloride");
    }

    @Test
    void converter_stores_empty_as_null() {
        NutrientMapConverter c = new NutrientMapConverter();

        assertThat(c.convertToDatabaseColumn(NutrientMap.EMPTY)).isNull();
        assertThat(c.convertToEntityAttribute(null)).isSameAs(NutrientMap.EMPTY);
        assertThat(c.convertToEntityAttribute("  ")).isSameAs(NutrientMap.EMPTY);

        String column = c.convertToDatabaseColumn(NutrientMap.EMPTY.with(NutrientId.IRON, 2.5));
        assertThat(column).isEqualTo("{\"iron\":2.5}");
        assertThat(c.convertToEntityAttribute("{\"iron\":2.5,\"legacyField\":1}").valueOrNull(NutrientId.IRON))
                .isEqualTo(2.5);
    }
}
