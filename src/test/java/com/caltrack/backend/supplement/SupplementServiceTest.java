package com.caltrack.backend.supplement;

import com.caltrack.backend.nutrient.NutrientId;
import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.supplement.entity.SupplementEntity;
import com.caltrack.backend.supplement.entity.SupplementEntryEntity;
import com.caltrack.backend.supplement.service.SupplementService;
import com.caltrack.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
class SupplementServiceTest extends BaseSpringTest {

    @Autowired SupplementService supplementService;

    private SupplementEntity multivitamin() {
        SupplementEntity s = new SupplementEntity();
        s.setName("Multivitamin");
        s.setBrand("Centrum");
        s.setServingSize(2.0);
        s.setNutrientsPerServing(NutrientMap.EMPTY
                .with(NutrientId.VITAMIN_C, 80.0)
                .with(NutrientId.ZINC, 10.0));
        return supplementService.create(s);
    }

    @Test
    void servings_scale_nutrients() {
        SupplementEntity s = multivitamin();

        SupplementEntryEntity e = supplementService.logServings(s.getId(), 1, Instant.parse("2026-01-15T08:00:00Z"));

        assertThat(e.getNutrients().valueOrNull(NutrientId.VITAMIN_C)).isEqualTo(40.0);
        assertThat(e.getNutrients().valueOrNull(NutrientId.ZINC)).isEqualTo(5.0);
        assertThat(e.getUnit()).isEqualTo("tablet");
        assertThat(supplementService.entriesForDay(e.getDailyLogId())).hasSize(1);
    }

    @Test
    void deleting_a_supplement_keeps_its_entries_by_name() {
        SupplementEntity s = multivitamin();
        SupplementEntryEntity e = supplementService.logServings(s.getId(), 2, Instant.parse("2026-01-15T08:00:00Z"));

        supplementService.delete(s.getId());

        SupplementEntryEntity stored = supplementEntryRepo.findById(e.getId()).orElseThrow();
        assertThat(stored.getSupplementId()).isNull();
        assertThat(stored.displayName()).isEqualTo("Multivitamin");
        assertThat(stored.getNutrients().valueOrNull(NutrientId.VITAMIN_C)).isEqualTo(80.0);

        supplementService.deleteEntry(e.getId());
        assertThat(supplementEntryRepo.count()).isZero();
    }
}
