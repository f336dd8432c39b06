package com.caltrack.backend.template;

import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.dailylog.service.FoodEntryService;
import com.caltrack.backend.nutrient.NutrientId;
import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.scaling.NutritionSnapshot;
import com.caltrack.backend.template.dto.AiFoodEstimate;
import com.caltrack.backend.template.dto.DerivedProduct;
import com.caltrack.backend.template.entity.AiFoodTemplateEntity;
import com.caltrack.backend.template.service.AiFoodTemplateService;
import com.caltrack.backend.testsupport.BaseSpringTest;
import com.caltrack.backend.testsupport.FixedClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
class AiFoodTemplateServiceTest extends BaseSpringTest {

    @Autowired AiFoodTemplateService templateService;
    @Autowired FoodEntryService foodEntryService;

    private final Instant at = Instant.parse("2026-01-15T19:00:00Z");

    private static AiFoodEstimate curry(String name) {
        NutritionSnapshot n = new NutritionSnapshot(700.0, 35.0, 90.0, 20.0, 8.0, null, null, 7.0, 1.2,
                NutrientMap.EMPTY.with(NutrientId.IRON, 5.6));
        return new AiFoodEstimate(name, 1, "plate", 400, n, "chicken curry with rice");
    }

    @Test
    void saving_the_same_name_refreshes_and_counts_a_use() {
        AiFoodTemplateEntity first = templateService.saveEstimate(curry("Chicken Curry"));
        AiFoodTemplateEntity again = templateService.saveEstimate(curry("chicken curry"));

        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(again.getUseCount()).isEqualTo(2);
        assertThat(again.getLastUsed()).isEqualTo(FixedClockConfig.NOW);
        assertThat(templateRepo.count()).isEqualTo(1);
    }

    @Test
    void create_entry_copies_the_snapshot() {
        AiFoodTemplateEntity t = templateService.saveEstimate(curry("Chicken Curry"));

        FoodEntryEntity e = templateService.createEntry(t.getId(), at);

        assertThat(e.isAiGenerated()).isTrue();
        assertThat(e.getCalories()).isEqualTo(700.0);
        assertThat(e.getNutrients().valueOrNull(NutrientId.IRON)).isEqualTo(5.6);
        assertThat(e.getCustomFoodName()).isEqualTo("Chicken Curry");
        assertThat(templateRepo.findById(t.getId()).orElseThrow().getUseCount()).isEqualTo(2);
    }

    @Test
    void derive_product_scales_to_per_100g() {
        AiFoodTemplateEntity t = templateService.saveEstimate(curry("Chicken Curry"));

        DerivedProduct d = templateService.deriveProduct(t.getId(), at);

        assertThat(d.product().isCustom()).isTrue();
        assertThat(d.product().getCaloriesPer100g()).isCloseTo(175.0, within(1e-9));
        assertThat(d.product().getNutrientsPer100g().valueOrNull(NutrientId.IRON)).isCloseTo(1.4, within(1e-9));
        assertThat(d.product().getSodiumPer100g()).isCloseTo(0.3, within(1e-9));

        assertThat(d.entry().getProductId()).isEqualTo(d.product().getId());
        assertThat(d.entry().getAmount()).isEqualTo(400.0);
        assertThat(d.entry().getCalories()).isCloseTo(700.0, within(1e-9));
        assertThat(d.entry().getNaturalSugar()).isNull();
    }

    @Test
    void template_from_an_ai_entry() {
        FoodEntryEntity e = foodEntryService.logEstimate(curry("Dal"), at);

        AiFoodTemplateEntity t = templateService.saveFromEntry(e.getId());

        assertThat(t.getName()).isEqualTo("Dal");
        assertThat(t.getCalories()).isEqualTo(700.0);
        assertThat(templateService.listRecent()).extracting(AiFoodTemplateEntity::getId).containsExactly(t.getId());
    }
}
