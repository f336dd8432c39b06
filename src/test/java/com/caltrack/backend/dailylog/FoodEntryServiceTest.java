package com.caltrack.backend.dailylog;

import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.dailylog.service.FoodEntryService;
import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.product.service.ProductService;
import com.caltrack.backend.scaling.InvalidAmountException;
import com.caltrack.backend.scaling.NutritionSnapshot;
import com.caltrack.backend.template.dto.AiFoodEstimate;
import com.caltrack.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
class FoodEntryServiceTest extends BaseSpringTest {

    @Autowired FoodEntryService foodEntryService;
    @Autowired ProductService productService;

    private final Instant at = Instant.parse("2026-01-15T12:00:00Z");

    private ProductEntity yoghurt() {
        ProductEntity p = new ProductEntity();
        p.setName("Greek Yoghurt");
        p.setCaloriesPer100g(82.0);
        p.setProteinPer100g(4.5);
        p.setPortionGrams(115.0);
        return productService.create(p);
    }

    @Test
    void log_two_portions() {
        ProductEntity p = yoghurt();

        FoodEntryEntity e = foodEntryService.logProductPortions(p.getId(), 2, at);

        FoodEntryEntity stored = foodEntryRepo.findById(e.getId()).orElseThrow();
        assertThat(stored.getAmount()).isEqualTo(230.0);
        assertThat(stored.getCalories()).isCloseTo(188.6, within(1e-9));
        assertThat(stored.getProtein()).isCloseTo(10.35, within(1e-9));
        assertThat(stored.getProductName()).isEqualTo("Greek Yoghurt");
        assertThat(stored.getDailyLogId()).isNotNull();
    }

    @Test
    void snapshot_does_not_follow_later_product_edits() {
        ProductEntity p = yoghurt();
        FoodEntryEntity e = foodEntryService.logProductGrams(p.getId(), 100, at);

        ProductEntity edited = productRepo.findById(p.getId()).orElseThrow();
        edited.setCaloriesPer100g(150.0);
        edited.setName("Greek Yoghurt (new recipe)");
        productRepo.save(edited);

        FoodEntryEntity stored = foodEntryRepo.findById(e.getId()).orElseThrow();
        assertThat(stored.getCalories()).isEqualTo(82.0);
        // live name still wins for display
        assertThat(foodEntryService.displayName(e.getId())).isEqualTo("Greek Yoghurt (new recipe)");
    }

    @Test
    void direct_amount_is_clamped_and_rescaled() {
        FoodEntryEntity e = foodEntryService.logProductGrams(yoghurt().getId(), 100, at);

        FoodEntryEntity big = foodEntryService.setAmount(e.getId(), 9000);
        assertThat(big.getAmount()).isEqualTo(5000.0);
        assertThat(big.getCalories()).isCloseTo(4100.0, within(1e-9));

        FoodEntryEntity tiny = foodEntryService.adjustAmount(e.getId(), -6000);
        assertThat(tiny.getAmount()).isEqualTo(1.0);
        assertThat(tiny.getCalories()).isCloseTo(0.82, within(1e-9));
    }

    @Test
    void zero_grams_are_rejected() {
        ProductEntity p = yoghurt();

        assertThatThrownBy(() -> foodEntryService.logProductGrams(p.getId(), 0, at))
                .isInstanceOf(InvalidAmountException.class);
        assertThat(foodEntryRepo.count()).isZero();
    }

    @Test
    void estimate_becomes_a_custom_ai_entry() {
        NutritionSnapshot n = new NutritionSnapshot(640.0, 28.0, 80.0, 22.0, null, null, null, 6.0, 1.9, NutrientMap.EMPTY);
        FoodEntryEntity e = foodEntryService.logEstimate(
                new AiFoodEstimate("Ramen", 1, "bowl", 550, n, "photo of ramen"), at);

        assertThat(e.isAiGenerated()).isTrue();
        assertThat(e.getProductId()).isNull();
        assertThat(e.getSugar()).isNull();
        assertThat(foodEntryService.displayName(e.getId())).isEqualTo("Ramen");

        foodEntryService.delete(e.getId());
        assertThat(foodEntryRepo.count()).isZero();
    }
}
