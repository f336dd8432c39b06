package com.caltrack.backend.testsupport;

import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.nutrient.NutrientId;
import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.supplement.entity.SupplementEntity;
import com.caltrack.backend.supplement.entity.SupplementEntryEntity;
import com.caltrack.backend.template.entity.AiFoodTemplateEntity;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

/** Detached entities for unit tests. */
public final class Fixtures {

    private Fixtures() {}

    public static String uuid() {
        return UUID.randomUUID().toString();
    }

    public static ProductEntity product(String id, String name, String brand, String barcode) {
        ProductEntity p = new ProductEntity();
        p.setId(id);
        p.setName(name);
        p.setBrand(brand);
        p.setBarcode(barcode);
        p.setCaloriesPer100g(82.0);
        p.setProteinPer100g(4.5);
        p.setCarbsPer100g(12.0);
        p.setFatPer100g(1.5);
        p.setNutrientsPer100g(NutrientMap.of(Map.of(NutrientId.IRON, 1.2)));
        p.setDateAdded(Instant.parse("2026-01-01T00:00:00Z"));
        return p;
    }

    public static DailyLogEntity day(String id, LocalDate date) {
        DailyLogEntity d = new DailyLogEntity();
        d.setId(id);
        d.setLogDate(date);
        d.setCalorieTarget(2000);
        d.setProteinTarget(50);
        d.setCarbTarget(250);
        d.setFatTarget(65);
        return d;
    }

    public static FoodEntryEntity entry(String id, String productId, String dayId, Instant at, Double calories) {
        FoodEntryEntity e = new FoodEntryEntity();
        e.setId(id);
        e.setProductId(productId);
        e.setDailyLogId(dayId);
        e.setAmount(100);
        e.setUnit("g");
        e.setTimestamp(at);
        e.setCalories(calories);
        e.setProtein(4.5);
        return e;
    }

    public static AiFoodTemplateEntity template(String id, String name) {
        AiFoodTemplateEntity t = new AiFoodTemplateEntity();
        t.setId(id);
        t.setName(name);
        t.setAmount(1);
        t.setUnit("bowl");
        t.setWeightInGrams(350);
        t.setCalories(420.0);
        t.setProtein(30.0);
        t.setUseCount(1);
        t.setLastUsed(Instant.parse("2026-01-10T12:00:00Z"));
        t.setDateCreated(Instant.parse("2026-01-10T12:00:00Z"));
        return t;
    }

    public static SupplementEntity supplement(String id, String name, String brand) {
        SupplementEntity s = new SupplementEntity();
        s.setId(id);
        s.setName(name);
        s.setBrand(brand);
        s.setServingSize(1.0);
        s.setNutrientsPerServing(NutrientMap.of(Map.of(NutrientId.VITAMIN_D, 25.0)));
        s.setDateAdded(Instant.parse("2026-01-01T00:00:00Z"));
        return s;
    }

    public static SupplementEntryEntity supplementEntry(String id, String supplementId, String dayId,
                                                        Instant at, double amount) {
        SupplementEntryEntity e = new SupplementEntryEntity();
        e.setId(id);
        e.setSupplementId(supplementId);
        e.setDailyLogId(dayId);
        e.setAmount(amount);
        e.setTimestamp(at);
        e.setNutrients(NutrientMap.of(Map.of(NutrientId.VITAMIN_D, 25.0 * amount)));
        return e;
    }
}
