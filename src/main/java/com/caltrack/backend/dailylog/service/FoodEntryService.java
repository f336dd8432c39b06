package com.caltrack.backend.dailylog.service;

import com.caltrack.backend.common.tx.StoreWriteGate;
import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.dailylog.repo.FoodEntryRepository;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.product.repo.ProductRepository;
import com.caltrack.backend.scaling.NutritionSnapshot;
import com.caltrack.backend.scaling.ScalingEngine;
import com.caltrack.backend.template.dto.AiFoodEstimate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Consumption entries. Nutrition is frozen at creation; later product edits never reach
 * existing entries, only amount changes re-scale them.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class FoodEntryService {

    private final FoodEntryRepository entryRepo;
    private final ProductRepository productRepo;
    private final DailyLogService dailyLogService;
    private final ScalingEngine scaling;
    private final StoreWriteGate gate;

    public FoodEntryEntity logProductGrams(String productId, double grams, Instant at) {
        return gate.write(() -> {
            ProductEntity p = requireProduct(productId);
            NutritionSnapshot s = scaling.scaleFromPer100g(p, grams);
            return saveProductEntry(p, grams, s, at);
        });
    }

    public FoodEntryEntity logProductPortions(String productId, double portions, Instant at) {
        return gate.write(() -> {
            ProductEntity p = requireProduct(productId);
            NutritionSnapshot s = scaling.scaleFromPortions(p, portions);
            return saveProductEntry(p, scaling.gramsForPortions(p, portions), s, at);
        });
    }

    /** Custom entry straight from an accepted estimate; no product is created. */
    public FoodEntryEntity logEstimate(AiFoodEstimate estimate, Instant at) {
        return gate.write(() -> {
            DailyLogEntity day = dailyLogService.findOrCreateForDay(at);

            FoodEntryEntity e = new FoodEntryEntity();
            e.setCustomFoodName(estimate.name());
            e.setDailyLogId(day.getId());
            e.setAmount(estimate.amount());
            e.setUnit(estimate.unit());
            e.setTimestamp(at);
            e.applySnapshot(estimate.nutrition());
            e.setAiGenerated(true);
            e.setAiPrompt(estimate.aiPrompt());
            return entryRepo.save(e);
        });
    }

    /** Amount typed in directly: clamped to [min, maxDirect], nutrition re-scaled by ratio. */
    public FoodEntryEntity setAmount(String entryId, double newAmount) {
        return gate.write(() -> {
            FoodEntryEntity e = requireEntry(entryId);
            NutritionSnapshot s = scaling.rescaleDirect(e, newAmount);
            e.setAmount(scaling.clampDirectAmount(newAmount));
            e.applySnapshot(s);
            return entryRepo.save(e);
        });
    }

    /** Stepper adjustment: clamped to the minimum only. */
    public FoodEntryEntity adjustAmount(String entryId, double delta) {
        return gate.write(() -> {
            FoodEntryEntity e = requireEntry(entryId);
            double target = scaling.clampStepAmount(e.getAmount() + delta);
            NutritionSnapshot s = scaling.rescale(e, target);
            e.setAmount(target);
            e.applySnapshot(s);
            return entryRepo.save(e);
        });
    }

    public void delete(String entryId) {
        gate.run(() -> {
            FoodEntryEntity e = requireEntry(entryId);
            entryRepo.delete(e);
        });
    }

    @Transactional(readOnly = true)
    public List<FoodEntryEntity> entriesForDay(String dailyLogId) {
        return entryRepo.findByDailyLogIdOrderByTimestampAsc(dailyLogId);
    }

    @Transactional(readOnly = true)
    public String displayName(String entryId) {
        FoodEntryEntity e = requireEntry(entryId);
        ProductEntity live = e.getProductId() == null
                ? null
                : productRepo.findById(e.getProductId()).orElse(null);
        return e.displayName(live);
    }

    private FoodEntryEntity saveProductEntry(ProductEntity p, double grams, NutritionSnapshot s, Instant at) {
        DailyLogEntity day = dailyLogService.findOrCreateForDay(at);

        FoodEntryEntity e = new FoodEntryEntity();
        e.setProductId(p.getId());
        e.setProductName(p.getName());
        e.setDailyLogId(day.getId());
        e.setAmount(grams);
        e.setUnit("g");
        e.setTimestamp(at);
        e.applySnapshot(s);

        FoodEntryEntity saved = entryRepo.save(e);
        log.debug("food entry logged. product={} grams={} day={}", p.getId(), grams, day.getLogDate());
        return saved;
    }

    private ProductEntity requireProduct(String productId) {
        return productRepo.findById(productId)
                .orElseThrow(() -> new NoSuchElementException("PRODUCT_NOT_FOUND"));
    }

    private FoodEntryEntity requireEntry(String entryId) {
        return entryRepo.findById(entryId)
                .orElseThrow(() -> new NoSuchElementException("FOOD_ENTRY_NOT_FOUND"));
    }
}
