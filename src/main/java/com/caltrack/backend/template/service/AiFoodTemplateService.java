package com.caltrack.backend.template.service;

import com.caltrack.backend.common.time.LocalDayResolver;
import com.caltrack.backend.common.tx.StoreWriteGate;
import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.dailylog.repo.FoodEntryRepository;
import com.caltrack.backend.dailylog.service.DailyLogService;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.product.repo.ProductRepository;
import com.caltrack.backend.scaling.NutritionSnapshot;
import com.caltrack.backend.scaling.ScalingEngine;
import com.caltrack.backend.template.dto.AiFoodEstimate;
import com.caltrack.backend.template.dto.DerivedProduct;
import com.caltrack.backend.template.entity.AiFoodTemplateEntity;
import com.caltrack.backend.template.repo.AiFoodTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Reusable AI estimates. Values are absolute for the template's amount, not per 100 g.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class AiFoodTemplateService {

    private final AiFoodTemplateRepository templateRepo;
    private final FoodEntryRepository entryRepo;
    private final ProductRepository productRepo;
    private final DailyLogService dailyLogService;
    private final ScalingEngine scaling;
    private final LocalDayResolver days;
    private final StoreWriteGate gate;

    /**
     * Saves the estimate as a template. A template with the same name (case-insensitive)
     * is refreshed with the new values and counted as a use.
     */
    public AiFoodTemplateEntity saveEstimate(AiFoodEstimate estimate) {
        return gate.write(() -> {
            AiFoodTemplateEntity t = templateRepo.findFirstByNameIgnoreCase(estimate.name())
                    .map(existing -> {
                        existing.recordUse(days.now());
                        return existing;
                    })
                    .orElseGet(() -> {
                        AiFoodTemplateEntity fresh = new AiFoodTemplateEntity();
                        fresh.setDateCreated(days.now());
                        fresh.setLastUsed(days.now());
                        return fresh;
                    });

            t.setName(estimate.name());
            t.setAmount(estimate.amount());
            t.setUnit(estimate.unit());
            t.setWeightInGrams(estimate.weightInGrams());
            t.applySnapshot(estimate.nutrition());
            t.setAiPrompt(estimate.aiPrompt());
            return templateRepo.save(t);
        });
    }

    /** Template from an AI-generated entry; the entry's amount doubles as its weight for gram units. */
    public AiFoodTemplateEntity saveFromEntry(String entryId) {
        return gate.write(() -> {
            FoodEntryEntity e = entryRepo.findById(entryId)
                    .orElseThrow(() -> new NoSuchElementException("FOOD_ENTRY_NOT_FOUND"));
            if (!e.isAiGenerated()) {
                throw new IllegalArgumentException("ENTRY_NOT_AI_GENERATED");
            }
            String name = e.displayName(null);
            return saveEstimate(new AiFoodEstimate(
                    name, e.getAmount(), e.getUnit(), e.getAmount(), e.snapshot(), e.getAiPrompt()));
        });
    }

    @Transactional(readOnly = true)
    public List<AiFoodTemplateEntity> listRecent() {
        return templateRepo.findAllByOrderByLastUsedDesc();
    }

    public AiFoodTemplateEntity recordUse(String templateId) {
        return gate.write(() -> {
            AiFoodTemplateEntity t = require(templateId);
            t.recordUse(days.now());
            return templateRepo.save(t);
        });
    }

    /** Logs the template as a custom entry with its frozen values. */
    public FoodEntryEntity createEntry(String templateId, Instant at) {
        return gate.write(() -> {
            AiFoodTemplateEntity t = require(templateId);
            t.recordUse(days.now());
            templateRepo.save(t);

            DailyLogEntity day = dailyLogService.findOrCreateForDay(at);
            FoodEntryEntity e = new FoodEntryEntity();
            e.setCustomFoodName(t.getName());
            e.setDailyLogId(day.getId());
            e.setAmount(t.getAmount());
            e.setUnit(t.getUnit());
            e.setTimestamp(at);
            e.applySnapshot(t.snapshot());
            e.setAiGenerated(true);
            e.setAiPrompt(t.getAiPrompt());
            return entryRepo.save(e);
        });
    }

    /**
     * Converts the template into a custom per-100g product and logs one entry of the
     * template's weight against it.
     */
    public DerivedProduct deriveProduct(String templateId, Instant at) {
        return gate.write(() -> {
            AiFoodTemplateEntity t = require(templateId);
            double weight = t.getWeightInGrams();

            ProductEntity draft = scaling.derivePer100gFromWeight(t.snapshot(), weight);
            draft.setName(t.getName());
            draft.setCustom(true);
            draft.setServingSize(100.0);
            draft.setServingSizeUnit("g");
            draft.setNotes(t.getAiPrompt());
            ProductEntity product = productRepo.save(draft);

            double grams = Math.max(weight, 1.0);
            NutritionSnapshot s = scaling.scaleFromPer100g(product, grams);
            DailyLogEntity day = dailyLogService.findOrCreateForDay(at);

            FoodEntryEntity e = new FoodEntryEntity();
            e.setProductId(product.getId());
            e.setProductName(product.getName());
            e.setDailyLogId(day.getId());
            e.setAmount(grams);
            e.setUnit("g");
            e.setTimestamp(at);
            e.applySnapshot(s);
            e.setAiGenerated(true);
            e.setAiPrompt(t.getAiPrompt());
            FoodEntryEntity entry = entryRepo.save(e);

            log.info("template converted to product. template={} product={}", t.getId(), product.getId());
            return new DerivedProduct(product, entry);
        });
    }

    private AiFoodTemplateEntity require(String templateId) {
        return templateRepo.findById(templateId)
                .orElseThrow(() -> new NoSuchElementException("AI_TEMPLATE_NOT_FOUND"));
    }
}
