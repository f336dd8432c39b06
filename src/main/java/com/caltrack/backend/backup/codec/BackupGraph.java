package com.caltrack.backend.backup.codec;

import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.supplement.entity.SupplementEntity;
import com.caltrack.backend.supplement.entity.SupplementEntryEntity;
import com.caltrack.backend.template.entity.AiFoodTemplateEntity;

import java.util.List;

/**
 * One flat list per entity type; cross references are plain ids.
 * Used for the live store, a decoded document and the set of rows an import creates.
 */
public record BackupGraph(
        List<ProductEntity> products,
        List<DailyLogEntity> dailyLogs,
        List<FoodEntryEntity> foodEntries,
        List<AiFoodTemplateEntity> aiTemplates,
        List<SupplementEntity> supplements,
        List<SupplementEntryEntity> supplementEntries
) {

    public static final BackupGraph EMPTY = new BackupGraph(
            List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

    public BackupGraph {
        products = products == null ? List.of() : products;
        dailyLogs = dailyLogs == null ? List.of() : dailyLogs;
        foodEntries = foodEntries == null ? List.of() : foodEntries;
        aiTemplates = aiTemplates == null ? List.of() : aiTemplates;
        supplements = supplements == null ? List.of() : supplements;
        supplementEntries = supplementEntries == null ? List.of() : supplementEntries;
    }

    public int entityCount() {
        return products.size() + dailyLogs.size() + foodEntries.size()
                + aiTemplates.size() + supplements.size() + supplementEntries.size();
    }
}
