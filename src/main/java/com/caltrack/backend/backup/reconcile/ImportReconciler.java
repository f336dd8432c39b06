package com.caltrack.backend.backup.reconcile;

import com.caltrack.backend.backup.codec.BackupGraph;
import com.caltrack.backend.backup.config.BackupProperties;
import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.supplement.entity.SupplementEntity;
import com.caltrack.backend.supplement.entity.SupplementEntryEntity;
import com.caltrack.backend.template.entity.AiFoodTemplateEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Decides create-vs-skip for every incoming entity and remaps foreign keys.
 *
 * Existing data wins: a match is skipped, never merged field by field.
 * Stage order matters (products, supplements, days, food entries, supplement entries, templates)
 * because entries are re-homed through the id maps the earlier stages build.
 *
 * Pure: reads both graphs, mutates only the incoming entities it decides to create.
 */
@Slf4j
@Component
public class ImportReconciler {

    private final Duration tolerance;

    public ImportReconciler(BackupProperties props) {
        this.tolerance = props.getEntryTimestampTolerance();
    }

    public ImportPlan reconcile(BackupGraph incoming, BackupGraph live) {
        Run run = new Run(live);

        run.products(incoming.products());
        run.supplements(incoming.supplements());
        run.dailyLogs(incoming.dailyLogs());
        run.foodEntries(incoming.foodEntries());
        run.supplementEntries(incoming.supplementEntries());
        run.templates(incoming.aiTemplates());

        return new ImportPlan(
                new BackupGraph(run.newProducts, run.newDays, run.newFoodEntries,
                        run.newTemplates, run.newSupplements, run.newSupplementEntries),
                run.summary.build()
        );
    }

    /** State of one import. Indexes grow as entities are created so in-document duplicates are skipped. */
    private final class Run {

        final ImportSummary.Builder summary = new ImportSummary.Builder();

        final List<ProductEntity> newProducts = new ArrayList<>();
        final List<DailyLogEntity> newDays = new ArrayList<>();
        final List<FoodEntryEntity> newFoodEntries = new ArrayList<>();
        final List<AiFoodTemplateEntity> newTemplates = new ArrayList<>();
        final List<SupplementEntity> newSupplements = new ArrayList<>();
        final List<SupplementEntryEntity> newSupplementEntries = new ArrayList<>();

        // incoming id -> id in the store after import
        final Map<String, String> productIds = new HashMap<>();
        final Map<String, String> supplementIds = new HashMap<>();
        final Map<String, String> dayIds = new HashMap<>();

        // store id -> name, for entries that lack a name snapshot
        final Map<String, String> productNames = new HashMap<>();
        final Map<String, String> supplementNames = new HashMap<>();

        final Map<String, ProductEntity> byBarcode = new HashMap<>();
        final Map<IdentityMatchers.NameBrand, ProductEntity> productsByNameBrand = new HashMap<>();
        final Map<IdentityMatchers.NameBrand, SupplementEntity> supplementsByNameBrand = new HashMap<>();
        final Map<LocalDate, DailyLogEntity> daysByDate = new HashMap<>();
        final Map<String, AiFoodTemplateEntity> templatesByName = new HashMap<>();
        final TimeWindowIndex<FoodEntryEntity> foodEntriesByTime = new TimeWindowIndex<>();
        final TimeWindowIndex<SupplementEntryEntity> supplementEntriesByTime = new TimeWindowIndex<>();

        final Set<String> productIdsTaken = new HashSet<>();
        final Set<String> supplementIdsTaken = new HashSet<>();
        final Set<String> dayIdsTaken = new HashSet<>();
        final Set<String> foodEntryIdsTaken = new HashSet<>();
        final Set<String> supplementEntryIdsTaken = new HashSet<>();
        final Set<String> templateIdsTaken = new HashSet<>();

        Run(BackupGraph live) {
            live.products().forEach(this::indexProduct);
            live.supplements().forEach(this::indexSupplement);
            live.dailyLogs().forEach(this::indexDay);
            live.foodEntries().forEach(this::indexFoodEntry);
            live.supplementEntries().forEach(this::indexSupplementEntry);
            live.aiTemplates().forEach(this::indexTemplate);
        }

        // ===== stages =====

        void products(List<ProductEntity> incoming) {
            for (ProductEntity p : incoming) {
                String incomingId = p.getId();
                ProductEntity match = findProduct(p);
                if (match != null) {
                    productIds.put(incomingId, match.getId());
                    summary.product(false);
                    log.debug("import product skipped. incoming={} existing={}", incomingId, match.getId());
                    continue;
                }
                p.setId(claimId(incomingId, productIdsTaken));
                productIds.put(incomingId, p.getId());
                indexProduct(p);
                newProducts.add(p);
                summary.product(true);
            }
        }

        void supplements(List<SupplementEntity> incoming) {
            for (SupplementEntity s : incoming) {
                String incomingId = s.getId();
                SupplementEntity match = supplementsByNameBrand.get(IdentityMatchers.nameBrandKey(s));
                if (match != null) {
                    supplementIds.put(incomingId, match.getId());
                    summary.supplement(false);
                    log.debug("import supplement skipped. incoming={} existing={}", incomingId, match.getId());
                    continue;
                }
                s.setId(claimId(incomingId, supplementIdsTaken));
                supplementIds.put(incomingId, s.getId());
                indexSupplement(s);
                newSupplements.add(s);
                summary.supplement(true);
            }
        }

        void dailyLogs(List<DailyLogEntity> incoming) {
            for (DailyLogEntity d : incoming) {
                String incomingId = d.getId();
                DailyLogEntity match = daysByDate.get(d.getLogDate());
                if (match != null) {
                    dayIds.put(incomingId, match.getId());
                    summary.day(false);
                    log.debug("import day skipped. date={} existing={}", d.getLogDate(), match.getId());
                    continue;
                }
                d.setId(claimId(incomingId, dayIdsTaken));
                dayIds.put(incomingId, d.getId());
                indexDay(d);
                newDays.add(d);
                summary.day(true);
            }
        }

        void foodEntries(List<FoodEntryEntity> incoming) {
            for (FoodEntryEntity e : incoming) {
                FoodEntryEntity match = foodEntriesByTime
                        .find(e.getTimestamp(), tolerance, ex -> IdentityMatchers.sameFoodEntry(ex, e, tolerance))
                        .orElse(null);
                if (match != null) {
                    summary.foodEntry(false);
                    log.debug("import food entry skipped. incoming={} existing={}", e.getId(), match.getId());
                    continue;
                }
                e.setId(claimId(e.getId(), foodEntryIdsTaken));
                e.setProductId(remap(e.getProductId(), productIds, productIdsTaken));
                e.setDailyLogId(remap(e.getDailyLogId(), dayIds, dayIdsTaken));
                if (e.getProductName() == null && e.getProductId() != null) {
                    e.setProductName(productNames.get(e.getProductId()));
                }
                indexFoodEntry(e);
                newFoodEntries.add(e);
                summary.foodEntry(true);
            }
        }

        void supplementEntries(List<SupplementEntryEntity> incoming) {
            for (SupplementEntryEntity e : incoming) {
                SupplementEntryEntity match = supplementEntriesByTime
                        .find(e.getTimestamp(), tolerance, ex -> IdentityMatchers.sameSupplementEntry(ex, e, tolerance))
                        .orElse(null);
                if (match != null) {
                    summary.supplementEntry(false);
                    continue;
                }
                e.setId(claimId(e.getId(), supplementEntryIdsTaken));
                e.setSupplementId(remap(e.getSupplementId(), supplementIds, supplementIdsTaken));
                e.setDailyLogId(remap(e.getDailyLogId(), dayIds, dayIdsTaken));
                if (e.getSupplementName() == null && e.getSupplementId() != null) {
                    e.setSupplementName(supplementNames.get(e.getSupplementId()));
                }
                indexSupplementEntry(e);
                newSupplementEntries.add(e);
                summary.supplementEntry(true);
            }
        }

        void templates(List<AiFoodTemplateEntity> incoming) {
            for (AiFoodTemplateEntity t : incoming) {
                AiFoodTemplateEntity match = templatesByName.get(IdentityMatchers.templateKey(t));
                if (match != null) {
                    summary.template(false);
                    log.debug("import template skipped. name={} existing={}", t.getName(), match.getId());
                    continue;
                }
                t.setId(claimId(t.getId(), templateIdsTaken));
                indexTemplate(t);
                newTemplates.add(t);
                summary.template(true);
            }
        }

        // ===== identity =====

        ProductEntity findProduct(ProductEntity incoming) {
            String barcode = IdentityMatchers.barcodeKey(incoming);
            if (barcode != null) {
                ProductEntity byCode = byBarcode.get(barcode);
                if (byCode != null) return byCode;
            }
            return productsByNameBrand.get(IdentityMatchers.nameBrandKey(incoming));
        }

        /**
         * Through the id map first; an id already present in the store is kept;
         * anything else is dangling and dropped.
         */
        String remap(String foreignId, Map<String, String> idMap, Set<String> storeIds) {
            if (foreignId == null) return null;
            String mapped = idMap.get(foreignId);
            if (mapped != null) return mapped;
            if (storeIds.contains(foreignId)) return foreignId;
            summary.dangling();
            log.debug("import dropped dangling reference. id={}", foreignId);
            return null;
        }

        /** keeps the incoming id unless the store already uses it */
        String claimId(String incomingId, Set<String> taken) {
            if (incomingId != null && taken.add(incomingId)) return incomingId;
            String fresh;
            do {
                fresh = UUID.randomUUID().toString();
            } while (!taken.add(fresh));
            return fresh;
        }

        // ===== indexes =====

        void indexProduct(ProductEntity p) {
            productIdsTaken.add(p.getId());
            productNames.put(p.getId(), p.getName());
            String barcode = IdentityMatchers.barcodeKey(p);
            if (barcode != null) byBarcode.putIfAbsent(barcode, p);
            productsByNameBrand.putIfAbsent(IdentityMatchers.nameBrandKey(p), p);
        }

        void indexSupplement(SupplementEntity s) {
            supplementIdsTaken.add(s.getId());
            supplementNames.put(s.getId(), s.getName());
            supplementsByNameBrand.putIfAbsent(IdentityMatchers.nameBrandKey(s), s);
        }

        void indexDay(DailyLogEntity d) {
            dayIdsTaken.add(d.getId());
            daysByDate.putIfAbsent(d.getLogDate(), d);
        }

        void indexFoodEntry(FoodEntryEntity e) {
            foodEntryIdsTaken.add(e.getId());
            foodEntriesByTime.add(e.getTimestamp(), e);
        }

        void indexSupplementEntry(SupplementEntryEntity e) {
            supplementEntryIdsTaken.add(e.getId());
            supplementEntriesByTime.add(e.getTimestamp(), e);
        }

        void indexTemplate(AiFoodTemplateEntity t) {
            templateIdsTaken.add(t.getId());
            templatesByName.putIfAbsent(IdentityMatchers.templateKey(t), t);
        }
    }
}
