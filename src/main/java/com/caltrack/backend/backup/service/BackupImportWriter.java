package com.caltrack.backend.backup.service;

import com.caltrack.backend.backup.codec.BackupGraph;
import com.caltrack.backend.common.tx.StoreWriteGate;
import com.caltrack.backend.dailylog.repo.DailyLogRepository;
import com.caltrack.backend.dailylog.repo.FoodEntryRepository;
import com.caltrack.backend.product.repo.ProductRepository;
import com.caltrack.backend.supplement.repo.SupplementEntryRepository;
import com.caltrack.backend.supplement.repo.SupplementRepository;
import com.caltrack.backend.template.repo.AiFoodTemplateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Inserts a reconciled graph. Must run under {@link StoreWriteGate}; the gate's transaction
 * makes the whole insert all-or-nothing.
 */
@RequiredArgsConstructor
@Component
public class BackupImportWriter {

    private final ProductRepository productRepo;
    private final DailyLogRepository dayRepo;
    private final FoodEntryRepository foodEntryRepo;
    private final AiFoodTemplateRepository templateRepo;
    private final SupplementRepository supplementRepo;
    private final SupplementEntryRepository supplementEntryRepo;
    private final StoreWriteGate gate;

    public void apply(BackupGraph toCreate) {
        if (!gate.isHeldByCurrentThread()) {
            throw new IllegalStateException("STORE_WRITE_GATE_NOT_HELD");
        }

        productRepo.saveAll(toCreate.products());
        supplementRepo.saveAll(toCreate.supplements());
        dayRepo.saveAll(toCreate.dailyLogs());
        foodEntryRepo.saveAll(toCreate.foodEntries());
        supplementEntryRepo.saveAll(toCreate.supplementEntries());
        templateRepo.saveAll(toCreate.aiTemplates());

        // surface constraint violations here, inside the gate, not at commit
        productRepo.flush();
    }
}
