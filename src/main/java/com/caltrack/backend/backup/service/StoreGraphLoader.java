package com.caltrack.backend.backup.service;

import com.caltrack.backend.backup.codec.BackupGraph;
import com.caltrack.backend.dailylog.repo.DailyLogRepository;
import com.caltrack.backend.dailylog.repo.FoodEntryRepository;
import com.caltrack.backend.product.repo.ProductRepository;
import com.caltrack.backend.supplement.repo.SupplementEntryRepository;
import com.caltrack.backend.supplement.repo.SupplementRepository;
import com.caltrack.backend.template.repo.AiFoodTemplateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

/** Reads the whole store, each table ordered by id. Runs inside the caller's transaction. */
@RequiredArgsConstructor
@Component
public class StoreGraphLoader {

    private static final Sort BY_ID = Sort.by("id");

    private final ProductRepository productRepo;
    private final DailyLogRepository dayRepo;
    private final FoodEntryRepository foodEntryRepo;
    private final AiFoodTemplateRepository templateRepo;
    private final SupplementRepository supplementRepo;
    private final SupplementEntryRepository supplementEntryRepo;

    public BackupGraph load() {
        return new BackupGraph(
                productRepo.findAll(BY_ID),
                dayRepo.findAll(BY_ID),
                foodEntryRepo.findAll(BY_ID),
                templateRepo.findAll(BY_ID),
                supplementRepo.findAll(BY_ID),
                supplementEntryRepo.findAll(BY_ID)
        );
    }
}
