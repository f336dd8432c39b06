package com.caltrack.backend.supplement.service;

import com.caltrack.backend.common.tx.StoreWriteGate;
import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import com.caltrack.backend.dailylog.service.DailyLogService;
import com.caltrack.backend.scaling.NutritionSnapshot;
import com.caltrack.backend.scaling.ScalingEngine;
import com.caltrack.backend.supplement.entity.SupplementEntity;
import com.caltrack.backend.supplement.entity.SupplementEntryEntity;
import com.caltrack.backend.supplement.repo.SupplementEntryRepository;
import com.caltrack.backend.supplement.repo.SupplementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

@Slf4j
@RequiredArgsConstructor
@Service
public class SupplementService {

    private final SupplementRepository supplementRepo;
    private final SupplementEntryRepository entryRepo;
    private final DailyLogService dailyLogService;
    private final ScalingEngine scaling;
    private final StoreWriteGate gate;

    public SupplementEntity create(SupplementEntity draft) {
        if (draft.getName() == null || draft.getName().isBlank()) {
            throw new IllegalArgumentException("SUPPLEMENT_NAME_REQUIRED");
        }
        return gate.write(() -> supplementRepo.save(draft));
    }

    @Transactional(readOnly = true)
    public List<SupplementEntity> listAll() {
        return supplementRepo.findAllByOrderByNameAsc();
    }

    /** Logs {@code servings} units; nutrients scale by servings / servingSize. */
    public SupplementEntryEntity logServings(String supplementId, double servings, Instant at) {
        return gate.write(() -> {
            SupplementEntity s = requireSupplement(supplementId);
            NutritionSnapshot snap = scaling.scaleFromServings(s, servings);
            DailyLogEntity day = dailyLogService.findOrCreateForDay(at);

            SupplementEntryEntity e = new SupplementEntryEntity();
            e.setSupplementId(s.getId());
            e.setSupplementName(s.getName());
            e.setDailyLogId(day.getId());
            e.setAmount(servings);
            e.setUnit(s.getServingSizeUnit());
            e.setTimestamp(at);
            e.setNutrients(snap.nutrients());
            return entryRepo.save(e);
        });
    }

    @Transactional(readOnly = true)
    public List<SupplementEntryEntity> entriesForDay(String dailyLogId) {
        return entryRepo.findByDailyLogIdOrderByTimestampAsc(dailyLogId);
    }

    public void deleteEntry(String entryId) {
        gate.run(() -> {
            SupplementEntryEntity e = entryRepo.findById(entryId)
                    .orElseThrow(() -> new NoSuchElementException("SUPPLEMENT_ENTRY_NOT_FOUND"));
            entryRepo.delete(e);
        });
    }

    /** Entries survive with their captured name and nutrients. */
    public int delete(String supplementId) {
        return gate.write(() -> {
            SupplementEntity s = requireSupplement(supplementId);
            int detached = entryRepo.clearSupplementReference(s.getId());
            supplementRepo.deleteById(s.getId());
            log.info("supplement deleted. id={} detachedEntries={}", s.getId(), detached);
            return detached;
        });
    }

    private SupplementEntity requireSupplement(String supplementId) {
        return supplementRepo.findById(supplementId)
                .orElseThrow(() -> new NoSuchElementException("SUPPLEMENT_NOT_FOUND"));
    }
}
