package com.caltrack.backend.dailylog.service;

import com.caltrack.backend.common.time.LocalDayResolver;
import com.caltrack.backend.common.tx.StoreWriteGate;
import com.caltrack.backend.dailylog.config.DailyLogProperties;
import com.caltrack.backend.dailylog.dto.DailyTotals;
import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import com.caltrack.backend.dailylog.repo.DailyLogRepository;
import com.caltrack.backend.dailylog.repo.FoodEntryRepository;
import com.caltrack.backend.supplement.repo.SupplementEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.NoSuchElementException;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Service
public class DailyLogService {

    private final DailyLogRepository dayRepo;
    private final FoodEntryRepository foodRepo;
    private final SupplementEntryRepository supplementEntryRepo;
    private final LocalDayResolver days;
    private final DailyLogProperties props;
    private final StoreWriteGate gate;

    /**
     * The single day containing {@code at}; created with the default targets when missing.
     */
    public DailyLogEntity findOrCreateForDay(Instant at) {
        LocalDate day = days.dayOf(at);
        return gate.write(() -> dayRepo.findByLogDate(day).orElseGet(() -> {
            DailyLogEntity d = new DailyLogEntity();
            d.setLogDate(day);
            d.setCalorieTarget(props.getDefaultCalorieTarget());
            d.setProteinTarget(props.getDefaultProteinTarget());
            d.setCarbTarget(props.getDefaultCarbTarget());
            d.setFatTarget(props.getDefaultFatTarget());
            d.setCreatedAtUtc(days.now());
            DailyLogEntity saved = dayRepo.saveAndFlush(d);
            log.debug("daily log created. date={} id={}", day, saved.getId());
            return saved;
        }));
    }

    @Transactional(readOnly = true)
    public Optional<DailyLogEntity> find(LocalDate day) {
        return dayRepo.findByLogDate(day);
    }

    public DailyLogEntity updateTargets(String dailyLogId,
                                        double calorieTarget,
                                        double proteinTarget,
                                        double carbTarget,
                                        double fatTarget) {
        return gate.write(() -> {
            DailyLogEntity d = require(dailyLogId);
            d.setCalorieTarget(calorieTarget);
            d.setProteinTarget(proteinTarget);
            d.setCarbTarget(carbTarget);
            d.setFatTarget(fatTarget);
            return dayRepo.save(d);
        });
    }

    @Transactional(readOnly = true)
    public DailyTotals totals(String dailyLogId) {
        DailyLogEntity d = require(dailyLogId);
        return DailyTotals.of(
                d,
                foodRepo.findByDailyLogIdOrderByTimestampAsc(d.getId()),
                supplementEntryRepo.findByDailyLogIdOrderByTimestampAsc(d.getId())
        );
    }

    /** Deletes the day together with its food and supplement entries. */
    public void delete(String dailyLogId) {
        gate.run(() -> {
            DailyLogEntity d = require(dailyLogId);
            int foods = foodRepo.deleteByDailyLogIdBulk(d.getId());
            int supplements = supplementEntryRepo.deleteByDailyLogIdBulk(d.getId());
            dayRepo.deleteById(d.getId());
            log.info("daily log deleted. date={} foodEntries={} supplementEntries={}",
                    d.getLogDate(), foods, supplements);
        });
    }

    private DailyLogEntity require(String dailyLogId) {
        return dayRepo.findById(dailyLogId)
                .orElseThrow(() -> new NoSuchElementException("DAILY_LOG_NOT_FOUND"));
    }
}
