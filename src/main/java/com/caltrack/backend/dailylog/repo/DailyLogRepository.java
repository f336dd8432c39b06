package com.caltrack.backend.dailylog.repo;

import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.Optional;

public interface DailyLogRepository extends JpaRepository<DailyLogEntity, String> {

    Optional<DailyLogEntity> findByLogDate(LocalDate logDate);
}
