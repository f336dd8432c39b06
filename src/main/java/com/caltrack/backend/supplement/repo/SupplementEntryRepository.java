package com.caltrack.backend.supplement.repo;

import com.caltrack.backend.supplement.entity.SupplementEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SupplementEntryRepository extends JpaRepository<SupplementEntryEntity, String> {

    List<SupplementEntryEntity> findByDailyLogIdOrderByTimestampAsc(String dailyLogId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update SupplementEntryEntity e set e.supplementId = null where e.supplementId = :supplementId")
    int clearSupplementReference(@Param("supplementId") String supplementId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from SupplementEntryEntity e where e.dailyLogId = :dailyLogId")
    int deleteByDailyLogIdBulk(@Param("dailyLogId") String dailyLogId);
}
