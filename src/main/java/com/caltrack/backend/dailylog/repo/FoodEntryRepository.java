package com.caltrack.backend.dailylog.repo;

import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface FoodEntryRepository extends JpaRepository<FoodEntryEntity, String> {

    List<FoodEntryEntity> findByDailyLogIdOrderByTimestampAsc(String dailyLogId);

    /** nullify delete: the entry keeps its snapshot and name */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update FoodEntryEntity e set e.productId = null where e.productId = :productId")
    int clearProductReference(@Param("productId") String productId);

    /** cascade delete of a day */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from FoodEntryEntity e where e.dailyLogId = :dailyLogId")
    int deleteByDailyLogIdBulk(@Param("dailyLogId") String dailyLogId);
}
