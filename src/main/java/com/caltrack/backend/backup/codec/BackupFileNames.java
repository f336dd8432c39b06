package com.caltrack.backend.backup.codec;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public final class BackupFileNames {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss");

    private BackupFileNames() {}

    /** CalorieTracker_Backup_2026-01-15_083000.json */
    public static String exportFileName(LocalDateTime localNow) {
        return "CalorieTracker_Backup_" + STAMP.format(localNow) + ".json";
    }
}
