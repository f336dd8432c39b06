package com.caltrack.backend.backup.service;

import com.caltrack.backend.backup.reconcile.ImportSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Runs export/import on the backup executor. Failures complete the future exceptionally.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class BackupJobRunner {

    private final BackupService backupService;

    @Async("backupExecutor")
    public CompletableFuture<byte[]> exportAsync() {
        return CompletableFuture.completedFuture(backupService.exportBackup());
    }

    @Async("backupExecutor")
    public CompletableFuture<ImportSummary> importAsync(byte[] document) {
        return CompletableFuture.completedFuture(backupService.importBackup(document));
    }

    /** Writes a new backup file into {@code directory} and returns its path. */
    @Async("backupExecutor")
    public CompletableFuture<Path> exportToDirectory(Path directory) {
        byte[] doc = backupService.exportBackup();
        Path target = directory.resolve(backupService.suggestedFileName());
        try {
            Files.createDirectories(directory);
            Files.write(target, doc);
        } catch (IOException e) {
            throw new UncheckedIOException("BACKUP_FILE_WRITE_FAILED", e);
        }
        log.info("backup file written. path={}", target);
        return CompletableFuture.completedFuture(target);
    }

    @Async("backupExecutor")
    public CompletableFuture<ImportSummary> importFromFile(Path file) {
        byte[] doc;
        try {
            doc = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("BACKUP_FILE_READ_FAILED", e);
        }
        return CompletableFuture.completedFuture(backupService.importBackup(doc));
    }
}
