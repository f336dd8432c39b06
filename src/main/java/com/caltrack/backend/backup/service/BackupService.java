package com.caltrack.backend.backup.service;

import com.caltrack.backend.backup.codec.BackupCodec;
import com.caltrack.backend.backup.codec.BackupFileNames;
import com.caltrack.backend.backup.codec.BackupGraph;
import com.caltrack.backend.backup.codec.DecodedBackup;
import com.caltrack.backend.backup.codec.MalformedBackupException;
import com.caltrack.backend.backup.reconcile.ImportPlan;
import com.caltrack.backend.backup.reconcile.ImportReconciler;
import com.caltrack.backend.backup.reconcile.ImportSummary;
import com.caltrack.backend.common.time.LocalDayResolver;
import com.caltrack.backend.common.tx.StorageFailureException;
import com.caltrack.backend.common.tx.StoreWriteGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * export(): whole store -> JSON bytes.
 * import(bytes): decode (no mutation) -> reconcile + insert under the write gate, one transaction.
 * A failed import leaves the store untouched; re-running it with the same file is safe.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class BackupService {

    private final BackupCodec codec;
    private final ImportReconciler reconciler;
    private final StoreGraphLoader loader;
    private final BackupImportWriter writer;
    private final StoreWriteGate gate;
    private final LocalDayResolver days;

    @Transactional(readOnly = true)
    public byte[] exportBackup() {
        BackupGraph graph = loader.load();
        byte[] doc = codec.encode(graph, days.now());
        log.info("backup exported. products={} days={} foodEntries={} templates={} supplements={} supplementEntries={} bytes={}",
                graph.products().size(), graph.dailyLogs().size(), graph.foodEntries().size(),
                graph.aiTemplates().size(), graph.supplements().size(), graph.supplementEntries().size(),
                doc.length);
        return doc;
    }

    public ImportSummary importBackup(byte[] document) {
        DecodedBackup decoded;
        try {
            decoded = codec.decode(document);
        } catch (MalformedBackupException e) {
            log.warn("backup rejected. code={} reason={}", e.getCode(), e.getMessage());
            throw e;
        }

        ImportSummary summary;
        try {
            summary = gate.write(() -> {
                ImportPlan plan = reconciler.reconcile(decoded.graph(), loader.load());
                writer.apply(plan.toCreate());
                return plan.summary();
            });
        } catch (DataAccessException | TransactionException e) {
            log.warn("backup import rolled back. exportDate={}", decoded.exportDate(), e);
            throw new StorageFailureException("STORAGE_WRITE_FAILED", e);
        }

        log.info("backup imported. {} {} dangling={}",
                summary.summaryText(), summary.skippedText(), summary.danglingReferences());
        return summary;
    }

    public String suggestedFileName() {
        return BackupFileNames.exportFileName(LocalDateTime.ofInstant(days.now(), days.zone()));
    }
}
