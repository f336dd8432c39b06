package com.caltrack.backend.backup.reconcile;

import com.caltrack.backend.backup.codec.BackupGraph;

/** Rows to insert (ids and foreign keys already remapped) plus the counts to report. */
public record ImportPlan(BackupGraph toCreate, ImportSummary summary) {}
