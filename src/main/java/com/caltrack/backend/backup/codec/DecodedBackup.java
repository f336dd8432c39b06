package com.caltrack.backend.backup.codec;

import java.time.Instant;

/** exportDate is null when the document does not carry one */
public record DecodedBackup(int version, Instant exportDate, BackupGraph graph) {}
