package com.caltrack.backend.backup.codec;

public class UnsupportedVersionException extends MalformedBackupException {

    private final int version;

    public UnsupportedVersionException(int version) {
        super("BACKUP_VERSION_UNSUPPORTED", "version=" + version);
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
