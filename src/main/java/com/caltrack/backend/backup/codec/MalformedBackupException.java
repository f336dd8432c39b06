package com.caltrack.backend.backup.codec;

/**
 * The document cannot be read as a backup. Raised before any store mutation.
 */
public class MalformedBackupException extends RuntimeException {

    private final String code;

    public MalformedBackupException(String code) {
        super(code);
        this.code = code;
    }

    public MalformedBackupException(String code, String detail) {
        super(code + " " + detail);
        this.code = code;
    }

    public MalformedBackupException(String code, Throwable cause) {
        super(code, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
