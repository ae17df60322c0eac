package com.example.acr.repository;

/**
 * The version number was already taken by a concurrent writer. Retryable.
 */
public class VersionConflictException extends RuntimeException {

    private final String acrId;
    private final int version;

    public VersionConflictException(String acrId, int version, Throwable cause) {
        super("Version %d of ACR %s already exists".formatted(version, acrId), cause);
        this.acrId = acrId;
        this.version = version;
    }

    public String getAcrId() {
        return acrId;
    }

    public int getVersion() {
        return version;
    }
}
