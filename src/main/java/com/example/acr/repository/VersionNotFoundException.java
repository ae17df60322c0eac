package com.example.acr.repository;

public class VersionNotFoundException extends RuntimeException {

    public VersionNotFoundException(String acrId, int version) {
        super("ACR %s has no version %d".formatted(acrId, version));
    }

    public VersionNotFoundException(String acrId) {
        super("ACR %s has no versions".formatted(acrId));
    }
}
