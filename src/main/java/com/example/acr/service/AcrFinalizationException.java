package com.example.acr.service;

import java.util.List;

/**
 * A document cannot become final because some criteria carry no attributed remarks.
 */
public class AcrFinalizationException extends RuntimeException {

    private final String acrId;
    private final List<String> unattributedCriteria;

    public AcrFinalizationException(String acrId, List<String> unattributedCriteria) {
        super("ACR %s cannot be finalized: %d criteria without attribution %s"
                .formatted(acrId, unattributedCriteria.size(), unattributedCriteria));
        this.acrId = acrId;
        this.unattributedCriteria = List.copyOf(unattributedCriteria);
    }

    public String getAcrId() {
        return acrId;
    }

    public List<String> getUnattributedCriteria() {
        return unattributedCriteria;
    }
}
