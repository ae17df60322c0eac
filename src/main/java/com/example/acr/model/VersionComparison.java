package com.example.acr.model;

import java.util.List;

/**
 * Diff between two stored versions of the same ACR.
 */
public record VersionComparison(
        String acrId,
        int versionA,
        int versionB,
        List<ChangeLogEntry> changes,
        Summary summary
) {
    public VersionComparison {
        changes = List.copyOf(changes);
    }

    /**
     * @param fieldsChanged   number of change entries
     * @param criteriaChanged number of distinct criteria touched
     * @param statusChanged   whether the document status differs
     */
    public record Summary(int fieldsChanged, int criteriaChanged, boolean statusChanged) {}
}
