package com.example.acr.model;

/**
 * One field-level difference between two ACR snapshots.
 *
 * @param field         dotted path, e.g. {@code status} or {@code criteria.1.1.1.remarks}
 * @param previousValue value before the change, null if the field did not exist
 * @param newValue      value after the change, null if the field was removed
 * @param reason        optional free-text reason supplied by the author
 */
public record ChangeLogEntry(String field, Object previousValue, Object newValue, String reason) {}
