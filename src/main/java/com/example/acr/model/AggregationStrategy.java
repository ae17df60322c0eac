package com.example.acr.model;

/**
 * How per-document conformance levels are combined into one batch verdict.
 * <ul>
 *   <li>CONSERVATIVE: the worst document decides</li>
 *   <li>OPTIMISTIC: decided by the share of fully supporting documents</li>
 * </ul>
 */
public enum AggregationStrategy {
    CONSERVATIVE, OPTIMISTIC
}
