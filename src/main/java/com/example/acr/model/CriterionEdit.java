package com.example.acr.model;

/**
 * Reviewer change to a single criterion row.
 *
 * @param conformanceLevel   new level, null keeps the current one
 * @param remarks            new remarks, null keeps the current ones
 * @param verificationStatus review outcome recorded with the edit
 * @param verifiedBy         reviewer id
 */
public record CriterionEdit(
        String criterionId,
        ConformanceLevel conformanceLevel,
        String remarks,
        VerificationStatus verificationStatus,
        String verifiedBy
) {}
