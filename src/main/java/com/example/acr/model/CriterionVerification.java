package com.example.acr.model;

/**
 * Review state of one criterion, used to pick its attribution tag.
 *
 * @param verificationStatus human review outcome, null when never reviewed
 * @param aiGenerated        whether the remark text was produced by an AI model
 * @param verifiedBy         reviewer id, null unless a human outcome was recorded
 */
public record CriterionVerification(
        String criterionId,
        VerificationStatus verificationStatus,
        boolean aiGenerated,
        String verifiedBy
) {
    public static CriterionVerification aiSuggested(String criterionId) {
        return new CriterionVerification(criterionId, null, true, null);
    }
}
