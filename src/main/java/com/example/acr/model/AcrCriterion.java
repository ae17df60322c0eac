package com.example.acr.model;

/**
 * One row of the conformance table in an ACR.
 *
 * @param attributedRemarks remarks prefixed with the attribution marker; required before the document is final
 */
public record AcrCriterion(
        String id,
        String name,
        CriterionLevel level,
        ConformanceLevel conformanceLevel,
        String remarks,
        AttributionTag attributionTag,
        String attributedRemarks
) {
    public AcrCriterion {
        if (conformanceLevel == null) conformanceLevel = ConformanceLevel.NOT_APPLICABLE;
        if (remarks == null) remarks = "";
    }

    public AcrCriterion withConformance(ConformanceLevel level, String newRemarks) {
        return new AcrCriterion(id, name, this.level, level, newRemarks, null, null);
    }

    public AcrCriterion withAttribution(AttributionTag tag, String attributed) {
        return new AcrCriterion(id, name, level, conformanceLevel, remarks, tag, attributed);
    }

    /** True when the row carries a tag and marker-prefixed remarks with actual content behind the marker. */
    public boolean isAttributed() {
        return attributionTag != null && !remarks.isBlank()
                && attributedRemarks != null && !attributedRemarks.isBlank();
    }
}
