package com.example.acr.model;

import java.util.List;

/** Number of criteria per status in one document analysis. */
public record AnalysisSummary(int supports, int partiallySupports, int doesNotSupport, int notApplicable) {

    public static AnalysisSummary of(List<CriterionAnalysis> criteria) {
        int s = 0, ps = 0, dns = 0, na = 0;
        for (CriterionAnalysis c : criteria) {
            switch (c.status()) {
                case SUPPORTS -> s++;
                case PARTIALLY_SUPPORTS -> ps++;
                case DOES_NOT_SUPPORT -> dns++;
                case NOT_APPLICABLE -> na++;
            }
        }
        return new AnalysisSummary(s, ps, dns, na);
    }
}
