package com.example.acr.service;

import com.example.acr.config.AcrProperties;
import com.example.acr.model.CriterionStatus;
import com.example.acr.model.Severity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered classification rules for a criterion. Rules are tried top to bottom and the
 * first matching predicate decides status, confidence and recommendation.
 */
@Component
public class SeverityRules {

    /**
     * Issue counts of one criterion, the input every rule is evaluated against.
     *
     * @param total     related issues, fixed or not
     * @param fixed     related issues covered by a remediation record
     * @param remaining remaining issues per severity
     */
    public record Profile(int total, int fixed, Map<Severity, Integer> remaining) {

        public Profile {
            EnumMap<Severity, Integer> copy = new EnumMap<>(Severity.class);
            for (Severity s : Severity.values()) copy.put(s, remaining.getOrDefault(s, 0));
            remaining = copy;
        }

        public int remaining(Severity severity) {
            return remaining.get(severity);
        }

        public int remainingTotal() {
            return total - fixed;
        }
    }

    public enum Outcome {
        NO_ISSUES, ALL_REMEDIATED, CRITICAL, SERIOUS, MODERATE, UNKNOWN, MINOR
    }

    public record Rule(Outcome outcome, Predicate<Profile> when, CriterionStatus status, int confidence,
                       Function<Profile, String> recommendation) {}

    public record Verdict(Outcome outcome, CriterionStatus status, int confidence, String recommendation) {}

    private final List<Rule> rules;
    private final AcrProperties.Confidence confidence;

    @Autowired
    public SeverityRules(AcrProperties properties) {
        this(properties.confidence());
    }

    public SeverityRules(AcrProperties.Confidence confidence) {
        this.confidence = confidence;
        this.rules = List.of(
                new Rule(Outcome.NO_ISSUES, p -> p.total() == 0,
                        CriterionStatus.SUPPORTS, confidence.noIssues(),
                        p -> "Continue to maintain compliance with this criterion"),
                new Rule(Outcome.ALL_REMEDIATED, p -> p.remainingTotal() == 0,
                        CriterionStatus.SUPPORTS, confidence.allRemediated(),
                        p -> "All detected issues have been resolved"),
                new Rule(Outcome.CRITICAL, p -> p.remaining(Severity.CRITICAL) > 0,
                        CriterionStatus.DOES_NOT_SUPPORT, confidence.critical(),
                        p -> "%d critical issue(s) must be resolved for compliance"
                                .formatted(p.remaining(Severity.CRITICAL))),
                new Rule(Outcome.SERIOUS, p -> p.remaining(Severity.SERIOUS) > 0,
                        CriterionStatus.PARTIALLY_SUPPORTS, confidence.serious(),
                        p -> "%d serious issue(s) should be addressed to improve compliance"
                                .formatted(p.remaining(Severity.SERIOUS))),
                new Rule(Outcome.MODERATE, p -> p.remaining(Severity.MODERATE) > 0,
                        CriterionStatus.PARTIALLY_SUPPORTS, confidence.moderate(),
                        p -> "%d moderate issue(s) detected - address to strengthen compliance"
                                .formatted(p.remaining(Severity.MODERATE))),
                new Rule(Outcome.UNKNOWN, p -> p.remaining(Severity.UNKNOWN) > 0,
                        CriterionStatus.PARTIALLY_SUPPORTS, confidence.unknown(),
                        p -> "%d issue(s) with unknown severity - investigate and categorize"
                                .formatted(p.remaining(Severity.UNKNOWN))),
                new Rule(Outcome.MINOR, p -> true,
                        CriterionStatus.SUPPORTS, confidence.minor(),
                        p -> "%d minor issue(s) detected - low priority fixes"
                                .formatted(p.remaining(Severity.MINOR)))
        );
    }

    public Verdict classify(Profile profile) {
        for (Rule rule : rules) {
            if (rule.when().test(profile)) {
                return new Verdict(rule.outcome(), rule.status(), rule.confidence(),
                        rule.recommendation().apply(profile));
            }
        }
        // the last rule always matches
        throw new IllegalStateException("No severity rule matched " + profile);
    }

    public List<Rule> rules() {
        return rules;
    }

    public AcrProperties.Confidence confidence() {
        return confidence;
    }
}
