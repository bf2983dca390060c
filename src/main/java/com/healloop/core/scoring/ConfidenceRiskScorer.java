package com.healloop.core.scoring;

import com.healloop.core.autofix.AutoFixProperties;
import com.healloop.core.patch.FileChange;
import com.healloop.core.patch.PatchPlan;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Keyword and shape based scoring of patch plans. No oracle involved, so the same
 * inputs always give the same score.
 */
@Component
public class ConfidenceRiskScorer {

    static final double BASE_CONFIDENCE = 0.5;

    private static final List<String> ERROR_KEYWORDS =
            List.of("import", "attribute", "typeerror", "keyerror", "missing");
    private static final List<String> SUMMARY_KEYWORDS =
            List.of("add import", "fix typo", "update parameter", "add missing");

    private final AutoFixProperties properties;

    public ConfidenceRiskScorer(AutoFixProperties properties) {
        this.properties = properties;
    }

    public FixAssessment assess(PatchPlan plan, String error, int priorAttempts) {
        return new FixAssessment(confidence(plan, error, priorAttempts), risk(plan));
    }

    public double confidence(PatchPlan plan, String error, int priorAttempts) {
        double confidence = BASE_CONFIDENCE;
        if (containsAny(error, ERROR_KEYWORDS)) {
            confidence += 0.2;
        }
        if (plan != null && containsAny(plan.summary(), SUMMARY_KEYWORDS)) {
            confidence += 0.3;
        }
        if (priorAttempts >= 3) {
            confidence += 0.1;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    /** First matching rule wins. */
    public RiskLevel risk(PatchPlan plan) {
        List<FileChange> files = plan.files();
        if (files.size() > 3) {
            return RiskLevel.HIGH;
        }
        if (!files.isEmpty() && files.stream().allMatch(f -> f instanceof FileChange.Create)) {
            return RiskLevel.LOW;
        }
        if (files.stream().anyMatch(f -> isCritical(f.path()))) {
            return RiskLevel.HIGH;
        }
        boolean importOnly = files.stream()
                .anyMatch(f -> f instanceof FileChange.Replace r
                        && r.search().contains("import") && r.search().length() < 100);
        if (importOnly) {
            return RiskLevel.LOW;
        }
        return RiskLevel.MEDIUM;
    }

    private boolean isCritical(String path) {
        String normalized = path.replace('\\', '/');
        for (String critical : properties.getCriticalFiles()) {
            if (normalized.equals(critical) || normalized.endsWith("/" + critical)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }
}
