package com.vtb.redteam.detection;

import com.vtb.redteam.config.RedTeamConfig;
import com.vtb.redteam.models.Severity;

/**
 * Пороги перевода detection score в severity: ниже medium - LOW и т.д.
 */
public record SeverityThresholds(double medium, double high, double critical) {

    public static final SeverityThresholds DEFAULT = new SeverityThresholds(0.25, 0.5, 0.75);

    public SeverityThresholds {
        if (!(medium <= high && high <= critical)) {
            throw new IllegalArgumentException("Пороги severity должны возрастать: "
                + medium + ", " + high + ", " + critical);
        }
    }

    public static SeverityThresholds from(RedTeamConfig.CategoryThresholds thresholds) {
        if (thresholds == null) {
            return DEFAULT;
        }
        return new SeverityThresholds(thresholds.getMedium(), thresholds.getHigh(), thresholds.getCritical());
    }

    public Severity classify(double score) {
        if (score >= critical) {
            return Severity.CRITICAL;
        }
        if (score >= high) {
            return Severity.HIGH;
        }
        if (score >= medium) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}
