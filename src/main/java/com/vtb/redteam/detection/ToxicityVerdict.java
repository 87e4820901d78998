package com.vtb.redteam.detection;

import com.vtb.redteam.models.Severity;

/**
 * Результат отдельной проверки текста на токсичность
 */
public record ToxicityVerdict(boolean toxic, double score, Severity severity) {
}
