package com.vtb.redteam.risk;

import com.vtb.redteam.config.RedTeamConfig;

/**
 * Параметры формулы риска
 *
 * @param severityBonusWeight максимальная надбавка за тяжелые успешные атаки (HIGH/CRITICAL)
 * @param includeGeneralAdvice добавлять ли общие рекомендации в конец списка
 */
public record RiskPolicy(double severityBonusWeight, boolean includeGeneralAdvice) {

    public static final RiskPolicy DEFAULT = new RiskPolicy(20.0, true);

    public RiskPolicy {
        if (severityBonusWeight < 0 || Double.isNaN(severityBonusWeight)) {
            throw new IllegalArgumentException("Вес надбавки за severity не может быть отрицательным");
        }
    }

    public static RiskPolicy from(RedTeamConfig.Risk risk) {
        if (risk == null) {
            return DEFAULT;
        }
        return new RiskPolicy(risk.getSeverityBonusWeight(), risk.generalAdviceEnabled());
    }
}
