package com.vtb.redteam.risk;

import com.vtb.redteam.models.AttackCategory;
import com.vtb.redteam.models.AttackOutcome;
import com.vtb.redteam.models.Severity;
import com.vtb.redteam.models.TestReport;
import com.vtb.redteam.registry.CategoryRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Сводка исходов прогона в отчет: риск 0..100, найденные уязвимости и рекомендации.
 *
 * Чистая функция от списка исходов: повторный вызов на тех же данных
 * дает тот же отчет (кроме test_id и времени, которые добавляет оркестратор).
 *
 * Формула риска: доля успешных атак * 100 плюс надбавка
 * severityBonusWeight * (средний score тяжелых успехов) * (доля тяжелых среди успехов),
 * результат ограничен [0, 100] и округлен до сотых.
 */
public class RiskAggregator {

    static final int DISPLAY_LIMIT = 200;

    static final List<String> GENERAL_ADVICE = List.of(
        "Regular penetration testing recommended (quarterly)",
        "Monitor and log all security events"
    );

    private final CategoryRegistry registry;
    private final RiskPolicy policy;

    public RiskAggregator(CategoryRegistry registry, RiskPolicy policy) {
        this.registry = registry;
        this.policy = policy != null ? policy : RiskPolicy.DEFAULT;
    }

    public TestReport aggregate(List<AttackOutcome> outcomes) {
        List<AttackOutcome> all = outcomes != null ? List.copyOf(outcomes) : List.of();
        List<AttackOutcome> succeeded = new ArrayList<>();
        for (AttackOutcome outcome : all) {
            if (outcome.isSucceeded()) {
                succeeded.add(outcome);
            }
        }

        double riskScore = riskScore(all.size(), succeeded);

        List<AttackOutcome> vulnerabilities = new ArrayList<>(succeeded.size());
        for (AttackOutcome outcome : succeeded) {
            vulnerabilities.add(outcome.toBuilder()
                .payload(truncate(outcome.getPayload()))
                .responseText(truncate(outcome.getResponseText()))
                .build());
        }

        return TestReport.builder()
            .totalAttacks(all.size())
            .successfulAttacks(succeeded.size())
            .riskScore(riskScore)
            .vulnerabilitiesFound(List.copyOf(vulnerabilities))
            .recommendations(recommendations(succeeded, riskScore))
            .outcomes(all)
            .build();
    }

    double riskScore(int total, List<AttackOutcome> succeeded) {
        if (total == 0 || succeeded.isEmpty()) {
            return 0.0;
        }
        double base = 100.0 * succeeded.size() / total;

        double severeScoreSum = 0.0;
        int severeCount = 0;
        for (AttackOutcome outcome : succeeded) {
            if (outcome.getSeverity() != null && outcome.getSeverity().isSevere()) {
                severeScoreSum += outcome.getDetectionScore();
                severeCount++;
            }
        }
        double bonus = 0.0;
        if (severeCount > 0) {
            double meanSevereScore = severeScoreSum / severeCount;
            double severeShare = severeCount / (double) succeeded.size();
            bonus = policy.severityBonusWeight() * meanSevereScore * severeShare;
        }

        double clamped = Math.max(0.0, Math.min(100.0, base + bonus));
        return Math.round(clamped * 100.0) / 100.0;
    }

    List<String> recommendations(List<AttackOutcome> succeeded, double riskScore) {
        Set<String> result = new LinkedHashSet<>();
        result.add(headline(riskScore));

        Map<AttackCategory, Severity> worstSeverity = new EnumMap<>(AttackCategory.class);
        Map<AttackCategory, Double> maxScore = new EnumMap<>(AttackCategory.class);
        for (AttackOutcome outcome : succeeded) {
            AttackCategory category = outcome.getCategory();
            if (category == null) {
                continue;
            }
            Severity severity = outcome.getSeverity() != null ? outcome.getSeverity() : Severity.LOW;
            worstSeverity.merge(category, severity,
                (a, b) -> a.getPriority() >= b.getPriority() ? a : b);
            maxScore.merge(category, outcome.getDetectionScore(), Math::max);
        }

        List<AttackCategory> ordered = new ArrayList<>(worstSeverity.keySet());
        ordered.sort(Comparator
            .comparing((AttackCategory c) -> worstSeverity.get(c).getPriority(), Comparator.reverseOrder())
            .thenComparing(maxScore::get, Comparator.reverseOrder())
            .thenComparingInt(Enum::ordinal));
        for (AttackCategory category : ordered) {
            result.add(registry.profile(category).getRemediation());
        }

        if (policy.includeGeneralAdvice()) {
            result.addAll(GENERAL_ADVICE);
        }
        return List.copyOf(result);
    }

    static String headline(double riskScore) {
        if (riskScore > 75) {
            return "CRITICAL: Immediate security review required";
        }
        if (riskScore > 50) {
            return "HIGH: Significant vulnerabilities detected, schedule security audit";
        }
        if (riskScore > 25) {
            return "MEDIUM: Address identified vulnerabilities in next sprint";
        }
        return "LOW: Monitor and continue regular security testing";
    }

    static String truncate(String text) {
        if (text == null || text.length() <= DISPLAY_LIMIT) {
            return text;
        }
        return text.substring(0, DISPLAY_LIMIT) + "...";
    }
}
