package com.vtb.redteam.detection;

import com.vtb.redteam.models.Attack;
import com.vtb.redteam.models.Severity;
import com.vtb.redteam.registry.CategoryProfile;
import com.vtb.redteam.registry.CategoryRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Оценка ответа цели: оценщик категории дает score, профиль категории
 * переводит его в severity и признак успеха.
 */
@Slf4j
public class DetectionEngine {

    private final CategoryRegistry registry;
    private final double nearMissMargin;
    private final ToxicityEvaluator toxicityAnalyzer = new ToxicityEvaluator();

    public DetectionEngine(CategoryRegistry registry, double nearMissMargin) {
        this.registry = registry;
        this.nearMissMargin = Math.max(0.0, nearMissMargin);
    }

    public DetectionResult score(Attack attack, String responseText) {
        return score(attack, responseText, null);
    }

    /**
     * @throws DetectionFailureException если ответ отсутствует или оценщик упал
     */
    public DetectionResult score(Attack attack, String responseText, String targetContext) {
        if (attack == null || attack.getCategory() == null) {
            throw new DetectionFailureException("Атака без категории");
        }
        if (responseText == null) {
            throw new DetectionFailureException("Нет текста ответа для атаки " + attack.getAttackId());
        }
        CategoryProfile profile = registry.profile(attack.getCategory());

        Evidence evidence;
        try {
            evidence = profile.getEvaluator().evaluate(attack, responseText, targetContext);
        } catch (DetectionFailureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DetectionFailureException("Оценщик " + attack.getCategory().getValue()
                + " не смог разобрать ответ: " + e.getMessage(), e);
        }
        if (evidence == null || Double.isNaN(evidence.score())) {
            throw new DetectionFailureException("Оценщик " + attack.getCategory().getValue()
                + " вернул некорректный score");
        }

        double score = ResponseSignals.clamp(evidence.score());
        double threshold = profile.getSuccessThreshold();
        boolean succeeded = score >= threshold;
        boolean nearMiss = !succeeded && score >= threshold - nearMissMargin;
        Severity severity = profile.getSeverityThresholds().classify(score);

        if (nearMiss) {
            log.info("Почти успешная атака {} [{}]: score {} при пороге {}",
                attack.getAttackId(), attack.getTechniqueTag(), String.format("%.2f", score), threshold);
        } else if (log.isDebugEnabled()) {
            log.debug("Атака {}: score={}, severity={}, индикаторы={}",
                attack.getAttackId(), score, severity, evidence.indicators());
        }

        return DetectionResult.builder()
            .score(score)
            .severity(severity)
            .succeeded(succeeded)
            .nearMiss(nearMiss)
            .indicators(evidence.indicators())
            .build();
    }

    /**
     * Отдельная проверка произвольного текста на токсичность
     */
    public ToxicityVerdict analyzeToxicity(String text) {
        return toxicityAnalyzer.analyze(text);
    }
}
