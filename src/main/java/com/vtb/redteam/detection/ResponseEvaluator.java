package com.vtb.redteam.detection;

import com.vtb.redteam.models.Attack;
import com.vtb.redteam.models.AttackCategory;

/**
 * Эвристический оценщик ответа для одной категории атак.
 * Чистая функция от (атака, ответ, контекст цели).
 */
public interface ResponseEvaluator {

    AttackCategory category();

    /**
     * @param attack исходная атака
     * @param responseText ответ цели, не null
     * @param targetContext системный контекст цели, может быть null
     * @throws DetectionFailureException если ответ не удается оценить
     */
    Evidence evaluate(Attack attack, String responseText, String targetContext);
}
