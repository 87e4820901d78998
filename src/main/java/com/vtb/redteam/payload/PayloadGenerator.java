package com.vtb.redteam.payload;

import com.vtb.redteam.config.RedTeamConfig;
import com.vtb.redteam.models.AttackCategory;
import com.vtb.redteam.models.Intensity;

import java.util.List;
import java.util.Random;

/**
 * Генератор нагрузок одной категории: фиксированная библиотека шаблонов
 * и подготовка контекста для каждого экземпляра атаки.
 */
public interface PayloadGenerator {

    AttackCategory category();

    /**
     * Шаблоны в фиксированном порядке; порядок определяет порядок атак в прогоне
     */
    List<TechniqueTemplate> templates();

    /**
     * Новый контекст для одной атаки (случайная цель, маркер и т.д.)
     */
    PayloadContext newContext(Random random, RedTeamConfig.Catalog catalog);

    /**
     * Комбинированный вариант двух техник для интенсивности high
     */
    default TechniqueTemplate combine(TechniqueTemplate first, TechniqueTemplate second) {
        return TechniqueTemplate.of(first.getTag() + "+" + second.getTag(), Intensity.HIGH,
            ctx -> first.render(ctx) + "\n\n" + second.render(ctx));
    }
}
