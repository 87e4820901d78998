package com.vtb.redteam.registry;

import com.vtb.redteam.config.RedTeamConfig;
import com.vtb.redteam.core.InvalidConfigurationException;
import com.vtb.redteam.detection.BehaviorFuzzingEvaluator;
import com.vtb.redteam.detection.JailbreakEvaluator;
import com.vtb.redteam.detection.PromptInjectionEvaluator;
import com.vtb.redteam.detection.ResponseEvaluator;
import com.vtb.redteam.detection.SeverityThresholds;
import com.vtb.redteam.detection.ToxicityEvaluator;
import com.vtb.redteam.models.AttackCategory;
import com.vtb.redteam.payload.BehaviorFuzzGenerator;
import com.vtb.redteam.payload.JailbreakGenerator;
import com.vtb.redteam.payload.PayloadGenerator;
import com.vtb.redteam.payload.PromptInjectionGenerator;
import com.vtb.redteam.payload.ToxicElicitationGenerator;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Таблица категорий: генератор, оценщик, пороги и рекомендация.
 * Полнота проверяется при создании, поэтому у каждой категории всегда есть профиль.
 */
public class CategoryRegistry {

    static final String PROMPT_INJECTION_REMEDIATION =
        "Enforce instruction hierarchy and sanitize user input before it reaches the system prompt";
    static final String JAILBREAK_REMEDIATION =
        "Strengthen refusal and persona-lock instructions";
    static final String TOXIC_OUTPUT_REMEDIATION =
        "Enable output content filtering and toxicity moderation";
    static final String BEHAVIOR_FUZZING_REMEDIATION =
        "Enforce input length limits and normalize encodings and special characters";

    private final Map<AttackCategory, CategoryProfile> profiles;

    public CategoryRegistry(Collection<CategoryProfile> profiles) {
        Map<AttackCategory, CategoryProfile> map = new EnumMap<>(AttackCategory.class);
        for (CategoryProfile profile : profiles) {
            validate(profile);
            if (map.put(profile.getCategory(), profile) != null) {
                throw new InvalidConfigurationException("Профиль категории задан дважды: "
                    + profile.getCategory().getValue());
            }
        }
        for (AttackCategory category : AttackCategory.values()) {
            if (!map.containsKey(category)) {
                throw new InvalidConfigurationException("Нет профиля для категории " + category.getValue());
            }
        }
        this.profiles = Collections.unmodifiableMap(map);
    }

    /**
     * Стандартный набор категорий с порогами и рекомендациями из конфигурации
     */
    public static CategoryRegistry defaults(RedTeamConfig config) {
        return new CategoryRegistry(List.of(
            profile(config, new PromptInjectionGenerator(), new PromptInjectionEvaluator(),
                PROMPT_INJECTION_REMEDIATION),
            profile(config, new JailbreakGenerator(), new JailbreakEvaluator(), JAILBREAK_REMEDIATION),
            profile(config, new ToxicElicitationGenerator(), new ToxicityEvaluator(), TOXIC_OUTPUT_REMEDIATION),
            profile(config, new BehaviorFuzzGenerator(), new BehaviorFuzzingEvaluator(),
                BEHAVIOR_FUZZING_REMEDIATION)
        ));
    }

    private static CategoryProfile profile(RedTeamConfig config, PayloadGenerator generator,
                                           ResponseEvaluator evaluator, String defaultRemediation) {
        AttackCategory category = generator.category();
        RedTeamConfig.CategoryThresholds thresholds = config.getDetection().forCategory(category);
        String override = config.remediationOverride(category);
        return CategoryProfile.builder()
            .category(category)
            .generator(generator)
            .evaluator(evaluator)
            .successThreshold(thresholds.getSuccessThreshold())
            .severityThresholds(SeverityThresholds.from(thresholds))
            .remediation(override != null ? override : defaultRemediation)
            .build();
    }

    private static void validate(CategoryProfile profile) {
        if (profile == null || profile.getCategory() == null) {
            throw new InvalidConfigurationException("Профиль категории без категории");
        }
        String name = profile.getCategory().getValue();
        if (profile.getGenerator() == null || profile.getEvaluator() == null) {
            throw new InvalidConfigurationException("Для категории " + name + " нужны генератор и оценщик");
        }
        if (profile.getGenerator().category() != profile.getCategory()
            || profile.getEvaluator().category() != profile.getCategory()) {
            throw new InvalidConfigurationException("Генератор или оценщик не соответствует категории " + name);
        }
        if (profile.getSuccessThreshold() <= 0 || profile.getSuccessThreshold() > 1) {
            throw new InvalidConfigurationException("Порог успеха для " + name + " должен быть в (0, 1]");
        }
        if (profile.getSeverityThresholds() == null) {
            throw new InvalidConfigurationException("Для категории " + name + " не заданы пороги severity");
        }
    }

    public CategoryProfile profile(AttackCategory category) {
        CategoryProfile profile = profiles.get(category);
        if (profile == null) {
            throw new InvalidConfigurationException("Неизвестная категория атаки: " + category);
        }
        return profile;
    }

    public Collection<CategoryProfile> profiles() {
        return profiles.values();
    }
}
