package com.vtb.redteam.payload;

import com.vtb.redteam.config.RedTeamConfig;
import com.vtb.redteam.core.InvalidConfigurationException;
import com.vtb.redteam.models.Attack;
import com.vtb.redteam.models.AttackCategory;
import com.vtb.redteam.models.Intensity;
import com.vtb.redteam.registry.CategoryProfile;
import com.vtb.redteam.registry.CategoryRegistry;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.UUID;

/**
 * Каталог техник атак.
 *
 * Раскрывает (категории, интенсивность) в упорядоченный список атак. Какие шаблоны
 * попадают в прогон и в каком порядке, определяется только входом; текст нагрузки
 * может содержать случайные элементы.
 */
@Slf4j
public class PayloadCatalog {

    private static final Map<AttackCategory, String> ID_PREFIXES = Map.of(
        AttackCategory.PROMPT_INJECTION, "pi",
        AttackCategory.JAILBREAK, "jb",
        AttackCategory.TOXIC_OUTPUT, "tx",
        AttackCategory.BEHAVIOR_FUZZING, "fz"
    );

    private final CategoryRegistry registry;
    private final RedTeamConfig.Catalog settings;
    private final Random random;

    public PayloadCatalog(CategoryRegistry registry, RedTeamConfig.Catalog settings) {
        this(registry, settings, new SecureRandom());
    }

    public PayloadCatalog(CategoryRegistry registry, RedTeamConfig.Catalog settings, Random random) {
        this.registry = registry;
        this.settings = settings;
        this.random = random;
    }

    public List<Attack> expand(Set<AttackCategory> categories, String intensity) {
        return expand(categories, Intensity.fromValue(intensity));
    }

    /**
     * @throws InvalidConfigurationException пустой набор категорий или интенсивность не задана
     */
    public List<Attack> expand(Set<AttackCategory> categories, Intensity intensity) {
        if (categories == null || categories.isEmpty()) {
            throw new InvalidConfigurationException("Не выбрано ни одной категории атак");
        }
        for (AttackCategory category : categories) {
            if (category == null) {
                throw new InvalidConfigurationException("Пустая категория в наборе категорий");
            }
        }
        if (intensity == null) {
            throw new InvalidConfigurationException("Интенсивность не указана");
        }

        // EnumSet итерирует в порядке объявления категорий
        List<Attack> attacks = new ArrayList<>();
        for (AttackCategory category : EnumSet.copyOf(categories)) {
            CategoryProfile profile = registry.profile(category);
            for (TechniqueTemplate template : templatesFor(profile.getGenerator(), intensity)) {
                attacks.add(instantiate(profile.getGenerator(), template));
            }
        }
        log.info("Каталог: {} атак для {} при интенсивности {}",
            attacks.size(), categories, intensity.getValue());
        return attacks;
    }

    /**
     * Не более count атак одной категории
     */
    public List<Attack> generate(AttackCategory category, Intensity intensity, int count) {
        if (count <= 0) {
            throw new InvalidConfigurationException("Количество атак должно быть положительным: " + count);
        }
        List<Attack> all = expand(EnumSet.of(category), intensity);
        return all.size() <= count ? all : new ArrayList<>(all.subList(0, count));
    }

    List<TechniqueTemplate> templatesFor(PayloadGenerator generator, Intensity intensity) {
        List<TechniqueTemplate> selected = new ArrayList<>();
        for (TechniqueTemplate template : generator.templates()) {
            if (intensity.covers(template.getTier())) {
                selected.add(template);
            }
        }
        if (intensity == Intensity.HIGH) {
            List<TechniqueTemplate> base = new ArrayList<>(selected);
            for (int i = 0; i + 1 < base.size(); i++) {
                selected.add(generator.combine(base.get(i), base.get(i + 1)));
            }
        }
        return selected;
    }

    private Attack instantiate(PayloadGenerator generator, TechniqueTemplate template) {
        PayloadContext context = generator.newContext(random, settings);
        String payload = template.render(context);
        int limit = settings.getMaxPayloadLength();
        if (payload.length() > limit) {
            payload = payload.substring(0, limit);
        }
        return Attack.builder()
            .attackId(ID_PREFIXES.get(generator.category()) + "-" + UUID.randomUUID())
            .category(generator.category())
            .payload(payload)
            .techniqueTag(template.getTag())
            .intent(context.intent())
            .canaryToken(context.canaryToken())
            .build();
    }
}
