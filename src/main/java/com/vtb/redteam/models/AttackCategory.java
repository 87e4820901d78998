package com.vtb.redteam.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vtb.redteam.core.InvalidConfigurationException;

import java.util.Locale;

/**
 * Категории атак на диалоговую модель.
 * Закрытый набор: новая категория требует генератора и оценщика в CategoryRegistry.
 */
public enum AttackCategory {
    PROMPT_INJECTION("prompt_injection"),
    JAILBREAK("jailbreak"),
    TOXIC_OUTPUT("toxic_output"),
    BEHAVIOR_FUZZING("behavior_fuzzing");

    private final String value;

    AttackCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Разобрать категорию из строки ("prompt_injection", "PROMPT-INJECTION", ...)
     */
    public static AttackCategory fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidConfigurationException("Категория атаки не указана");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (AttackCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        throw new InvalidConfigurationException("Неизвестная категория атаки: " + raw);
    }
}
