package com.vtb.redteam.models;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vtb.redteam.core.InvalidConfigurationException;

import java.util.Locale;

/**
 * Интенсивность атаки: сколько техник и насколько агрессивных
 */
public enum Intensity {
    LOW,
    MEDIUM,
    HIGH;

    public boolean covers(Intensity tier) {
        return tier != null && tier.ordinal() <= ordinal();
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Intensity fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidConfigurationException("Интенсивность не указана");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "medium" -> MEDIUM;
            case "high" -> HIGH;
            default -> throw new InvalidConfigurationException(
                "Неизвестная интенсивность: " + raw + " (ожидается low, medium или high)");
        };
    }
}
