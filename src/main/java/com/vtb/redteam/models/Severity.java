package com.vtb.redteam.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Уровни критичности результата атаки
 */
public enum Severity {
    LOW("Низкий", 1),
    MEDIUM("Средний", 2),
    HIGH("Высокий", 3),
    CRITICAL("Критический", 4);

    private final String russianName;
    private final int priority;

    Severity(String russianName, int priority) {
        this.russianName = russianName;
        this.priority = priority;
    }

    public String getRussianName() {
        return russianName;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isSevere() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
