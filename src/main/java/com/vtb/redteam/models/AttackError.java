package com.vtb.redteam.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Причина, по которой для атаки не удалось получить оценку
 */
public enum AttackError {
    /** Истек таймаут одного вызова цели */
    TIMEOUT,
    /** Истек общий таймаут прогона, атака не успела завершиться */
    RUN_TIMEOUT,
    /** Ошибка транспорта после исчерпания повторов */
    TRANSPORT_ERROR,
    /** Оценщик не смог разобрать ответ, либо обработка атаки упала локально */
    DETECTION_FAILURE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
