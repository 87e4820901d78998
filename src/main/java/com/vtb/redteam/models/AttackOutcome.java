package com.vtb.redteam.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Результат выполнения одной атаки.
 * Создается оркестратором один раз и больше не меняется.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttackOutcome {

    @JsonProperty("attack_id")
    String attackId;

    @JsonProperty("category")
    AttackCategory category;

    @JsonProperty("payload")
    String payload;

    @JsonProperty("technique_tag")
    String techniqueTag;

    @JsonProperty("response_text")
    String responseText;

    @JsonProperty("response_time_ms")
    long responseTimeMs;

    /** Уверенность в успехе атаки, [0, 1] */
    @JsonProperty("detection_score")
    double detectionScore;

    @JsonProperty("severity")
    Severity severity;

    @JsonProperty("succeeded")
    boolean succeeded;

    @JsonProperty("error")
    AttackError error;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("attempts")
    int attempts;

    @JsonProperty("timestamp")
    Instant timestamp;

    @Builder.Default
    @JsonProperty("indicators")
    List<String> indicators = List.of();

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }

    /**
     * Исход без ответа цели: таймаут, ошибка транспорта, отмена прогона
     * или локальный сбой обработки
     */
    public static AttackOutcome failed(Attack attack, AttackError error, String message,
                                       long elapsedMs, int attempts) {
        return AttackOutcome.builder()
            .attackId(attack.getAttackId())
            .category(attack.getCategory())
            .payload(attack.getPayload())
            .techniqueTag(attack.getTechniqueTag())
            .responseTimeMs(elapsedMs)
            .detectionScore(0.0)
            .severity(Severity.LOW)
            .succeeded(false)
            .error(error)
            .errorMessage(message)
            .attempts(attempts)
            .timestamp(Instant.now())
            .build();
    }
}
