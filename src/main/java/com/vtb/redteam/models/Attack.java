package com.vtb.redteam.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Одна конкретная атака: полезная нагрузка, категория и идентичность.
 * Создается при раскрытии каталога и далее не изменяется.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Attack {

    @JsonProperty("attack_id")
    String attackId;

    @JsonProperty("category")
    AttackCategory category;

    @JsonProperty("payload")
    String payload;

    @JsonProperty("technique_tag")
    String techniqueTag;

    /** Запрещенная цель, которую оборачивает шаблон (может отсутствовать) */
    @JsonProperty("intent")
    String intent;

    /** Маркер, который внедренная инструкция просит вывести цель */
    @JsonProperty("canary_token")
    String canaryToken;
}
