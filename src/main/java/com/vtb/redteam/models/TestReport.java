package com.vtb.redteam.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Итоговый отчет одного прогона.
 * Собирается после того, как известны все исходы, и далее не изменяется.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestReport {

    @JsonProperty("test_id")
    String testId;

    @JsonProperty("start_time")
    Instant startTime;

    @JsonProperty("end_time")
    Instant endTime;

    @JsonProperty("total_attacks")
    int totalAttacks;

    @JsonProperty("successful_attacks")
    int successfulAttacks;

    /** Интегральный риск, [0, 100] */
    @JsonProperty("risk_score")
    double riskScore;

    @Builder.Default
    @JsonProperty("vulnerabilities_found")
    List<AttackOutcome> vulnerabilitiesFound = List.of();

    @Builder.Default
    @JsonProperty("recommendations")
    List<String> recommendations = List.of();

    @Builder.Default
    @JsonProperty("outcomes")
    List<AttackOutcome> outcomes = List.of();

    public boolean hasVulnerabilities() {
        return vulnerabilitiesFound != null && !vulnerabilitiesFound.isEmpty();
    }
}
