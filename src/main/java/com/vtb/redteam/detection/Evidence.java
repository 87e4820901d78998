package com.vtb.redteam.detection;

import java.util.List;

/**
 * Сырая оценка оценщика и сработавшие индикаторы
 */
public record Evidence(double score, List<String> indicators) {

    public Evidence {
        indicators = indicators != null ? List.copyOf(indicators) : List.of();
    }

    public static Evidence none() {
        return new Evidence(0.0, List.of());
    }
}
