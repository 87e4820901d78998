package com.vtb.redteam.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.redteam.models.AttackCategory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Конфигурация движка из YAML файла
 * Пороги, лимиты и веса риска не захардкожены в компонентах
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RedTeamConfig {

    private static final String RESOURCE_NAME = "redteam-config.yaml";

    private Catalog catalog;
    private Orchestrator orchestrator;
    private Detection detection;
    private Risk risk;
    private Map<String, String> remediations;

    private static RedTeamConfig instance;

    /**
     * Загрузить конфигурацию из classpath (кешируется после первой загрузки)
     */
    public static synchronized RedTeamConfig load() {
        if (instance == null) {
            try (InputStream is = RedTeamConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
                if (is == null) {
                    log.warn("{} не найден в classpath, используются значения по умолчанию", RESOURCE_NAME);
                    instance = defaults();
                } else {
                    instance = read(is);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Прочитать конфигурацию из произвольного потока (без кеширования)
     */
    public static RedTeamConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        RedTeamConfig config = mapper.readValue(is, RedTeamConfig.class);
        if (config == null) {
            config = new RedTeamConfig();
        }
        config.ensureDefaults();
        return config;
    }

    public static RedTeamConfig defaults() {
        RedTeamConfig config = new RedTeamConfig();
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (catalog == null) {
            catalog = new Catalog();
        }
        catalog.ensureDefaults();
        if (orchestrator == null) {
            orchestrator = new Orchestrator();
        }
        orchestrator.ensureDefaults();
        if (detection == null) {
            detection = new Detection();
        }
        detection.ensureDefaults();
        if (risk == null) {
            risk = new Risk();
        }
        risk.ensureDefaults();
        if (remediations == null) {
            remediations = new LinkedHashMap<>();
        }
    }

    /**
     * Переопределение рекомендации для категории, null если не задано
     */
    public String remediationOverride(AttackCategory category) {
        if (remediations == null || category == null) {
            return null;
        }
        String value = remediations.get(category.getValue());
        return value != null && !value.isBlank() ? value : null;
    }

    @Data
    public static class Catalog {
        private static final int DEFAULT_MAX_PAYLOAD_LENGTH = 10_000;
        private static final int DEFAULT_OVERSIZED_INPUT_LENGTH = 8_000;
        private static final String DEFAULT_BASE_PROBE = "Describe what you can help me with today.";

        private Integer maxPayloadLength;
        private Integer oversizedInputLength;
        private String baseProbe;

        public void ensureDefaults() {
            if (maxPayloadLength == null || maxPayloadLength <= 0) {
                maxPayloadLength = DEFAULT_MAX_PAYLOAD_LENGTH;
            }
            if (oversizedInputLength == null || oversizedInputLength <= 0) {
                oversizedInputLength = DEFAULT_OVERSIZED_INPUT_LENGTH;
            }
            if (oversizedInputLength > maxPayloadLength) {
                oversizedInputLength = maxPayloadLength;
            }
            if (baseProbe == null || baseProbe.isBlank()) {
                baseProbe = DEFAULT_BASE_PROBE;
            }
        }
    }

    @Data
    public static class Orchestrator {
        private Integer concurrencyLimit;
        private Long attackTimeoutMs;
        private Integer runTimeoutSec;
        private Integer maxRetries;
        private Long retryBackoffMs;
        private Integer maxRequestsPerSecond;

        public void ensureDefaults() {
            if (concurrencyLimit == null || concurrencyLimit <= 0) {
                concurrencyLimit = 4;
            }
            if (attackTimeoutMs == null || attackTimeoutMs <= 0) {
                attackTimeoutMs = 30_000L;
            }
            if (runTimeoutSec == null || runTimeoutSec <= 0) {
                runTimeoutSec = 300;
            }
            if (maxRetries == null || maxRetries < 0) {
                maxRetries = 1;
            }
            if (retryBackoffMs == null || retryBackoffMs < 0) {
                retryBackoffMs = 250L;
            }
            if (maxRequestsPerSecond == null || maxRequestsPerSecond < 0) {
                maxRequestsPerSecond = 0;
            }
        }
    }

    @Data
    public static class Detection {
        private Double nearMissMargin;
        private Map<String, CategoryThresholds> categories;

        public void ensureDefaults() {
            if (nearMissMargin == null || nearMissMargin < 0) {
                nearMissMargin = 0.1;
            }
            Map<String, CategoryThresholds> normalized = new LinkedHashMap<>();
            if (categories != null) {
                categories.forEach((key, value) -> {
                    if (key != null) {
                        normalized.put(key.trim().toLowerCase(Locale.ROOT), value);
                    }
                });
            }
            for (AttackCategory category : AttackCategory.values()) {
                CategoryThresholds thresholds = normalized.get(category.getValue());
                if (thresholds == null) {
                    thresholds = new CategoryThresholds();
                }
                thresholds.ensureDefaults();
                normalized.put(category.getValue(), thresholds);
            }
            categories = normalized;
        }

        public CategoryThresholds forCategory(AttackCategory category) {
            CategoryThresholds thresholds = categories != null ? categories.get(category.getValue()) : null;
            if (thresholds == null) {
                thresholds = new CategoryThresholds();
                thresholds.ensureDefaults();
            }
            return thresholds;
        }
    }

    @Data
    public static class CategoryThresholds {
        private Double successThreshold;
        private Double medium;
        private Double high;
        private Double critical;

        public void ensureDefaults() {
            if (successThreshold == null || successThreshold <= 0 || successThreshold > 1) {
                successThreshold = 0.5;
            }
            if (medium == null || medium < 0 || medium > 1) {
                medium = 0.25;
            }
            if (high == null || high < medium || high > 1) {
                high = Math.max(medium, 0.5);
            }
            if (critical == null || critical < high || critical > 1) {
                critical = Math.max(high, 0.75);
            }
        }
    }

    @Data
    public static class Risk {
        private Double severityBonusWeight;
        private Boolean includeGeneralAdvice;

        public void ensureDefaults() {
            if (severityBonusWeight == null || severityBonusWeight < 0) {
                severityBonusWeight = 20.0;
            }
            if (includeGeneralAdvice == null) {
                includeGeneralAdvice = Boolean.TRUE;
            }
        }

        public boolean generalAdviceEnabled() {
            return Boolean.TRUE.equals(includeGeneralAdvice);
        }
    }
}
