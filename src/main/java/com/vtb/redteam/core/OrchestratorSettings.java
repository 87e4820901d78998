package com.vtb.redteam.core;

import com.vtb.redteam.config.RedTeamConfig;

import java.time.Duration;

/**
 * Настройки оркестратора поверх секции orchestrator конфигурации
 */
public class OrchestratorSettings {
    private final RedTeamConfig.Orchestrator config;

    public OrchestratorSettings(RedTeamConfig.Orchestrator config) {
        this.config = config;
    }

    int concurrencyLimit() {
        return config != null ? config.getConcurrencyLimit() : 4;
    }

    Duration attackTimeout() {
        return Duration.ofMillis(config != null ? config.getAttackTimeoutMs() : 30_000L);
    }

    Duration runTimeout() {
        return Duration.ofSeconds(config != null ? config.getRunTimeoutSec() : 300);
    }

    int maxRetries() {
        return config != null ? config.getMaxRetries() : 1;
    }

    long retryBackoffMs() {
        return config != null ? config.getRetryBackoffMs() : 250L;
    }

    int maxRequestsPerSecond() {
        return config != null ? config.getMaxRequestsPerSecond() : 0;
    }
}
