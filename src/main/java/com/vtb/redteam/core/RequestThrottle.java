package com.vtb.redteam.core;

import java.util.concurrent.TimeUnit;

/**
 * Token bucket на вызовы цели. 0 запросов в секунду - без ограничения.
 * Общий для всех воркеров одного прогона.
 */
class RequestThrottle {

    private final double permitsPerSecond;
    private final double capacity;
    private double tokens;
    private long lastRefillNanos;

    RequestThrottle(int maxRequestsPerSecond) {
        this.permitsPerSecond = Math.max(0, maxRequestsPerSecond);
        this.capacity = Math.max(1.0, permitsPerSecond);
        this.tokens = capacity;
        this.lastRefillNanos = System.nanoTime();
    }

    boolean isUnlimited() {
        return permitsPerSecond <= 0;
    }

    /**
     * Забрать токен, ожидая его появления при необходимости
     */
    void acquire() throws InterruptedException {
        if (isUnlimited()) {
            return;
        }
        while (true) {
            long waitNanos;
            synchronized (this) {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return;
                }
                waitNanos = (long) ((1.0 - tokens) / permitsPerSecond * TimeUnit.SECONDS.toNanos(1));
            }
            TimeUnit.NANOSECONDS.sleep(Math.max(1L, waitNanos));
        }
    }

    private void refill() {
        long now = System.nanoTime();
        double elapsedSec = (now - lastRefillNanos) / (double) TimeUnit.SECONDS.toNanos(1);
        tokens = Math.min(capacity, tokens + elapsedSec * permitsPerSecond);
        lastRefillNanos = now;
    }
}
