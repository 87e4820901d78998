package com.vtb.redteam.models;

/**
 * Состояние прогона: PENDING -> RUNNING -> {COMPLETED, FAILED}
 */
public enum RunState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
