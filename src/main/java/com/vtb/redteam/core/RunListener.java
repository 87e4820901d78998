package com.vtb.redteam.core;

import com.vtb.redteam.models.AttackOutcome;
import com.vtb.redteam.models.RunState;

/**
 * Наблюдатель за прогоном. Вызывается из потоков оркестратора,
 * реализации должны быть потокобезопасными.
 */
public interface RunListener {

    RunListener NONE = new RunListener() {
    };

    /**
     * @param from предыдущее состояние, null для первого перехода в PENDING
     */
    default void onStateChange(String testId, RunState from, RunState to) {
    }

    default void onOutcome(String testId, AttackOutcome outcome) {
    }
}
