package com.vtb.redteam.target;

import java.time.Duration;

/**
 * Узкий интерфейс к тестируемой системе.
 *
 * Ядро ничего не знает о транспорте: авторизация и сериализация удаленного
 * вызова целиком на стороне реализации. Каждый вызов независим, состояние
 * диалога между атаками не переносится.
 */
@FunctionalInterface
public interface TargetAdapter {

    /**
     * Отправить нагрузку цели
     *
     * @param targetContext системный промпт / контекст цели
     * @param payload текст атаки
     * @param timeout таймаут одного вызова
     * @return текст ответа и время вызова
     * @throws TargetTimeoutException если цель не ответила вовремя
     * @throws TargetTransportException при любой другой ошибке транспорта
     */
    TargetResponse invoke(String targetContext, String payload, Duration timeout)
        throws TargetTimeoutException, TargetTransportException;

    default String name() {
        return getClass().getSimpleName();
    }
}
