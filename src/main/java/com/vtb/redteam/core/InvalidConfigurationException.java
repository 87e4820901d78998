package com.vtb.redteam.core;

/**
 * Некорректная конфигурация прогона (пустой набор категорий, неизвестная
 * интенсивность, неположительные лимиты). Единственная ошибка, которая
 * прерывает прогон целиком.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
