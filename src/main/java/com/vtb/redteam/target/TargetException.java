package com.vtb.redteam.target;

/**
 * Базовая ошибка вызова цели
 */
public abstract class TargetException extends Exception {

    protected TargetException(String message) {
        super(message);
    }

    protected TargetException(String message, Throwable cause) {
        super(message, cause);
    }
}
