package com.vtb.redteam.target;

/**
 * Цель не ответила за отведенное время
 */
public class TargetTimeoutException extends TargetException {

    public TargetTimeoutException(String message) {
        super(message);
    }

    public TargetTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
