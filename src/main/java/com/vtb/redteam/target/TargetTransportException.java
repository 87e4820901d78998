package com.vtb.redteam.target;

/**
 * Вызов цели завершился ошибкой транспорта (сеть, статус, разбор ответа)
 */
public class TargetTransportException extends TargetException {

    public TargetTransportException(String message) {
        super(message);
    }

    public TargetTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
