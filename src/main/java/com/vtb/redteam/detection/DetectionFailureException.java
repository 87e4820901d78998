package com.vtb.redteam.detection;

/**
 * Оценщик не смог разобрать ответ цели
 */
public class DetectionFailureException extends RuntimeException {

    public DetectionFailureException(String message) {
        super(message);
    }

    public DetectionFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
