package com.vtb.redteam.target;

/**
 * Ответ цели и время вызова
 */
public record TargetResponse(String responseText, long elapsedMs) {
}
