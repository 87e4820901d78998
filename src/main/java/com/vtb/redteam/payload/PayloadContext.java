package com.vtb.redteam.payload;

import java.util.Random;

/**
 * Данные для отрисовки одного шаблона: цель, маркер, базовый текст и источник случайности
 */
public record PayloadContext(String intent,
                             String canaryToken,
                             String baseProbe,
                             int oversizedLength,
                             Random random) {

    public PayloadContext withBaseProbe(String probe) {
        return new PayloadContext(intent, canaryToken, probe, oversizedLength, random);
    }
}
