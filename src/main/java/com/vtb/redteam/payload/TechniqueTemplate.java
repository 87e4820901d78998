package com.vtb.redteam.payload;

import com.vtb.redteam.models.Intensity;

import java.util.Objects;
import java.util.function.Function;

/**
 * Шаблон техники атаки. Tier задает минимальную интенсивность, с которой
 * шаблон попадает в прогон.
 */
public final class TechniqueTemplate {

    private final String tag;
    private final Intensity tier;
    private final Function<PayloadContext, String> renderer;

    private TechniqueTemplate(String tag, Intensity tier, Function<PayloadContext, String> renderer) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.tier = Objects.requireNonNull(tier, "tier");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public static TechniqueTemplate of(String tag, Intensity tier, Function<PayloadContext, String> renderer) {
        return new TechniqueTemplate(tag, tier, renderer);
    }

    /**
     * Шаблон-строка с плейсхолдерами {intent}, {canary} и {probe}
     */
    public static TechniqueTemplate text(String tag, Intensity tier, String pattern) {
        return new TechniqueTemplate(tag, tier, ctx -> fill(pattern, ctx));
    }

    static String fill(String pattern, PayloadContext ctx) {
        return pattern
            .replace("{intent}", ctx.intent() != null ? ctx.intent() : "")
            .replace("{canary}", ctx.canaryToken() != null ? ctx.canaryToken() : "")
            .replace("{probe}", ctx.baseProbe() != null ? ctx.baseProbe() : "");
    }

    public String render(PayloadContext ctx) {
        String rendered = renderer.apply(ctx);
        return rendered != null ? rendered : "";
    }

    public String getTag() {
        return tag;
    }

    public Intensity getTier() {
        return tier;
    }

    @Override
    public String toString() {
        return tag + "[" + tier.getValue() + "]";
    }
}
