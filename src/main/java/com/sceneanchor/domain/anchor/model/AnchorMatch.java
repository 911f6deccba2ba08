package com.sceneanchor.domain.anchor.model;

/**
 * Successful relocation of a span.
 *
 * @param tier       the strategy that found it
 * @param confidence 0..1, meaningful only within the tier's band
 * @param position   new absolute start position in the current text
 */
public record AnchorMatch(
        AnchorTier tier,
        double confidence,
        int position
) {
    public static AnchorMatch of(AnchorTier tier, double confidence, int position) {
        return new AnchorMatch(tier, Math.round(confidence * 10_000d) / 10_000d, position);
    }

    public int level() {
        return tier.level();
    }
}
