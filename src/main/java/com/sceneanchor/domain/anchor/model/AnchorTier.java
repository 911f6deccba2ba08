package com.sceneanchor.domain.anchor.model;

/**
 * Matching strategies, from most to least certain. Confidence bands are per tier and
 * are never compared across tiers.
 */
public enum AnchorTier {
    EXACT(1),
    CONTEXT_WINDOW(2),
    FUZZY_CORRIDOR(3),
    RARE_SHINGLE(4);

    private final int level;

    AnchorTier(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }
}
