package com.sceneanchor.domain.anchor.model;

/**
 * Outcome of one tier during a resolution.
 */
public record TierAttempt(
        AnchorTier tier,
        Outcome outcome
) {
    public enum Outcome {
        MATCHED,
        NO_MATCH,
        /** The fingerprint lacks the inputs this tier needs. */
        SKIPPED
    }
}
