package com.sceneanchor.domain.anchor.model;

import java.util.List;
import java.util.Optional;

/**
 * Result of a resolution together with the tiers that were tried on the way.
 *
 * @param match    the winning match, or null when every tier failed
 * @param attempts tier outcomes in the order they were tried
 */
public record ResolutionTrace(
        AnchorMatch match,
        List<TierAttempt> attempts
) {
    public ResolutionTrace {
        attempts = List.copyOf(attempts);
    }

    public Optional<AnchorMatch> toMatch() {
        return Optional.ofNullable(match);
    }

    public boolean resolved() {
        return match != null;
    }

    /**
     * The last tier that actually ran (skipped tiers do not count), or null if none ran.
     */
    public AnchorTier lastAttemptedTier() {
        AnchorTier last = null;
        for (TierAttempt attempt : attempts) {
            if (attempt.outcome() != TierAttempt.Outcome.SKIPPED) {
                last = attempt.tier();
            }
        }
        return last;
    }
}
