package com.sceneanchor.infrastructure.anchor.resolver;

import com.sceneanchor.domain.anchor.model.AnchorMatch;
import com.sceneanchor.domain.anchor.model.AnchorTier;

import java.util.Optional;

/**
 * One matching strategy of the resolver. Implementations never throw for "no match" and
 * clamp every offset they derive from the fingerprint.
 */
public interface AnchorTierStrategy {

    AnchorTier tier();

    /**
     * Whether the fingerprint carries what this tier needs (text, contexts, shingles).
     */
    boolean isApplicable(ResolutionContext ctx);

    Optional<AnchorMatch> attempt(ResolutionContext ctx);
}
