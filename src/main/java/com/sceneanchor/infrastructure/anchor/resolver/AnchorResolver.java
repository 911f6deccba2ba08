package com.sceneanchor.infrastructure.anchor.resolver;

import com.sceneanchor.domain.anchor.model.AnchorMatch;
import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.domain.anchor.model.ResolutionTrace;
import com.sceneanchor.domain.anchor.model.TierAttempt;
import com.sceneanchor.infrastructure.anchor.MalformedFingerprintException;
import com.sceneanchor.infrastructure.anchor.normalization.ChurnNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Relocates a fingerprinted span in the current document text.
 * <p>
 * Order: exact slice, context window, fuzzy corridor, rare shingles.
 * </p>
 * Tiers run strictly in that order and the first match wins. "No match" is never an
 * exception; only a malformed fingerprint (negative offset or length, text that disagrees
 * with the recorded length) throws.
 * Stateless and safe to call from several threads for distinct fingerprints.
 */
@Slf4j
@Component
public class AnchorResolver {

    public static final int DEFAULT_CORRIDOR = 1500;
    public static final int DEFAULT_CONTEXT_MIN = 8;

    private final ChurnNormalizer normalizer;
    private final List<AnchorTierStrategy> tiers;

    @Value("${anchor.resolver.corridor:1500}")
    private int corridor = DEFAULT_CORRIDOR;

    @Value("${anchor.resolver.context-min:8}")
    private int contextMin = DEFAULT_CONTEXT_MIN;

    public AnchorResolver(ChurnNormalizer normalizer,
                          ExactSliceTier exactSliceTier,
                          ContextWindowTier contextWindowTier,
                          FuzzyCorridorTier fuzzyCorridorTier,
                          RareShingleTier rareShingleTier) {
        this.normalizer = normalizer;
        this.tiers = List.of(exactSliceTier, contextWindowTier, fuzzyCorridorTier, rareShingleTier);
    }

    public Optional<AnchorMatch> resolve(Fingerprint fingerprint, String currentText) {
        return resolveTrace(fingerprint, currentText, corridor, contextMin).toMatch();
    }

    public Optional<AnchorMatch> resolve(Fingerprint fingerprint, String currentText, int corridor, int contextMin) {
        return resolveTrace(fingerprint, currentText, corridor, contextMin).toMatch();
    }

    public ResolutionTrace resolveTrace(Fingerprint fingerprint, String currentText) {
        return resolveTrace(fingerprint, currentText, corridor, contextMin);
    }

    /**
     * Run the tiers in order and record what each one did.
     *
     * @param fingerprint the previous fingerprint of the span
     * @param currentText the full current document text
     * @param corridor    half-width of the search corridor around the prior position
     * @param contextMin  minimum usable length of a normalized context
     * @return trace with the winning match, or without one if every tier failed
     * @throws MalformedFingerprintException if the fingerprint is unusable
     */
    public ResolutionTrace resolveTrace(Fingerprint fingerprint, String currentText, int corridor, int contextMin) {
        validate(fingerprint);
        if (currentText == null) {
            throw new IllegalArgumentException("current text must not be null");
        }

        ResolutionContext ctx = new ResolutionContext(
                fingerprint, currentText, Math.max(0, corridor), Math.max(1, contextMin), normalizer);

        List<TierAttempt> attempts = new ArrayList<>();
        for (AnchorTierStrategy tier : tiers) {
            if (!tier.isApplicable(ctx)) {
                attempts.add(new TierAttempt(tier.tier(), TierAttempt.Outcome.SKIPPED));
                log.debug("[AnchorResolver] span {}: tier {} skipped", fingerprint.id(), tier.tier().level());
                continue;
            }

            Optional<AnchorMatch> match = tier.attempt(ctx);
            if (match.isPresent()) {
                attempts.add(new TierAttempt(tier.tier(), TierAttempt.Outcome.MATCHED));
                log.debug("[AnchorResolver] span {}: tier {} matched at {} (confidence={})",
                        fingerprint.id(), tier.tier().level(), match.get().position(), match.get().confidence());
                return new ResolutionTrace(match.get(), attempts);
            }

            attempts.add(new TierAttempt(tier.tier(), TierAttempt.Outcome.NO_MATCH));
            log.debug("[AnchorResolver] span {}: tier {} no match", fingerprint.id(), tier.tier().level());
        }

        return new ResolutionTrace(null, attempts);
    }

    private void validate(Fingerprint fingerprint) {
        if (fingerprint == null) {
            throw new MalformedFingerprintException("fingerprint must not be null");
        }
        if (fingerprint.offset() < 0) {
            throw new MalformedFingerprintException(
                    "fingerprint " + fingerprint.id() + " has negative offset " + fingerprint.offset());
        }
        if (fingerprint.length() < 0) {
            throw new MalformedFingerprintException(
                    "fingerprint " + fingerprint.id() + " has negative length " + fingerprint.length());
        }
        if (fingerprint.text() != null && fingerprint.text().length() != fingerprint.length()) {
            throw new MalformedFingerprintException(String.format(
                    "fingerprint %s text length %d does not match recorded length %d",
                    fingerprint.id(), fingerprint.text().length(), fingerprint.length()));
        }
    }
}
