package com.sceneanchor.infrastructure.anchor.resolver;

import com.sceneanchor.domain.anchor.model.AnchorMatch;
import com.sceneanchor.domain.anchor.model.AnchorTier;
import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.infrastructure.anchor.fingerprint.ContentHasher;
import com.sceneanchor.infrastructure.anchor.normalization.ChurnNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Tier 1: the span is still at its last known offset.
 * <ul>
 *   <li>slice equals the stored text verbatim: 1.0</li>
 *   <li>slice hashes to the stored content hash: 1.0</li>
 *   <li>text at the offset equals the stored text once churn is removed: 0.98</li>
 * </ul>
 * The churn check reads slightly past the stored length, since CRLF/LF churn inside the
 * span changes its raw length.
 */
@Component
@RequiredArgsConstructor
public class ExactSliceTier implements AnchorTierStrategy {

    static final double EXACT_CONFIDENCE = 1.0;
    static final double CHURN_CONFIDENCE = 0.98;

    private static final int MIN_CHURN_SLACK = 16;

    private final ContentHasher hasher;
    private final ChurnNormalizer normalizer;

    @Override
    public AnchorTier tier() {
        return AnchorTier.EXACT;
    }

    @Override
    public boolean isApplicable(ResolutionContext ctx) {
        Fingerprint fp = ctx.getFingerprint();
        return fp.hasText() || fp.contentHash() != null;
    }

    @Override
    public Optional<AnchorMatch> attempt(ResolutionContext ctx) {
        Fingerprint fp = ctx.getFingerprint();
        String text = ctx.getCurrentText();
        int offset = fp.offset();
        long end = (long) offset + fp.length();

        if (offset > text.length()) {
            return Optional.empty();
        }

        if (end <= text.length()) {
            String slice = text.substring(offset, (int) end);
            if (fp.hasText() && slice.equals(fp.text())) {
                return Optional.of(AnchorMatch.of(AnchorTier.EXACT, EXACT_CONFIDENCE, offset));
            }
            if (fp.contentHash() != null && fp.contentHash().equals(hasher.sha256(slice))) {
                return Optional.of(AnchorMatch.of(AnchorTier.EXACT, EXACT_CONFIDENCE, offset));
            }
        }

        if (fp.hasText() && offset < text.length()) {
            String storedNormalized = normalizer.normalizeString(fp.text());
            int slack = Math.max(MIN_CHURN_SLACK, fp.length() / 10);
            int windowEnd = (int) Math.min(text.length(), end + slack);
            String windowNormalized = normalizer.normalizeString(text.substring(offset, windowEnd));
            if (!storedNormalized.isBlank() && windowNormalized.startsWith(storedNormalized)) {
                return Optional.of(AnchorMatch.of(AnchorTier.EXACT, CHURN_CONFIDENCE, offset));
            }
        }

        return Optional.empty();
    }
}
