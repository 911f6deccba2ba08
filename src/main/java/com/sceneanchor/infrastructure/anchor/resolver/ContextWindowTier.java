package com.sceneanchor.infrastructure.anchor.resolver;

import com.sceneanchor.domain.anchor.model.AnchorMatch;
import com.sceneanchor.domain.anchor.model.AnchorTier;
import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.infrastructure.anchor.normalization.ChurnNormalizer;
import com.sceneanchor.infrastructure.anchor.normalization.NormalizedText;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Tier 2: reattach by the text that surrounded the span, searched inside the corridor.
 * <p>
 * Both contexts and the corridor are churn-normalized; match positions are mapped back to
 * raw offsets through the corridor's position table.
 * </p>
 * <ul>
 *   <li>preceding then following context, in order: 0.95</li>
 *   <li>preceding context only: 0.90</li>
 *   <li>following context only (start estimated from the stored length): 0.85</li>
 * </ul>
 * When the two contexts are found next to each other with only whitespace between them,
 * the span has been deleted and the tier fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextWindowTier implements AnchorTierStrategy {

    static final double BOTH_CONTEXTS_CONFIDENCE = 0.95;
    static final double PRECEDING_ONLY_CONFIDENCE = 0.90;
    static final double FOLLOWING_ONLY_CONFIDENCE = 0.85;

    static final int CONTEXT_LIMIT = 64;

    private final ChurnNormalizer normalizer;

    private record Contexts(String preceding, String following, boolean precedingUsable, boolean followingUsable) {}

    @Override
    public AnchorTier tier() {
        return AnchorTier.CONTEXT_WINDOW;
    }

    @Override
    public boolean isApplicable(ResolutionContext ctx) {
        Contexts contexts = contexts(ctx);
        return contexts.precedingUsable() || contexts.followingUsable();
    }

    @Override
    public Optional<AnchorMatch> attempt(ResolutionContext ctx) {
        if (!ctx.hasCorridor()) {
            return Optional.empty();
        }

        Fingerprint fp = ctx.getFingerprint();
        Contexts contexts = contexts(ctx);
        NormalizedText corridor = ctx.normalizedCorridor();
        String corridorText = corridor.text();
        int prior = ctx.priorInCorridor();

        String preceding = contexts.preceding();
        String followingCore = contexts.following().strip();

        List<Integer> precedingEnds = new ArrayList<>();
        if (contexts.precedingUsable()) {
            for (int index : occurrences(corridorText, preceding)) {
                precedingEnds.add(index + preceding.length());
            }
            precedingEnds.sort(Comparator
                    .comparingInt((Integer end) -> Math.abs(end - prior))
                    .thenComparingInt(end -> end));
        }

        if (contexts.followingUsable() && fp.length() > 0) {
            for (int precedingEnd : precedingEnds) {
                if (corridorText.substring(precedingEnd).stripLeading().startsWith(followingCore)) {
                    log.debug("[AnchorResolver] span {}: contexts adjacent at {}, span removed",
                            fp.id(), ctx.corridorToRaw(precedingEnd));
                    return Optional.empty();
                }
            }
        }

        if (contexts.followingUsable()) {
            int maxGap = Math.max(CONTEXT_LIMIT, 2 * fp.length() + CONTEXT_LIMIT);
            for (int precedingEnd : precedingEnds) {
                int followingIndex = corridorText.indexOf(followingCore, precedingEnd);
                if (followingIndex >= 0 && followingIndex - precedingEnd <= maxGap) {
                    return Optional.of(AnchorMatch.of(AnchorTier.CONTEXT_WINDOW,
                            BOTH_CONTEXTS_CONFIDENCE, ctx.corridorToRaw(precedingEnd)));
                }
            }
        }

        if (!precedingEnds.isEmpty()) {
            return Optional.of(AnchorMatch.of(AnchorTier.CONTEXT_WINDOW,
                    PRECEDING_ONLY_CONFIDENCE, ctx.corridorToRaw(precedingEnds.get(0))));
        }

        if (contexts.followingUsable()) {
            return followingOnly(ctx, contexts, corridorText, prior);
        }

        return Optional.empty();
    }

    private Optional<AnchorMatch> followingOnly(ResolutionContext ctx, Contexts contexts,
                                                String corridorText, int prior) {
        Fingerprint fp = ctx.getFingerprint();
        String followingCore = contexts.following().strip();
        String precedingCore = contexts.preceding().strip();
        int expected = prior + fp.length();

        List<Integer> candidates = occurrences(corridorText, followingCore);
        candidates.sort(Comparator
                .comparingInt((Integer index) -> Math.abs(index - expected))
                .thenComparingInt(index -> index));

        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        int index = candidates.get(0);
        if (contexts.precedingUsable()
                && corridorText.substring(0, index).stripTrailing().endsWith(precedingCore)) {
            log.debug("[AnchorResolver] span {}: contexts adjacent at {}, span removed",
                    fp.id(), ctx.corridorToRaw(index));
            return Optional.empty();
        }
        int rawFollowingStart = ctx.corridorToRaw(index);
        int position = Math.max(0, rawFollowingStart - leadingWhitespace(fp.followingContext()) - fp.length());
        return Optional.of(AnchorMatch.of(AnchorTier.CONTEXT_WINDOW, FOLLOWING_ONLY_CONFIDENCE, position));
    }

    private Contexts contexts(ResolutionContext ctx) {
        Fingerprint fp = ctx.getFingerprint();
        String rawPreceding = fp.precedingContext();
        String rawFollowing = fp.followingContext();
        String preceding = normalizer.normalizeString(
                rawPreceding.substring(Math.max(0, rawPreceding.length() - CONTEXT_LIMIT)));
        String following = normalizer.normalizeString(
                rawFollowing.substring(0, Math.min(rawFollowing.length(), CONTEXT_LIMIT)));
        return new Contexts(
                preceding,
                following,
                preceding.strip().length() >= ctx.getContextMin(),
                following.strip().length() >= ctx.getContextMin()
        );
    }

    private static List<Integer> occurrences(String haystack, String needle) {
        List<Integer> found = new ArrayList<>();
        int index = haystack.indexOf(needle);
        while (index >= 0) {
            found.add(index);
            index = haystack.indexOf(needle, index + 1);
        }
        return found;
    }

    private static int leadingWhitespace(String raw) {
        int i = 0;
        while (i < raw.length() && Character.isWhitespace(raw.charAt(i))) {
            i++;
        }
        return i;
    }
}
