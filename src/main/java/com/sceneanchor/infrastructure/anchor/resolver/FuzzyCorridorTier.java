package com.sceneanchor.infrastructure.anchor.resolver;

import com.sceneanchor.domain.anchor.model.AnchorMatch;
import com.sceneanchor.domain.anchor.model.AnchorTier;
import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.infrastructure.anchor.normalization.ChurnNormalizer;
import com.sceneanchor.infrastructure.anchor.token.SpanTokenizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tier 3: the span was edited but still starts the same way and stayed near its old place.
 * <p>
 * The first five stored tokens seed a search inside the normalized corridor. At each seed
 * hit (nearest the prior offset first) a slice of about 1.1 times the stored length is compared
 * to the stored text by token-set overlap. Accepted from a ratio of 0.55; confidence grows
 * linearly from 0.6 (ratio 0.55) to 0.8 (ratio 1.0). Needs the stored span text.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class FuzzyCorridorTier implements AnchorTierStrategy {

    static final int MIN_TOKENS = 3;
    static final int SEED_TOKENS = 5;
    static final int MAX_SEED_HITS = 8;
    static final double SLICE_FACTOR = 1.1;

    static final double ACCEPT_RATIO = 0.55;
    static final double MIN_CONFIDENCE = 0.6;
    static final double MAX_CONFIDENCE = 0.8;

    private final SpanTokenizer tokenizer;
    private final ChurnNormalizer normalizer;

    @Override
    public AnchorTier tier() {
        return AnchorTier.FUZZY_CORRIDOR;
    }

    @Override
    public boolean isApplicable(ResolutionContext ctx) {
        Fingerprint fp = ctx.getFingerprint();
        return fp.hasText() && tokenizer.tokenize(fp.text()).size() >= MIN_TOKENS;
    }

    @Override
    public Optional<AnchorMatch> attempt(ResolutionContext ctx) {
        if (!ctx.hasCorridor()) {
            return Optional.empty();
        }

        Fingerprint fp = ctx.getFingerprint();
        List<String> storedTokens = tokenizer.tokenize(fp.text());
        Set<String> storedSet = Set.copyOf(storedTokens);
        Pattern seed = tokenizer.sequencePattern(
                storedTokens.subList(0, Math.min(SEED_TOKENS, storedTokens.size())));

        // chars before the first token (opening quote, dash...) inside the stored span
        Matcher own = seed.matcher(normalizer.normalizeString(fp.text()));
        int leadIn = own.find() ? own.start() : 0;

        int prior = ctx.priorInCorridor();
        List<Integer> seedStarts = new ArrayList<>();
        Matcher matcher = seed.matcher(ctx.normalizedCorridor().text());
        while (matcher.find()) {
            seedStarts.add(Math.max(0, matcher.start() - leadIn));
        }
        seedStarts.sort(Comparator
                .comparingInt((Integer start) -> Math.abs(start - prior))
                .thenComparingInt(start -> start));

        String text = ctx.getCurrentText();
        int sliceLength = (int) Math.ceil(fp.length() * SLICE_FACTOR);
        for (int start : seedStarts.subList(0, Math.min(MAX_SEED_HITS, seedStarts.size()))) {
            int rawStart = ctx.corridorToRaw(start);
            int rawEnd = (int) Math.min(text.length(), (long) rawStart + sliceLength);
            Set<String> candidate = tokenizer.tokenSet(text.substring(rawStart, rawEnd));

            long shared = storedSet.stream().filter(candidate::contains).count();
            double ratio = (double) shared / storedSet.size();
            if (ratio >= ACCEPT_RATIO) {
                return Optional.of(AnchorMatch.of(AnchorTier.FUZZY_CORRIDOR, confidence(ratio), rawStart));
            }
        }

        return Optional.empty();
    }

    static double confidence(double ratio) {
        double clamped = Math.min(1.0, Math.max(ACCEPT_RATIO, ratio));
        return MIN_CONFIDENCE + (clamped - ACCEPT_RATIO) / (1.0 - ACCEPT_RATIO) * (MAX_CONFIDENCE - MIN_CONFIDENCE);
    }
}
