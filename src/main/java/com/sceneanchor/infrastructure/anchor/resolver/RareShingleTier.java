package com.sceneanchor.infrastructure.anchor.resolver;

import com.sceneanchor.domain.anchor.model.AnchorMatch;
import com.sceneanchor.domain.anchor.model.AnchorTier;
import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.infrastructure.anchor.token.RareShingleSelector;
import com.sceneanchor.infrastructure.anchor.token.SpanTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tier 4: global search of the whole document by the span's rare shingles.
 * <p>
 * Every occurrence of a shingle's first token is a candidate start (shifted back by that
 * shingle's offset inside the stored text, when the text is known). A candidate scores the
 * number of shingles lying completely within {@code length} chars from it. The best
 * candidate (earliest on ties) is accepted from a hit ratio of 0.34, with confidence
 * {@code 0.6 + min(0.4, ratio) * 0.4}.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RareShingleTier implements AnchorTierStrategy {

    static final double ACCEPT_RATIO = 0.34;
    static final double BASE_CONFIDENCE = 0.6;
    static final double RATIO_CAP = 0.4;
    static final double RATIO_WEIGHT = 0.4;

    private final SpanTokenizer tokenizer;
    private final RareShingleSelector shingleSelector;

    private record CompiledShingle(Pattern sequence, Pattern firstToken, int leadIn) {}

    @Override
    public AnchorTier tier() {
        return AnchorTier.RARE_SHINGLE;
    }

    @Override
    public boolean isApplicable(ResolutionContext ctx) {
        Fingerprint fp = ctx.getFingerprint();
        return !fp.rareShingles().isEmpty() || fp.hasText();
    }

    @Override
    public Optional<AnchorMatch> attempt(ResolutionContext ctx) {
        Fingerprint fp = ctx.getFingerprint();
        List<CompiledShingle> shingles = compile(fp);
        if (shingles.isEmpty()) {
            return Optional.empty();
        }

        String text = ctx.getCurrentText();
        TreeSet<Integer> candidates = new TreeSet<>();
        for (CompiledShingle shingle : shingles) {
            Matcher matcher = shingle.firstToken().matcher(text);
            while (matcher.find()) {
                candidates.add(Math.max(0, matcher.start() - shingle.leadIn()));
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        List<Matcher> sequenceMatchers = shingles.stream()
                .map(s -> s.sequence().matcher(text).useTransparentBounds(true))
                .toList();
        int window = Math.max(1, fp.length());

        int bestPosition = -1;
        int bestHits = 0;
        for (int candidate : candidates) {
            int end = (int) Math.min(text.length(), (long) candidate + window);
            int hits = 0;
            for (Matcher sequence : sequenceMatchers) {
                sequence.region(candidate, end);
                if (sequence.find()) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                bestHits = hits;
                bestPosition = candidate;
                if (hits == shingles.size()) {
                    break;
                }
            }
        }

        double ratio = (double) bestHits / shingles.size();
        log.debug("[AnchorResolver] span {}: {} candidates, best {}/{} shingles at {}",
                fp.id(), candidates.size(), bestHits, shingles.size(), bestPosition);
        if (bestPosition < 0 || ratio < ACCEPT_RATIO) {
            return Optional.empty();
        }
        double confidence = BASE_CONFIDENCE + Math.min(RATIO_CAP, ratio) * RATIO_WEIGHT;
        return Optional.of(AnchorMatch.of(AnchorTier.RARE_SHINGLE, confidence, bestPosition));
    }

    private List<CompiledShingle> compile(Fingerprint fp) {
        List<String> shingles = !fp.rareShingles().isEmpty()
                ? fp.rareShingles()
                : shingleSelector.select(fp.text());

        List<CompiledShingle> compiled = new ArrayList<>();
        for (String shingle : shingles.subList(0, Math.min(RareShingleSelector.MAX_SHINGLES, shingles.size()))) {
            List<String> tokens = tokenizer.shingleTokens(shingle);
            if (tokens.isEmpty()) {
                continue;
            }
            Pattern sequence = tokenizer.sequencePattern(tokens);
            int leadIn = 0;
            if (fp.hasText()) {
                Matcher own = sequence.matcher(fp.text());
                leadIn = own.find() ? own.start() : 0;
            }
            compiled.add(new CompiledShingle(sequence, tokenizer.tokenPattern(tokens.get(0)), leadIn));
        }
        return compiled;
    }
}
