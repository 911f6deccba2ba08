package com.sceneanchor.infrastructure.anchor.token;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the most distinctive 8-token phrases of a span.
 *
 * A shingle scores the sum of 1/frequency of its tokens within the span. Shingles are
 * taken greedily by score (earlier start wins ties) and must start at least
 * {@link #SHINGLE_SIZE} tokens apart. Only shingles starting in the first
 * {@link #SEARCH_WINDOW_TOKENS} tokens are considered, which keeps the full-document
 * search bounded.
 */
@Component
@RequiredArgsConstructor
public class RareShingleSelector {

    public static final int SHINGLE_SIZE = 8;
    public static final int MAX_SHINGLES = 3;
    public static final int SEARCH_WINDOW_TOKENS = 64;

    private final SpanTokenizer tokenizer;

    private record ScoredShingle(int start, double score, String text) {}

    /**
     * @param spanText the span text
     * @return up to 3 shingles as space-joined lowercase tokens; empty if the span has fewer than 8 tokens
     */
    public List<String> select(String spanText) {
        List<String> tokens = tokenizer.tokenize(spanText);
        if (tokens.size() < SHINGLE_SIZE) {
            return List.of();
        }

        Map<String, Integer> frequency = new HashMap<>();
        for (String token : tokens) {
            frequency.merge(token, 1, Integer::sum);
        }

        int lastStart = Math.min(tokens.size() - SHINGLE_SIZE, SEARCH_WINDOW_TOKENS - 1);
        List<ScoredShingle> candidates = new ArrayList<>();
        for (int i = 0; i <= lastStart; i++) {
            double score = 0;
            for (int j = i; j < i + SHINGLE_SIZE; j++) {
                score += 1.0 / frequency.get(tokens.get(j));
            }
            candidates.add(new ScoredShingle(i, score,
                    String.join(" ", tokens.subList(i, i + SHINGLE_SIZE))));
        }

        candidates.sort(Comparator
                .comparingDouble(ScoredShingle::score).reversed()
                .thenComparingInt(ScoredShingle::start));

        List<ScoredShingle> picked = new ArrayList<>();
        for (ScoredShingle candidate : candidates) {
            if (picked.size() >= MAX_SHINGLES) {
                break;
            }
            boolean tooClose = picked.stream()
                    .anyMatch(p -> Math.abs(p.start() - candidate.start()) < SHINGLE_SIZE);
            if (!tooClose) {
                picked.add(candidate);
            }
        }

        return picked.stream().map(ScoredShingle::text).toList();
    }
}
