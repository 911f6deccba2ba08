package com.sceneanchor.infrastructure.anchor.fingerprint;

import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.domain.anchor.model.FingerprintCollection;
import com.sceneanchor.domain.anchor.model.SceneSpan;
import com.sceneanchor.infrastructure.anchor.InvalidSpanException;
import com.sceneanchor.infrastructure.anchor.normalization.ChurnNormalizer;
import com.sceneanchor.infrastructure.anchor.token.RareShingleSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Captures one fingerprint per span from a single document snapshot.
 * <p>
 * The content hash is taken over the exact span text, so any byte-level change breaks hash
 * equality and forces the resolver into its fallback tiers. Contexts are stored verbatim;
 * normalization only happens at comparison time.
 * </p>
 */
@Slf4j
@Component
public class FingerprintBuilder {

    public static final int CONTEXT_LENGTH = 64;

    private final ContentHasher hasher;
    private final ChurnNormalizer normalizer;
    private final RareShingleSelector shingleSelector;
    private final Clock clock;

    @Value("${anchor.fingerprint.retain-text:true}")
    private boolean retainText = true;

    @Value("${anchor.fingerprint.rare-shingles:true}")
    private boolean computeRareShingles = true;

    public FingerprintBuilder(ContentHasher hasher,
                              ChurnNormalizer normalizer,
                              RareShingleSelector shingleSelector,
                              Clock clock) {
        this.hasher = hasher;
        this.normalizer = normalizer;
        this.shingleSelector = shingleSelector;
        this.clock = clock;
    }

    /**
     * Fingerprint every span of the document.
     *
     * @param document full document text
     * @param spans    spans in document order, ids unique
     * @return the collection for this snapshot
     * @throws InvalidSpanException if a span lies outside the document or an id repeats
     */
    public FingerprintCollection build(String document, List<SceneSpan> spans) {
        if (document == null) {
            throw new InvalidSpanException("document must not be null");
        }
        if (spans == null) {
            throw new InvalidSpanException("span list must not be null");
        }

        Map<String, Fingerprint> fingerprints = new LinkedHashMap<>();
        for (SceneSpan span : spans) {
            Fingerprint fingerprint = fingerprint(document, span);
            if (fingerprints.putIfAbsent(span.id(), fingerprint) != null) {
                throw new InvalidSpanException("duplicate span id: " + span.id());
            }
        }

        log.debug("[FingerprintBuilder] {} fingerprints from {} chars", fingerprints.size(), document.length());

        return new FingerprintCollection(checksum(document), clock.instant(), fingerprints);
    }

    /**
     * Fingerprint a single span.
     */
    public Fingerprint fingerprint(String document, SceneSpan span) {
        if (span == null || span.id() == null) {
            throw new InvalidSpanException("span and span id must not be null");
        }
        int start = span.startOffset();
        int end = span.endOffset();
        if (start < 0 || end < start || end > document.length()) {
            throw new InvalidSpanException(String.format(
                    "span %s bounds [%d, %d) outside document of length %d",
                    span.id(), start, end, document.length()));
        }

        String text = document.substring(start, end);
        if (span.text() != null && !span.text().equals(text)) {
            log.warn("[FingerprintBuilder] span {} text differs from document slice [{}, {}), using the slice",
                    span.id(), start, end);
        }

        String preceding = document.substring(Math.max(0, start - CONTEXT_LENGTH), start);
        String following = document.substring(end, Math.min(document.length(), end + CONTEXT_LENGTH));
        List<String> shingles = computeRareShingles ? shingleSelector.select(text) : List.of();

        return new Fingerprint(
                span.id(),
                hasher.sha256(text),
                start,
                end - start,
                preceding,
                following,
                shingles,
                retainText ? text : null
        );
    }

    /**
     * Checksum of the whole document, insensitive to churn.
     */
    public String checksum(String document) {
        return hasher.sha256(normalizer.normalizeString(document).strip());
    }
}
