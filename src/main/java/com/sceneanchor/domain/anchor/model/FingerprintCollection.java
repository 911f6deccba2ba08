package com.sceneanchor.domain.anchor.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All fingerprints taken from one document snapshot. Immutable; a new edit cycle produces a
 * replacement collection.
 *
 * @param documentChecksum SHA-256 hex of the churn-normalized full text
 * @param generatedAt      capture time
 * @param spans            fingerprints keyed by span id, in document order
 */
public record FingerprintCollection(
        String documentChecksum,
        Instant generatedAt,
        Map<String, Fingerprint> spans
) {
    public FingerprintCollection {
        spans = spans != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(spans))
                : Map.of();
    }

    public Fingerprint get(String id) {
        return spans.get(id);
    }

    public boolean contains(String id) {
        return spans.containsKey(id);
    }

    public int size() {
        return spans.size();
    }
}
