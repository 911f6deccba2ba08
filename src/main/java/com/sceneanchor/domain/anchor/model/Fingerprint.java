package com.sceneanchor.domain.anchor.model;

import java.util.List;
import java.util.Objects;

/**
 * Content-addressed descriptor of one span, used to relocate it after the document changes.
 * <p>
 * Records loaded from disk are not validated here: a negative offset or length is reported
 * by the resolver, so one bad record cannot prevent the rest of a collection from loading.
 * </p>
 *
 * @param id               stable span identifier
 * @param contentHash      SHA-256 hex of the exact, unnormalized span text (nullable on malformed records)
 * @param offset           last known start position
 * @param length           span length in chars
 * @param precedingContext up to 64 chars immediately before the span
 * @param followingContext up to 64 chars immediately after the span
 * @param rareShingles     up to 3 cached 8-token signatures (never null)
 * @param text             the span text itself, nullable when only the hash was retained
 */
public record Fingerprint(
        String id,
        String contentHash,
        int offset,
        int length,
        String precedingContext,
        String followingContext,
        List<String> rareShingles,
        String text
) {
    public Fingerprint {
        Objects.requireNonNull(id, "id");
        precedingContext = precedingContext != null ? precedingContext : "";
        followingContext = followingContext != null ? followingContext : "";
        rareShingles = rareShingles != null ? List.copyOf(rareShingles) : List.of();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public int end() {
        return offset + length;
    }

    /**
     * Copy without the span text, as written to the fingerprint file.
     */
    public Fingerprint withoutText() {
        return new Fingerprint(id, contentHash, offset, length,
                precedingContext, followingContext, rareShingles, null);
    }
}
