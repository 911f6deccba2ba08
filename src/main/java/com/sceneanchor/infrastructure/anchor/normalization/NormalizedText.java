package com.sceneanchor.infrastructure.anchor.normalization;

import java.util.Arrays;

/**
 * Churn-normalized text plus the table mapping each normalized index back to the raw
 * index it came from. A collapsed whitespace run maps to the start of the run; index
 * {@code length()} maps to the raw length. The table is strictly increasing.
 */
public final class NormalizedText {

    private final String text;
    private final int[] rawIndex;

    NormalizedText(String text, int[] rawIndex) {
        this.text = text;
        this.rawIndex = rawIndex;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public int rawLength() {
        return rawIndex[rawIndex.length - 1];
    }

    /**
     * Raw position of the normalized position {@code normalizedIndex} (clamped to bounds).
     */
    public int toRaw(int normalizedIndex) {
        int i = Math.max(0, Math.min(normalizedIndex, text.length()));
        return rawIndex[i];
    }

    /**
     * Normalized position covering the raw position {@code rawPosition}: the last normalized
     * char whose raw origin is at or before it.
     */
    public int fromRaw(int rawPosition) {
        int found = Arrays.binarySearch(rawIndex, rawPosition);
        if (found >= 0) {
            return found;
        }
        int insertion = -found - 1;
        return Math.max(0, insertion - 1);
    }

    public int indexOf(String needle, int fromIndex) {
        return text.indexOf(needle, fromIndex);
    }

    @Override
    public String toString() {
        return text;
    }
}
