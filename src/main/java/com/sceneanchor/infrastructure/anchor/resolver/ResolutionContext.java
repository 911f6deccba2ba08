package com.sceneanchor.infrastructure.anchor.resolver;

import com.sceneanchor.domain.anchor.model.Fingerprint;
import com.sceneanchor.infrastructure.anchor.normalization.ChurnNormalizer;
import com.sceneanchor.infrastructure.anchor.normalization.NormalizedText;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Per-call state shared by the tiers of one resolution. The corridor and its normalized
 * form (with position table) are computed once and reused by the context and fuzzy tiers.
 * Never shared between threads.
 */
@Getter
public class ResolutionContext {

    private final Fingerprint fingerprint;
    private final String currentText;
    private final int corridor;
    private final int contextMin;

    /** Prior offset clamped into the current text. */
    private final int priorOffset;
    private final int corridorStart;
    private final int corridorEnd;

    @Getter(AccessLevel.NONE)
    private final ChurnNormalizer normalizer;

    @Getter(AccessLevel.NONE)
    private NormalizedText normalizedCorridor;

    public ResolutionContext(Fingerprint fingerprint,
                             String currentText,
                             int corridor,
                             int contextMin,
                             ChurnNormalizer normalizer) {
        this.fingerprint = fingerprint;
        this.currentText = currentText;
        this.corridor = corridor;
        this.contextMin = contextMin;
        this.normalizer = normalizer;

        int textLength = currentText.length();
        this.priorOffset = clamp(fingerprint.offset(), 0, textLength);
        this.corridorStart = clamp((long) fingerprint.offset() - corridor, textLength);
        this.corridorEnd = clamp((long) fingerprint.offset() + fingerprint.length() + corridor, textLength);
    }

    public boolean hasCorridor() {
        return corridorEnd > corridorStart;
    }

    public NormalizedText normalizedCorridor() {
        if (normalizedCorridor == null) {
            normalizedCorridor = normalizer.normalize(currentText.substring(corridorStart, corridorEnd));
        }
        return normalizedCorridor;
    }

    /**
     * The prior offset expressed as a normalized index into the corridor.
     */
    public int priorInCorridor() {
        return normalizedCorridor().fromRaw(Math.max(0, priorOffset - corridorStart));
    }

    /**
     * Absolute raw position of a normalized corridor index.
     */
    public int corridorToRaw(int normalizedIndex) {
        return corridorStart + normalizedCorridor().toRaw(normalizedIndex);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static int clamp(long value, int max) {
        return (int) Math.max(0L, Math.min(max, value));
    }
}
