package com.sceneanchor.infrastructure.anchor;

/**
 * Deterministic nonsense prose. Words are built from syllables that never spell an English
 * word used by the test spans, so contexts and shingles only match where a test puts them.
 */
public final class FillerText {

    private static final String[] SYLLABLES = {
            "zo", "qua", "vex", "kri", "mul", "tab", "nep", "dro",
            "gli", "sor", "pim", "fal", "rud", "kel", "yon", "bri"
    };

    private long state;

    public FillerText(long seed) {
        this.state = seed;
    }

    /**
     * Exactly {@code length} chars of prose, always ending with a space.
     */
    public static String of(long seed, int length) {
        FillerText filler = new FillerText(seed);
        StringBuilder sb = new StringBuilder();
        while (sb.length() < length) {
            sb.append(filler.nextWord()).append(' ');
        }
        sb.setLength(Math.max(0, length - 1));
        return sb.append(' ').toString();
    }

    /**
     * {@code count} words with a full stop every eleventh word, ending with a space.
     */
    public static String words(long seed, int count) {
        FillerText filler = new FillerText(seed);
        StringBuilder sb = new StringBuilder(count * 8);
        for (int i = 1; i <= count; i++) {
            sb.append(filler.nextWord());
            sb.append(i % 11 == 0 ? ". " : " ");
        }
        return sb.toString();
    }

    public String nextWord() {
        int syllables = 2 + next(2);
        StringBuilder word = new StringBuilder();
        for (int i = 0; i < syllables; i++) {
            word.append(SYLLABLES[next(SYLLABLES.length)]);
        }
        return word.toString();
    }

    private int next(int bound) {
        state = state * 6364136223846793005L + 1442695040888963407L;
        return (int) ((state >>> 33) % bound);
    }
}
