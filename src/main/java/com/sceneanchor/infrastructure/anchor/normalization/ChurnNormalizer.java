package com.sceneanchor.infrastructure.anchor.normalization;

import org.springframework.stereotype.Component;

/**
 * Removes incidental editing churn so it is not mistaken for a content edit:
 * - curly single/double quotes to straight quotes
 * - any whitespace run (CR, LF, CRLF, tabs, NBSP) to a single space
 *
 * Line endings need no separate rule: they are whitespace and collapse with their run.
 * Every rule maps one raw char (or one run) to one normalized char, so the position
 * table stays monotonic.
 */
@Component
public class ChurnNormalizer {

    /**
     * Normalize and keep the normalized-to-raw position table.
     *
     * @param text raw text (null is treated as empty)
     * @return normalized text with its position table
     */
    public NormalizedText normalize(String text) {
        String raw = text != null ? text : "";
        int n = raw.length();
        StringBuilder sb = new StringBuilder(n);
        int[] map = new int[n + 1];
        int size = 0;

        int i = 0;
        while (i < n) {
            char c = raw.charAt(i);
            if (isChurnWhitespace(c)) {
                int start = i;
                while (i < n && isChurnWhitespace(raw.charAt(i))) {
                    i++;
                }
                sb.append(' ');
                map[size++] = start;
                continue;
            }
            sb.append(foldQuote(c));
            map[size++] = i;
            i++;
        }
        map[size] = n;

        int[] table = new int[size + 1];
        System.arraycopy(map, 0, table, 0, size + 1);
        return new NormalizedText(sb.toString(), table);
    }

    /**
     * Normalized string only, for comparisons where positions are not needed.
     */
    public String normalizeString(String text) {
        return normalize(text).text();
    }

    /**
     * True when both texts are equal once churn is removed.
     */
    public boolean equalsIgnoringChurn(String a, String b) {
        if (a == null || b == null) {
            return a == b;
        }
        return normalizeString(a).equals(normalizeString(b));
    }

    static boolean isChurnWhitespace(char c) {
        return Character.isWhitespace(c) || c == '\u00A0' || c == '\u2007' || c == '\u202F';
    }

    static char foldQuote(char c) {
        return switch (c) {
            case '\u2018', '\u2019', '\u201A', '\u201B' -> '\'';
            case '\u201C', '\u201D', '\u201E', '\u201F' -> '"';
            default -> c;
        };
    }
}
