package com.sceneanchor.infrastructure.anchor.token;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word tokenizer shared by the fuzzy corridor and rare shingle tiers, plus builders for
 * search patterns that find token sequences in raw or normalized text.
 *
 * Tokens are lowercase runs of letters, digits and inner apostrophes. Patterns tolerate any
 * non-alphanumeric separator between tokens (whitespace, punctuation, line breaks, quotes).
 */
@Component
public class SpanTokenizer {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}']+");

    private static final String PATTERN_SEPARATOR = "[^\\p{L}\\p{N}]+";
    private static final String LEFT_BOUNDARY = "(?<![\\p{L}\\p{N}])";
    private static final String RIGHT_BOUNDARY = "(?![\\p{L}\\p{N}])";
    private static final String APOSTROPHES = "['\\u2019]";

    private static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /**
     * Split text into lowercase word tokens.
     *
     * @param text any text (null yields no tokens)
     * @return tokens in order of appearance
     */
    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        String folded = text.toLowerCase(Locale.ROOT)
                .replace('\u2019', '\'')
                .replace('\u2018', '\'');

        List<String> tokens = new ArrayList<>();
        for (String part : TOKEN_SEPARATOR.split(folded)) {
            String token = stripApostrophes(part);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public Set<String> tokenSet(String text) {
        return new LinkedHashSet<>(tokenize(text));
    }

    /**
     * Pattern matching the given tokens in sequence, whole words only, case-insensitive,
     * separated by any run of non-alphanumeric chars.
     */
    public Pattern sequencePattern(List<String> tokens) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("token sequence must not be empty");
        }
        StringBuilder regex = new StringBuilder(LEFT_BOUNDARY);
        for (int i = 0; i < tokens.size(); i++) {
            if (i > 0) {
                regex.append(PATTERN_SEPARATOR);
            }
            regex.append(tokenRegex(tokens.get(i)));
        }
        regex.append(RIGHT_BOUNDARY);
        return Pattern.compile(regex.toString(), PATTERN_FLAGS);
    }

    /**
     * Pattern matching a single token as a whole word.
     */
    public Pattern tokenPattern(String token) {
        return Pattern.compile(LEFT_BOUNDARY + tokenRegex(token) + RIGHT_BOUNDARY, PATTERN_FLAGS);
    }

    /**
     * Split a stored shingle (space-joined tokens) back into its tokens.
     */
    public List<String> shingleTokens(String shingle) {
        if (shingle == null || shingle.isBlank()) {
            return List.of();
        }
        return List.of(shingle.strip().split(" +"));
    }

    private String tokenRegex(String token) {
        StringBuilder sb = new StringBuilder();
        int from = 0;
        int apostrophe;
        while ((apostrophe = token.indexOf('\'', from)) >= 0) {
            if (apostrophe > from) {
                sb.append(Pattern.quote(token.substring(from, apostrophe)));
            }
            sb.append(APOSTROPHES);
            from = apostrophe + 1;
        }
        if (from < token.length()) {
            sb.append(Pattern.quote(token.substring(from)));
        }
        return sb.toString();
    }

    private String stripApostrophes(String part) {
        int start = 0;
        int end = part.length();
        while (start < end && part.charAt(start) == '\'') {
            start++;
        }
        while (end > start && part.charAt(end - 1) == '\'') {
            end--;
        }
        return part.substring(start, end);
    }
}
