package com.pulse.trending.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns article text into candidate topic keywords.
 *
 * <p>Pure function of the text and the configured bounds: never throws, blank or
 * unparseable text yields no keywords. The lower bound defaults to 2 so that short
 * acronyms such as "AI" survive.
 */
public class KeywordExtractor {
    private static final Pattern MARKS = Pattern.compile("\\p{M}+");

    private final Stopwords stopwords;
    private final int minLen;
    private final int maxLen;

    public KeywordExtractor(Stopwords stopwords, int minLen, int maxLen) {
        this.stopwords = stopwords;
        this.minLen = minLen;
        this.maxLen = maxLen;
    }

    /**
     * Every qualifying keyword occurrence, in text order. Repeated words are repeated.
     *
     * <p>Words are runs of ASCII letters after diacritics are stripped; digits, hyphens and
     * other punctuation separate them. Dotted initialisms collapse into one word ("U.S." is
     * "us", "A.I." is "ai"). An apostrophe inside a word is dropped ("won't" is "wont"),
     * except a trailing possessive "'s", which is cut off ("Europe's" is "europe").
     */
    public List<String> tokens(String text) {
        if (text == null || text.isBlank()) return List.of();
        String norm = MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFKD))
                .replaceAll("")
                .toLowerCase(Locale.ROOT);

        List<String> out = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        int run = 0; // letters since the last initialism dot
        int n = norm.length();
        for (int i = 0; i < n; i++) {
            char c = norm.charAt(i);
            if (isLetter(c)) {
                word.append(c);
                run++;
                continue;
            }
            if (word.length() > 0 && c == '.' && run == 1 && startsInitial(norm, i + 1)) {
                run = 0;
                continue;
            }
            if (word.length() > 0 && isApostrophe(c) && i + 1 < n && isLetter(norm.charAt(i + 1))) {
                if (norm.charAt(i + 1) == 's' && (i + 2 >= n || !isLetter(norm.charAt(i + 2)))) {
                    i++; // possessive
                } else {
                    continue;
                }
            }
            emit(word, out);
            run = 0;
        }
        emit(word, out);
        return out;
    }

    private void emit(StringBuilder word, List<String> out) {
        if (word.length() == 0) return;
        String w = word.toString();
        word.setLength(0);
        if (w.length() < minLen || w.length() > maxLen) return;
        if (stopwords.contains(w)) return;
        out.add(w);
    }

    /** A single letter followed by a dot, i.e. the next part of an initialism. */
    private static boolean startsInitial(String s, int at) {
        return at + 1 < s.length() && isLetter(s.charAt(at)) && s.charAt(at + 1) == '.';
    }

    private static boolean isLetter(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isApostrophe(char c) {
        return c == '\'' || c == '\u2019';
    }

    /**
     * Distinct keywords in order of first appearance.
     */
    public Set<String> keywords(String text) {
        return new LinkedHashSet<>(tokens(text));
    }

    public int minKeywordLength() {
        return minLen;
    }

    public int maxKeywordLength() {
        return maxLen;
    }
}
