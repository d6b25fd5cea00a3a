package io.github.linepicker.util;

import java.text.BreakIterator;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Character helpers for {@link io.github.linepicker.FuzzyMatcher}.
 *
 * <p>A character is a grapheme cluster as found by {@link BreakIterator#getCharacterInstance(Locale)}, so a base letter
 * with combining marks or a surrogate pair counts as one position. Clusters compare equal when they are canonically
 * equivalent and differ at most in case: {@code "é"} (U+00E9) equals {@code "É"}.
 */
public final class FuzzyMatcherUtil {
    private FuzzyMatcherUtil() {}

    /** Case-folded NFC form of one grapheme cluster. */
    public static String foldCase(String grapheme) {
        return Normalizer.normalize(grapheme.toLowerCase(Locale.ROOT), Normalizer.Form.NFC);
    }

    /**
     * Splits {@code s} into grapheme clusters and folds each one. Entry {@code k} is the k-th character of the original
     * string, so indices into the result are positions in {@code s}.
     */
    public static String[] foldedGraphemes(String s) {
        var clusters = new ArrayList<String>();
        var it = BreakIterator.getCharacterInstance(Locale.ROOT);
        it.setText(s);
        int start = it.first();
        for (int end = it.next(); end != BreakIterator.DONE; start = end, end = it.next()) {
            clusters.add(foldCase(s.substring(start, end)));
        }
        return clusters.toArray(String[]::new);
    }

    /**
     * Whether the 0-based position {@code index} starts a word: the first position, or a position right after a
     * plain space. Tabs and punctuation are not boundaries.
     */
    public static boolean isBoundary(String[] text, int index) {
        return index == 0 || " ".equals(text[index - 1]);
    }
}
