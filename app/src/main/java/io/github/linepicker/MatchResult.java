package io.github.linepicker;

import java.util.List;

/**
 * Outcome of matching one pattern against one candidate.
 *
 * @param matched whether the pattern fuzzily occurs in the candidate
 * @param score relevance, higher is better; always {@code > 0} for a non-empty pattern that matched, {@code 0}
 *     otherwise
 * @param positions ascending character (grapheme cluster) indices into the original candidate attributed to the
 *     pattern; may be shorter than the pattern
 */
public record MatchResult(boolean matched, int score, List<Integer> positions) {
    /** Result for every candidate when the pattern is empty. */
    public static final MatchResult EMPTY_PATTERN = new MatchResult(true, 0, List.of());

    public static final MatchResult NO_MATCH = new MatchResult(false, 0, List.of());

    public MatchResult {
        positions = List.copyOf(positions);
    }
}
