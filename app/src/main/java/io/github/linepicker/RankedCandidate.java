package io.github.linepicker;

import java.util.List;

/**
 * One entry of a ranked view.
 *
 * @param text the candidate line, unchanged
 * @param originalIndex index of the candidate in the list that was ranked
 * @param score match score; 0 when the query was empty
 * @param positions matched character positions; empty when the query was empty
 */
public record RankedCandidate(String text, int originalIndex, int score, List<Integer> positions) {
    public RankedCandidate {
        positions = List.copyOf(positions);
    }

    static RankedCandidate unscored(String text, int originalIndex) {
        return new RankedCandidate(text, originalIndex, 0, List.of());
    }
}
