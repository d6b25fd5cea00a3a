package io.github.linepicker;

import static java.util.Objects.requireNonNull;

import io.github.linepicker.ScoringConfig.ConsecutiveRule;
import io.github.linepicker.util.FuzzyMatcherUtil;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A dynamic-programming fuzzy matcher. It decides whether a pattern occurs as a (possibly gapped) subsequence of a
 * candidate, scores the alignment, and recovers the candidate positions attributed to the pattern.
 *
 * <p>Both sides are split into grapheme clusters, and each cluster is compared after NFC normalization and case
 * folding, so precomposed and decomposed accents match. Reported positions are cluster indices into the original
 * candidate. Higher scores indicate better matches; a candidate matches only when its score is
 * strictly positive.
 *
 * <p>For a pattern of length m and a candidate of length n, cell {@code (i, j)} holds the best score of the first i
 * pattern characters against the first j candidate characters:
 *
 * <ul>
 *   <li>equal characters either start a match on the diagonal (match bonus, plus boundary and consecutive bonuses) or,
 *       when that does not beat the cell above plus the gap-start penalty, carry the cell above down;
 *   <li>different characters take the better of the cell to the left plus the gap-extend penalty and the cell above
 *       plus the gap-start penalty, and always inherit the positions of the cell to the left.
 * </ul>
 *
 * <p>Only two score rows are kept. Each cell records which of the three moves produced it, and the final positions are
 * recovered with a single backtrack from {@code (m, n)}. This yields exactly the positions a table of per-cell position
 * lists would hold, without copying lists.
 *
 * <p>Instances are immutable and thread-safe.
 */
public class FuzzyMatcher {
    private static final byte MATCH_START = 1;
    private static final byte GAP_FROM_ABOVE = 2;
    private static final byte GAP_FROM_LEFT = 3;

    private final String pattern;
    private final String[] foldedPattern;
    private final ScoringConfig config;

    /**
     * Constructs a matcher for the given pattern using the default weights.
     *
     * @param pattern the query; not trimmed, spaces are significant
     */
    public FuzzyMatcher(String pattern) {
        this(pattern, ScoringConfig.DEFAULT);
    }

    public FuzzyMatcher(String pattern, ScoringConfig config) {
        this.pattern = requireNonNull(pattern);
        this.config = requireNonNull(config);
        this.foldedPattern = FuzzyMatcherUtil.foldedGraphemes(pattern);
    }

    /** Convenience for a one-off match with default weights. */
    public static MatchResult match(String pattern, String candidate) {
        return new FuzzyMatcher(pattern).match(candidate);
    }

    public String getPattern() {
        return pattern;
    }

    public ScoringConfig getConfig() {
        return config;
    }

    /**
     * Checks if the given candidate matches the pattern.
     */
    public boolean matches(String candidate) {
        return match(candidate).matched();
    }

    /**
     * Returns the score of the candidate, or {@code 0} if it does not match.
     */
    public int score(String candidate) {
        return match(candidate).score();
    }

    /**
     * Matches the pattern against {@code candidate}.
     *
     * <p>An empty pattern matches everything with score 0 and no positions. A pattern with more characters than the
     * candidate never matches.
     */
    public MatchResult match(String candidate) {
        requireNonNull(candidate);
        int m = foldedPattern.length;
        if (m == 0) {
            return MatchResult.EMPTY_PATTERN;
        }
        String[] text = FuzzyMatcherUtil.foldedGraphemes(candidate);
        int n = text.length;
        if (m > n) {
            return MatchResult.NO_MATCH;
        }

        boolean adjacentRun = config.consecutiveRule() == ConsecutiveRule.ADJACENT_RUN;
        int[] prev = new int[n + 1];
        int[] cur = new int[n + 1];
        // last matched position on the recovered path of each cell, -1 if none; only needed for ADJACENT_RUN
        int[] prevLast = adjacentRun ? filled(n + 1, -1) : null;
        int[] curLast = adjacentRun ? filled(n + 1, -1) : null;
        byte[][] moves = new byte[m + 1][n + 1];

        for (int i = 1; i <= m; i++) {
            String p = foldedPattern[i - 1];
            cur[0] = 0;
            if (adjacentRun) {
                curLast[0] = -1;
            }
            for (int j = 1; j <= n; j++) {
                String c = text[j - 1];
                if (p.equals(c)) {
                    int bonus = config.matchBonus();
                    if (FuzzyMatcherUtil.isBoundary(text, j - 1)) {
                        bonus += config.boundaryBonus();
                    }
                    if (i > 1 && j > 1) {
                        boolean consecutive = adjacentRun
                                ? prevLast[j - 1] == j - 2
                                : foldedPattern[i - 2].equals(text[j - 2]);
                        if (consecutive) {
                            bonus += config.consecutiveBonus();
                        }
                    }
                    int newScore = prev[j - 1] + bonus;
                    int carried = prev[j] + config.gapStartPenalty();
                    if (newScore > carried) {
                        cur[j] = newScore;
                        moves[i][j] = MATCH_START;
                        if (adjacentRun) {
                            curLast[j] = j - 1;
                        }
                    } else {
                        cur[j] = carried;
                        moves[i][j] = GAP_FROM_ABOVE;
                        if (adjacentRun) {
                            curLast[j] = prevLast[j];
                        }
                    }
                } else {
                    cur[j] = Math.max(cur[j - 1] + config.gapExtendPenalty(), prev[j] + config.gapStartPenalty());
                    // positions follow the left cell even when the vertical term wins
                    moves[i][j] = GAP_FROM_LEFT;
                    if (adjacentRun) {
                        curLast[j] = curLast[j - 1];
                    }
                }
            }
            int[] swap = prev;
            prev = cur;
            cur = swap;
            if (adjacentRun) {
                int[] swapLast = prevLast;
                prevLast = curLast;
                curLast = swapLast;
            }
        }

        int finalScore = prev[n];
        if (finalScore <= 0) {
            return MatchResult.NO_MATCH;
        }
        return new MatchResult(true, finalScore, backtrack(moves, m, n));
    }

    /**
     * Walks the move table from {@code (m, n)} back to row 0 or column 0, both of which hold an empty position list.
     */
    private static List<Integer> backtrack(byte[][] moves, int m, int n) {
        var positions = new ArrayList<Integer>();
        int i = m;
        int j = n;
        while (i > 0 && j > 0) {
            switch (moves[i][j]) {
                case MATCH_START -> {
                    positions.add(j - 1);
                    i--;
                    j--;
                }
                case GAP_FROM_ABOVE -> i--;
                case GAP_FROM_LEFT -> j--;
                default -> throw new IllegalStateException("Unfilled cell at (" + i + ", " + j + ")");
            }
        }
        Collections.reverse(positions);
        return positions;
    }

    private static int[] filled(int length, int value) {
        var a = new int[length];
        Arrays.fill(a, value);
        return a;
    }

    @Override
    public String toString() {
        return "FuzzyMatcher[" + pattern + "]";
    }
}
