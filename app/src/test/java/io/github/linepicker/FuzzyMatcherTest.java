package io.github.linepicker;

import static org.junit.jupiter.api.Assertions.*;

import io.github.linepicker.ScoringConfig.ConsecutiveRule;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for {@link FuzzyMatcher}. Expected scores follow the DP rules with the default weights: match 16,
 * boundary 16, consecutive 16, gap start -3, gap extend -1.
 */
class FuzzyMatcherTest {

    private static void assertBetterScore(String pattern, String betterMatch, String worseMatch) {
        var matcher = new FuzzyMatcher(pattern);
        int better = matcher.score(betterMatch);
        int worse = matcher.score(worseMatch);
        assertTrue(
                better > worse,
                String.format(
                        "Expected score for '%s' (%d) to exceed score for '%s' (%d) with pattern '%s'",
                        betterMatch, better, worseMatch, worse, pattern));
    }

    @Test
    @DisplayName("Empty pattern matches anything with score 0 and no positions")
    void emptyPatternMatchesEverything() {
        var matcher = new FuzzyMatcher("");
        assertEquals(MatchResult.EMPTY_PATTERN, matcher.match("anything"));
        assertEquals(MatchResult.EMPTY_PATTERN, matcher.match(""));
    }

    @Test
    @DisplayName("Pattern longer than the candidate never matches")
    void longerPatternNeverMatches() {
        assertEquals(MatchResult.NO_MATCH, FuzzyMatcher.match("xyz", "x"));
        assertEquals(MatchResult.NO_MATCH, FuzzyMatcher.match("ab", "a"));
        assertEquals(MatchResult.NO_MATCH, FuzzyMatcher.match("a", ""));
    }

    @Test
    void nonMatchHasZeroScoreAndNoPositions() {
        var result = FuzzyMatcher.match("abc", "xyz");
        assertFalse(result.matched());
        assertEquals(0, result.score());
        assertTrue(result.positions().isEmpty());
    }

    @Test
    void singleCharacterAtStartGetsBoundaryBonus() {
        assertEquals(new MatchResult(true, 32, List.of(0)), FuzzyMatcher.match("a", "a"));
        assertEquals(new MatchResult(true, 16, List.of(1)), FuzzyMatcher.match("a", "xa"));
    }

    @Test
    void exactMatchCollectsEveryBonus() {
        assertEquals(new MatchResult(true, 96, List.of(0, 1, 2)), FuzzyMatcher.match("foo", "foo"));
    }

    @Test
    @DisplayName("Consecutive bonus compares the preceding characters of pattern and candidate")
    void consecutiveBonusUsesPrecedingCharacters() {
        // the second 'o' follows 'o' in the candidate but 'f' in the pattern, so it earns no consecutive bonus
        assertEquals(new MatchResult(true, 47, List.of(0, 2)), FuzzyMatcher.match("fo", "foo"));
        assertEquals(new MatchResult(true, 31, List.of(1, 3)), FuzzyMatcher.match("fo", "xfoo"));
    }

    @Test
    void spaceStartsAWord() {
        assertEquals(new MatchResult(true, 58, List.of(0, 3)), FuzzyMatcher.match("ms", "my stuff"));
        assertEquals(new MatchResult(true, 43, List.of(0, 2)), FuzzyMatcher.match("ms", "mystuff"));
        assertBetterScore("ms", "my stuff", "mystuff");
    }

    @Test
    @DisplayName("Mismatch cells inherit positions from the left even when the vertical gap wins")
    void positionsMayBeShorterThanPattern() {
        var result = FuzzyMatcher.match("readme", "main.go");
        assertTrue(result.matched());
        assertEquals(23, result.score());
        assertEquals(List.of(), result.positions());

        var pie = FuzzyMatcher.match("pie", "grape juice");
        assertEquals(new MatchResult(true, 43, List.of(3, 8, 10)), pie);
    }

    @Test
    void trailingCharactersCostGapExtension() {
        assertEquals(16, FuzzyMatcher.match("q", "abcdefghijklmnopq").score());
        assertEquals(7, FuzzyMatcher.match("q", "abcdefghijklmnopqrstuvwxyzabcdefghijklmnopqrstuvwxyz").score());
    }

    @Test
    @DisplayName("Matching is case-insensitive and case does not change the score")
    void caseInsensitive() {
        var upper = FuzzyMatcher.match("AB", "xaybz");
        var lower = FuzzyMatcher.match("ab", "xAYbz");
        assertTrue(upper.matched());
        assertEquals(upper.matched(), lower.matched());
        assertEquals(upper.score(), lower.score());
        assertEquals(30, upper.score());
        assertEquals(List.of(1, 3), lower.positions());
    }

    @Test
    void nonAsciiCaseFolding() {
        assertEquals(new MatchResult(true, 64, List.of(0, 1)), FuzzyMatcher.match("ÄB", "äb"));
    }

    @Test
    @DisplayName("Precomposed and decomposed accents are the same character")
    void canonicallyEquivalentFormsMatch() {
        var precomposed = "Caf\u00e9";
        var decomposed = "Cafe\u0301";
        assertEquals(new MatchResult(true, 128, List.of(0, 1, 2, 3)), FuzzyMatcher.match("caf\u00e9", decomposed));
        assertEquals(FuzzyMatcher.match("caf\u00e9", precomposed), FuzzyMatcher.match("caf\u00e9", decomposed));
        assertEquals(FuzzyMatcher.match("caf\u00e9", precomposed), FuzzyMatcher.match("cafe\u0301", precomposed));
        assertEquals(new MatchResult(true, 32, List.of(0)), FuzzyMatcher.match("\u00e9", "e\u0301"));
        assertEquals(new MatchResult(true, 32, List.of(0)), FuzzyMatcher.match("\u00c9", "e\u0301"));
    }

    @Test
    void combiningMarkBelongsToItsBaseCharacter() {
        // the accent combines with 'e' into one character, so 'x' sits at index 1
        assertEquals(new MatchResult(true, 16, List.of(1)), FuzzyMatcher.match("x", "e\u0301x"));
        assertFalse(FuzzyMatcher.match("e", "e\u0301").matched());
    }

    @Test
    @DisplayName("Positions count characters, not UTF-16 units")
    void supplementaryCharactersCountAsOnePosition() {
        var result = FuzzyMatcher.match("a", "😀a");
        assertEquals(new MatchResult(true, 16, List.of(1)), result);
        assertEquals(MatchResult.NO_MATCH, FuzzyMatcher.match("ab", "😀"));
    }

    @Test
    void boundaryMatchBeatsMidWordMatch() {
        assertBetterScore("fo", "foo", "xfoo");
        assertBetterScore("hw", "hello world", "helloworld");
    }

    @Test
    void wholeCandidateBeatsScatteredSubsequence() {
        assertBetterScore("abc", "abc", "a_b_c");
        assertBetterScore("foo", "foo", "f_o_o_bar");
        assertEquals(62, FuzzyMatcher.match("abc", "a_b_c").score());
    }

    @Test
    void readmeScenario() {
        var matcher = new FuzzyMatcher("readme");
        assertEquals(192, matcher.score("README"));
        assertEquals(189, matcher.score("Readme.md"));
        assertTrue(matcher.score("README") >= matcher.score("Readme.md"));
        assertTrue(matcher.score("Readme.md") > matcher.score("main.go"));
    }

    @Test
    @DisplayName("Adjacent-run rule only rewards runs on the recovered path")
    void adjacentRunRuleDiffersFromLiteralRule() {
        var literal = new FuzzyMatcher("aabaa");
        var adjacent = new FuzzyMatcher("aabaa", ScoringConfig.DEFAULT.withConsecutiveRule(ConsecutiveRule.ADJACENT_RUN));

        assertEquals(new MatchResult(true, 73, List.of(4)), literal.match("xxaaax"));
        assertEquals(new MatchResult(true, 57, List.of(4)), adjacent.match("xxaaax"));

        // on an exact match both rules agree
        assertEquals(new MatchResult(true, 160, List.of(0, 1, 2, 3, 4)), adjacent.match("aabaa"));
        assertEquals(literal.match("aabaa"), adjacent.match("aabaa"));
        assertEquals(96, new FuzzyMatcher("foo", adjacent.getConfig()).score("foo"));
    }

    @Test
    @DisplayName("The reserved non-contiguous penalty never changes scores")
    void nonContiguousPenaltyIsInert() {
        var tuned = new ScoringConfig(16, 16, 16, -3, -1, -500, ConsecutiveRule.PREVIOUS_CHARACTERS);
        for (var candidate : List.of("a_b_c", "abc", "xaxbxc", "a b c")) {
            assertEquals(FuzzyMatcher.match("abc", candidate), new FuzzyMatcher("abc", tuned).match(candidate));
        }
    }

    @Test
    void customWeightsAreApplied() {
        var noBoundary = new ScoringConfig(16, 0, 16, -3, -1, -5, ConsecutiveRule.PREVIOUS_CHARACTERS);
        assertEquals(16, new FuzzyMatcher("a", noBoundary).score("a"));
    }

    @ParameterizedTest(name = "[{index}] ''{0}'' in ''{1}'' matches: {2}")
    @CsvSource({
        "ap, apple pie, true",
        "ap, banana split, true",
        "ap, grape juice, true",
        "ju, grape juice, true",
        "ju, apple pie, false",
        "e, banana split, false",
        "abc, xyz, false",
        "git, digital, true",
        "zz, pizza, true"
    })
    void matchScenarios(String pattern, String candidate, boolean expected) {
        assertEquals(expected, FuzzyMatcher.match(pattern, candidate).matched());
    }

    @Test
    void matchedIffScoreIsPositive() {
        for (var candidate : List.of("apple pie", "banana split", "grape juice", "", "e", "split")) {
            for (var pattern : List.of("e", "ap", "split", "qqq", "pie")) {
                var result = FuzzyMatcher.match(pattern, candidate);
                assertEquals(result.score() > 0, result.matched(), pattern + " / " + candidate);
            }
        }
    }
}
