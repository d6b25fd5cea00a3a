package io.github.linepicker;

import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Weights used by {@link FuzzyMatcher}. Bonuses are positive, penalties negative; a candidate matches when its final
 * score is strictly positive.
 *
 * @param matchBonus awarded for every pattern character matched
 * @param boundaryBonus added when the matched candidate character is first or follows a space
 * @param consecutiveBonus added when the consecutive rule holds for the matched cell
 * @param gapStartPenalty applied when a pattern character is carried down without consuming a candidate character
 * @param gapExtendPenalty applied for every skipped candidate character
 * @param nonContiguousPenalty reserved for tuning; never applied to scores
 * @param consecutiveRule how the consecutive bonus is decided
 */
public record ScoringConfig(
        int matchBonus,
        int boundaryBonus,
        int consecutiveBonus,
        int gapStartPenalty,
        int gapExtendPenalty,
        int nonContiguousPenalty,
        ConsecutiveRule consecutiveRule) {
    private static final Logger logger = LogManager.getLogger(ScoringConfig.class);

    public static final String KEY_MATCH_BONUS = "match.bonus";
    public static final String KEY_BOUNDARY_BONUS = "boundary.bonus";
    public static final String KEY_CONSECUTIVE_BONUS = "consecutive.bonus";
    public static final String KEY_GAP_START_PENALTY = "gap.start.penalty";
    public static final String KEY_GAP_EXTEND_PENALTY = "gap.extend.penalty";
    public static final String KEY_NONCONTIGUOUS_PENALTY = "noncontiguous.penalty";
    public static final String KEY_CONSECUTIVE_RULE = "consecutive.rule";

    public static final ScoringConfig DEFAULT =
            new ScoringConfig(16, 16, 16, -3, -1, -5, ConsecutiveRule.PREVIOUS_CHARACTERS);

    public enum ConsecutiveRule {
        /**
         * Bonus when the pattern character before the current one equals the candidate character before the current
         * one. Whether that earlier pair was itself matched is not checked.
         */
        PREVIOUS_CHARACTERS,
        /** Bonus only when the path recovered for the diagonal cell ends at the immediately preceding position. */
        ADJACENT_RUN
    }

    public ScoringConfig {
        if (consecutiveRule == null) {
            throw new IllegalArgumentException("consecutiveRule must not be null");
        }
    }

    public ScoringConfig withConsecutiveRule(ConsecutiveRule rule) {
        return new ScoringConfig(
                matchBonus, boundaryBonus, consecutiveBonus, gapStartPenalty, gapExtendPenalty, nonContiguousPenalty, rule);
    }

    /**
     * Reads weights from {@code props}. Missing keys keep the default; malformed values are logged and also keep the
     * default.
     */
    public static ScoringConfig fromProperties(Properties props) {
        var d = DEFAULT;
        return new ScoringConfig(
                intProperty(props, KEY_MATCH_BONUS, d.matchBonus()),
                intProperty(props, KEY_BOUNDARY_BONUS, d.boundaryBonus()),
                intProperty(props, KEY_CONSECUTIVE_BONUS, d.consecutiveBonus()),
                intProperty(props, KEY_GAP_START_PENALTY, d.gapStartPenalty()),
                intProperty(props, KEY_GAP_EXTEND_PENALTY, d.gapExtendPenalty()),
                intProperty(props, KEY_NONCONTIGUOUS_PENALTY, d.nonContiguousPenalty()),
                ruleProperty(props, d.consecutiveRule()));
    }

    public Properties toProperties() {
        var props = new Properties();
        props.setProperty(KEY_MATCH_BONUS, Integer.toString(matchBonus));
        props.setProperty(KEY_BOUNDARY_BONUS, Integer.toString(boundaryBonus));
        props.setProperty(KEY_CONSECUTIVE_BONUS, Integer.toString(consecutiveBonus));
        props.setProperty(KEY_GAP_START_PENALTY, Integer.toString(gapStartPenalty));
        props.setProperty(KEY_GAP_EXTEND_PENALTY, Integer.toString(gapExtendPenalty));
        props.setProperty(KEY_NONCONTIGUOUS_PENALTY, Integer.toString(nonContiguousPenalty));
        props.setProperty(KEY_CONSECUTIVE_RULE, consecutiveRule.name().toLowerCase(Locale.ROOT));
        return props;
    }

    private static int intProperty(Properties props, String key, int fallback) {
        @Nullable String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-integer value '{}' for scoring key {}; using {}", raw, key, fallback);
            return fallback;
        }
    }

    private static ConsecutiveRule ruleProperty(Properties props, ConsecutiveRule fallback) {
        @Nullable String raw = props.getProperty(KEY_CONSECUTIVE_RULE);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return ConsecutiveRule.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown consecutive rule '{}'; using {}", raw, fallback);
            return fallback;
        }
    }
}
