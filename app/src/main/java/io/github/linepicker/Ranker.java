package io.github.linepicker;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.stream.IntStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Filters and orders candidate lines against a query using {@link FuzzyMatcher}.
 *
 * <p>An empty query returns every candidate in its original order without scoring. Otherwise non-matching candidates
 * are dropped and the rest are sorted by descending score; equal scores keep their original relative order.
 */
public class Ranker {
    private static final Logger logger = LogManager.getLogger(Ranker.class);

    private static final Comparator<RankedCandidate> BY_SCORE_THEN_ORIGINAL_ORDER =
            Comparator.<RankedCandidate>comparingInt(RankedCandidate::score)
                    .reversed()
                    .thenComparingInt(RankedCandidate::originalIndex);

    private final ScoringConfig config;

    public Ranker() {
        this(ScoringConfig.DEFAULT);
    }

    public Ranker(ScoringConfig config) {
        this.config = requireNonNull(config);
    }

    public ScoringConfig getConfig() {
        return config;
    }

    /** Ranks with default weights and returns only the candidate texts. */
    public static List<String> rank(String query, List<String> candidates) {
        return new Ranker().rankTexts(query, candidates);
    }

    public List<String> rankTexts(String query, List<String> candidates) {
        return rankDetailed(query, candidates).stream()
                .map(RankedCandidate::text)
                .toList();
    }

    public List<RankedCandidate> rankDetailed(String query, List<String> candidates) {
        return rankDetailed(query, candidates, () -> false);
    }

    /**
     * Ranks {@code candidates}, checking {@code cancelled} between candidates.
     *
     * @throws CancellationException if {@code cancelled} reports true before the pass completes
     */
    public List<RankedCandidate> rankDetailed(String query, List<String> candidates, BooleanSupplier cancelled) {
        requireNonNull(query);
        requireNonNull(candidates);
        if (query.isEmpty()) {
            return IntStream.range(0, candidates.size())
                    .mapToObj(i -> RankedCandidate.unscored(candidates.get(i), i))
                    .toList();
        }

        var matcher = new FuzzyMatcher(query, config);
        var kept = new ArrayList<RankedCandidate>();
        for (int i = 0; i < candidates.size(); i++) {
            if (cancelled.getAsBoolean()) {
                throw new CancellationException("Ranking for '" + query + "' superseded");
            }
            var candidate = candidates.get(i);
            var result = matcher.match(candidate);
            if (result.matched()) {
                kept.add(new RankedCandidate(candidate, i, result.score(), result.positions()));
            }
        }
        kept.sort(BY_SCORE_THEN_ORIGINAL_ORDER);
        logger.debug("Ranked {} of {} candidates for query '{}'", kept.size(), candidates.size(), query);
        return List.copyOf(kept);
    }
}
