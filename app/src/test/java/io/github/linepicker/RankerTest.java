package io.github.linepicker;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class RankerTest {
    private static final List<String> FRUIT = List.of("apple pie", "banana split", "grape juice");

    @Test
    void emptyQueryReturnsCandidatesUnchanged() {
        assertEquals(FRUIT, Ranker.rank("", FRUIT));

        var detailed = new Ranker().rankDetailed("", FRUIT);
        assertEquals(3, detailed.size());
        for (int i = 0; i < detailed.size(); i++) {
            assertEquals(new RankedCandidate(FRUIT.get(i), i, 0, List.of()), detailed.get(i));
        }
    }

    @Test
    void apQueryPutsApplePieFirst() {
        // scores: apple pie 57, grape juice 41, banana split 27
        assertEquals(List.of("apple pie", "grape juice", "banana split"), Ranker.rank("ap", FRUIT));

        var detailed = new Ranker().rankDetailed("ap", FRUIT);
        assertEquals(List.of(57, 41, 27), detailed.stream().map(RankedCandidate::score).toList());
        assertEquals(List.of(0, 6), detailed.get(0).positions());
        assertEquals(0, detailed.get(0).originalIndex());
        assertEquals(1, detailed.get(2).originalIndex());
    }

    @Test
    void nonMatchesAreDropped() {
        assertEquals(List.of("grape juice"), Ranker.rank("ju", FRUIT));
        assertEquals(List.of("apple pie", "grape juice"), Ranker.rank("e", FRUIT));
        assertEquals(List.of(), Ranker.rank("qqq", FRUIT));
    }

    @Test
    void readmeScenario() {
        var ranked = Ranker.rank("readme", List.of("Readme.md", "main.go", "README"));
        assertEquals(List.of("README", "Readme.md", "main.go"), ranked);
    }

    @Test
    void equalScoresKeepOriginalOrder() {
        var ranked = Ranker.rank("a", List.of("xa", "a b", "ya", "za"));
        assertEquals(List.of("a b", "xa", "ya", "za"), ranked);
    }

    @Test
    void rankingIsIdempotentAndDoesNotMutateInput() {
        var candidates = new ArrayList<>(List.of("git status", "digital", "gist", "logit"));
        var snapshot = List.copyOf(candidates);
        var first = Ranker.rank("git", candidates);
        var second = Ranker.rank("git", candidates);
        assertEquals(first, second);
        assertEquals(snapshot, candidates);
    }

    @Test
    void duplicateLinesAreKept() {
        assertEquals(List.of("dup", "dup"), Ranker.rank("d", List.of("dup", "other", "dup")));
    }

    @Test
    void cancellationStopsThePass() {
        var checks = new AtomicInteger();
        var ranker = new Ranker();
        assertThrows(
                CancellationException.class,
                () -> ranker.rankDetailed("a", FRUIT, () -> checks.incrementAndGet() > 1));
        assertEquals(2, checks.get());
    }

    @Test
    void emptyQueryIgnoresCancellation() {
        assertEquals(3, new Ranker().rankDetailed("", FRUIT, () -> true).size());
    }
}
