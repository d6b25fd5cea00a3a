package io.github.linepicker;

import static java.util.Objects.requireNonNull;

import io.github.linepicker.util.ExecutorServiceUtil;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Ranks off the caller's thread with last-query-wins delivery.
 *
 * <p>Each {@link #submit(String)} takes the next generation number. A pass that notices a newer generation stops
 * between candidates and delivers nothing; a pass that finishes while still the newest hands its complete view to the
 * listener. Passes run one at a time on a single worker, so the listener sees views in submission order and never a
 * mix of two passes.
 *
 * <p>The listener runs on the worker thread. UI callers should hop to their own event thread from there.
 */
public class AsyncRanker implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(AsyncRanker.class);

    /** A complete ranked view for one query. */
    public record RankedView(long generation, String query, List<RankedCandidate> entries) {
        public RankedView {
            entries = List.copyOf(entries);
        }

        public List<String> lines() {
            return entries.stream().map(RankedCandidate::text).toList();
        }
    }

    private final List<String> candidates;
    private final Ranker ranker;
    private final Consumer<RankedView> listener;
    private final ExecutorService worker;
    private final boolean ownsWorker;
    private final AtomicLong rankGeneration = new AtomicLong(0);

    public AsyncRanker(List<String> candidates, Ranker ranker, Consumer<RankedView> listener) {
        this(candidates, ranker, listener, ExecutorServiceUtil.newSingleThreadExecutor("linepicker-rank"), true);
    }

    /**
     * Uses the given worker, which must run tasks one at a time in submission order. The caller keeps ownership of it.
     */
    public AsyncRanker(
            List<String> candidates, Ranker ranker, Consumer<RankedView> listener, ExecutorService worker) {
        this(candidates, ranker, listener, worker, false);
    }

    private AsyncRanker(
            List<String> candidates,
            Ranker ranker,
            Consumer<RankedView> listener,
            ExecutorService worker,
            boolean ownsWorker) {
        this.candidates = List.copyOf(candidates);
        this.ranker = requireNonNull(ranker);
        this.listener = requireNonNull(listener);
        this.worker = requireNonNull(worker);
        this.ownsWorker = ownsWorker;
    }

    /** Generation of the most recent submission, 0 before the first. */
    public long currentGeneration() {
        return rankGeneration.get();
    }

    /**
     * Schedules a ranking pass for {@code query} and invalidates every earlier pass.
     *
     * @return completes with the delivered view, or empty if a newer query superseded this one; completes
     *     exceptionally if ranking failed
     */
    public CompletableFuture<Optional<RankedView>> submit(String query) {
        requireNonNull(query);
        long myGen = rankGeneration.incrementAndGet();
        logger.trace("Submitting rank pass generation {} for '{}'", myGen, query);
        var result = new CompletableFuture<Optional<RankedView>>();
        try {
            worker.execute(() -> runPass(myGen, query, result));
        } catch (RejectedExecutionException e) {
            logger.warn("Rank pass generation {} rejected; ranker is closed", myGen);
            result.completeExceptionally(e);
        }
        return result;
    }

    private void runPass(long myGen, String query, CompletableFuture<Optional<RankedView>> result) {
        if (isStale(myGen)) {
            logger.trace("Rank pass {} is stale (current gen {}), skipping", myGen, rankGeneration.get());
            result.complete(Optional.empty());
            return;
        }
        try {
            var entries = ranker.rankDetailed(query, candidates, () -> isStale(myGen));
            if (isStale(myGen)) {
                logger.trace("Rank pass {} finished stale, dropping result", myGen);
                result.complete(Optional.empty());
                return;
            }
            var view = new RankedView(myGen, query, entries);
            listener.accept(view);
            result.complete(Optional.of(view));
        } catch (CancellationException e) {
            logger.trace("Rank pass {} cancelled by a newer query", myGen);
            result.complete(Optional.empty());
        } catch (RuntimeException e) {
            logger.error("Rank pass {} for '{}' failed", myGen, query, e);
            result.completeExceptionally(e);
        }
    }

    private boolean isStale(long myGen) {
        return myGen != rankGeneration.get();
    }

    @Override
    public void close() {
        // invalidate whatever is still queued
        rankGeneration.incrementAndGet();
        if (ownsWorker) {
            worker.shutdown();
        }
    }
}
