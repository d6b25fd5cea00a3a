package io.github.linepicker;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Headless model of the picker: the immutable candidate set, the current query, the ranked view for that query and the
 * selected row.
 *
 * <p>Every query edit replaces the ranked view with a fresh ranking of the whole candidate set and clamps the
 * selection into the new view. Not thread-safe; drive it from a single UI thread.
 */
public class PickerSession {
    private static final Logger logger = LogManager.getLogger(PickerSession.class);

    /** What an escape key press did. */
    public enum EscapeOutcome {
        /** The query was non-empty and has been cleared. */
        CLEARED_QUERY,
        /** The query was already empty; the picker should close without a choice. */
        DISMISS
    }

    private final List<String> candidates;
    private final Ranker ranker;

    private String query = "";
    private List<RankedCandidate> view;
    private int selectedIndex;

    public PickerSession(List<String> candidates) {
        this(candidates, new Ranker());
    }

    public PickerSession(List<String> candidates, Ranker ranker) {
        this.candidates = List.copyOf(candidates);
        this.ranker = requireNonNull(ranker);
        this.view = ranker.rankDetailed(query, this.candidates);
        this.selectedIndex = Selection.clamp(0, view.size());
    }

    public List<String> getCandidates() {
        return candidates;
    }

    public String getQuery() {
        return query;
    }

    /** The ranked view for the current query. */
    public List<RankedCandidate> getView() {
        return view;
    }

    public List<String> getVisibleLines() {
        return view.stream().map(RankedCandidate::text).toList();
    }

    /** Selected row in the view, or {@link Selection#NONE}. */
    public int getSelectedIndex() {
        return selectedIndex;
    }

    /**
     * Re-ranks the full candidate set for {@code newQuery}. The previous selection survives if it is still in bounds,
     * otherwise the first row is selected.
     */
    public void updateQuery(String newQuery) {
        requireNonNull(newQuery);
        applyView(newQuery, ranker.rankDetailed(newQuery, candidates));
    }

    /**
     * Installs a view computed elsewhere, e.g. by {@link AsyncRanker}, for {@code rankedQuery}.
     */
    public void applyView(String rankedQuery, List<RankedCandidate> rankedView) {
        this.query = requireNonNull(rankedQuery);
        this.view = List.copyOf(rankedView);
        this.selectedIndex = Selection.clamp(selectedIndex, view.size());
        logger.trace("Query '{}' shows {} rows, selection {}", query, view.size(), selectedIndex);
    }

    /** Moves the selection by {@code offset} rows, pinned to the ends of the view. */
    public void moveSelection(int offset) {
        selectedIndex = Selection.move(selectedIndex, offset, view.size());
    }

    public void selectRow(int index) {
        if (index >= 0 && index < view.size()) {
            selectedIndex = index;
        }
    }

    /** The line the user would emit right now, if any. */
    public Optional<String> selectedCandidate() {
        if (selectedIndex < 0 || selectedIndex >= view.size()) {
            return Optional.empty();
        }
        return Optional.of(view.get(selectedIndex).text());
    }

    /**
     * Escape clears a non-empty query (showing the full list again) and otherwise asks the caller to dismiss.
     */
    public EscapeOutcome escape() {
        if (!query.isEmpty()) {
            updateQuery("");
            return EscapeOutcome.CLEARED_QUERY;
        }
        return EscapeOutcome.DISMISS;
    }
}
