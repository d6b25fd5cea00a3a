package io.github.linepicker;

/** Selection index arithmetic for a ranked view. {@code -1} means nothing is selected. */
public final class Selection {
    public static final int NONE = -1;

    private Selection() {}

    /**
     * Index to keep after the view changed to {@code newSize} entries: {@link #NONE} for an empty view, {@code 0} when
     * {@code previousIndex} is out of bounds, otherwise {@code previousIndex}.
     */
    public static int clamp(int previousIndex, int newSize) {
        if (newSize <= 0) {
            return NONE;
        }
        if (previousIndex < 0 || previousIndex >= newSize) {
            return 0;
        }
        return previousIndex;
    }

    /**
     * Moves {@code current} by {@code offset} rows, pinned to the first and last row. Moving down from {@link #NONE}
     * lands on the first row. Returns {@link #NONE} for an empty view.
     */
    public static int move(int current, int offset, int size) {
        if (size <= 0) {
            return NONE;
        }
        long next = (long) current + offset;
        return (int) Math.max(0, Math.min(next, size - 1L));
    }
}
