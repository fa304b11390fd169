package io.avery.mastertree;

/**
 * A range of indices, each end either included, excluded, or unbounded. A range is resolved against a list size
 * into a half-open {@code [fromIndex, toIndex)} pair when it is used.
 */
public final class Range {
    private static final int UNBOUNDED = 0, INCLUDED = 1, EXCLUDED = 2;
    private static final Range ALL = new Range(UNBOUNDED, 0, UNBOUNDED, 0);

    private final int fromKind;
    private final int from;
    private final int toKind;
    private final int to;

    private Range(int fromKind, int from, int toKind, int to) {
        this.fromKind = fromKind;
        this.from = from;
        this.toKind = toKind;
        this.to = to;
    }

    /** {@code (..)} */
    public static Range all() {
        return ALL;
    }

    /** {@code [from, to)} */
    public static Range closedOpen(int from, int to) {
        return new Range(INCLUDED, from, EXCLUDED, to);
    }

    /** {@code [from, to]} */
    public static Range closed(int from, int to) {
        return new Range(INCLUDED, from, INCLUDED, to);
    }

    /** {@code (from, to)} */
    public static Range open(int from, int to) {
        return new Range(EXCLUDED, from, EXCLUDED, to);
    }

    /** {@code (from, to]} */
    public static Range openClosed(int from, int to) {
        return new Range(EXCLUDED, from, INCLUDED, to);
    }

    /** {@code [from, ..)} */
    public static Range atLeast(int from) {
        return new Range(INCLUDED, from, UNBOUNDED, 0);
    }

    /** {@code (from, ..)} */
    public static Range greaterThan(int from) {
        return new Range(EXCLUDED, from, UNBOUNDED, 0);
    }

    /** {@code (.., to)} */
    public static Range lessThan(int to) {
        return new Range(UNBOUNDED, 0, EXCLUDED, to);
    }

    /** {@code (.., to]} */
    public static Range atMost(int to) {
        return new Range(UNBOUNDED, 0, INCLUDED, to);
    }

    // Widened to long so that an excluded Integer.MAX_VALUE start (or included end) fails the bounds check
    // instead of wrapping.

    long fromIndex() {
        return switch (fromKind) {
            case INCLUDED -> from;
            case EXCLUDED -> from + 1L;
            default -> 0;
        };
    }

    long toIndex(int size) {
        return switch (toKind) {
            case INCLUDED -> to + 1L;
            case EXCLUDED -> to;
            default -> size;
        };
    }

    /**
     * Resolves this range against a list of the given size.
     *
     * @return {@code {fromIndex, toIndex}}
     * @throws IndexOutOfBoundsException if the range does not lie within {@code [0, size)}
     */
    int[] resolve(int size) {
        long fromIndex = fromIndex();
        long toIndex = toIndex(size);
        if (fromIndex < 0 || fromIndex > toIndex || toIndex > size) {
            throw new IndexOutOfBoundsException("Range " + this + " out of bounds for length " + size);
        }
        return new int[]{ (int) fromIndex, (int) toIndex };
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof Range r)) {
            return false;
        }
        return fromKind == r.fromKind && from == r.from && toKind == r.toKind && to == r.to;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * fromKind + from) + toKind) + to;
    }

    @Override
    public String toString() {
        String lo = switch (fromKind) {
            case INCLUDED -> "[" + from;
            case EXCLUDED -> "(" + from;
            default -> "(";
        };
        String hi = switch (toKind) {
            case INCLUDED -> to + "]";
            case EXCLUDED -> to + ")";
            default -> ")";
        };
        return lo + ".." + hi;
    }
}
