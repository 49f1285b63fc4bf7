package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.utils.Utils;

/**
 * A closed range of bases, {@code s..e}, where either bound may be fuzzy ({@code <s..>e}).
 */
public final class RangeLocation implements Location {
    public static final String SEPARATOR = "..";

    private final Position start;
    private final Position end;

    /**
     * @throws IllegalArgumentException if both bounds are exact and {@code start > end}
     */
    public RangeLocation(final Position start, final Position end) {
        Utils.nonNull(start, "start cannot be null");
        Utils.nonNull(end, "end cannot be null");
        Utils.validateArg(!isInverted(start, end), () -> "range start must not be after its end: " + start + SEPARATOR + end);
        this.start = start;
        this.end = end;
    }

    public RangeLocation(final int start, final int end) {
        this(Position.exact(start), Position.exact(end));
    }

    /**
     * Ordering is only checked between exact bounds.
     */
    static boolean isInverted(final Position start, final Position end) {
        return start.isExact() && end.isExact() && start.getCoordinate() > end.getCoordinate();
    }

    public Position getStart() {
        return start;
    }

    public Position getEnd() {
        return end;
    }

    @Override
    public <T> T accept(final LocationVisitor<T> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final RangeLocation that = (RangeLocation) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return start + SEPARATOR + end;
    }
}
