package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.exceptions.FuzzyPositionException;
import org.broadinstitute.genbank.utils.SimpleInterval;
import org.broadinstitute.genbank.utils.Utils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Coordinate arithmetic on {@link Location}s that does not need the sequence itself.
 *
 * The span of a location is the interval from its smallest to its largest known coordinate. Unknown ({@code ?})
 * positions do not contribute to a span, and neither do parts that point at another record
 * ({@code accession:location}), since their coordinates are not on this one.
 */
public final class LocationUtils {

    // contig name for spans that are only compared with each other
    private static final String LOCAL_CONTIG = "local";

    private LocationUtils() {}

    /**
     * @return the smallest known coordinate of the location
     * @throws FuzzyPositionException if the location has no known coordinate on this record
     */
    public static int getStart(final Location location) {
        return span(location, LOCAL_CONTIG).getStart();
    }

    /**
     * @return the largest known coordinate of the location
     * @throws FuzzyPositionException if the location has no known coordinate on this record
     */
    public static int getEnd(final Location location) {
        return span(location, LOCAL_CONTIG).getEnd();
    }

    /**
     * Returns the interval covered by the location, gaps included.
     *
     * @param location the location, never {@code null}
     * @param contig name of the record the location is on
     * @return a 1-based closed interval from {@link #getStart} to {@link #getEnd}
     * @throws FuzzyPositionException if the location has no known coordinate on this record
     * @throws IllegalArgumentException if a range of the location starts after its end
     */
    public static SimpleInterval getSpan(final Location location, final String contig) {
        Utils.nonNull(contig, "contig cannot be null");
        return span(location, contig);
    }

    private static SimpleInterval span(final Location location, final String contig) {
        Utils.nonNull(location, "location cannot be null");
        final int[] bounds = location.accept(SpanVisitor.INSTANCE);
        if (bounds == null) {
            throw new FuzzyPositionException(Position.unknown(), "location " + location + " has no known coordinate on this record");
        }
        return new SimpleInterval(contig, bounds[0], bounds[1]);
    }

    /**
     * Number of bases the location resolves to. A {@code n^n+1} site counts as 0.
     *
     * @throws FuzzyPositionException if any position of the location is unknown
     * @throws IllegalArgumentException if a range of the location starts after its end
     */
    public static int getLength(final Location location) {
        Utils.nonNull(location, "location cannot be null");
        return location.accept(LengthVisitor.INSTANCE);
    }

    /**
     * Returns the gaps between the parts of a join or order, sorted by coordinate. For a spliced feature these are
     * the introns. A location made of a single part, or whose parts touch or overlap, has no gaps.
     * A top-level {@code complement(...)} is looked through, so {@code complement(join(1..10,20..30))} has the gap
     * {@code 11-19}.
     *
     * @param location the location, never {@code null}
     * @param contig name of the record the location is on
     * @param sequenceLength length of that record, every part must lie within it
     * @return the gaps, possibly empty
     * @throws IllegalArgumentException if a part extends past {@code sequenceLength}
     * @throws FuzzyPositionException if a part has no known coordinate
     */
    public static List<SimpleInterval> getIntrons(final Location location, final String contig, final int sequenceLength) {
        Utils.nonNull(location, "location cannot be null");
        Utils.nonNull(contig, "contig cannot be null");
        Utils.validateArg(sequenceLength > 0, "sequence length must be positive");

        Location outer = location;
        if (outer instanceof ComplementLocation) {
            outer = ((ComplementLocation) outer).getInner();
        }
        if (!(outer instanceof CompoundLocation)) {
            return new ArrayList<>();
        }

        final List<SimpleInterval> exons = new ArrayList<>();
        for (final Location part : ((CompoundLocation) outer).getParts()) {
            if (part instanceof RemoteLocation) {
                continue;
            }
            final SimpleInterval exon = span(part, contig);
            Utils.validateArg(exon.getEnd() <= sequenceLength,
                    () -> "part " + part + " extends past the end of the sequence (" + sequenceLength + ")");
            exons.add(exon);
        }
        exons.sort(Comparator.comparingInt(SimpleInterval::getStart).thenComparingInt(SimpleInterval::getEnd));

        final List<SimpleInterval> introns = new ArrayList<>();
        int lastCovered = 0;
        for (final SimpleInterval exon : exons) {
            if (lastCovered > 0 && exon.getStart() > lastCovered + 1) {
                introns.add(new SimpleInterval(contig, lastCovered + 1, exon.getStart() - 1));
            }
            lastCovered = Math.max(lastCovered, exon.getEnd());
        }
        return introns;
    }

    /**
     * Returns a join with the same parts ordered by start coordinate (ties keep their declared order).
     * Resolution itself always concatenates in declared order, so this changes what the join resolves to.
     *
     * @throws FuzzyPositionException if a part has no known coordinate
     */
    public static JoinLocation sortByCoordinate(final JoinLocation join) {
        Utils.nonNull(join, "join cannot be null");
        final List<Location> sorted = join.getParts().stream()
                .sorted(Comparator.comparingInt(LocationUtils::getStart))
                .collect(Collectors.toList());
        return new JoinLocation(sorted);
    }

    /**
     * @return true if the span of {@code outer} covers the span of {@code inner}
     */
    public static boolean contains(final Location outer, final Location inner) {
        return span(outer, LOCAL_CONTIG).contains(span(inner, LOCAL_CONTIG));
    }

    /**
     * @return true if {@code location} ends before {@code other} starts
     */
    public static boolean isLeftOf(final Location location, final Location other) {
        return span(location, LOCAL_CONTIG).getEnd() < span(other, LOCAL_CONTIG).getStart();
    }

    /**
     * @return true if {@code location} starts after {@code other} ends
     */
    public static boolean isRightOf(final Location location, final Location other) {
        return span(location, LOCAL_CONTIG).getStart() > span(other, LOCAL_CONTIG).getEnd();
    }

    /**
     * Distance between the spans of two locations: 0 when they overlap, otherwise the difference between the start
     * of the right one and the end of the left one (so adjacent locations are 1 apart).
     */
    public static int distance(final Location location, final Location other) {
        final SimpleInterval first = span(location, LOCAL_CONTIG);
        final SimpleInterval second = span(other, LOCAL_CONTIG);
        if (first.overlaps(second)) {
            return 0;
        }
        return first.getEnd() < second.getStart() ? second.getStart() - first.getEnd() : first.getStart() - second.getEnd();
    }

    /**
     * A range built with a {@code <} or {@code >} bound skips the order check of {@link RangeLocation}, so
     * {@code <10..5} reaches here.
     */
    private static void checkOrdered(final RangeLocation location) {
        Utils.validateArg(location.getStart().getCoordinate() <= location.getEnd().getCoordinate(),
                () -> "range " + location + " starts after its end");
    }

    /**
     * {@code [min, max]} of the known local coordinates, or {@code null} if there are none.
     */
    private static final class SpanVisitor implements LocationVisitor<int[]> {
        private static final SpanVisitor INSTANCE = new SpanVisitor();

        @Override
        public int[] visitSingleBase(final SingleBaseLocation location) {
            final Position position = location.getPosition();
            return position.hasCoordinate() ? new int[]{position.getCoordinate(), position.getCoordinate()} : null;
        }

        @Override
        public int[] visitRange(final RangeLocation location) {
            final Position start = location.getStart();
            final Position end = location.getEnd();
            if (start.hasCoordinate() && end.hasCoordinate()) {
                checkOrdered(location);
                return new int[]{start.getCoordinate(), end.getCoordinate()};
            } else if (start.hasCoordinate()) {
                return new int[]{start.getCoordinate(), start.getCoordinate()};
            } else if (end.hasCoordinate()) {
                return new int[]{end.getCoordinate(), end.getCoordinate()};
            }
            return null;
        }

        @Override
        public int[] visitBetween(final BetweenLocation location) {
            if (location.isCircular()) {
                return new int[]{location.getLeft(), location.getLeft()};
            }
            return new int[]{location.getLeft(), location.getRight()};
        }

        @Override
        public int[] visitComplement(final ComplementLocation location) {
            return location.getInner().accept(this);
        }

        @Override
        public int[] visitJoin(final JoinLocation location) {
            return merge(location);
        }

        @Override
        public int[] visitOrder(final OrderLocation location) {
            return merge(location);
        }

        private int[] merge(final CompoundLocation location) {
            int[] merged = null;
            for (final Location part : location.getParts()) {
                final int[] bounds = part.accept(this);
                if (bounds == null) {
                    continue;
                }
                if (merged == null) {
                    merged = bounds;
                } else {
                    merged = new int[]{Math.min(merged[0], bounds[0]), Math.max(merged[1], bounds[1])};
                }
            }
            return merged;
        }

        @Override
        public int[] visitRemote(final RemoteLocation location) {
            return null;
        }
    }

    private static final class LengthVisitor implements LocationVisitor<Integer> {
        private static final LengthVisitor INSTANCE = new LengthVisitor();

        @Override
        public Integer visitSingleBase(final SingleBaseLocation location) {
            location.getPosition().getCoordinate();
            return 1;
        }

        @Override
        public Integer visitRange(final RangeLocation location) {
            final int start = location.getStart().getCoordinate();
            final int end = location.getEnd().getCoordinate();
            checkOrdered(location);
            return end - start + 1;
        }

        @Override
        public Integer visitBetween(final BetweenLocation location) {
            return 0;
        }

        @Override
        public Integer visitComplement(final ComplementLocation location) {
            return location.getInner().accept(this);
        }

        @Override
        public Integer visitJoin(final JoinLocation location) {
            return sum(location);
        }

        @Override
        public Integer visitOrder(final OrderLocation location) {
            return sum(location);
        }

        private int sum(final CompoundLocation location) {
            int length = 0;
            for (final Location part : location.getParts()) {
                length += part.accept(this);
            }
            return length;
        }

        @Override
        public Integer visitRemote(final RemoteLocation location) {
            return location.getInner().accept(this);
        }
    }
}
