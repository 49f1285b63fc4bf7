package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.exceptions.FuzzyPositionException;
import org.broadinstitute.genbank.utils.Utils;

import java.io.Serializable;

/**
 * One 1-based coordinate of a location, possibly fuzzy.
 *
 * Fuzziness is informational: a {@link FuzzyType#BEFORE} or {@link FuzzyType#AFTER} position still resolves to its
 * coordinate. Only {@link FuzzyType#UNKNOWN} positions have no coordinate.
 */
public final class Position implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int NO_COORDINATE = -1;

    private static final Position UNKNOWN_POSITION = new Position(NO_COORDINATE, FuzzyType.UNKNOWN);

    private final int coordinate;
    private final FuzzyType fuzzy;

    private Position(final int coordinate, final FuzzyType fuzzy) {
        this.coordinate = coordinate;
        this.fuzzy = fuzzy;
    }

    /**
     * @param coordinate 1-based coordinate, must be >= 1
     * @param fuzzy any type but {@link FuzzyType#UNKNOWN}, see {@link #unknown()} for that one
     */
    public static Position of(final int coordinate, final FuzzyType fuzzy) {
        Utils.nonNull(fuzzy, "fuzzy type cannot be null");
        Utils.validateArg(fuzzy != FuzzyType.UNKNOWN, "unknown positions carry no coordinate, use Position.unknown()");
        Utils.validateArg(coordinate >= 1, () -> "coordinate must be >= 1 but was " + coordinate);
        return new Position(coordinate, fuzzy);
    }

    public static Position exact(final int coordinate) {
        return of(coordinate, FuzzyType.EXACT);
    }

    public static Position before(final int coordinate) {
        return of(coordinate, FuzzyType.BEFORE);
    }

    public static Position after(final int coordinate) {
        return of(coordinate, FuzzyType.AFTER);
    }

    public static Position unknown() {
        return UNKNOWN_POSITION;
    }

    public FuzzyType getFuzzy() {
        return fuzzy;
    }

    public boolean isExact() {
        return fuzzy == FuzzyType.EXACT;
    }

    public boolean hasCoordinate() {
        return fuzzy != FuzzyType.UNKNOWN;
    }

    /**
     * @return the 1-based coordinate
     * @throws FuzzyPositionException if this position is {@link FuzzyType#UNKNOWN}
     */
    public int getCoordinate() {
        if (!hasCoordinate()) {
            throw new FuzzyPositionException(this, "the coordinate of an unknown position cannot be used");
        }
        return coordinate;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final Position that = (Position) o;
        return coordinate == that.coordinate && fuzzy == that.fuzzy;
    }

    @Override
    public int hashCode() {
        return 31 * coordinate + fuzzy.hashCode();
    }

    @Override
    public String toString() {
        return hasCoordinate() ? fuzzy.getMarker() + coordinate : fuzzy.getMarker();
    }
}
