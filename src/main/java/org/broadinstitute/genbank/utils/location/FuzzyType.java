package org.broadinstitute.genbank.utils.location;

/**
 * How certain a {@link Position} is.
 */
public enum FuzzyType {
    /** the coordinate is the position */
    EXACT(""),
    /** the position lies at or before the coordinate, written {@code <n} */
    BEFORE("<"),
    /** the position lies at or after the coordinate, written {@code >n} */
    AFTER(">"),
    /** the position is not known at all, written {@code ?}; there is no coordinate */
    UNKNOWN("?");

    private final String marker;

    FuzzyType(final String marker) {
        this.marker = marker;
    }

    /**
     * @return the text that precedes the coordinate in a location expression
     */
    public String getMarker() {
        return marker;
    }
}
