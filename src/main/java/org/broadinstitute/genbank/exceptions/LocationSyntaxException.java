package org.broadinstitute.genbank.exceptions;

/**
 * Thrown when a GenBank location expression cannot be parsed.
 *
 * Carries the raw text, the 0-based offset at which parsing failed and the offending substring so that
 * callers can point at the problem in the original feature table.
 */
public final class LocationSyntaxException extends UserException {
    private static final long serialVersionUID = 0L;

    private final String rawLocation;
    private final int offset;
    private final String offendingText;

    public LocationSyntaxException(final String rawLocation, final int offset, final String offendingText, final String message) {
        super(String.format("Badly formed location '%s' at offset %d near '%s': %s", rawLocation, offset, offendingText, message));
        this.rawLocation = rawLocation;
        this.offset = offset;
        this.offendingText = offendingText;
    }

    public String getRawLocation() {
        return rawLocation;
    }

    /**
     * @return 0-based offset into {@link #getRawLocation()} of the first character that could not be parsed
     */
    public int getOffset() {
        return offset;
    }

    public String getOffendingText() {
        return offendingText;
    }
}
