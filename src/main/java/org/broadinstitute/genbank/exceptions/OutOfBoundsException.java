package org.broadinstitute.genbank.exceptions;

/**
 * Thrown when a 1-based closed interval does not fit on a sequence. Coordinates are never clamped.
 */
public final class OutOfBoundsException extends UserException {
    private static final long serialVersionUID = 0L;

    private final int start;
    private final int end;
    private final int sequenceLength;

    public OutOfBoundsException(final int start, final int end, final int sequenceLength) {
        super(String.format("Interval %d..%d is not within the sequence bounds 1..%d", start, end, sequenceLength));
        this.start = start;
        this.end = end;
        this.sequenceLength = sequenceLength;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getSequenceLength() {
        return sequenceLength;
    }
}
