package org.broadinstitute.genbank.exceptions;

import org.broadinstitute.genbank.utils.location.Position;

/**
 * Thrown when a coordinate is needed from a position whose coordinate is unknown.
 */
public final class FuzzyPositionException extends UserException {
    private static final long serialVersionUID = 0L;

    private final Position position;

    public FuzzyPositionException(final Position position, final String message) {
        super(String.format("Position '%s' has no usable coordinate: %s", position, message));
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }
}
