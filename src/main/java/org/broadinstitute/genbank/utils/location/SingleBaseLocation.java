package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.utils.Utils;

/**
 * A single base, {@code n}.
 */
public final class SingleBaseLocation implements Location {

    private final Position position;

    public SingleBaseLocation(final Position position) {
        this.position = Utils.nonNull(position, "position cannot be null");
    }

    public Position getPosition() {
        return position;
    }

    @Override
    public <T> T accept(final LocationVisitor<T> visitor) {
        return visitor.visitSingleBase(this);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return position.equals(((SingleBaseLocation) o).position);
    }

    @Override
    public int hashCode() {
        return position.hashCode();
    }

    @Override
    public String toString() {
        return position.toString();
    }
}
