package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.utils.Utils;

/**
 * The reverse complement strand of another location, {@code complement(...)}.
 */
public final class ComplementLocation implements Location {
    public static final String OPERATOR = "complement";

    private final Location inner;

    public ComplementLocation(final Location inner) {
        this.inner = Utils.nonNull(inner, "complemented location cannot be null");
    }

    public Location getInner() {
        return inner;
    }

    @Override
    public <T> T accept(final LocationVisitor<T> visitor) {
        return visitor.visitComplement(this);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return inner.equals(((ComplementLocation) o).inner);
    }

    @Override
    public int hashCode() {
        return 17 + inner.hashCode();
    }

    @Override
    public String toString() {
        return OPERATOR + "(" + inner + ")";
    }
}
