package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.utils.Utils;

/**
 * A location on another record, {@code accession:location}, e.g. {@code J00194.1:100..202}.
 */
public final class RemoteLocation implements Location {
    public static final String SEPARATOR = ":";

    private final String accession;
    private final Location inner;

    public RemoteLocation(final String accession, final Location inner) {
        this.accession = Utils.nonEmpty(accession, "accession cannot be null or empty");
        this.inner = Utils.nonNull(inner, "remote location cannot be null");
    }

    public String getAccession() {
        return accession;
    }

    public Location getInner() {
        return inner;
    }

    @Override
    public <T> T accept(final LocationVisitor<T> visitor) {
        return visitor.visitRemote(this);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final RemoteLocation that = (RemoteLocation) o;
        return accession.equals(that.accession) && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return 31 * accession.hashCode() + inner.hashCode();
    }

    @Override
    public String toString() {
        return accession + SEPARATOR + inner;
    }
}
