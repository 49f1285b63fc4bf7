package org.broadinstitute.genbank.utils.location;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.genbank.utils.Utils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Base class for the operators that list several locations in a significant order ({@code join}, {@code order}).
 *
 * A part that is itself the same operator is spliced into this one, so {@code join(join(a,b),c)} and
 * {@code join(a,b,c)} are the same location.
 */
public abstract class CompoundLocation implements Location {

    private final ImmutableList<Location> parts;

    protected CompoundLocation(final List<? extends Location> parts) {
        Utils.nonEmpty(parts, getOperator() + " needs at least one part");
        Utils.containsNoNull(parts, getOperator() + " parts cannot be null");
        final ImmutableList.Builder<Location> builder = ImmutableList.builder();
        for (final Location part : parts) {
            if (part.getClass() == getClass()) {
                builder.addAll(((CompoundLocation) part).getParts());
            } else {
                builder.add(part);
            }
        }
        this.parts = builder.build();
    }

    /**
     * @return operator name as written in GenBank files
     */
    public abstract String getOperator();

    /**
     * @return the parts in declared order, never empty
     */
    public List<Location> getParts() {
        return parts;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return parts.equals(((CompoundLocation) o).parts);
    }

    @Override
    public int hashCode() {
        return 31 * getOperator().hashCode() + parts.hashCode();
    }

    @Override
    public String toString() {
        return parts.stream().map(Location::toString).collect(Collectors.joining(",", getOperator() + "(", ")"));
    }
}
