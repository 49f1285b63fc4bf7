package org.broadinstitute.genbank.utils.location;

import java.util.Arrays;
import java.util.List;

/**
 * Parts joined end to end in the declared 5' to 3' order, {@code join(...)}.
 *
 * The order is never changed: it is the assembly order of exons or segments and may be non-monotonic
 * (trans-splicing, features spanning the origin of a circular molecule).
 */
public final class JoinLocation extends CompoundLocation {
    public static final String OPERATOR = "join";

    public JoinLocation(final List<? extends Location> parts) {
        super(parts);
    }

    public JoinLocation(final Location... parts) {
        this(Arrays.asList(parts));
    }

    @Override
    public String getOperator() {
        return OPERATOR;
    }

    @Override
    public <T> T accept(final LocationVisitor<T> visitor) {
        return visitor.visitJoin(this);
    }
}
