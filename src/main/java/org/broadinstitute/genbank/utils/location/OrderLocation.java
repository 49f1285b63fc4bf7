package org.broadinstitute.genbank.utils.location;

import java.util.Arrays;
import java.util.List;

/**
 * Parts found in the declared order without the claim that they are contiguous once assembled, {@code order(...)}.
 */
public final class OrderLocation extends CompoundLocation {
    public static final String OPERATOR = "order";

    public OrderLocation(final List<? extends Location> parts) {
        super(parts);
    }

    public OrderLocation(final Location... parts) {
        this(Arrays.asList(parts));
    }

    @Override
    public String getOperator() {
        return OPERATOR;
    }

    @Override
    public <T> T accept(final LocationVisitor<T> visitor) {
        return visitor.visitOrder(this);
    }
}
