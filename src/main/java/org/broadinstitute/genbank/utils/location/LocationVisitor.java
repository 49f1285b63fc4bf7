package org.broadinstitute.genbank.utils.location;

/**
 * One method per {@link Location} variant.
 *
 * @param <T> result of visiting a location
 */
public interface LocationVisitor<T> {

    T visitSingleBase(SingleBaseLocation location);

    T visitRange(RangeLocation location);

    T visitBetween(BetweenLocation location);

    T visitComplement(ComplementLocation location);

    T visitJoin(JoinLocation location);

    T visitOrder(OrderLocation location);

    T visitRemote(RemoteLocation location);
}
