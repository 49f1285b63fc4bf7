package org.broadinstitute.genbank.utils.location;

/**
 * A parsed GenBank feature location expression.
 *
 * Locations form a small tree: {@link SingleBaseLocation}, {@link RangeLocation}, {@link BetweenLocation} are the
 * leaves, {@link ComplementLocation}, {@link RemoteLocation}, {@link JoinLocation} and {@link OrderLocation} wrap
 * other locations. All implementations are immutable, have structural {@code equals}/{@code hashCode} and print
 * themselves back as GenBank location text from {@code toString()}.
 *
 * Operations over the tree (resolution against a sequence, span and length computations) are written as
 * {@link LocationVisitor}s; see {@link LocationResolver} and {@link LocationUtils}.
 */
public interface Location {

    <T> T accept(LocationVisitor<T> visitor);
}
