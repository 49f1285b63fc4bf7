package org.broadinstitute.genbank.utils.location;

import com.google.common.collect.ImmutableMap;
import org.broadinstitute.genbank.exceptions.FuzzyPositionException;
import org.broadinstitute.genbank.exceptions.LocationResolutionException;
import org.broadinstitute.genbank.exceptions.MissingRemoteSequenceException;
import org.broadinstitute.genbank.exceptions.OutOfBoundsException;
import org.broadinstitute.genbank.utils.BaseUtils;
import org.broadinstitute.genbank.utils.BaseUtils.UnmappedBasePolicy;
import org.broadinstitute.genbank.utils.Utils;
import org.broadinstitute.genbank.utils.config.GenbankConfig;
import org.broadinstitute.genbank.utils.reference.NucleotideSequence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a {@link Location} against a {@link NucleotideSequence} and returns the bases it describes, with strand
 * orientation applied:
 *
 * <ul>
 *     <li>a single base or range returns the bases between its coordinates; {@code <} and {@code >} markers do not
 *     move the bounds</li>
 *     <li>{@code complement(x)} returns the reverse complement of {@code x}</li>
 *     <li>{@code join(...)} and {@code order(...)} concatenate their parts in declared order, never sorted</li>
 *     <li>{@code a^b} returns no bases</li>
 *     <li>{@code accession:x} resolves {@code x} against the sequence registered for that accession</li>
 * </ul>
 *
 * A resolver is immutable, so one instance can resolve any number of locations concurrently.
 * The first failure aborts resolution; it is reported as a {@link LocationResolutionException} whose cause is the
 * underlying problem and whose part index path tells which part of a join or order failed.
 */
public final class LocationResolver {

    private static final LocationResolver DEFAULT_RESOLVER = builder().build();

    private final boolean acceptApproximateBounds;
    private final UnmappedBasePolicy unmappedBasePolicy;
    private final ImmutableMap<String, NucleotideSequence> remoteSequences;

    private LocationResolver(final Builder builder) {
        this.acceptApproximateBounds = builder.acceptApproximateBounds;
        this.unmappedBasePolicy = builder.unmappedBasePolicy;
        this.remoteSequences = ImmutableMap.copyOf(builder.remoteSequences);
    }

    /**
     * Resolve with the default options: unknown positions fail, non-ACGT bases complement to themselves and there are
     * no remote sequences.
     *
     * @throws LocationResolutionException if the location cannot be resolved against the sequence
     */
    public static String resolve(final Location location, final NucleotideSequence sequence) {
        return DEFAULT_RESOLVER.resolveLocation(location, sequence);
    }

    /**
     * @return a resolver with the default options
     */
    public static LocationResolver getDefault() {
        return DEFAULT_RESOLVER;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialized from the resolver options in the given configuration
     */
    public static Builder builder(final GenbankConfig config) {
        Utils.nonNull(config, "config cannot be null");
        return builder()
                .acceptApproximateBounds(config.resolver_accept_approximate_bounds())
                .unmappedBasePolicy(config.complement_unmapped_base_policy());
    }

    /**
     * @return the bases described by {@code location}, in the orientation it describes
     * @throws LocationResolutionException if the location cannot be resolved against the sequence
     */
    public String resolveLocation(final Location location, final NucleotideSequence sequence) {
        Utils.nonNull(location, "location cannot be null");
        Utils.nonNull(sequence, "sequence cannot be null");
        final ResolvingVisitor visitor = new ResolvingVisitor(sequence);
        try {
            return location.accept(visitor);
        } catch (final OutOfBoundsException | FuzzyPositionException | MissingRemoteSequenceException | IllegalArgumentException e) {
            throw new LocationResolutionException(location, visitor.partIndexPath, e);
        }
    }

    public boolean acceptsApproximateBounds() {
        return acceptApproximateBounds;
    }

    public UnmappedBasePolicy getUnmappedBasePolicy() {
        return unmappedBasePolicy;
    }

    public Map<String, NucleotideSequence> getRemoteSequences() {
        return remoteSequences;
    }

    /**
     * Walks one location against one sequence. Not thread-safe, a new one is made for each resolution.
     */
    private final class ResolvingVisitor implements LocationVisitor<String> {
        private NucleotideSequence sequence;

        // indices of the compound parts being resolved, left in place when a part fails
        private final List<Integer> partIndexPath = new ArrayList<>();

        private ResolvingVisitor(final NucleotideSequence sequence) {
            this.sequence = sequence;
        }

        @Override
        public String visitSingleBase(final SingleBaseLocation location) {
            return String.valueOf(sequence.at(location.getPosition().getCoordinate()));
        }

        @Override
        public String visitRange(final RangeLocation location) {
            final int start = boundOrApproximation(location.getStart(), 1);
            final int end = boundOrApproximation(location.getEnd(), sequence.length());
            return sequence.slice(start, end);
        }

        private int boundOrApproximation(final Position position, final int approximation) {
            if (!position.hasCoordinate() && acceptApproximateBounds) {
                return approximation;
            }
            return position.getCoordinate();
        }

        @Override
        public String visitBetween(final BetweenLocation location) {
            sequence.at(location.getLeft());
            return "";
        }

        @Override
        public String visitComplement(final ComplementLocation location) {
            return BaseUtils.simpleReverseComplement(location.getInner().accept(this), unmappedBasePolicy);
        }

        @Override
        public String visitJoin(final JoinLocation location) {
            return concatenate(location);
        }

        @Override
        public String visitOrder(final OrderLocation location) {
            return concatenate(location);
        }

        private String concatenate(final CompoundLocation location) {
            final StringBuilder bases = new StringBuilder();
            final List<Location> parts = location.getParts();
            for (int i = 0; i < parts.size(); i++) {
                partIndexPath.add(i);
                bases.append(parts.get(i).accept(this));
                partIndexPath.remove(partIndexPath.size() - 1);
            }
            return bases.toString();
        }

        @Override
        public String visitRemote(final RemoteLocation location) {
            final NucleotideSequence primary = sequence;
            sequence = findRemoteSequence(location.getAccession(), primary);
            try {
                return location.getInner().accept(this);
            } finally {
                sequence = primary;
            }
        }

        private NucleotideSequence findRemoteSequence(final String accession, final NucleotideSequence primary) {
            final NucleotideSequence remote = remoteSequences.get(accession);
            if (remote != null) {
                return remote;
            }
            if (accession.equals(primary.getName())) {
                return primary;
            }
            throw new MissingRemoteSequenceException(accession);
        }
    }

    public static final class Builder {
        private boolean acceptApproximateBounds = false;
        private UnmappedBasePolicy unmappedBasePolicy = UnmappedBasePolicy.PASS_THROUGH;
        private final Map<String, NucleotideSequence> remoteSequences = new HashMap<>();

        private Builder() {}

        /**
         * @param accept if true, an unknown range start resolves to 1 and an unknown range end to the sequence length.
         *               Unknown single bases never resolve.
         */
        public Builder acceptApproximateBounds(final boolean accept) {
            this.acceptApproximateBounds = accept;
            return this;
        }

        public Builder unmappedBasePolicy(final UnmappedBasePolicy policy) {
            this.unmappedBasePolicy = Utils.nonNull(policy, "policy cannot be null");
            return this;
        }

        /**
         * Register the sequence used for locations of the form {@code accession:location}.
         */
        public Builder addRemoteSequence(final String accession, final NucleotideSequence sequence) {
            Utils.nonEmpty(accession, "accession cannot be null or empty");
            remoteSequences.put(accession, Utils.nonNull(sequence, "sequence cannot be null"));
            return this;
        }

        public LocationResolver build() {
            return new LocationResolver(this);
        }
    }
}
