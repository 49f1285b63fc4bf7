package org.broadinstitute.genbank.utils.codecs.genbank;

import org.broadinstitute.genbank.utils.Utils;
import org.broadinstitute.genbank.utils.genbank.FeatureTable;
import org.broadinstitute.genbank.utils.location.Location;
import org.broadinstitute.genbank.utils.location.LocationResolver;
import org.broadinstitute.genbank.utils.reference.NucleotideSequence;

/**
 * A parsed GenBank record: header, feature table and sequence.
 */
public final class GenbankRecord {

    private final GenbankMetadata metadata;
    private final FeatureTable features;
    private final NucleotideSequence sequence;

    public GenbankRecord(final GenbankMetadata metadata, final FeatureTable features, final NucleotideSequence sequence) {
        this.metadata = Utils.nonNull(metadata, "metadata cannot be null");
        this.features = Utils.nonNull(features, "features cannot be null");
        this.sequence = Utils.nonNull(sequence, "sequence cannot be null");
    }

    public GenbankMetadata getMetadata() {
        return metadata;
    }

    public FeatureTable getFeatures() {
        return features;
    }

    public NucleotideSequence getSequence() {
        return sequence;
    }

    /**
     * Bases of the {@code occurrenceIndex}-th feature with the given key, resolved with the default options.
     */
    public String getFeatureSequence(final String featureKey, final int occurrenceIndex) {
        return getFeatureSequence(featureKey, occurrenceIndex, LocationResolver.getDefault());
    }

    public String getFeatureSequence(final String featureKey, final int occurrenceIndex, final LocationResolver resolver) {
        Utils.nonNull(resolver, "resolver cannot be null");
        final Location location = features.getLocation(featureKey, occurrenceIndex);
        return resolver.resolveLocation(location, sequence);
    }

    @Override
    public String toString() {
        return "GenbankRecord{" + metadata.getSequenceName() + ", features=" + features.size() + ", length=" + sequence.length() + '}';
    }
}
