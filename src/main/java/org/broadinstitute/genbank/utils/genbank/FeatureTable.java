package org.broadinstitute.genbank.utils.genbank;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import org.broadinstitute.genbank.exceptions.LocationSyntaxException;
import org.broadinstitute.genbank.utils.Utils;
import org.broadinstitute.genbank.utils.location.Location;

import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The features of one GenBank record, in file order, with lookup by feature key.
 *
 * The same key usually occurs many times ({@code gene}, {@code CDS}), so a feature is addressed by its key and its
 * 0-based occurrence index among the features with that key.
 */
public final class FeatureTable implements Iterable<GenbankFeature> {

    private final ImmutableList<GenbankFeature> features;
    private final ImmutableListMultimap<String, GenbankFeature> featuresByKey;

    public FeatureTable(final List<GenbankFeature> features) {
        Utils.nonNull(features, "features cannot be null");
        Utils.containsNoNull(features, "features cannot contain null");
        this.features = ImmutableList.copyOf(features);
        this.featuresByKey = Multimaps.index(this.features, GenbankFeature::getKey);
    }

    /**
     * Location of the {@code occurrenceIndex}-th feature with the given key, parsed on first access.
     *
     * @throws IllegalArgumentException if there is no such key or the index is out of range for it
     * @throws LocationSyntaxException if the location text of that feature is malformed
     */
    public Location getLocation(final String featureKey, final int occurrenceIndex) {
        return getFeature(featureKey, occurrenceIndex).getLocation();
    }

    /**
     * @throws IllegalArgumentException if there is no such key or the index is out of range for it
     */
    public GenbankFeature getFeature(final String featureKey, final int occurrenceIndex) {
        Utils.nonNull(featureKey, "feature key cannot be null");
        final List<GenbankFeature> withKey = featuresByKey.get(featureKey);
        Utils.validateArg(!withKey.isEmpty(), () -> "no feature with key " + featureKey);
        Utils.validateArg(occurrenceIndex >= 0 && occurrenceIndex < withKey.size(),
                () -> "feature " + featureKey + " occurs " + withKey.size() + " times, there is no occurrence " + occurrenceIndex);
        return withKey.get(occurrenceIndex);
    }

    /**
     * @return the features with the given key in file order, empty if there are none
     */
    public List<GenbankFeature> getFeatures(final String featureKey) {
        return featuresByKey.get(featureKey);
    }

    public List<GenbankFeature> getFeatures() {
        return features;
    }

    /**
     * @return the distinct feature keys in order of first appearance
     */
    public Set<String> getFeatureKeys() {
        return featuresByKey.keySet();
    }

    public int size() {
        return features.size();
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public Stream<GenbankFeature> stream() {
        return features.stream();
    }

    @Override
    public Iterator<GenbankFeature> iterator() {
        return features.iterator();
    }
}
