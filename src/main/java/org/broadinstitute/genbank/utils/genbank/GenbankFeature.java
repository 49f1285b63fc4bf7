package org.broadinstitute.genbank.utils.genbank;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import org.broadinstitute.genbank.exceptions.LocationSyntaxException;
import org.broadinstitute.genbank.utils.Utils;
import org.broadinstitute.genbank.utils.location.Location;
import org.broadinstitute.genbank.utils.location.LocationParser;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One entry of a GenBank feature table: a feature key ({@code gene}, {@code CDS}, ...), the location text as it
 * appears in the record, and the qualifiers in file order.
 *
 * The location is parsed the first time it is asked for and kept for later calls. If several threads race on the
 * first call, one parse wins and every caller gets that same tree.
 */
public final class GenbankFeature {

    private final String key;
    private final String rawLocation;
    private final ImmutableListMultimap<String, String> qualifiers;
    private final AtomicReference<Location> location = new AtomicReference<>();

    /**
     * @param key feature key, never {@code null} or empty
     * @param rawLocation location text, never {@code null}; it is not parsed until {@link #getLocation()}
     * @param qualifiers qualifier name to values in file order; valueless qualifiers map to the empty string
     */
    public GenbankFeature(final String key, final String rawLocation, final ListMultimap<String, String> qualifiers) {
        this.key = Utils.nonEmpty(key, "feature key cannot be null or empty");
        this.rawLocation = Utils.nonNull(rawLocation, "location cannot be null");
        this.qualifiers = ImmutableListMultimap.copyOf(Utils.nonNull(qualifiers, "qualifiers cannot be null"));
    }

    public GenbankFeature(final String key, final String rawLocation) {
        this(key, rawLocation, ImmutableListMultimap.of());
    }

    public String getKey() {
        return key;
    }

    public String getRawLocation() {
        return rawLocation;
    }

    /**
     * @return the parsed location, the same instance on every call
     * @throws LocationSyntaxException if the location text is malformed; the next call tries again
     */
    public Location getLocation() {
        final Location cached = location.get();
        if (cached != null) {
            return cached;
        }
        final Location parsed = LocationParser.parse(rawLocation);
        return location.compareAndSet(null, parsed) ? parsed : location.get();
    }

    /**
     * @return true once the location has been parsed
     */
    public boolean isLocationParsed() {
        return location.get() != null;
    }

    public ListMultimap<String, String> getQualifiers() {
        return qualifiers;
    }

    public boolean hasQualifier(final String name) {
        return qualifiers.containsKey(name);
    }

    /**
     * @return the first value of the qualifier, or {@code null} if the feature does not have it
     */
    public String getQualifier(final String name) {
        final List<String> values = qualifiers.get(name);
        return values.isEmpty() ? null : values.get(0);
    }

    /**
     * @return every value of the qualifier in file order, empty if the feature does not have it
     */
    public List<String> getQualifierValues(final String name) {
        return qualifiers.get(name);
    }

    @Override
    public String toString() {
        return key + " " + rawLocation;
    }
}
