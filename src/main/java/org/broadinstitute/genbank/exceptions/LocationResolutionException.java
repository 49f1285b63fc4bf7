package org.broadinstitute.genbank.exceptions;

import org.broadinstitute.genbank.utils.location.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a location cannot be resolved against a sequence.
 *
 * The cause is the underlying problem ({@link OutOfBoundsException}, {@link FuzzyPositionException},
 * {@link MissingRemoteSequenceException} or an {@link IllegalArgumentException} for unmapped bases).
 * When the failure happened inside a join or order, {@link #getPartIndexPath()} lists the 0-based index of the
 * failing part in each enclosing compound, outermost first.
 */
public final class LocationResolutionException extends UserException {
    private static final long serialVersionUID = 0L;

    private final transient Location location;
    private final List<Integer> partIndexPath;

    public LocationResolutionException(final Location location, final List<Integer> partIndexPath, final Throwable cause) {
        super(buildMessage(location, partIndexPath, cause), cause);
        this.location = location;
        this.partIndexPath = Collections.unmodifiableList(new ArrayList<>(partIndexPath));
    }

    private static String buildMessage(final Location location, final List<Integer> partIndexPath, final Throwable cause) {
        final String where = partIndexPath.isEmpty() ? "" :
                " (failing part index " + partIndexPath.stream().map(String::valueOf).collect(Collectors.joining("/")) + ")";
        return String.format("Could not resolve location %s%s: %s", location, where, getMessage(cause));
    }

    public Location getLocation() {
        return location;
    }

    /**
     * @return index path of the failing part, empty if the location is not a compound or the compound itself failed
     */
    public List<Integer> getPartIndexPath() {
        return partIndexPath;
    }

    /**
     * @return index of the failing part within the outermost join or order, or -1 if there is none
     */
    public int getFailingPartIndex() {
        return partIndexPath.isEmpty() ? -1 : partIndexPath.get(0);
    }
}
