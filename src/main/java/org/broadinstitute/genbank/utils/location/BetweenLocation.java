package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.utils.Utils;

/**
 * The site between two adjacent bases, {@code n^n+1}, e.g. an endonucleolytic cleavage site.
 * On a circular molecule the site between the last and the first base is written {@code n^1}.
 *
 * A between location covers no bases.
 */
public final class BetweenLocation implements Location {
    public static final String SEPARATOR = "^";

    private final int left;
    private final int right;

    /**
     * @throws IllegalArgumentException unless {@code right == left + 1}, or {@code right == 1} (circular)
     */
    public BetweenLocation(final int left, final int right) {
        Utils.validateArg(left >= 1 && right >= 1, () -> "between coordinates must be >= 1: " + left + SEPARATOR + right);
        Utils.validateArg(isAdjacent(left, right), () -> "between coordinates must be adjacent: " + left + SEPARATOR + right);
        this.left = left;
        this.right = right;
    }

    static boolean isAdjacent(final int left, final int right) {
        return right == left + 1 || right == 1;
    }

    public int getLeft() {
        return left;
    }

    public int getRight() {
        return right;
    }

    /**
     * @return true if this site spans the origin of a circular molecule ({@code n^1})
     */
    public boolean isCircular() {
        return right == 1;
    }

    @Override
    public <T> T accept(final LocationVisitor<T> visitor) {
        return visitor.visitBetween(this);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final BetweenLocation that = (BetweenLocation) o;
        return left == that.left && right == that.right;
    }

    @Override
    public int hashCode() {
        return 31 * left + right;
    }

    @Override
    public String toString() {
        return left + SEPARATOR + right;
    }
}
