package org.broadinstitute.genbank.utils.reference;

import org.broadinstitute.genbank.exceptions.OutOfBoundsException;
import org.broadinstitute.genbank.utils.Utils;

import java.io.Serializable;

/**
 * NucleotideSequence stores the bases of one record (the unwrapped ORIGIN block) and gives access to them with
 * GenBank coordinates: 1-based, closed intervals. Nothing outside this class sees 0-based indices.
 */
public final class NucleotideSequence implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final String bases;

    /**
     * @param name accession (or locus name) of the record the bases belong to, may be {@code null} if unknown
     * @param bases the flat sequence, no whitespace or line numbers
     */
    public NucleotideSequence(final String name, final String bases) {
        this.name = name;
        this.bases = Utils.nonNull(bases, "bases cannot be null");
    }

    public NucleotideSequence(final String bases) {
        this(null, bases);
    }

    /**
     * @return accession (or locus name) of the record, or {@code null}
     */
    public String getName() {
        return name;
    }

    public int length() {
        return bases.length();
    }

    /**
     * Returns the base at a 1-based position.
     *
     * @throws OutOfBoundsException if {@code position < 1 || position > length()}
     */
    public char at(final int position) {
        checkBounds(position, position);
        return bases.charAt(position - 1);
    }

    /**
     * Returns the bases from {@code start} to {@code end}, both 1-based and inclusive.
     *
     * @throws OutOfBoundsException if {@code start < 1 || end > length() || start > end}
     */
    public String slice(final int start, final int end) {
        checkBounds(start, end);
        return bases.substring(start - 1, end);
    }

    /**
     * @return all the bases
     */
    public String getBases() {
        return bases;
    }

    private void checkBounds(final int start, final int end) {
        if (start < 1 || end > bases.length() || start > end) {
            throw new OutOfBoundsException(start, end, bases.length());
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final NucleotideSequence that = (NucleotideSequence) o;
        return bases.equals(that.bases) && (name == null ? that.name == null : name.equals(that.name));
    }

    @Override
    public int hashCode() {
        return 31 * (name == null ? 0 : name.hashCode()) + bases.hashCode();
    }

    @Override
    public String toString() {
        return "NucleotideSequence{" +
                "name=" + name +
                ", length=" + bases.length() +
                '}';
    }
}
