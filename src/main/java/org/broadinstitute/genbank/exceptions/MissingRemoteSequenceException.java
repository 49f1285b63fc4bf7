package org.broadinstitute.genbank.exceptions;

/**
 * Thrown when a location points into another record (accession:location) and no sequence for that
 * accession was supplied.
 */
public final class MissingRemoteSequenceException extends UserException {
    private static final long serialVersionUID = 0L;

    private final String accession;

    public MissingRemoteSequenceException(final String accession) {
        super(String.format("No sequence is available for remote accession %s", accession));
        this.accession = accession;
    }

    public String getAccession() {
        return accession;
    }
}
