package org.broadinstitute.genbank.utils.codecs.genbank;

/**
 * One REFERENCE block of a GenBank header. Fields the block does not have are {@code null}.
 */
public final class GenbankReference {

    private final String reference;
    private final String authors;
    private final String consortium;
    private final String title;
    private final String journal;
    private final String pubmed;
    private final String remark;

    public GenbankReference(final String reference, final String authors, final String consortium, final String title,
                            final String journal, final String pubmed, final String remark) {
        this.reference = reference;
        this.authors = authors;
        this.consortium = consortium;
        this.title = title;
        this.journal = journal;
        this.pubmed = pubmed;
        this.remark = remark;
    }

    /**
     * @return the text after the REFERENCE keyword, e.g. {@code 1  (bases 1 to 5028)}
     */
    public String getReference() {
        return reference;
    }

    public String getAuthors() {
        return authors;
    }

    public String getConsortium() {
        return consortium;
    }

    public String getTitle() {
        return title;
    }

    public String getJournal() {
        return journal;
    }

    public String getPubmed() {
        return pubmed;
    }

    public String getRemark() {
        return remark;
    }

    @Override
    public String toString() {
        return "GenbankReference{" + reference + ", title=" + title + '}';
    }
}
