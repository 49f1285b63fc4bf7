package org.broadinstitute.genbank.utils.codecs.genbank;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.genbank.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Header of a GenBank record: the LOCUS line and the keyword blocks that follow it, up to FEATURES.
 * Values are the text of the record with continuation lines joined; absent values are {@code null}
 * (lists are empty).
 */
public final class GenbankMetadata {

    private final String locusName;
    private final int sequenceLength;
    private final String moleculeType;
    private final String topology;
    private final String division;
    private final String modificationDate;
    private final String definition;
    private final ImmutableList<String> accessions;
    private final String version;
    private final String keywords;
    private final String source;
    private final String organism;
    private final ImmutableList<GenbankReference> references;

    private GenbankMetadata(final Builder builder) {
        this.locusName = builder.locusName;
        this.sequenceLength = builder.sequenceLength;
        this.moleculeType = builder.moleculeType;
        this.topology = builder.topology;
        this.division = builder.division;
        this.modificationDate = builder.modificationDate;
        this.definition = builder.definition;
        this.accessions = ImmutableList.copyOf(builder.accessions);
        this.version = builder.version;
        this.keywords = builder.keywords;
        this.source = builder.source;
        this.organism = builder.organism;
        this.references = ImmutableList.copyOf(builder.references);
    }

    public static Builder builder(final String locusName) {
        return new Builder(locusName);
    }

    public String getLocusName() {
        return locusName;
    }

    /**
     * @return the length declared on the LOCUS line
     */
    public int getSequenceLength() {
        return sequenceLength;
    }

    /**
     * @return molecule type from the LOCUS line ({@code DNA}, {@code mRNA}, {@code ss-DNA}, ...)
     */
    public String getMoleculeType() {
        return moleculeType;
    }

    /**
     * @return {@code linear}, {@code circular} or {@code null} when the LOCUS line does not say
     */
    public String getTopology() {
        return topology;
    }

    public boolean isCircular() {
        return "circular".equalsIgnoreCase(topology);
    }

    public String getDivision() {
        return division;
    }

    public String getModificationDate() {
        return modificationDate;
    }

    public String getDefinition() {
        return definition;
    }

    /**
     * @return the accessions of the ACCESSION line, primary accession first
     */
    public List<String> getAccessions() {
        return accessions;
    }

    /**
     * @return the primary accession, or {@code null}
     */
    public String getPrimaryAccession() {
        return accessions.isEmpty() ? null : accessions.get(0);
    }

    /**
     * @return the accession.version of the VERSION line, e.g. {@code U49845.1}
     */
    public String getVersion() {
        return version;
    }

    public String getKeywords() {
        return keywords;
    }

    public String getSource() {
        return source;
    }

    /**
     * @return the organism name followed by its lineage lines, separated by newlines
     */
    public String getOrganism() {
        return organism;
    }

    public List<GenbankReference> getReferences() {
        return references;
    }

    /**
     * @return the name sequences of this record go by: the versioned accession, else the primary accession, else
     * the locus name
     */
    public String getSequenceName() {
        if (version != null) {
            return version;
        }
        final String accession = getPrimaryAccession();
        return accession != null ? accession : locusName;
    }

    @Override
    public String toString() {
        return "GenbankMetadata{" + locusName + ", length=" + sequenceLength + ", version=" + version + '}';
    }

    public static final class Builder {
        private final String locusName;
        private int sequenceLength;
        private String moleculeType;
        private String topology;
        private String division;
        private String modificationDate;
        private String definition;
        private final List<String> accessions = new ArrayList<>();
        private String version;
        private String keywords;
        private String source;
        private String organism;
        private final List<GenbankReference> references = new ArrayList<>();

        private Builder(final String locusName) {
            this.locusName = Utils.nonEmpty(locusName, "locus name cannot be null or empty");
        }

        public Builder sequenceLength(final int sequenceLength) {
            this.sequenceLength = sequenceLength;
            return this;
        }

        public Builder moleculeType(final String moleculeType) {
            this.moleculeType = moleculeType;
            return this;
        }

        public Builder topology(final String topology) {
            this.topology = topology;
            return this;
        }

        public Builder division(final String division) {
            this.division = division;
            return this;
        }

        public Builder modificationDate(final String modificationDate) {
            this.modificationDate = modificationDate;
            return this;
        }

        public Builder definition(final String definition) {
            this.definition = definition;
            return this;
        }

        public Builder addAccession(final String accession) {
            accessions.add(Utils.nonNull(accession));
            return this;
        }

        public Builder version(final String version) {
            this.version = version;
            return this;
        }

        public Builder keywords(final String keywords) {
            this.keywords = keywords;
            return this;
        }

        public Builder source(final String source) {
            this.source = source;
            return this;
        }

        public Builder organism(final String organism) {
            this.organism = organism;
            return this;
        }

        public Builder addReference(final GenbankReference reference) {
            references.add(Utils.nonNull(reference));
            return this;
        }

        public GenbankMetadata build() {
            return new GenbankMetadata(this);
        }
    }
}
