package org.broadinstitute.genbank.tools;

import htsjdk.samtools.reference.FastaReferenceWriter;
import htsjdk.samtools.reference.FastaReferenceWriterBuilder;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.genbank.cmdline.CommandLineProgram;
import org.broadinstitute.genbank.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genbank.cmdline.programgroups.GenbankProgramGroup;
import org.broadinstitute.genbank.exceptions.LocationResolutionException;
import org.broadinstitute.genbank.exceptions.LocationSyntaxException;
import org.broadinstitute.genbank.exceptions.UserException;
import org.broadinstitute.genbank.utils.codecs.genbank.GenbankReader;
import org.broadinstitute.genbank.utils.codecs.genbank.GenbankRecord;
import org.broadinstitute.genbank.utils.config.ConfigFactory;
import org.broadinstitute.genbank.utils.config.GenbankConfig;
import org.broadinstitute.genbank.utils.genbank.GenbankFeature;
import org.broadinstitute.genbank.utils.location.LocationResolver;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.*;

/**
 * Writes the sequence of every feature of a GenBank file to a FASTA file.
 *
 * Each feature location is parsed and resolved against the sequence of its record, so spliced features
 * come out joined and features on the reverse strand come out reverse-complemented.
 * Records are named {@code <key>_<n>}, where {@code n} counts the occurrences of that feature key in the file,
 * starting at 1. The {@code /locus_tag}, {@code /gene} or {@code /product} qualifier, whichever comes first,
 * goes in the description. Features located between two bases ({@code 123^124}) have no sequence and are
 * not written.
 *
 * <h3>Usage example</h3>
 * <pre>
 *   genbank-tools ExtractFeatureSequences \
 *     -I NC_001416.gbk \
 *     -O cds.fasta \
 *     --feature-key CDS
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Extract the sequence of each feature of a GenBank file into a FASTA file.",
        oneLineSummary = "Extract GenBank feature sequences to FASTA",
        programGroup = GenbankProgramGroup.class
)
public final class ExtractFeatureSequences extends CommandLineProgram {

    public static final String FEATURE_KEY_LONG_NAME = "feature-key";
    public static final String SKIP_UNRESOLVABLE_LONG_NAME = "skip-unresolvable";
    public static final String ACCEPT_APPROXIMATE_BOUNDS_LONG_NAME = "accept-approximate-bounds";

    static final List<String> DESCRIPTION_QUALIFIERS = Collections.unmodifiableList(Arrays.asList("locus_tag", "gene", "product"));

    @Argument(
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            doc = "GenBank flat file to read.")
    public File input;

    @Argument(
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            doc = "FASTA file to which the feature sequences are written.")
    public File output;

    @Argument(
            fullName = FEATURE_KEY_LONG_NAME,
            doc = "Only extract features with this key (e.g. CDS). May be specified multiple times. All features are extracted if none is given.",
            optional = true)
    public List<String> featureKeys = new ArrayList<>();

    @Argument(
            fullName = SKIP_UNRESOLVABLE_LONG_NAME,
            doc = "Skip, with a warning, the features whose location cannot be parsed or resolved instead of failing.",
            optional = true)
    public boolean skipUnresolvable = false;

    @Argument(
            fullName = ACCEPT_APPROXIMATE_BOUNDS_LONG_NAME,
            doc = "Resolve a range with an unknown (?) bound to the start or end of the sequence. Defaults to the configuration value.",
            optional = true)
    public Boolean acceptApproximateBounds = null;

    private LocationResolver resolver;

    @Override
    protected void onStartup() {
        final GenbankConfig config = ConfigFactory.getInstance().getGenbankConfig();
        final LocationResolver.Builder builder = LocationResolver.builder(config);
        if (acceptApproximateBounds != null) {
            builder.acceptApproximateBounds(acceptApproximateBounds);
        }
        resolver = builder.build();
    }

    @Override
    protected Object doWork() {
        final Set<String> keys = new LinkedHashSet<>(featureKeys);
        final Map<String, Integer> occurrences = new HashMap<>();
        int written = 0;
        int skipped = 0;
        int empty = 0;

        // opened on the first sequence, since the FASTA writer cannot be closed without one
        FastaReferenceWriter writer = null;
        try (final GenbankReader reader = new GenbankReader(input.toPath())) {
            GenbankRecord record;
            while ((record = reader.readRecord()) != null) {
                for (final GenbankFeature feature : record.getFeatures()) {
                    if (!keys.isEmpty() && !keys.contains(feature.getKey())) {
                        continue;
                    }
                    final int occurrence = occurrences.merge(feature.getKey(), 1, Integer::sum);
                    final String bases;
                    try {
                        bases = resolver.resolveLocation(feature.getLocation(), record.getSequence());
                    } catch (final LocationSyntaxException | LocationResolutionException e) {
                        if (!skipUnresolvable) {
                            throw e;
                        }
                        logger.warn(String.format("Skipping %s %d of %s: %s", feature.getKey(), occurrence,
                                record.getMetadata().getSequenceName(), e.getMessage()));
                        skipped++;
                        continue;
                    }
                    if (bases.isEmpty()) {
                        // sites between two bases have no sequence and FASTA records cannot be empty
                        logger.debug(String.format("No bases for %s %d of %s (%s)", feature.getKey(), occurrence,
                                record.getMetadata().getSequenceName(), feature.getRawLocation()));
                        empty++;
                        continue;
                    }
                    if (writer == null) {
                        writer = openWriter();
                    }
                    writeSequence(writer, recordName(feature, occurrence), description(feature), bases);
                    written++;
                }
            }
            if (writer != null) {
                writer.close();
            } else {
                logger.warn("No feature sequence to write, " + output + " is empty");
                Files.write(output.toPath(), new byte[0]);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(output.toPath(), e);
        } finally {
            closeAfterFailure(writer);
        }

        logger.info(String.format("Wrote %d feature sequences to %s", written, output));
        if (empty > 0) {
            logger.info(String.format("%d features between two bases have no sequence and were not written", empty));
        }
        if (skipped > 0) {
            logger.warn(String.format("Skipped %d features that could not be resolved", skipped));
        }
        return written;
    }

    private FastaReferenceWriter openWriter() throws IOException {
        return new FastaReferenceWriterBuilder()
                .setFastaFile(output.toPath())
                .setMakeFaiOutput(false)
                .setMakeDictOutput(false)
                .build();
    }

    /**
     * Releases the output of a run that failed before the writer was closed. Closing an already closed writer does
     * nothing.
     */
    private void closeAfterFailure(final FastaReferenceWriter writer) {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (final IOException | IllegalStateException e) {
            logger.warn("Could not close " + output + " after a failure: " + e.getMessage());
        }
    }

    private void writeSequence(final FastaReferenceWriter writer, final String name, final String description, final String bases) throws IOException {
        try {
            if (description == null) {
                writer.startSequence(name);
            } else {
                writer.startSequence(name, description);
            }
            writer.appendBases(bases);
        } catch (final IllegalArgumentException e) {
            throw new UserException.BadInput("cannot write " + name + " as FASTA: " + e.getMessage(), e);
        }
    }

    static String recordName(final GenbankFeature feature, final int occurrence) {
        return feature.getKey() + "_" + occurrence;
    }

    /**
     * @return the first of the descriptive qualifiers the feature has, or {@code null}
     */
    static String description(final GenbankFeature feature) {
        for (final String qualifier : DESCRIPTION_QUALIFIERS) {
            final String value = feature.getQualifier(qualifier);
            if (value != null && !value.trim().isEmpty()) {
                // FASTA descriptions are a single line
                return value.trim().replaceAll("\\s+", " ");
            }
        }
        return null;
    }
}
