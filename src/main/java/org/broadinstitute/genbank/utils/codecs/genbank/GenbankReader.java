package org.broadinstitute.genbank.utils.codecs.genbank;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import htsjdk.samtools.util.PeekableIterator;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genbank.exceptions.UserException;
import org.broadinstitute.genbank.utils.Utils;
import org.broadinstitute.genbank.utils.config.ConfigFactory;
import org.broadinstitute.genbank.utils.genbank.FeatureTable;
import org.broadinstitute.genbank.utils.genbank.GenbankFeature;
import org.broadinstitute.genbank.utils.reference.NucleotideSequence;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads GenBank flat files, one record at a time.
 *
 * A record runs from its LOCUS line to a line holding {@code //}; a file may contain any number of records.
 * The layout follows the GenBank release notes:
 * <ul>
 *     <li>header keywords start at column 0, sub-keywords (ORGANISM, AUTHORS, ...) are indented, and values that
 *     do not fit on one line continue on lines indented by 12 spaces</li>
 *     <li>in the feature table a feature key starts at column 5 and its location at column 21; lines indented by
 *     21 spaces either continue the location or hold {@code /name=value} qualifiers</li>
 *     <li>ORIGIN lines are a base number followed by blocks of bases</li>
 * </ul>
 *
 * Locations are not parsed here; {@link GenbankFeature} parses them on first use.
 * Header sections that have no place in {@link GenbankMetadata} (COMMENT, DBLINK, BASE COUNT, CONTIG, ...) are
 * skipped.
 */
public final class GenbankReader implements Closeable {
    private static final Logger logger = LogManager.getLogger(GenbankReader.class);

    public static final String LOCUS = "LOCUS";
    public static final String FEATURES = "FEATURES";
    public static final String ORIGIN = "ORIGIN";
    public static final String END_OF_RECORD = "//";

    static final String TRANSLATION_QUALIFIER = "translation";

    private static final int KEYWORD_WIDTH = 12;
    private static final String CONTINUATION_INDENT = Utils.dupChar(' ', KEYWORD_WIDTH);
    private static final String FEATURE_KEY_INDENT = Utils.dupChar(' ', 5);
    private static final String QUALIFIER_INDENT = Utils.dupChar(' ', 21);

    private static final Pattern DATE_PATTERN = Pattern.compile("\\d{1,2}-[A-Za-z]{3}-\\d{4}");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final String source;
    private final BufferedReader reader;
    private final PeekableIterator<String> lines;
    private final boolean uppercaseOrigin;
    private int lineNumber = 0;

    /**
     * Opens a GenBank file, upper-casing the sequence as set by {@code origin_uppercase} in the configuration.
     *
     * @throws UserException.CouldNotReadInputFile if the file cannot be opened
     */
    public GenbankReader(final Path path) {
        this(path, ConfigFactory.getInstance().getGenbankConfig().origin_uppercase());
    }

    /**
     * @throws UserException.CouldNotReadInputFile if the file cannot be opened
     */
    public GenbankReader(final Path path, final boolean uppercaseOrigin) {
        this(openFile(path), path.toString(), uppercaseOrigin);
    }

    /**
     * @param reader text of one or more records; closed along with this reader
     * @param source name of the input used in error messages
     * @param uppercaseOrigin if true the sequence bases are upper-cased
     */
    public GenbankReader(final Reader reader, final String source, final boolean uppercaseOrigin) {
        Utils.nonNull(reader, "reader cannot be null");
        this.source = Utils.nonNull(source, "source cannot be null");
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.lines = new PeekableIterator<>(this.reader.lines().iterator());
        this.uppercaseOrigin = uppercaseOrigin;
    }

    private static Reader openFile(final Path path) {
        Utils.nonNull(path, "path cannot be null");
        if (!Files.isReadable(path)) {
            throw new UserException.CouldNotReadInputFile(path, "file does not exist or is not readable");
        }
        try {
            return Files.newBufferedReader(path, StandardCharsets.ISO_8859_1);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Read every record of a file.
     */
    public static List<GenbankRecord> readRecords(final Path path) {
        try (final GenbankReader reader = new GenbankReader(path)) {
            return reader.readAll();
        }
    }

    /**
     * @return the remaining records
     */
    public List<GenbankRecord> readAll() {
        final List<GenbankRecord> records = new ArrayList<>();
        GenbankRecord record;
        while ((record = readRecord()) != null) {
            records.add(record);
        }
        return records;
    }

    /**
     * @return the next record, or {@code null} once the input is exhausted
     * @throws UserException.MalformedGenbankRecord if the record is not laid out as a GenBank record
     */
    public GenbankRecord readRecord() {
        skipBlankLines();
        final String locusLine = peekLine();
        if (locusLine == null) {
            return null;
        }
        if (!LOCUS.equals(keywordOf(locusLine))) {
            nextLine();
            throw malformed("expected a LOCUS line but found: " + StringUtils.abbreviate(locusLine, 40));
        }
        final int firstLine = lineNumber + 1;
        final GenbankMetadata.Builder metadata = parseLocus(nextLine());

        parseHeader(metadata);
        final GenbankMetadata header = metadata.build();

        final FeatureTable features = FEATURES.equals(keywordOf(peekLine())) ? parseFeatures() : new FeatureTable(new ArrayList<>());
        final String bases = parseSequenceAndEnd();

        if (!bases.isEmpty() && bases.length() != header.getSequenceLength()) {
            logger.warn(String.format("%s: LOCUS %s declares %d bases but ORIGIN has %d",
                    source, header.getLocusName(), header.getSequenceLength(), bases.length()));
        }
        logger.debug(String.format("Read record %s (lines %d-%d): %d features, %d bases",
                header.getSequenceName(), firstLine, lineNumber, features.size(), bases.length()));
        return new GenbankRecord(header, features, new NucleotideSequence(header.getSequenceName(), bases));
    }

    // =================================================================================================================
    // LOCUS and header keywords

    private GenbankMetadata.Builder parseLocus(final String line) {
        final String[] tokens = StringUtils.split(line.substring(LOCUS.length()));
        if (tokens.length < 2) {
            throw malformed("LOCUS line needs at least a name and a length: " + line);
        }
        if (!DIGITS.matcher(tokens[1]).matches()) {
            throw malformed("LOCUS length is not a number: " + tokens[1]);
        }
        final GenbankMetadata.Builder builder = GenbankMetadata.builder(tokens[0]);
        try {
            builder.sequenceLength(Integer.parseInt(tokens[1]));
        } catch (final NumberFormatException e) {
            throw malformed("LOCUS length is too large: " + tokens[1]);
        }

        // <name> <length> bp|aa [molecule] [linear|circular] [division] [date]
        int i = tokens.length > 2 && ("bp".equals(tokens[2]) || "aa".equals(tokens[2])) ? 3 : 2;
        boolean topologySeen = false;
        boolean moleculeSeen = false;
        for (; i < tokens.length; i++) {
            final String token = tokens[i];
            if ("linear".equalsIgnoreCase(token) || "circular".equalsIgnoreCase(token)) {
                builder.topology(token);
                topologySeen = true;
            } else if (DATE_PATTERN.matcher(token).matches()) {
                builder.modificationDate(token);
            } else if (!moleculeSeen && !topologySeen) {
                builder.moleculeType(token);
                moleculeSeen = true;
            } else {
                builder.division(token);
            }
        }
        return builder;
    }

    private void parseHeader(final GenbankMetadata.Builder metadata) {
        while (true) {
            skipBlankLines();
            final String line = peekLine();
            if (line == null) {
                throw malformed("record ended without '" + END_OF_RECORD + "'");
            }
            if (line.startsWith(" ")) {
                logger.debug(String.format("%s:%d: skipping stray header line", source, lineNumber + 1));
                nextLine();
                continue;
            }
            final String keyword = keywordOf(line);
            switch (keyword) {
                case FEATURES:
                case ORIGIN:
                case END_OF_RECORD:
                case "BASE COUNT":
                case "CONTIG":
                    return;
                case LOCUS:
                    nextLine();
                    throw malformed("LOCUS line inside the header of " + metadata.build().getLocusName() + ", is '" + END_OF_RECORD + "' missing?");
                case "DEFINITION":
                    metadata.definition(readValue(" "));
                    break;
                case "ACCESSION":
                    for (final String accession : StringUtils.split(readValue(" "))) {
                        metadata.addAccession(accession);
                    }
                    break;
                case "VERSION":
                    final String[] version = StringUtils.split(readValue(" "));
                    if (version.length > 0) {
                        metadata.version(version[0]);
                    }
                    break;
                case "KEYWORDS":
                    metadata.keywords(readValue(" "));
                    break;
                case "SOURCE":
                    metadata.source(readValue(" "));
                    parseSourceSubKeywords(metadata);
                    break;
                case "REFERENCE":
                    metadata.addReference(parseReference());
                    break;
                default:
                    logger.debug(String.format("%s:%d: skipping %s", source, lineNumber + 1, keyword));
                    readValue(" ");
                    skipSubKeywords();
            }
        }
    }

    private void parseSourceSubKeywords(final GenbankMetadata.Builder metadata) {
        while (isSubKeyword(peekLine())) {
            if ("ORGANISM".equals(keywordOf(peekLine()))) {
                // the organism name and its lineage, one line each
                metadata.organism(readValue("\n"));
            } else {
                readValue(" ");
            }
        }
    }

    private GenbankReference parseReference() {
        final String reference = readValue(" ");
        String authors = null;
        String consortium = null;
        String title = null;
        String journal = null;
        String pubmed = null;
        String remark = null;
        while (isSubKeyword(peekLine())) {
            final String subKeyword = keywordOf(peekLine());
            final String value = readValue(" ");
            switch (subKeyword) {
                case "AUTHORS": authors = value; break;
                case "CONSRTM": consortium = value; break;
                case "TITLE": title = value; break;
                case "JOURNAL": journal = value; break;
                case "PUBMED": pubmed = value; break;
                case "REMARK": remark = value; break;
                default:
                    logger.debug(String.format("%s:%d: skipping reference field %s", source, lineNumber, subKeyword));
            }
        }
        return new GenbankReference(reference, authors, consortium, title, journal, pubmed, remark);
    }

    private void skipSubKeywords() {
        while (isSubKeyword(peekLine())) {
            readValue(" ");
        }
    }

    /**
     * Consume a keyword line and its continuation lines.
     * @return the value after the keyword column, continuation lines joined with {@code delimiter}
     */
    private String readValue(final String delimiter) {
        final StringBuilder value = new StringBuilder(valueOf(nextLine()));
        while (isContinuation(peekLine())) {
            final String continuation = nextLine().trim();
            if (value.length() > 0) {
                value.append(delimiter);
            }
            value.append(continuation);
        }
        return value.toString();
    }

    private static String keywordOf(final String line) {
        if (line == null) {
            return null;
        }
        return line.length() > KEYWORD_WIDTH ? line.substring(0, KEYWORD_WIDTH).trim() : line.trim();
    }

    private static String valueOf(final String line) {
        return line.length() > KEYWORD_WIDTH ? line.substring(KEYWORD_WIDTH).trim() : "";
    }

    private static boolean isContinuation(final String line) {
        return line != null && line.startsWith(CONTINUATION_INDENT) && !StringUtils.isBlank(line);
    }

    private static boolean isSubKeyword(final String line) {
        return line != null && line.startsWith(" ") && !line.startsWith(CONTINUATION_INDENT) && !StringUtils.isBlank(line);
    }

    // =================================================================================================================
    // Feature table

    private FeatureTable parseFeatures() {
        nextLine(); // FEATURES             Location/Qualifiers
        final List<GenbankFeature> features = new ArrayList<>();
        FeatureBuilder current = null;
        while (true) {
            final String line = peekLine();
            if (line == null) {
                throw malformed("record ended inside the feature table");
            }
            if (StringUtils.isBlank(line)) {
                nextLine();
                continue;
            }
            if (!line.startsWith(" ")) {
                break;
            }
            nextLine();
            if (line.startsWith(FEATURE_KEY_INDENT) && line.length() > FEATURE_KEY_INDENT.length()
                    && line.charAt(FEATURE_KEY_INDENT.length()) != ' ') {
                if (current != null) {
                    features.add(current.build());
                }
                final String[] keyAndLocation = StringUtils.split(line.trim(), null, 2);
                current = new FeatureBuilder(keyAndLocation[0], lineNumber);
                if (keyAndLocation.length > 1) {
                    current.appendLocation(keyAndLocation[1].trim());
                }
            } else if (line.startsWith(QUALIFIER_INDENT)) {
                if (current == null) {
                    throw malformed("qualifier or location line before the first feature key");
                }
                current.addLine(line.trim());
            } else {
                throw malformed("line is neither a feature key (column 6) nor a qualifier (column 22): " + StringUtils.abbreviate(line.trim(), 40));
            }
        }
        if (current != null) {
            features.add(current.build());
        }
        return new FeatureTable(features);
    }

    /**
     * Accumulates the lines of one feature. A qualifier is only stored when the next one starts (or the feature
     * ends), since a quoted value may span several lines.
     */
    private final class FeatureBuilder {
        private final String key;
        private final int keyLine;
        private final StringBuilder location = new StringBuilder();
        private final ListMultimap<String, String> qualifiers = ArrayListMultimap.create();

        private String qualifierName = null;
        private StringBuilder qualifierValue = null;
        private boolean quoted = false;
        private int qualifierLine = 0;

        private FeatureBuilder(final String key, final int keyLine) {
            this.key = key;
            this.keyLine = keyLine;
        }

        private void appendLocation(final String text) {
            location.append(text);
        }

        private void addLine(final String text) {
            if (qualifierName != null && quoted && !isClosedQuote(qualifierValue)) {
                // nothing but the opening quote so far: no separator
                if (!TRANSLATION_QUALIFIER.equals(qualifierName) && qualifierValue.length() > 1) {
                    qualifierValue.append(' ');
                }
                qualifierValue.append(text);
            } else if (text.startsWith("/")) {
                commitQualifier();
                startQualifier(text.substring(1));
            } else if (qualifierName == null) {
                // locations that do not fit on the key line continue here
                appendLocation(text);
            } else {
                qualifierValue.append(' ').append(text);
            }
        }

        private void startQualifier(final String text) {
            final int equals = text.indexOf('=');
            qualifierLine = lineNumber;
            if (equals < 0) {
                qualifierName = text;
                qualifierValue = new StringBuilder();
                quoted = false;
            } else {
                qualifierName = text.substring(0, equals);
                qualifierValue = new StringBuilder(text.substring(equals + 1));
                quoted = qualifierValue.length() > 0 && qualifierValue.charAt(0) == '"';
            }
            if (qualifierName.isEmpty()) {
                throw malformed("qualifier without a name in feature " + key);
            }
        }

        private void commitQualifier() {
            if (qualifierName == null) {
                return;
            }
            String value = qualifierValue.toString();
            if (quoted) {
                if (!isClosedQuote(qualifierValue)) {
                    throw new UserException.MalformedGenbankRecord(source, qualifierLine,
                            "unterminated quoted value for /" + qualifierName + " in feature " + key);
                }
                // "" is an escaped quote inside a quoted value
                value = value.substring(1, value.length() - 1).replace("\"\"", "\"");
            }
            qualifiers.put(qualifierName, value);
            qualifierName = null;
            qualifierValue = null;
            quoted = false;
        }

        private GenbankFeature build() {
            commitQualifier();
            if (location.length() == 0) {
                throw new UserException.MalformedGenbankRecord(source, keyLine, "feature " + key + " has no location");
            }
            return new GenbankFeature(key, location.toString(), qualifiers);
        }
    }

    /**
     * A quoted value is closed when it ends with a quote and its quotes pair up, escaped quotes being doubled.
     */
    private static boolean isClosedQuote(final CharSequence value) {
        if (value.length() < 2 || value.charAt(value.length() - 1) != '"') {
            return false;
        }
        return StringUtils.countMatches(value, '"') % 2 == 0;
    }

    // =================================================================================================================
    // ORIGIN and the end of the record

    private String parseSequenceAndEnd() {
        final StringBuilder bases = new StringBuilder();
        while (true) {
            skipBlankLines();
            final String line = peekLine();
            if (line == null) {
                throw malformed("record ended without '" + END_OF_RECORD + "'");
            }
            final String keyword = keywordOf(line);
            if (END_OF_RECORD.equals(keyword)) {
                nextLine();
                return uppercaseOrigin ? StringUtils.upperCase(bases.toString()) : bases.toString();
            } else if (ORIGIN.equals(keyword)) {
                nextLine();
                readOrigin(bases);
            } else if (LOCUS.equals(keyword)) {
                nextLine();
                throw malformed("next LOCUS found before '" + END_OF_RECORD + "'");
            } else if (line.startsWith(" ")) {
                nextLine();
                throw malformed("unexpected indented line after the feature table: " + StringUtils.abbreviate(line.trim(), 40));
            } else {
                logger.debug(String.format("%s:%d: skipping %s", source, lineNumber + 1, keyword));
                readValue(" ");
                skipSubKeywords();
            }
        }
    }

    private void readOrigin(final StringBuilder bases) {
        while (true) {
            final String line = peekLine();
            if (line == null || !line.startsWith(" ") && !StringUtils.isBlank(line)) {
                return;
            }
            nextLine();
            final String[] blocks = StringUtils.split(line);
            if (blocks.length == 0) {
                continue;
            }
            if (!DIGITS.matcher(blocks[0]).matches()) {
                throw malformed("ORIGIN line does not start with a base number: " + StringUtils.abbreviate(line.trim(), 40));
            }
            for (int i = 1; i < blocks.length; i++) {
                bases.append(blocks[i]);
            }
        }
    }

    // =================================================================================================================
    // Line access

    private String peekLine() {
        try {
            return lines.hasNext() ? lines.peek() : null;
        } catch (final UncheckedIOException e) {
            throw new UserException.CouldNotReadInputFile("error reading " + source + " after line " + lineNumber, e.getCause());
        }
    }

    private String nextLine() {
        final String line = peekLine();
        if (line != null) {
            lines.next();
            lineNumber++;
        }
        return line;
    }

    private void skipBlankLines() {
        while (true) {
            final String line = peekLine();
            if (line == null || !StringUtils.isBlank(line)) {
                return;
            }
            nextLine();
        }
    }

    private UserException.MalformedGenbankRecord malformed(final String message) {
        return new UserException.MalformedGenbankRecord(source, lineNumber, message);
    }

    /**
     * @return number of lines consumed so far
     */
    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public void close() {
        lines.close();
        try {
            reader.close();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile("error closing " + source, e);
        }
    }
}
