package org.broadinstitute.genbank.utils.codecs.genbank;

import org.broadinstitute.genbank.exceptions.UserException;
import org.broadinstitute.genbank.testutils.GenbankBaseTest;
import org.broadinstitute.genbank.utils.genbank.FeatureTable;
import org.broadinstitute.genbank.utils.genbank.GenbankFeature;
import org.broadinstitute.genbank.utils.location.BetweenLocation;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.StringReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class GenbankReaderUnitTest extends GenbankBaseTest {

    private static final Path SAMPLE = Paths.get(packageRootTestDir + "utils/codecs/genbank/sample.gb");

    private static final String SAMPLE_BASES = "ATGAAACCCGGGTTTTAGCCTTAGCATGCATCCCATCGATCGTAGCTAGCTAGGATCCAA";

    private static GenbankReader readerFor(final String text) {
        return new GenbankReader(new StringReader(text), "test.gb", true);
    }

    @Test
    public void testReadSampleHeader() {
        final List<GenbankRecord> records = GenbankReader.readRecords(SAMPLE);
        Assert.assertEquals(records.size(), 2);

        final GenbankMetadata first = records.get(0).getMetadata();
        Assert.assertEquals(first.getLocusName(), "TEST0001");
        Assert.assertEquals(first.getSequenceLength(), 60);
        Assert.assertEquals(first.getMoleculeType(), "DNA");
        Assert.assertEquals(first.getTopology(), "linear");
        Assert.assertFalse(first.isCircular());
        Assert.assertEquals(first.getDivision(), "BCT");
        Assert.assertEquals(first.getModificationDate(), "15-MAR-2021");
        Assert.assertEquals(first.getDefinition(),
                "Synthetic test construct carrying two short open reading frames and a spliced gene.");
        Assert.assertEquals(first.getAccessions(), Arrays.asList("TEST0001", "TEST0001X"));
        Assert.assertEquals(first.getPrimaryAccession(), "TEST0001");
        Assert.assertEquals(first.getVersion(), "TEST0001.1");
        Assert.assertEquals(first.getSequenceName(), "TEST0001.1");
        Assert.assertEquals(first.getKeywords(), ".");
        Assert.assertEquals(first.getSource(), "Test organism");
        Assert.assertEquals(first.getOrganism(), "Test organism\nBacteria; Testota.");

        Assert.assertEquals(first.getReferences().size(), 1);
        final GenbankReference reference = first.getReferences().get(0);
        Assert.assertEquals(reference.getReference(), "1  (bases 1 to 60)");
        Assert.assertEquals(reference.getAuthors(), "Doe,J. and Roe,R.");
        Assert.assertEquals(reference.getTitle(), "A synthetic record for reader tests");
        Assert.assertEquals(reference.getJournal(), "Unpublished");
        Assert.assertEquals(reference.getPubmed(), "12345678");
        Assert.assertNull(reference.getConsortium());
        Assert.assertNull(reference.getRemark());

        final GenbankMetadata second = records.get(1).getMetadata();
        Assert.assertEquals(second.getLocusName(), "TEST0002");
        Assert.assertTrue(second.isCircular());
        Assert.assertEquals(second.getDivision(), "SYN");
        Assert.assertEquals(second.getSequenceName(), "TEST0002.3");
        Assert.assertEquals(second.getOrganism(), "synthetic construct");
        Assert.assertTrue(second.getReferences().isEmpty());
    }

    @Test
    public void testReadSampleFeatures() {
        final FeatureTable features = GenbankReader.readRecords(SAMPLE).get(0).getFeatures();
        Assert.assertEquals(features.stream().map(GenbankFeature::getKey).collect(Collectors.toList()),
                Arrays.asList("source", "gene", "CDS", "gene", "CDS", "CDS", "repeat_region", "misc_feature"));

        final GenbankFeature cds = features.getFeature("CDS", 0);
        Assert.assertEquals(cds.getRawLocation(), "1..18");
        Assert.assertEquals(cds.getQualifier("locus_tag"), "TST_0001");
        Assert.assertEquals(cds.getQualifier("codon_start"), "1");
        Assert.assertEquals(cds.getQualifier("product"), "hypothetical protein");
        Assert.assertEquals(cds.getQualifier("translation"), "MKPGF");

        Assert.assertTrue(features.getFeature("gene", 1).hasQualifier("pseudo"));
        Assert.assertEquals(features.getFeature("gene", 1).getQualifier("pseudo"), "");

        final GenbankFeature reverse = features.getFeature("CDS", 1);
        Assert.assertEquals(reverse.getQualifier("note"),
                "reverse strand gene whose note is long enough to wrap onto a second line");
        Assert.assertEquals(reverse.getQualifier("translation"), "MHAL");

        final GenbankFeature spliced = features.getFeature("CDS", 2);
        Assert.assertEquals(spliced.getRawLocation(), "join(35..40,45..50)");
        Assert.assertEquals(spliced.getQualifier("product"), "spliced \"test\" protein");

        Assert.assertTrue(features.getLocation("misc_feature", 0) instanceof BetweenLocation);
        // locations are parsed lazily
        Assert.assertFalse(features.getFeature("repeat_region", 0).isLocationParsed());
    }

    @Test
    public void testReadSampleSequences() {
        final List<GenbankRecord> records = GenbankReader.readRecords(SAMPLE);
        Assert.assertEquals(records.get(0).getSequence().getBases(), SAMPLE_BASES);
        Assert.assertEquals(records.get(0).getSequence().getName(), "TEST0001.1");
        Assert.assertEquals(records.get(1).getSequence().getBases(), "GGCCTTAAGGCCATGCCCAT");
    }

    @DataProvider
    public Object[][] featureSequences() {
        return new Object[][] {
                {0, "CDS", 0, "ATGAAACCCGGGTTTTAG"},
                {0, "CDS", 1, "GATGCATGCTAA"},
                {0, "CDS", 2, "ATCGATGCTAGC"},
                {0, "gene", 1, "GATGCATGCTAA"},
                {0, "repeat_region", 0, "TGCC"},
                {0, "misc_feature", 0, ""},
                {0, "source", 0, SAMPLE_BASES},
                {1, "CDS", 0, "GCCCATGGC"},
                {1, "misc_feature", 0, ""},
        };
    }

    @Test(dataProvider = "featureSequences")
    public void testFeatureSequence(final int recordIndex, final String key, final int occurrence, final String expected) {
        final GenbankRecord record = GenbankReader.readRecords(SAMPLE).get(recordIndex);
        Assert.assertEquals(record.getFeatureSequence(key, occurrence), expected);
    }

    @Test
    public void testKeepLowercase() {
        try (final GenbankReader reader = new GenbankReader(SAMPLE, false)) {
            final GenbankRecord record = reader.readRecord();
            Assert.assertEquals(record.getSequence().getBases(), SAMPLE_BASES.toLowerCase());
            Assert.assertEquals(record.getFeatureSequence("CDS", 1), "gatgcatgctaa");
        }
    }

    @Test
    public void testReadOneRecordAtATime() {
        try (final GenbankReader reader = new GenbankReader(SAMPLE)) {
            Assert.assertEquals(reader.readRecord().getMetadata().getLocusName(), "TEST0001");
            Assert.assertEquals(reader.readRecord().getMetadata().getLocusName(), "TEST0002");
            Assert.assertNull(reader.readRecord());
            Assert.assertNull(reader.readRecord());
        }
    }

    @Test
    public void testEmptyInput() {
        try (final GenbankReader reader = readerFor("\n\n")) {
            Assert.assertEquals(reader.readAll(), Collections.emptyList());
        }
    }

    @Test
    public void testMinimalRecords() {
        final String text =
                "LOCUS       A 4 bp DNA\n" +
                "//\n" +
                "LOCUS       B 4 bp\n" +
                "ORIGIN\n" +
                "        1 acgt\n" +
                "//\n";
        try (final GenbankReader reader = readerFor(text)) {
            final List<GenbankRecord> records = reader.readAll();
            Assert.assertEquals(records.size(), 2);
            Assert.assertTrue(records.get(0).getFeatures().isEmpty());
            Assert.assertEquals(records.get(0).getSequence().length(), 0);
            Assert.assertEquals(records.get(0).getSequence().getName(), "A");
            Assert.assertNull(records.get(1).getMetadata().getMoleculeType());
            Assert.assertEquals(records.get(1).getSequence().getBases(), "ACGT");
            Assert.assertEquals(reader.getLineNumber(), 6);
        }
    }

    @Test
    public void testDeclaredLengthMismatchIsTolerated() {
        final String text =
                "LOCUS       A 10 bp DNA\n" +
                "ORIGIN\n" +
                "        1 acgt\n" +
                "//\n";
        try (final GenbankReader reader = readerFor(text)) {
            final GenbankRecord record = reader.readRecord();
            Assert.assertEquals(record.getMetadata().getSequenceLength(), 10);
            Assert.assertEquals(record.getSequence().length(), 4);
        }
    }

    @Test
    public void testQuotedValueStartingOnNextLine() {
        final String text =
                "LOCUS       A 4 bp DNA\n" +
                "FEATURES             Location/Qualifiers\n" +
                "     misc_feature    1..4\n" +
                "                     /note=\"\n" +
                "                     hello\"\n" +
                "                     /translation=\"\n" +
                "                     MK\"\n" +
                "ORIGIN\n" +
                "        1 acgt\n" +
                "//\n";
        try (final GenbankReader reader = readerFor(text)) {
            final GenbankFeature feature = reader.readRecord().getFeatures().getFeature("misc_feature", 0);
            Assert.assertEquals(feature.getQualifier("note"), "hello");
            Assert.assertEquals(feature.getQualifier("translation"), "MK");
        }
    }

    @DataProvider
    public Object[][] malformedRecords() {
        return new Object[][] {
                {"hello\n", 1},
                {"LOCUS       A\n//\n", 1},
                {"LOCUS       A ten bp DNA\n//\n", 1},
                {"LOCUS       A 4 bp DNA\nORIGIN\n        1 acgt\n", 3},
                {"LOCUS       A 4 bp DNA\nDEFINITION  first\nLOCUS       B 4 bp DNA\n//\n", 3},
                {"LOCUS       A 4 bp DNA\nFEATURES             Location/Qualifiers\n" +
                        "                     /note=\"x\"\n//\n", 3},
                {"LOCUS       A 4 bp DNA\nFEATURES             Location/Qualifiers\n" +
                        "   gene   1..4\n//\n", 3},
                {"LOCUS       A 4 bp DNA\nFEATURES             Location/Qualifiers\n" +
                        "     gene\n     CDS             1..4\n//\n", 3},
                {"LOCUS       A 4 bp DNA\nFEATURES             Location/Qualifiers\n" +
                        "     gene            1..4\n                     /note=\"abc\n" +
                        "     CDS             1..4\n//\n", 4},
                {"LOCUS       A 4 bp DNA\nFEATURES             Location/Qualifiers\n" +
                        "     gene            1..4\n", 3},
                {"LOCUS       A 4 bp DNA\nORIGIN\n        x acgt\n//\n", 3},
        };
    }

    @Test(dataProvider = "malformedRecords")
    public void testMalformedRecord(final String text, final int expectedLine) {
        try (final GenbankReader reader = readerFor(text)) {
            reader.readRecord();
            Assert.fail("expected a malformed record");
        } catch (final UserException.MalformedGenbankRecord e) {
            Assert.assertEquals(e.getLineNumber(), expectedLine, e.getMessage());
            Assert.assertTrue(e.getMessage().contains("test.gb"), e.getMessage());
        }
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingFile() {
        new GenbankReader(Paths.get(publicTestDir, "no_such_file.gb"));
    }
}
