package org.broadinstitute.genbank.utils.reference;

import org.broadinstitute.genbank.exceptions.OutOfBoundsException;
import org.broadinstitute.genbank.testutils.GenbankBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class NucleotideSequenceUnitTest extends GenbankBaseTest {

    private static final NucleotideSequence SEQUENCE = new NucleotideSequence("TEST1", "ACGTACGT");

    @Test
    public void testAccessors() {
        Assert.assertEquals(SEQUENCE.getName(), "TEST1");
        Assert.assertEquals(SEQUENCE.length(), 8);
        Assert.assertEquals(SEQUENCE.getBases(), "ACGTACGT");
        Assert.assertNull(new NucleotideSequence("ACGT").getName());
    }

    @Test
    public void testAtIsOneBased() {
        Assert.assertEquals(SEQUENCE.at(1), 'A');
        Assert.assertEquals(SEQUENCE.at(5), 'A');
        Assert.assertEquals(SEQUENCE.at(8), 'T');
    }

    @DataProvider(name = "slices")
    public Object[][] slices() {
        return new Object[][]{
                {1, 1, "A"},
                {2, 4, "CGT"},
                {5, 6, "AC"},
                {1, 8, "ACGTACGT"},
        };
    }

    @Test(dataProvider = "slices")
    public void testSlice(final int start, final int end, final String expected) {
        Assert.assertEquals(SEQUENCE.slice(start, end), expected);
    }

    @DataProvider(name = "outOfBounds")
    public Object[][] outOfBounds() {
        return new Object[][]{
                {0, 3},
                {1, 9},
                {9, 9},
                {5, 4},
        };
    }

    @Test(dataProvider = "outOfBounds")
    public void testSliceOutOfBounds(final int start, final int end) {
        try {
            SEQUENCE.slice(start, end);
            Assert.fail(start + ".." + end + " is not within 1..8");
        } catch (final OutOfBoundsException e) {
            Assert.assertEquals(e.getStart(), start);
            Assert.assertEquals(e.getEnd(), end);
            Assert.assertEquals(e.getSequenceLength(), 8);
        }
    }

    @Test(expectedExceptions = OutOfBoundsException.class)
    public void testAtOutOfBounds() {
        SEQUENCE.at(0);
    }

    @Test
    public void testEmptySequence() {
        final NucleotideSequence empty = new NucleotideSequence("EMPTY", "");
        Assert.assertEquals(empty.length(), 0);
        Assert.assertThrows(OutOfBoundsException.class, () -> empty.at(1));
    }

    @Test
    public void testEquality() {
        Assert.assertEquals(SEQUENCE, new NucleotideSequence("TEST1", "ACGTACGT"));
        Assert.assertEquals(SEQUENCE.hashCode(), new NucleotideSequence("TEST1", "ACGTACGT").hashCode());
        Assert.assertNotEquals(SEQUENCE, new NucleotideSequence("TEST2", "ACGTACGT"));
        Assert.assertNotEquals(SEQUENCE, new NucleotideSequence("ACGTACGT"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullBases() {
        new NucleotideSequence("TEST1", null);
    }
}
