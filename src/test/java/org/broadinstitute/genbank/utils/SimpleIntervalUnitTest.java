package org.broadinstitute.genbank.utils;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.genbank.testutils.GenbankBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class SimpleIntervalUnitTest extends GenbankBaseTest {

    @DataProvider(name = "badIntervals")
    public Object[][] badIntervals(){
        return new Object[][]{
                {null,1,12, "null contig"},
                {"1", 0, 10, "start==0"},
                {"1", -10, 10, "negative start"},
                {"1", 10, 9, "end < start"}
        };
    }

    @Test(dataProvider = "badIntervals", expectedExceptions = IllegalArgumentException.class)
    public void badIntervals(String contig, int start, int end, String name){
        new SimpleInterval(contig, start, end);
    }

    @Test(dataProvider = "badIntervals", expectedExceptions = IllegalArgumentException.class)
    public void badIntervalsFromLocatable(String contig, int start, int end, String name){
        Locatable l = getLocatable(contig, start, end);
        new SimpleInterval(l);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void illegalArgumentExceptionFromNullLocatable(){
        new SimpleInterval((Locatable)null);
    }

    private static Locatable getLocatable(final String contig, final int start, final int end) {
        return new Locatable() {
            @Override
            public String getContig() {
                return contig;
            }

            @Override
            public int getStart() {
                return start;
            }

            @Override
            public int getEnd() {
                return end;
            }
        };
    }

    @DataProvider(name = "overlaps")
    public Object[][] overlaps() {
        final SimpleInterval standard = new SimpleInterval("TEST1", 10, 20);
        return new Object[][]{
                {standard, new SimpleInterval("TEST1", 10, 20), true},
                {standard, new SimpleInterval("TEST1", 1, 9), false},
                {standard, new SimpleInterval("TEST1", 1, 10), true},
                {standard, new SimpleInterval("TEST1", 20, 30), true},
                {standard, new SimpleInterval("TEST1", 21, 30), false},
                {standard, new SimpleInterval("TEST1", 12, 15), true},
                {standard, new SimpleInterval("TEST2", 10, 20), false},
                {standard, null, false},
        };
    }

    @Test(dataProvider = "overlaps")
    public void testOverlaps(final SimpleInterval first, final SimpleInterval second, final boolean expected) {
        Assert.assertEquals(first.overlaps(second), expected);
    }

    @Test
    public void testContains() {
        final SimpleInterval interval = new SimpleInterval("TEST1", 10, 20);
        Assert.assertTrue(interval.contains(new SimpleInterval("TEST1", 10, 20)));
        Assert.assertTrue(interval.contains(new SimpleInterval("TEST1", 12, 15)));
        Assert.assertFalse(interval.contains(new SimpleInterval("TEST1", 5, 15)));
        Assert.assertFalse(interval.contains(new SimpleInterval("TEST2", 12, 15)));
        Assert.assertFalse(interval.contains(null));
    }

    @Test
    public void testSpanWith() {
        final SimpleInterval span = new SimpleInterval("TEST1", 10, 20).spanWith(new SimpleInterval("TEST1", 30, 40));
        Assert.assertEquals(span, new SimpleInterval("TEST1", 10, 40));
        Assert.assertEquals(span.size(), 31);
        Assert.assertEquals(span.toString(), "TEST1:10-40");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSpanWithOnDifferentContigs() {
        new SimpleInterval("TEST1", 10, 20).spanWith(new SimpleInterval("TEST2", 30, 40));
    }
}
