package org.broadinstitute.genbank.utils.location;

import org.broadinstitute.genbank.testutils.GenbankBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public final class LocationUnitTest extends GenbankBaseTest {

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvertedRange() {
        new RangeLocation(5, 2);
    }

    @Test
    public void testFuzzyBoundsAreNotOrdered() {
        final RangeLocation range = new RangeLocation(Position.before(5), Position.exact(2));
        Assert.assertEquals(range.toString(), "<5..2");
    }

    @Test
    public void testBetween() {
        Assert.assertFalse(new BetweenLocation(4, 5).isCircular());
        Assert.assertTrue(new BetweenLocation(200, 1).isCircular());
        Assert.assertEquals(new BetweenLocation(4, 5), new BetweenLocation(4, 5));
        Assert.assertEquals(new BetweenLocation(4, 5).toString(), "4^5");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBetweenNonAdjacentBases() {
        new BetweenLocation(4, 6);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmptyJoin() {
        new JoinLocation(Collections.emptyList());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testJoinWithNullPart() {
        new JoinLocation(Arrays.asList(new RangeLocation(1, 2), null));
    }

    @Test
    public void testJoinFlattening() {
        final JoinLocation inner = new JoinLocation(new RangeLocation(1, 2), new RangeLocation(3, 4));
        final JoinLocation outer = new JoinLocation(inner, new RangeLocation(5, 6));
        Assert.assertEquals(outer.getParts(), Arrays.asList(new RangeLocation(1, 2), new RangeLocation(3, 4), new RangeLocation(5, 6)));
        Assert.assertEquals(outer, new JoinLocation(new RangeLocation(1, 2), new RangeLocation(3, 4), new RangeLocation(5, 6)));
    }

    @Test
    public void testOrderFlatteningKeepsJoins() {
        final OrderLocation order = new OrderLocation(
                new OrderLocation(new RangeLocation(1, 2), new RangeLocation(3, 4)),
                new JoinLocation(new RangeLocation(5, 6), new RangeLocation(7, 8)));
        Assert.assertEquals(order.getParts().size(), 3);
        Assert.assertTrue(order.getParts().get(2) instanceof JoinLocation);
    }

    @Test
    public void testJoinAndOrderAreDifferent() {
        final JoinLocation join = new JoinLocation(new RangeLocation(1, 2), new RangeLocation(5, 6));
        final OrderLocation order = new OrderLocation(new RangeLocation(1, 2), new RangeLocation(5, 6));
        Assert.assertNotEquals(join, order);
        Assert.assertEquals(join.getParts(), order.getParts());
        Assert.assertNotEquals(join.hashCode(), order.hashCode());
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testPartsAreImmutable() {
        new JoinLocation(new RangeLocation(1, 2)).getParts().add(new RangeLocation(3, 4));
    }

    @Test
    public void testComplementAndRemote() {
        final ComplementLocation complement = new ComplementLocation(new RangeLocation(1, 4));
        Assert.assertEquals(complement.getInner(), new RangeLocation(1, 4));
        Assert.assertEquals(complement, new ComplementLocation(new RangeLocation(1, 4)));
        Assert.assertNotEquals(complement, new RangeLocation(1, 4));

        final RemoteLocation remote = new RemoteLocation("J00194.1", complement);
        Assert.assertEquals(remote.getAccession(), "J00194.1");
        Assert.assertEquals(remote.toString(), "J00194.1:complement(1..4)");
        Assert.assertNotEquals(remote, new RemoteLocation("J00194.2", complement));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRemoteNeedsAccession() {
        new RemoteLocation("", new RangeLocation(1, 2));
    }
}
