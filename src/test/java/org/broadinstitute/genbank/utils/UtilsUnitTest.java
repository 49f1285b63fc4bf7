package org.broadinstitute.genbank.utils;

import com.google.common.collect.Sets;
import org.broadinstitute.genbank.testutils.GenbankBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;

public final class UtilsUnitTest extends GenbankBaseTest {

    @Test
    public void testDupChar() {
        Assert.assertEquals("aaa", Utils.dupChar('a', 3));
        Assert.assertEquals("     ", Utils.dupChar(' ', 5));
        Assert.assertEquals("", Utils.dupChar('a', 0));
    }

    @Test
    public void testNonNullDoesNotThrow(){
        final Object testObject = new Object();
        Assert.assertSame(Utils.nonNull(testObject), testObject);
        Assert.assertSame(Utils.nonNull(testObject, "some message"), testObject);
        Assert.assertSame(Utils.nonNull(testObject, () -> "some message"), testObject);
    }

    @Test
    public void testNonNullThrowsWithMessage() {
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.nonNull(null));
        try {
            Utils.nonNull(null, () -> "deliberately null");
            Assert.fail("expected an IllegalArgumentException");
        } catch (final IllegalArgumentException e) {
            Assert.assertEquals(e.getMessage(), "deliberately null");
        }
    }

    @Test
    public void testNonEmpty(){
        final Collection<String> notEmpty = Collections.singletonList("string1");
        Assert.assertSame(Utils.nonEmpty(notEmpty, "some message"), notEmpty);
    }

    @DataProvider(name= "emptyAndNull")
    public Object[][] emptyAndNull(){
        return new Object[][] {
                {Collections.emptyList()},
                {null}
        };
    }

    @Test(expectedExceptions = IllegalArgumentException.class, dataProvider = "emptyAndNull")
    public void testNonEmptyThrowsWithMessage(Collection<?> collection) {
        Utils.nonEmpty(collection, "some message");
    }

    @Test
    public void testNonEmptyString() {
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.nonEmpty((String)null, "deliberately empty"));
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.nonEmpty("", "deliberately empty" ));
        Assert.assertEquals(Utils.nonEmpty("this is not empty", "not thrown"), "this is not empty");
    }

    @DataProvider
    public Object[][] getNonNullCollections() {
        return new Object[][]{
                {Collections.emptyList()},
                {Arrays.asList("something", "something else")},
                {Sets.newHashSet("something")},
        };
    }

    @DataProvider
    public Object[][] getCollectionsWithNulls() {
        return new Object[][]{
                {null},
                {Arrays.asList("something", null)},
                {Sets.newHashSet("something", null)},
        };
    }

    @Test(dataProvider = "getNonNullCollections")
    public void testContainsNoNull(Collection<?> collection){
        Utils.containsNoNull(collection, "bad");
    }

    @Test(dataProvider = "getCollectionsWithNulls", expectedExceptions = IllegalArgumentException.class)
    public void testContainsNull( Collection<?> collection){
        Utils.containsNoNull(collection, "This was expected");
    }

    @Test
    public void testValidateArg() {
        Utils.validateArg(true, "not thrown");
        Utils.validateArg(true, () -> "not thrown");
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.validateArg(false, "thrown"));
        Assert.assertThrows(IllegalArgumentException.class, () -> Utils.validateArg(false, () -> "thrown"));
    }

    @Test
    public void testDateTimeForDisplay() {
        final ZonedDateTime dateTime = ZonedDateTime.of(2021, 3, 15, 10, 30, 0, 0, ZoneId.of("UTC"));
        Assert.assertTrue(Utils.getDateTimeForDisplay(dateTime).contains("2021"));
    }
}
