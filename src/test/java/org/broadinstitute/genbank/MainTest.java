package org.broadinstitute.genbank;

import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.genbank.cmdline.CommandLineProgram;
import org.broadinstitute.genbank.cmdline.programgroups.GenbankProgramGroup;
import org.broadinstitute.genbank.exceptions.GenbankException;
import org.broadinstitute.genbank.exceptions.UserException;
import org.broadinstitute.genbank.tools.ExtractFeatureSequences;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class MainTest extends CommandLineProgramTest {

    @Test(expectedExceptions = UserException.class)
    public void testCommandNotFoundThrows(){
        this.runCommandLine(new String[]{"Brain"});
    }

    @Test
    public void testMisspelledCommandSuggestsTool() {
        try {
            new Main().instanceMain(new String[]{"ExtractFeatureSequencez"});
            Assert.fail("expected a UserException");
        } catch (final UserException e) {
            assertContains(e.getMessage(), "'ExtractFeatureSequencez' is not a valid command.");
            assertContains(e.getMessage(), "Did you mean this?");
            assertContains(e.getMessage(), ExtractFeatureSequences.class.getSimpleName());
        }
    }

    @Test
    public void testNoSuggestionForUnrelatedCommand() {
        final Set<Class<?>> classes = new LinkedHashSet<>(Collections.singletonList(ExtractFeatureSequences.class));
        final String message = new Main().getSuggestedAlternateCommand(classes, "Brain");
        Assert.assertTrue(message.startsWith("'Brain' is not a valid command."), message);
        Assert.assertFalse(message.contains("Did you mean"), message);
    }

    @Test
    public void testHelpListsTools() {
        final String usage = captureStdout(() -> Assert.assertNull(new Main().instanceMain(new String[]{"--help"})));
        assertContains(usage, "genbank-tools");
        assertContains(usage, GenbankProgramGroup.NAME);
        assertContains(usage, ExtractFeatureSequences.class.getSimpleName());
    }

    @Test
    public void testNoArgumentsPrintsUsage() {
        final String usage = captureStdout(() -> Assert.assertNull(new Main().instanceMain(new String[0])));
        assertContains(usage, "Available Programs");
    }

    @CommandLineProgramProperties(
            programGroup = GenbankProgramGroup.class,
            summary = "OmitFromCommandLine test",
            oneLineSummary = "OmitFromCommandLine test",
            omitFromCommandLine = true)
    public static final class OmitFromCommandLineCLP extends CommandLineProgram {

        public static final int RETURN_VALUE = 1;

        @Override
        protected Object doWork() {
            return RETURN_VALUE;
        }
    }

    public static final class UnannotatedCLP extends CommandLineProgram {
        @Override
        protected Object doWork() {
            return null;
        }
    }

    private static final class OmitFromCommandLineMain extends Main {
        @Override
        protected List<Class<? extends CommandLineProgram>> getClassList() {
            return Collections.singletonList(OmitFromCommandLineCLP.class);
        }
    }

    @Test
    public void testClpOmitFromCommandLine() {
        final OmitFromCommandLineMain main = new OmitFromCommandLineMain();
        final String clpName = "OmitFromCommandLineCLP";
        // test that the tool can be run from main correctly (returns non-null)
        Assert.assertEquals(main.instanceMain(new String[]{clpName, "--QUIET", "true"}), OmitFromCommandLineCLP.RETURN_VALUE);
        // test that the usage is not shown if help is printed
        final String usage = captureStdout(() -> main.instanceMain(new String[]{"-h"}));
        Assert.assertFalse(usage.contains(clpName));
    }

    @Test(expectedExceptions = GenbankException.class)
    public void testProgramWithoutPropertiesIsRejected() {
        new Main().instanceMain(new String[]{"UnannotatedCLP"}, Collections.singletonList(UnannotatedCLP.class), "test");
    }

    @Test(expectedExceptions = GenbankException.class)
    public void testSimpleNameCollisionIsRejected() {
        new Main().instanceMain(new String[]{"OmitFromCommandLineCLP"},
                Arrays.asList(OmitFromCommandLineCLP.class, OmitFromCommandLineCLP.class), "test");
    }

    @Test
    public void testEnsureShortDescriptionsAreShort() {
        final int maxOneLineSummaryLength = 120;
        for (final Class<? extends CommandLineProgram> clazz : new Main().getClassList()) {
            final CommandLineProgramProperties properties = Main.getProgramProperty(clazz);
            Assert.assertNotNull(properties, clazz.getName());
            Assert.assertTrue(properties.oneLineSummary().length() <= maxOneLineSummaryLength,
                    String.format("One line summary for tool '%s' exceeds allowable length of %d",
                            clazz.getCanonicalName(), maxOneLineSummaryLength));
        }
    }
}
