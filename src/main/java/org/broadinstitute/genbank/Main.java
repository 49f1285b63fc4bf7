package org.broadinstitute.genbank;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.genbank.cmdline.CommandLineProgram;
import org.broadinstitute.genbank.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genbank.exceptions.GenbankException;
import org.broadinstitute.genbank.exceptions.UserException;
import org.broadinstitute.genbank.tools.ExtractFeatureSequences;
import org.broadinstitute.genbank.utils.Utils;
import org.broadinstitute.genbank.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.io.Serializable;
import java.lang.reflect.InvocationTargetException;
import java.util.*;

/**
 * This is the main class of the toolkit and the way of executing individual command line programs.
 *
 * The first argument names the program (by its simple class name); the remaining arguments are handed to it.
 *
 * If you want your own single command line program, extend this class and override if required:
 *
 * - {@link #getClassList()} to return the classes to include.
 * - {@link #getCommandLineName()} for the name of the toolkit.
 * - {@link #handleResult(Object)} for handle the result of the tool.
 * - {@link #handleNonUserException(Exception)} for handle non {@link UserException}.
 * - {@link #parseArgsForConfigSetup(String[])} for pulling command-line configuration options out and initializing
 *   the {@link org.broadinstitute.genbank.utils.config.GenbankConfig}
 *
 * Note: If any of the previous methods was overridden, {@link #main(String[])} should be implemented to instantiate
 * your class and call {@link #mainEntry(String[])} to make the changes effective.
 */
public class Main {

    static {
        // Number formatting in messages and output must not depend on the user's locale.
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * Provides ANSI colors for the terminal output *
     */
    private static final String KNRM = "\u001B[0m"; // reset
    private static final String RED = "\u001B[31m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";
    private static final String WHITE = "\u001B[37m";
    private static final String BOLDRED = "\u001B[1m\u001B[31m";

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value when an unrecoverable {@link UserException} occurs.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "genbank_stacktrace_on_user_exception";
    private static final String STACK_TRACE_ON_USER_EXCEPTION_ENV = "GENBANK_STACKTRACE_ON_USER_EXCEPTION";

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************") ;
    }

    /**
     * Reads from the given command-line arguments, pulls out configuration options,
     * and initializes the configuration for this instance of Main.
     */
    protected void parseArgsForConfigSetup(final String[] args) {
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args, "--" + StandardArgumentDefinitions.GENBANK_CONFIG_FILE_OPTION);
    }

    /**
     * The classes we wish to include in our command line.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.singletonList(ExtractFeatureSequences.class);
    }

    /** Returns the command line that will appear in the usage. */
    protected String getCommandLineName() {
        return "genbank-tools";
    }

    /**
     * Run the program named by the first argument.
     *
     * This method is not intended to be used outside of the toolkit and tests.
     */
    public Object instanceMain(final String[] args, final List<Class<? extends CommandLineProgram>> classList, final String commandLineName) {
        final CommandLineProgram program = setupConfigAndExtractProgram(args, classList, commandLineName);
        return runCommandLineProgram(program, args);
    }

    /**
     * This method is not intended to be used outside of the toolkit and tests.
     */
    public Object instanceMain(final String[] args) {
        return instanceMain(args, getClassList(), getCommandLineName());
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs these are the raw arguments from the command line, the first will be stripped off
     * @return the result of running  {program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {

        if (null == program) return null; // no program found!  This will happen if help was specified with no other arguments
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * Set up the configuration and create the {@link CommandLineProgram} to run.
     * @param args Argument array passed into this invocation of {@link Main}.
     * @param classList List of classes to include in the command-line.
     * @param commandLineName The command-line name as it appears in the usage.
     * @return The {@link CommandLineProgram} to run, or {@code null} if only the usage was asked for.
     */
    protected CommandLineProgram setupConfigAndExtractProgram(final String[] args,
                                                              final List<Class<? extends CommandLineProgram>> classList,
                                                              final String commandLineName ){
        // The configuration must be loaded before the program is instantiated, its argument defaults may read it.
        parseArgsForConfigSetup(args);

        return extractCommandLineProgram(args, classList, commandLineName);
    }

    /**
     * The entry point to the toolkit from commandline: it uses {@link #instanceMain(String[])} to run the command line
     * program and handle the returned object with {@link #handleResult(Object)}, and exit with 0.
     * If any error occurs, it handles the exception (if non-user exception, through {@link #handleNonUserException(Exception)})
     * and exit with the concrete error exit value.
     *
     * Note: this is the only method that is allowed to call System.exit (because tools may be run from a test harness)
     */
    protected final void mainEntry(final String[] args) {

        CommandLineProgram program = null;
        try {
            program = setupConfigAndExtractProgram(args, getClassList(), getCommandLineName());
            final Object result = runCommandLineProgram(program, args);
            handleResult(result);
        } catch (final CommandLineException e){
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e){
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final Exception e){
            handleNonUserException(e);
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    /**
     * Handle the result returned for a tool. Default implementation prints a message with the string value of the object if it is not null.
     * @param result the result of the tool (may be null)
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    /**
     * Handle an exception that was likely caused by user error.
     * This includes {@link UserException} and {@link CommandLineException}
     *
     * Default implementation produces a pretty error message
     * and a stack trace iff {@link #printStackTraceOnUserExceptions()}
     *
     * @param e the exception to handle
     */
    protected void handleUserException(Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if(printStackTraceOnUserExceptions()) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set %s=true in the configuration file (or the environment variable %s) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_ENV));
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     * @param exception the exception to handle (never an {@link UserException}).
     */
    protected void handleNonUserException(final Exception exception) {
        exception.printStackTrace();
    }

    /** The entry point from the command line. It calls {@link #mainEntry(String[])} from this instance. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    // the configuration publishes its value as a system property
    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_ENV)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY);
    }

    /**
     * Returns the command line program specified, or prints the usage and returns {@code null} if help was asked for.
     * @throws UserException if the program name is not known
     */
    private CommandLineProgram extractCommandLineProgram( final String[] args,
                                                          final List<Class<? extends CommandLineProgram>> classList,
                                                          final String commandLineName ) {
        final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<? extends CommandLineProgram> clazz : classList) {
            if (getProgramProperty(clazz) == null) {
                throw new GenbankException("The class " + clazz.getSimpleName() + " is missing the required CommandLineProgramProperties annotation");
            }
            if (simpleNameToClass.containsKey(clazz.getSimpleName())) {
                throw new GenbankException("Simple class name collision: " + clazz.getName());
            }
            simpleNameToClass.put(clazz.getSimpleName(), clazz);
        }

        final Set<Class<?>> classes = new LinkedHashSet<>(simpleNameToClass.values());

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, classes, commandLineName);
        } else {
            final Class<? extends CommandLineProgram> clazz = simpleNameToClass.get(args[0]);
            if (clazz != null) {
                try {
                    return clazz.getDeclaredConstructor().newInstance();
                } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                    throw new GenbankException("Could not create an instance of " + clazz.getName(), e);
                }
            }
            printUsage(System.err, classes, commandLineName);
            throw new UserException(getSuggestedAlternateCommand(classes, args[0]));
        }
        return null;
    }

    public static CommandLineProgramProperties getProgramProperty(Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private static class SimpleNameComparator implements Comparator<Class<?>>, Serializable {
        private static final long serialVersionUID = 1L;

        @Override
        public int compare(final Class<?> aClass, final Class<?> bClass) {
            return aClass.getSimpleName().compareTo(bClass.getSimpleName());
        }
    }

    private void printUsage(final PrintStream destinationStream, final Set<Class<?>> classes, final String commandLineName) {
        final StringBuilder builder = new StringBuilder();
        builder.append(BOLDRED + "USAGE: " + commandLineName + " " + GREEN + "<program name>" + BOLDRED + " [-h]\n\n" + KNRM)
                .append(BOLDRED + "Available Programs:\n" + KNRM);

        // Group CommandLinePrograms by CommandLineProgramGroup
        final Map<Class<? extends CommandLineProgramGroup>, CommandLineProgramGroup> programGroupClassToProgramGroupInstance = new LinkedHashMap<>();
        final Map<CommandLineProgramGroup, List<Class<?>>> programsByGroup = new TreeMap<>(CommandLineProgramGroup.comparator);
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            if (property.omitFromCommandLine()) {
                continue;
            }
            CommandLineProgramGroup programGroup = programGroupClassToProgramGroupInstance.get(property.programGroup());
            if (null == programGroup) {
                try {
                    programGroup = property.programGroup().getDeclaredConstructor().newInstance();
                } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                    throw new GenbankException("Could not create program group " + property.programGroup().getName(), e);
                }
                programGroupClassToProgramGroupInstance.put(property.programGroup(), programGroup);
            }
            programsByGroup.computeIfAbsent(programGroup, g -> new ArrayList<>()).add(clazz);
        }

        // Print out the programs in each group
        for (final Map.Entry<CommandLineProgramGroup, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = entry.getKey();

            builder.append(WHITE + "--------------------------------------------------------------------------------------\n" + KNRM);
            builder.append(String.format("%s%-48s %-45s%s\n", RED, programGroup.getName() + ":", programGroup.getDescription(), KNRM));

            final List<Class<?>> sortedClasses = new ArrayList<>(entry.getValue());
            sortedClasses.sort(new SimpleNameComparator());

            for (final Class<?> clazz : sortedClasses) {
                builder.append(getDisplaySummaryForTool(clazz, getProgramProperty(clazz)));
            }
            builder.append(String.format("\n"));
        }
        builder.append(WHITE + "--------------------------------------------------------------------------------------\n" + KNRM);
        destinationStream.println(builder.toString());
    }

    /**
     * Return a summary string for a command line tool suitable for display.
     * @param toolClass tool class
     * @param clpProperties {@link CommandLineProgramProperties} for the tool
     */
    protected String getDisplaySummaryForTool(final Class<?> toolClass, final CommandLineProgramProperties clpProperties) {
        final String summaryLine = String.format("%s%s", CYAN, clpProperties.oneLineSummary());
        final String toolName = toolClass.getSimpleName();
        if (toolName.length() >= 45) {
            return String.format("%s    %s    %s%s\n", GREEN, toolName, summaryLine, KNRM);
        } else {
            return String.format("%s    %-45s%s%s\n", GREEN, toolName, summaryLine, KNRM);
        }
    }

    /**
     * similarity floor for matching in getSuggestedAlternateCommand *
     */
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    /**
     * When a command does not match any known command, searches for similar commands, using the same method as GIT *
     * @return returns an error message including the closes match if relevant.
     */
    public String getSuggestedAlternateCommand(final Set<Class<?>> classes, final String command) {
        final Map<Class<?>, Integer> distances = new LinkedHashMap<>();

        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;

        // Score against all classes
        for (final Class<?> clazz : classes) {
            final String name = clazz.getSimpleName();
            final int distance;
            if (name.equals(command)) {
                throw new GenbankException.ShouldNeverReachHereException("Command matches: " + command);
            }
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            } else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(clazz, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }

        // Upper bound on the similarity score
        if (0 == bestDistance && bestN == classes.size()) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        final StringBuilder message = new StringBuilder();
        message.append(String.format("'%s' is not a valid command.", command));
        message.append(System.lineSeparator());
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            message.append(String.format("Did you mean %s?", (bestN < 2) ? "this" : "one of these"));
            message.append(System.lineSeparator());
            for (final Class<?> clazz : classes) {
                if (bestDistance == distances.get(clazz)) {
                    message.append(String.format("        %s", clazz.getSimpleName()));
                }
            }
        }
        return message.toString();
    }
}
