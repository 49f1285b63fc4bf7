package org.broadinstitute.genbank.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genbank.exceptions.GenbankException;
import org.broadinstitute.genbank.exceptions.UserException;
import org.broadinstitute.genbank.utils.LoggingUtils;
import org.broadinstitute.genbank.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads {@link GenbankConfig} with {@link org.aeonbits.owner}.
 * A {@code ${name}} variable in the {@link org.aeonbits.owner.Config.Sources} of a configuration that nobody has set
 * is pointed at {@link #NO_PATH_VARIABLE_VALUE}, so that source yields nothing and the packaged defaults apply.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory INSTANCE = new ConfigFactory();

    private static final Pattern PATH_VARIABLE = Pattern.compile("\\$\\{(.*)}");

    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> resolvedClasses = new HashSet<>();

    private ConfigFactory() {}

    public static ConfigFactory getInstance() {
        return INSTANCE;
    }

    /**
     * @return the cached {@link GenbankConfig}, loaded on first use
     */
    public GenbankConfig getGenbankConfig() {
        resolvePathVariables(GenbankConfig.class);
        return ConfigCache.getOrCreate(GenbankConfig.class);
    }

    /**
     * Builds a fresh, uncached configuration of the given type.
     */
    public <T extends Config> T create(final Class<? extends T> clazz) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz);
    }

    private synchronized void resolvePathVariables(final Class<? extends Config> clazz) {
        if (resolvedClasses.add(clazz)) {
            for (final String variable : getPathVariables(clazz)) {
                if (System.getenv(variable) == null && System.getProperty(variable) == null
                        && org.aeonbits.owner.ConfigFactory.getProperty(variable) == null) {
                    logger.debug("Config path variable " + variable + " is unset, using " + NO_PATH_VARIABLE_VALUE);
                    org.aeonbits.owner.ConfigFactory.setProperty(variable, NO_PATH_VARIABLE_VALUE);
                } else {
                    logger.debug("Config path variable " + variable + " is set, its file will be read");
                }
            }
        }
    }

    /**
     * @return the names of the {@code ${...}} variables in the sources of {@code clazz}, in declaration order
     */
    @VisibleForTesting
    static List<String> getPathVariables(final Class<? extends Config> clazz) {
        final Config.Sources sources = clazz.getAnnotation(Config.Sources.class);
        if (sources == null) {
            return Collections.emptyList();
        }
        final List<String> variables = new ArrayList<>();
        for (final String source : sources.value()) {
            final Matcher matcher = PATH_VARIABLE.matcher(source);
            if (matcher.find()) {
                variables.add(matcher.group(1));
            }
        }
        return variables;
    }

    /**
     * Finds the value following the first occurrence of {@code configFileOption}. The file itself is not checked.
     *
     * @return the named file, or {@code null} if the option is absent
     * @throws UserException.BadInput if the option is the last argument or is followed by another option
     */
    public static String getConfigFilenameFromArgs(final String[] args, final String configFileOption) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);
        final int index = Arrays.asList(args).indexOf(configFileOption);
        if (index < 0) {
            return null;
        }
        if (index + 1 == args.length || args[index + 1].startsWith("-")) {
            throw new UserException.BadInput("no configuration file given after " + configFileOption);
        }
        return args[index + 1];
    }

    /**
     * Loads {@link GenbankConfig} from the file given with {@code configFileOption}, if any, and publishes its
     * {@link SystemProperty} options. Must run before anything else reads the configuration.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs(final String[] args, final String configFileOption) {
        final String configFile = getConfigFilenameFromArgs(args, configFileOption);
        if (configFile != null) {
            org.aeonbits.owner.ConfigFactory.setProperty(GenbankConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFile);
        }
        injectToSystemProperties(getSystemPropertiesFromConfig(getGenbankConfig()));
    }

    /**
     * Sets each property that the JVM does not already define.
     */
    @VisibleForTesting
    static void injectToSystemProperties(final Map<String, String> properties) {
        properties.forEach((key, value) -> {
            if (System.getProperty(key) != null) {
                logger.debug("Keeping existing system property " + key);
            } else {
                System.setProperty(key, value);
            }
        });
    }

    public static void logConfigFields(final Config config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        final Level level = LoggingUtils.levelToLog4jLevel(Utils.nonNull(logLevel));
        if (logger.isEnabled(level)) {
            logger.log(level, "Configuration values:");
            getConfigMap(config, false).forEach((key, value) -> logger.log(level, "\t" + key + " = " + value));
        }
    }

    @VisibleForTesting
    static Map<String, String> getSystemPropertiesFromConfig(final Config config) {
        final Map<String, String> properties = new LinkedHashMap<>();
        getConfigMap(config, true).forEach((key, value) -> properties.put(key, String.valueOf(value)));
        return properties;
    }

    /**
     * @param onlySystemProperties keep only the options annotated with {@link SystemProperty}
     * @return option name (its {@link Config.Key} if present) to current value
     */
    @VisibleForTesting
    static Map<String, Object> getConfigMap(final Config config, final boolean onlySystemProperties) {
        final Map<String, Object> options = new LinkedHashMap<>();
        // the OWNER proxy also implements interfaces of its own
        for (final Class<?> type : config.getClass().getInterfaces()) {
            if (!Config.class.isAssignableFrom(type)) {
                continue;
            }
            for (final Method getter : type.getDeclaredMethods()) {
                if (onlySystemProperties && !getter.isAnnotationPresent(SystemProperty.class)) {
                    continue;
                }
                final Config.Key key = getter.getAnnotation(Config.Key.class);
                try {
                    options.put(key == null ? getter.getName() : key.value(), getter.invoke(config));
                } catch (final IllegalAccessException | InvocationTargetException e) {
                    throw new GenbankException("Could not read configuration option " + getter.getName(), e);
                }
            }
        }
        return options;
    }
}
