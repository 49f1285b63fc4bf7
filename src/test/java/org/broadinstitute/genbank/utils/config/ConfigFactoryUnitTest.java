package org.broadinstitute.genbank.utils.config;

import org.broadinstitute.genbank.exceptions.UserException;
import org.broadinstitute.genbank.testutils.GenbankBaseTest;
import org.broadinstitute.genbank.utils.BaseUtils.UnmappedBasePolicy;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tests for {@link ConfigFactory}.
 */
public final class ConfigFactoryUnitTest extends GenbankBaseTest {

    private static final String CONFIG_OPTION = "--genbank-config-file";

    @DataProvider
    public Object[][] configFileArgs() {
        return new Object[][] {
                {new String[0], null},
                {new String[] {"ExtractFeatureSequences", "-I", "in.gb"}, null},
                {new String[] {"ExtractFeatureSequences", CONFIG_OPTION, "my.properties", "-I", "in.gb"}, "my.properties"},
                {new String[] {CONFIG_OPTION, "first.properties", CONFIG_OPTION, "second.properties"}, "first.properties"},
        };
    }

    @Test(dataProvider = "configFileArgs")
    public void testGetConfigFilenameFromArgs(final String[] args, final String expected) {
        Assert.assertEquals(ConfigFactory.getConfigFilenameFromArgs(args, CONFIG_OPTION), expected);
    }

    @DataProvider
    public Object[][] missingConfigFileArgs() {
        return new Object[][] {
                {new String[] {"ExtractFeatureSequences", CONFIG_OPTION}},
                {new String[] {CONFIG_OPTION, "--verbosity", "ERROR"}},
        };
    }

    @Test(dataProvider = "missingConfigFileArgs", expectedExceptions = UserException.BadInput.class)
    public void testConfigOptionWithoutFile(final String[] args) {
        ConfigFactory.getConfigFilenameFromArgs(args, CONFIG_OPTION);
    }

    @Test
    public void testDefaults() {
        final GenbankConfig config = ConfigFactory.getInstance().create(GenbankConfig.class);
        Assert.assertTrue(config.origin_uppercase());
        Assert.assertFalse(config.resolver_accept_approximate_bounds());
        Assert.assertEquals(config.complement_unmapped_base_policy(), UnmappedBasePolicy.PASS_THROUGH);
        Assert.assertFalse(config.genbank_stacktrace_on_user_exception());
    }

    @Test
    public void testConfigFileOverridesDefaults() {
        final Path configFile = writeTempFile("GenbankConfig", ".properties",
                "origin_uppercase = false\ncomplement_unmapped_base_policy = ERROR\n");
        try {
            org.aeonbits.owner.ConfigFactory.setProperty(GenbankConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFile.toString());
            final GenbankConfig config = ConfigFactory.getInstance().create(GenbankConfig.class);
            Assert.assertFalse(config.origin_uppercase());
            Assert.assertEquals(config.complement_unmapped_base_policy(), UnmappedBasePolicy.ERROR);
            // options missing from the file fall through to the packaged defaults
            Assert.assertFalse(config.resolver_accept_approximate_bounds());
        } finally {
            org.aeonbits.owner.ConfigFactory.setProperty(GenbankConfig.CONFIG_FILE_VARIABLE_FILE_NAME, ConfigFactory.NO_PATH_VARIABLE_VALUE);
        }
    }

    @Test
    public void testSystemPropertiesFromConfig() {
        final GenbankConfig config = ConfigFactory.getInstance().create(GenbankConfig.class);
        final Map<String, String> properties = ConfigFactory.getSystemPropertiesFromConfig(config);
        Assert.assertEquals(properties, Collections.singletonMap("genbank_stacktrace_on_user_exception", "false"));
    }

    @Test
    public void testConfigMapHasEveryOption() {
        final GenbankConfig config = ConfigFactory.getInstance().create(GenbankConfig.class);
        final Map<String, Object> options = ConfigFactory.getConfigMap(config, false);
        Assert.assertEquals(options.keySet().size(), 4, options.toString());
        Assert.assertEquals(options.get("complement_unmapped_base_policy"), UnmappedBasePolicy.PASS_THROUGH);
        Assert.assertEquals(options.get("origin_uppercase"), true);
    }

    @Test
    public void testInjectToSystemPropertiesDoesNotOverride() {
        final String existing = "genbank.test.existing.property";
        final String fresh = "genbank.test.fresh.property";
        System.setProperty(existing, "original");
        try {
            final Map<String, String> properties = new LinkedHashMap<>();
            properties.put(existing, "replaced");
            properties.put(fresh, "added");
            ConfigFactory.injectToSystemProperties(properties);
            Assert.assertEquals(System.getProperty(existing), "original");
            Assert.assertEquals(System.getProperty(fresh), "added");
        } finally {
            System.clearProperty(existing);
            System.clearProperty(fresh);
        }
    }

    @Test
    public void testSourcesPathVariables() {
        Assert.assertEquals(ConfigFactory.getPathVariables(GenbankConfig.class),
                Collections.singletonList(GenbankConfig.CONFIG_FILE_VARIABLE_FILE_NAME));
    }
}
