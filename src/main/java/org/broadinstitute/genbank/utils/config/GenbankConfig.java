package org.broadinstitute.genbank.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Mutable;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.broadinstitute.genbank.utils.BaseUtils.UnmappedBasePolicy;

/**
 * Configuration for reading GenBank records and resolving their locations.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, so an option missing from the first source is looked up in
 * the following ones, and the @DefaultValue is used when no source defines it.
 *
 * The load order is:
 *        1)   "file:${" + GenbankConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "file:GenbankConfig.properties",
 *        3)   "classpath:org/broadinstitute/genbank/utils/config/GenbankConfig.properties"
 *        4)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + GenbankConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",                // Variable for file loading
        "file:GenbankConfig.properties",                                               // Default path
        "classpath:org/broadinstitute/genbank/utils/config/GenbankConfig.properties"   // Class path
})
public interface GenbankConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link GenbankConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "GenbankConfig.pathToConfig";

    // ----------------------------------------------------------
    // Miscellaneous Options:
    // ----------------------------------------------------------

    @SystemProperty
    @Key("genbank_stacktrace_on_user_exception")
    @DefaultValue("false")
    boolean genbank_stacktrace_on_user_exception();

    // ----------------------------------------------------------
    // Reader Options:
    // ----------------------------------------------------------

    /**
     * Upper-case the ORIGIN bases while reading.
     */
    @Key("origin_uppercase")
    @DefaultValue("true")
    boolean origin_uppercase();

    // ----------------------------------------------------------
    // Resolver Options:
    // ----------------------------------------------------------

    @Key("complement_unmapped_base_policy")
    @DefaultValue("PASS_THROUGH")
    UnmappedBasePolicy complement_unmapped_base_policy();

    @Key("resolver_accept_approximate_bounds")
    @DefaultValue("false")
    boolean resolver_accept_approximate_bounds();
}
