package org.broadinstitute.genbank.utils.config;

import java.lang.annotation.*;

/**
 * Marks a {@link org.aeonbits.owner.Config} option that is also published as a Java System Property by
 * {@link ConfigFactory#initializeConfigurationsFromCommandLineArgs}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
@Documented
public @interface SystemProperty {

}
