package org.omicsfusion.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;

/**
 * Default settings for multi-omics integration runs.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is always resolved "top-down" by declaration order in the @Sources annotation.
 *
 * In this case, the load order is:
 *        1)   "file:${" + OmicsFusionConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + OmicsFusionConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:OmicsFusionConfig.properties",
 *        4)   "classpath:org/omicsfusion/utils/config/OmicsFusionConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 *
 * These values only seed {@link org.omicsfusion.tools.integration.IntegrationConfig.Builder}; every run is driven
 * by the explicit configuration it is given.
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + OmicsFusionConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",          // Variable for file loading
        "classpath:${" + OmicsFusionConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",    // Variable for class path loading
        "file:OmicsFusionConfig.properties",                                         // Default path
        "classpath:org/omicsfusion/utils/config/OmicsFusionConfig.properties"        // Class path
})
public interface OmicsFusionConfig extends Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link OmicsFusionConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "OmicsFusionConfig.pathToConfig";

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link OmicsFusionConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "OmicsFusionConfig.classPathToConfig";

    // ----------------------------------------------------------
    // Reduction Options:
    // ----------------------------------------------------------

    @Key("omicsfusion.default_num_components")
    @DefaultValue("10")
    int default_num_components();

    @Key("omicsfusion.default_final_num_components")
    @DefaultValue("10")
    int default_final_num_components();

    @Key("omicsfusion.scale_features")
    @DefaultValue("false")
    boolean scale_features();

    // ----------------------------------------------------------
    // Execution Options:
    // ----------------------------------------------------------

    @Key("omicsfusion.num_threads")
    @DefaultValue("1")
    int num_threads();
}
