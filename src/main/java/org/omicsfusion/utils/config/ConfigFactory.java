package org.omicsfusion.utils.config;

import com.google.common.annotations.VisibleForTesting;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.omicsfusion.exceptions.OmicsFusionException;
import org.omicsfusion.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * This class wraps functionality in the {@link org.aeonbits.owner} configuration utilities to be a more
 * project-specific interface.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    //=======================================
    // Singleton members / methods:
    private static final ConfigFactory instance;

    static {
        instance = new ConfigFactory();
    }

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    //=======================================

    /**
     * A regex to use to look for variables in the Sources annotation
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set each variable for configuration file paths when the variable
     * has not been set in either Java System properties or environment properties.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    /**
     * A set to keep track of the classes we've already resolved for configuration path purposes:
     */
    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    // =================================================================================================================

    /**
     * Checks each of the given {@code filenameProperties} for if they are defined in system {@link System#getProperties()}
     * or environment {@link System#getenv()} properties.  If they are not, this method will set them in the
     * {@link org.aeonbits.owner.ConfigFactory} to an empty file path so the {@link org.aeonbits.owner.ConfigFactory} will know to try to resolve them as
     * variables at load-time (and not as raw paths).
     * @param filenameProperties A {@link List} of filename properties as specified in {@link Config} {@link org.aeonbits.owner.Config.Sources} annotations to check for existence in system and environment properties.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        final Properties systemProperties = System.getProperties();
        final Map<String, String> environmentProperties = System.getenv();

        // Make sure that if our property isn't in the system, environment, and ConfigFactory
        // properties, that we set it to a neutral value that will not contain
        // anything (so that the property will fall back into the next value).
        for (final String property : filenameProperties) {

            if ( environmentProperties.containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + environmentProperties.get(property) + " - will search for config here.");
            }
            else if ( systemProperties.containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + systemProperties.get(property) + " - will search for config here.");
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties: " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property) + " - will search for config here.");
            }
            else {
                logger.debug("Config path variable not found: " + property +
                        " - setting value to default empty variable: " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get a list of the config file variables from the given {@link Config} class.
     * @param configClass A configuration class from which to extract variable names in its {@link org.aeonbits.owner.Config.Sources}.
     * @return A list of variables in the {@link org.aeonbits.owner.Config.Sources} of the given {@code configClass}
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {

        final List<String> configPathVariableNames = new ArrayList<>();

        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);

        if ( annotation != null ) {
            for (final String val : annotation.value()) {

                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }

        return configPathVariableNames;
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if ( !alreadyResolvedPathVariables.contains(clazz) ) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(getSourcesAnnotationPathVariables(clazz));
            alreadyResolvedPathVariables.add(clazz);
        }
    }

    // =================================================================================================================

    /**
     * Quick way to get the integration defaults.
     * @return The cached {@link OmicsFusionConfig}.
     */
    public OmicsFusionConfig getOmicsFusionConfig() {
        return getOrCreate( OmicsFusionConfig.class );
    }

    /**
     * Wrapper around {@link org.aeonbits.owner.ConfigFactory#create(Class, Map[])} which will ensure that
     * path variables specified in {@link org.aeonbits.owner.Config.Sources} annotations are resolved prior
     * to creation.
     *
     * @param clazz   the interface extending from {@link Config} that you want to instantiate.
     * @param imports additional variables to be used to resolve the properties.
     * @param <T>     type of the interface.
     * @return an object implementing the given interface, which maps methods to property values.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {

        Utils.nonNull(clazz);

        resolvePathVariables(clazz);

        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Wrapper around {@link ConfigCache#getOrCreate(Class, Map[])} which will ensure that
     * path variables specified in {@link org.aeonbits.owner.Config.Sources} annotations are resolved prior
     * to creation.
     *
     * @param clazz     the interface extending from {@link Config} that you want to instantiate.
     * @param imports   additional variables to be used to resolve the properties.
     * @param <T>       type of the interface.
     * @return          an object implementing the given interface, that can be taken from the cache,
     *                  which maps methods to property values.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {

        Utils.nonNull(clazz);

        resolvePathVariables(clazz);

        return ConfigCache.getOrCreate(clazz, imports);
    }

    /**
     * Logs all the parameters in the given {@link Config} object at {@link Level#DEBUG}
     * @param config A {@link Config} object from which to log all parameters and values.
     * @param <T> any {@link Config} type to use to log all configuration information.
     */
    public static <T extends Config> void logConfigFields(final T config) {
        logConfigFields(config, Level.DEBUG);
    }

    /**
     * Logs all the parameters in the given {@link Config} object at the given {@link Level}
     * @param config A {@link Config} object from which to log all parameters and values.
     * @param level The log level at which to log the data in {@code config}
     * @param <T> any {@link Config} type to use to log all configuration information.
     */
    public static <T extends Config> void logConfigFields(final T config, final Level level) {

        Utils.nonNull(config);
        Utils.nonNull(level);

        // Only continue in this method here if we would log the given level:
        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final Map.Entry<String, Object> entry : getConfigMap(config).entrySet() ) {
            logger.log(level, "\t" + entry.getKey() + " = " + entry.getValue());
        }
    }

    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap( final T config ) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        // The proxy implements the config interface, whose declared methods are the property getters.
        for ( final Class<?> classInterface : config.getClass().getInterfaces() ) {
            if ( !Config.class.isAssignableFrom(classInterface) ) {
                continue;
            }

            for (final Method propertyMethod : classInterface.getDeclaredMethods()) {

                // Get the real property name if we've overwritten it with a key:
                final Config.Key key = propertyMethod.getAnnotation(Config.Key.class);
                final String propertyName = key != null ? key.value() : propertyMethod.getName();

                try {
                    configMap.put(propertyName, propertyMethod.invoke(config));
                } catch (final IllegalAccessException ex) {
                    throw new OmicsFusionException("Could not access the config getter: " +
                            config.getClass().getSimpleName() + "." +
                            propertyMethod.getName(), ex);

                } catch (final InvocationTargetException ex) {
                    throw new OmicsFusionException("Could not invoke the config getter: " +
                            config.getClass().getSimpleName() + "." +
                            propertyMethod.getName(), ex);
                }
            }
        }

        return configMap;
    }
}
