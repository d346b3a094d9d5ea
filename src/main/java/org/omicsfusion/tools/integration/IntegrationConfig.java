package org.omicsfusion.tools.integration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.omicsfusion.exceptions.UserException;
import org.omicsfusion.utils.Utils;
import org.omicsfusion.utils.config.ConfigFactory;
import org.omicsfusion.utils.config.OmicsFusionConfig;
import org.omicsfusion.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Settings of one integration run.
 *
 * <p>
 *     Instances are immutable; use {@link #builder()} to create them.  A builder starts from the defaults in
 *     {@link OmicsFusionConfig}, and from then on nothing but the values set on it affects the run.
 * </p>
 */
public final class IntegrationConfig {

    private static final Logger logger = LogManager.getLogger(IntegrationConfig.class);

    private final int defaultNumComponents;
    private final Map<String, Integer> numComponentsByModality;
    private final int finalNumComponents;
    private final boolean defaultScaleFeatures;
    private final Map<String, Boolean> scaleFeaturesByModality;
    private final List<String> modalityOrder;
    private final int numThreads;
    private final DimensionalityReducer.Factory reducerFactory;

    private IntegrationConfig(final Builder builder) {
        this.defaultNumComponents = builder.defaultNumComponents;
        this.numComponentsByModality = Collections.unmodifiableMap(new LinkedHashMap<>(builder.numComponentsByModality));
        this.finalNumComponents = builder.finalNumComponents;
        this.defaultScaleFeatures = builder.defaultScaleFeatures;
        this.scaleFeaturesByModality = Collections.unmodifiableMap(new LinkedHashMap<>(builder.scaleFeaturesByModality));
        this.modalityOrder = builder.modalityOrder == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.modalityOrder));
        this.numThreads = builder.numThreads;
        this.reducerFactory = builder.reducerFactory;
    }

    /**
     * Returns a configuration with all the defaults.
     */
    public static IntegrationConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a builder seeded with the defaults of {@link ConfigFactory#getOmicsFusionConfig()}.
     */
    public static Builder builder() {
        return builder(ConfigFactory.getInstance().getOmicsFusionConfig());
    }

    /**
     * Returns a builder seeded with the given defaults.
     */
    public static Builder builder(final OmicsFusionConfig defaults) {
        Utils.nonNull(defaults, "the defaults cannot be null");
        ConfigFactory.logConfigFields(defaults);
        return new Builder()
                .setDefaultNumComponents(defaults.default_num_components())
                .setFinalNumComponents(defaults.default_final_num_components())
                .setDefaultScaleFeatures(defaults.scale_features())
                .setNumThreads(defaults.num_threads());
    }

    /**
     * Returns the target dimensionality for a modality (before any clamping).
     */
    public int getNumComponents(final String modality) {
        return numComponentsByModality.getOrDefault(modality, defaultNumComponents);
    }

    public int getDefaultNumComponents() {
        return defaultNumComponents;
    }

    public int getFinalNumComponents() {
        return finalNumComponents;
    }

    /**
     * Returns whether the features of a modality are divided by their standard deviation after centering.
     */
    public boolean isScalingFeatures(final String modality) {
        return scaleFeaturesByModality.getOrDefault(modality, defaultScaleFeatures);
    }

    public boolean isScalingFeaturesByDefault() {
        return defaultScaleFeatures;
    }

    /**
     * Returns the requested concatenation order, or {@code null} to use the input order.
     */
    public List<String> getModalityOrder() {
        return modalityOrder;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public DimensionalityReducer.Factory getReducerFactory() {
        return reducerFactory;
    }

    /**
     * Determines the concatenation order for the given modalities.
     *
     * @param modalities the supplied modality names in input order. Not {@code null}.
     * @return the configured order if there is one, otherwise the input order.
     * @throws UserException.BadInput if the configured order does not name exactly the supplied modalities.
     */
    public List<String> resolveModalityOrder(final List<String> modalities) {
        Utils.nonNull(modalities, "the modality list cannot be null");
        if (modalityOrder == null) {
            return Collections.unmodifiableList(new ArrayList<>(modalities));
        }
        final Set<String> supplied = new LinkedHashSet<>(modalities);
        final Set<String> ordered = new LinkedHashSet<>(modalityOrder);
        if (ordered.size() != modalityOrder.size() || !ordered.equals(supplied)) {
            throw new UserException.BadInput(String.format("the modality order [%s] must name each supplied modality [%s] exactly once",
                    String.join(", ", modalityOrder), String.join(", ", modalities)));
        }
        return modalityOrder;
    }

    /**
     * Logs a warning for per-modality settings that name none of the supplied modalities.
     *
     * @param modalities the supplied modality names. Not {@code null}.
     * @return the names of the unknown modalities, in configuration order.
     */
    public Set<String> warnOnUnknownModalities(final Collection<String> modalities) {
        Utils.nonNull(modalities, "the modality collection cannot be null");
        final Set<String> unknown = new LinkedHashSet<>();
        numComponentsByModality.keySet().stream().filter(m -> !modalities.contains(m)).forEach(unknown::add);
        scaleFeaturesByModality.keySet().stream().filter(m -> !modalities.contains(m)).forEach(unknown::add);
        if (!unknown.isEmpty()) {
            logger.warn("Ignoring settings for modalities that were not supplied: " + String.join(", ", unknown));
        }
        return unknown;
    }

    @Override
    public String toString() {
        return String.format("IntegrationConfig{defaultNumComponents=%d, numComponents=%s, finalNumComponents=%d, " +
                        "defaultScaleFeatures=%s, scaleFeatures=%s, modalityOrder=%s, numThreads=%d}",
                defaultNumComponents, numComponentsByModality, finalNumComponents, defaultScaleFeatures,
                scaleFeaturesByModality, modalityOrder, numThreads);
    }

    public static final class Builder {
        private int defaultNumComponents = 10;
        private final Map<String, Integer> numComponentsByModality = new LinkedHashMap<>();
        private int finalNumComponents = 10;
        private boolean defaultScaleFeatures = false;
        private final Map<String, Boolean> scaleFeaturesByModality = new LinkedHashMap<>();
        private List<String> modalityOrder = null;
        private int numThreads = 1;
        private DimensionalityReducer.Factory reducerFactory = PrincipalComponentReducer::new;

        private Builder() {}

        public Builder setDefaultNumComponents(final int numComponents) {
            this.defaultNumComponents = ParamUtils.isPositive(numComponents, "the default number of components must be at least 1: " + numComponents);
            return this;
        }

        public Builder setNumComponents(final String modality, final int numComponents) {
            Utils.nonEmpty(modality, "the modality name cannot be null or empty");
            numComponentsByModality.put(modality,
                    ParamUtils.isPositive(numComponents, "the number of components of " + modality + " must be at least 1: " + numComponents));
            return this;
        }

        public Builder setFinalNumComponents(final int numComponents) {
            this.finalNumComponents = ParamUtils.isPositive(numComponents, "the final number of components must be at least 1: " + numComponents);
            return this;
        }

        public Builder setDefaultScaleFeatures(final boolean scaleFeatures) {
            this.defaultScaleFeatures = scaleFeatures;
            return this;
        }

        public Builder setScaleFeatures(final String modality, final boolean scaleFeatures) {
            Utils.nonEmpty(modality, "the modality name cannot be null or empty");
            scaleFeaturesByModality.put(modality, scaleFeatures);
            return this;
        }

        /**
         * Sets the concatenation order; {@code null} restores the input order.
         */
        public Builder setModalityOrder(final List<String> modalityOrder) {
            if (modalityOrder != null) {
                Utils.containsNoNull(modalityOrder, "the modality order cannot contain nulls");
            }
            this.modalityOrder = modalityOrder == null ? null : new ArrayList<>(modalityOrder);
            return this;
        }

        public Builder setNumThreads(final int numThreads) {
            this.numThreads = ParamUtils.isPositive(numThreads, "the number of threads must be at least 1: " + numThreads);
            return this;
        }

        public Builder setReducerFactory(final DimensionalityReducer.Factory reducerFactory) {
            this.reducerFactory = Utils.nonNull(reducerFactory, "the reducer factory cannot be null");
            return this;
        }

        public IntegrationConfig build() {
            return new IntegrationConfig(this);
        }
    }
}
