package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.RealMatrix;
import org.omicsfusion.utils.Utils;

/**
 * Structure to hold the result of a {@link DimensionalityReducer}.
 */
public final class Reduction {
    private final RealMatrix latent;
    private final double[] componentVariances;

    /**
     * @param latent one row per reduced sample and one column per component. Not {@code null}.
     * @param componentVariances variance explained by each component, or an empty array if the method has no
     *                           such notion. Not {@code null}.
     */
    public Reduction(final RealMatrix latent, final double[] componentVariances) {
        this.latent = Utils.nonNull(latent, "the latent matrix cannot be null");
        this.componentVariances = Utils.nonNull(componentVariances, "the component variances cannot be null").clone();
    }

    public RealMatrix getLatent() {
        return latent.copy();
    }

    public double[] getComponentVariances() {
        return componentVariances.clone();
    }
}
