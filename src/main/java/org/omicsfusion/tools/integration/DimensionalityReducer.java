package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Reduces a sample-by-feature matrix to a sample-by-component matrix.
 *
 * <p>
 *     Used both for each modality and for the joint stage, so that alternative reduction methods can be plugged
 *     in without touching sample alignment or concatenation.  Implementations must be deterministic and must not
 *     modify the input matrix.
 * </p>
 */
public interface DimensionalityReducer {

    /**
     * Reduces {@code data} to {@code numComponents} dimensions.
     *
     * @param data one row per sample. Not {@code null}.
     * @param numComponents target dimensionality, between 1 and {@code min(rows, columns) - 1}.
     * @return never {@code null}, with one row per input row (same order) and {@code numComponents} columns.
     */
    Reduction reduce(final RealMatrix data, final int numComponents);

    /**
     * Creates the reducer used for a stage.
     */
    @FunctionalInterface
    interface Factory {

        /**
         * @param scaleFeatures whether features must be divided by their standard deviation before the reduction.
         * @return never {@code null}.
         */
        DimensionalityReducer create(final boolean scaleFeatures);
    }
}
