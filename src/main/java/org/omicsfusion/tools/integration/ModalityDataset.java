package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.omicsfusion.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One omics layer: a sample-by-feature matrix of measurements together with the identifier of the sample
 * on each row.
 *
 * <p>
 *     Instances hold a private copy of the values, so later changes to the caller's arrays have no effect.
 *     Shape and identifier consistency are not checked here but by {@link ModalityValidator}, so that every
 *     problem is reported as the appropriate {@link org.omicsfusion.exceptions.UserException}.
 * </p>
 */
public final class ModalityDataset {

    private final String name;

    private final double[][] values;

    private final List<String> samples;

    /**
     * Creates a dataset.
     *
     * @param name the modality name. Not {@code null} nor empty.
     * @param values the measurements, one row per sample. Not {@code null}; rows must not be {@code null}.
     * @param samples the sample identifier of each row. Not {@code null}.
     */
    public ModalityDataset(final String name, final double[][] values, final List<String> samples) {
        this.name = Utils.nonEmpty(name, "the modality name cannot be null or empty");
        Utils.nonNull(values, "the value matrix cannot be null");
        Utils.nonNull(samples, "the sample list cannot be null");
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = Utils.nonNull(values[i], "matrix rows cannot be null").clone();
        }
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
    }

    /**
     * Creates a dataset from an Apache Commons matrix.
     */
    public ModalityDataset(final String name, final RealMatrix values, final List<String> samples) {
        this(name, Utils.nonNull(values, "the value matrix cannot be null").getData(), samples);
    }

    public String getName() {
        return name;
    }

    public List<String> getSamples() {
        return samples;
    }

    public int getRowCount() {
        return values.length;
    }

    /**
     * Returns the length of the first row, or 0 if there are no rows.
     */
    public int getColumnCount() {
        return values.length == 0 ? 0 : values[0].length;
    }

    /**
     * Returns a copy of the row of values at index {@code row}.
     */
    public double[] getRow(final int row) {
        return values[Utils.validIndex(row, values.length)].clone();
    }

    /**
     * Returns a new matrix with the measurements.  Only meaningful on validated datasets.
     *
     * @return never {@code null}.
     */
    public RealMatrix getMatrix() {
        return new Array2DRowRealMatrix(values, true);
    }

    @Override
    public String toString() {
        return String.format("%s (%d x %d)", name, getRowCount(), getColumnCount());
    }
}
