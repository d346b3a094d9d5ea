package org.omicsfusion.utils.pca;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.omicsfusion.utils.MatrixUtils;
import org.omicsfusion.utils.Utils;
import org.omicsfusion.utils.param.ParamUtils;
import org.omicsfusion.utils.svd.SVD;

import java.util.function.Function;
import java.util.stream.DoubleStream;

/**
 * Principal component analysis.
 *
 * <p>
 *     Components are sorted by decreasing variance and oriented so that, for each of them, the sample with the
 *     largest absolute score has a positive score.  Thus the same input always produces the very same result.
 * </p>
 */
public final class PCA {

    /**
     * Array of variable centers subtracted from the data-matrix before PCA.
     */
    private final double[] centers;

    /**
     * Array of variable scales the centered data-matrix was divided by, or {@code null} if no scaling was done.
     */
    private final double[] scales;

    /**
     * Principal component directions or eigenVectors, one per column in the same order
     * as in {@link #variances}.
     */
    private final RealMatrix eigenVectors;

    /**
     * Sample coordinates on each principal component, one row per sample and one column per component.
     */
    private final RealMatrix scores;

    /**
     * Principal component variances sorted by magnitude (large variance comes first).
     */
    private final double[] variances;

    /**
     * Creates a new PCA result using SVD.
     * <p>
     * This operation will do all required computation, thus it might take long to complete for
     * large matrices.
     * </p>
     * <p>
     * The input matrix rows must represent samples whereas columns represent variables.
     * </p>
     *
     * @param dataMatrix the input data matrix. Not {@code null}; it is not modified.
     * @param scale      whether each centered variable should also be divided by its standard deviation.
     * @param svdFactory the factory to create a SVD from a data-matrix. Not {@code null}.
     * @throws IllegalArgumentException if either {@code dataMatrix} or {@code svdFactory} is {@code null}.
     */
    public static PCA createPCA(final RealMatrix dataMatrix, final boolean scale, final Function<RealMatrix, SVD> svdFactory) {
        Utils.nonNull(dataMatrix, "the input matrix cannot be null");
        Utils.nonNull(svdFactory, "the SVD factory cannot be null");
        final int rowCount = dataMatrix.getRowDimension();

        final double[] centers = MatrixUtils.getColumnMeans(dataMatrix);
        final double[] scales = scale ? MatrixUtils.getColumnStandardDeviations(dataMatrix) : null;
        final RealMatrix centered = MatrixUtils.centerColumns(dataMatrix, scale);

        final SVD svd = svdFactory.apply(centered);
        final RealMatrix u = svd.getU().copy();
        final RealMatrix v = svd.getV().copy();
        final double[] singularValues = svd.getSingularValues();
        orientComponents(u, v);

        final RealMatrix scores = new Array2DRowRealMatrix(u.getRowDimension(), u.getColumnDimension());
        for (int j = 0; j < u.getColumnDimension(); j++) {
            scores.setColumnVector(j, u.getColumnVector(j).mapMultiply(singularValues[j]));
        }
        final double inverseDenominator = 1.0 / Math.max(1, rowCount - 1);
        final double[] variances = DoubleStream.of(singularValues).map(d -> d * d * inverseDenominator).toArray();
        return new PCA(centers, scales, v, scores, variances);
    }

    /**
     * Flips the sign of each component so that its largest absolute entry in {@code u} is positive.
     * The first such entry wins on ties.
     */
    private static void orientComponents(final RealMatrix u, final RealMatrix v) {
        for (int j = 0; j < u.getColumnDimension(); j++) {
            int maxIndex = 0;
            for (int i = 1; i < u.getRowDimension(); i++) {
                if (Math.abs(u.getEntry(i, j)) > Math.abs(u.getEntry(maxIndex, j))) {
                    maxIndex = i;
                }
            }
            if (u.getEntry(maxIndex, j) < 0) {
                u.setColumnVector(j, u.getColumnVector(j).mapMultiply(-1));
                v.setColumnVector(j, v.getColumnVector(j).mapMultiply(-1));
            }
        }
    }

    /**
     * Creates a PCA instance given all its member values.
     */
    private PCA(final double[] centers, final double[] scales, final RealMatrix eigenVectors, final RealMatrix scores,
                final double[] variances) {
        this.centers = centers;
        this.scales = scales;
        this.eigenVectors = eigenVectors;
        this.scores = scores;
        this.variances = variances;
    }

    /**
     * Returns the number of principal components available.
     */
    public int getNumComponents() {
        return variances.length;
    }

    /**
     * Returns the eigen-vectors for the principal components.
     * <p>
     *     The result matrix has one column per principal components.
     * </p>
     * <p>
     *     Each row represent the contributions of the corresponding input variable to that component.
     * </p>
     *
     * @return never {@code null}.
     */
    public RealMatrix getEigenVectors() {
        return eigenVectors.copy();
    }

    /**
     * Returns the coordinates of the input samples on the first {@code numComponents} principal components.
     *
     * @param numComponents number of leading components to keep, between 1 and {@link #getNumComponents()}.
     * @return never {@code null}, one row per input sample (same order) and {@code numComponents} columns.
     */
    public RealMatrix getScores(final int numComponents) {
        ParamUtils.inRange(numComponents, 1, getNumComponents(),
                "the number of components must be between 1 and " + getNumComponents() + ": " + numComponents);
        return scores.getSubMatrix(0, scores.getRowDimension() - 1, 0, numComponents - 1);
    }

    /**
     * Projects new samples onto the first {@code numComponents} principal components, applying the same centering
     * (and scaling) as the data this PCA was created from.
     *
     * @param data one row per sample, with the same variables (columns) as the original data-matrix. Not {@code null}.
     * @param numComponents number of leading components to keep, between 1 and {@link #getNumComponents()}.
     * @return never {@code null}, one row per input sample and {@code numComponents} columns.
     */
    public RealMatrix project(final RealMatrix data, final int numComponents) {
        Utils.nonNull(data, "the data to project cannot be null");
        Utils.validateArg(data.getColumnDimension() == centers.length,
                () -> "the data to project must have " + centers.length + " columns but has " + data.getColumnDimension());
        ParamUtils.inRange(numComponents, 1, getNumComponents(),
                "the number of components must be between 1 and " + getNumComponents() + ": " + numComponents);
        final RealMatrix standardized = data.copy();
        for (int i = 0; i < standardized.getRowDimension(); i++) {
            for (int j = 0; j < centers.length; j++) {
                final double centered = standardized.getEntry(i, j) - centers[j];
                standardized.setEntry(i, j, scales == null || scales[j] == 0 ? centered : centered / scales[j]);
            }
        }
        return standardized.multiply(eigenVectors.getSubMatrix(0, eigenVectors.getRowDimension() - 1, 0, numComponents - 1));
    }

    /**
     * Returns the variable centers subtracted from the data before performing PCA.
     * @return never {@code null}.
     */
    public RealVector getCenters() {
        return new ArrayRealVector(centers);
    }

    /**
     * Returns the variable scales applied after centering, or {@code null} if the data was not scaled.
     */
    public RealVector getScales() {
        return scales == null ? null : new ArrayRealVector(scales);
    }

    /**
     * Returns the variances of each principal component.
     * @return never {@code null}.
     */
    public RealVector getVariances() {
        return new ArrayRealVector(variances);
    }
}
