package org.omicsfusion.utils;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Static class for implementing some matrix operations not in Apache Commons Math.
 */
public final class MatrixUtils {

    private MatrixUtils() {}

    /**
     * Return an array containing the mean for each column in the given matrix.
     * @param m Not {@code null}.  Size MxN, where neither dimension is zero.
     * @return array of size N.  Never {@code null}
     */
    public static double[] getColumnMeans(final RealMatrix m) {
        Utils.nonNull(m, "Cannot calculate means on a null matrix.");
        final Mean meanCalculator = new Mean();
        return IntStream.range(0, m.getColumnDimension())
                .mapToDouble(i -> meanCalculator.evaluate(m.getColumn(i))).toArray();
    }

    /**
     * Return an array containing the population standard deviation (no bias correction) for each column
     * in the given matrix.
     * @param m Not {@code null}.  Size MxN, where neither dimension is zero.
     * @return array of size N.  Never {@code null}
     */
    public static double[] getColumnStandardDeviations(final RealMatrix m) {
        Utils.nonNull(m, "Cannot calculate standard deviations on a null matrix.");
        final StandardDeviation std = new StandardDeviation(false);
        return IntStream.range(0, m.getColumnDimension())
                .mapToDouble(i -> std.evaluate(m.getColumn(i))).toArray();
    }

    /**
     * Returns a new matrix whose columns have been centered on their mean and, if requested, divided by their
     * standard deviation.  Columns with zero standard deviation are only centered.
     *
     * <p>The input matrix is not modified.</p>
     *
     * @param m Not {@code null}.  Size MxN, where neither dimension is zero.
     * @param scale whether to divide each centered column by its standard deviation.
     * @return never {@code null}, a MxN matrix.
     */
    public static RealMatrix centerColumns(final RealMatrix m, final boolean scale) {
        Utils.nonNull(m, "Cannot center a null matrix.");
        final double[] centers = getColumnMeans(m);
        final double[] scales = scale ? getColumnStandardDeviations(m) : null;
        final int rowCount = m.getRowDimension();
        final int columnCount = m.getColumnDimension();
        final double[][] result = new double[rowCount][columnCount];
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < columnCount; j++) {
                final double centered = m.getEntry(i, j) - centers[j];
                result[i][j] = scales == null || scales[j] == 0 ? centered : centered / scales[j];
            }
        }
        return new Array2DRowRealMatrix(result, false);
    }

    /**
     * Concatenates the given matrices side by side.
     *
     * @param blocks Not {@code null} nor empty, all with the same number of rows.
     * @return never {@code null}, a matrix with as many columns as all the blocks together.
     */
    public static RealMatrix concatenateColumns(final List<RealMatrix> blocks) {
        Utils.nonEmpty(blocks, "there must be at least one matrix to concatenate");
        final int rowCount = blocks.get(0).getRowDimension();
        Utils.validateArg(blocks.stream().allMatch(b -> b.getRowDimension() == rowCount),
                "all matrices to concatenate must have the same number of rows");
        final int columnCount = blocks.stream().mapToInt(RealMatrix::getColumnDimension).sum();
        final RealMatrix result = new Array2DRowRealMatrix(rowCount, columnCount);
        int offset = 0;
        for (final RealMatrix block : blocks) {
            if (block.getColumnDimension() > 0) {
                result.setSubMatrix(block.getData(), 0, offset);
            }
            offset += block.getColumnDimension();
        }
        return result;
    }
}
