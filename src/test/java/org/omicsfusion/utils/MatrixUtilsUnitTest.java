package org.omicsfusion.utils;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.omicsfusion.OmicsFusionBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public final class MatrixUtilsUnitTest extends OmicsFusionBaseTest {

    @DataProvider(name = "columnStatistics")
    public Object[][] columnStatistics() {
        return new Object[][] {
                {
                        new double[][]{{1.0, 2.0, 3.0}, {4.0, 5.0, 6.0}, {7.0, 8.0, 9.0}},
                        new double[]{4.0, 5.0, 6.0},
                        new double[]{Math.sqrt(6), Math.sqrt(6), Math.sqrt(6)}
                },
                {
                        new double[][]{{2.0, 1.0}, {4.0, 1.0}, {4.0, 1.0}, {4.0, 1.0}, {5.0, 1.0}, {5.0, 1.0}, {7.0, 1.0}, {9.0, 1.0}},
                        new double[]{5.0, 1.0},
                        new double[]{2.0, 0.0}
                },
        };
    }

    @Test(dataProvider = "columnStatistics")
    public void testColumnStatistics(final double[][] data, final double[] expectedMeans, final double[] expectedStds) {
        final RealMatrix m = new Array2DRowRealMatrix(data);
        assertEqualsDoubleArrays(MatrixUtils.getColumnMeans(m), expectedMeans, DOUBLE_TOLERANCE);
        assertEqualsDoubleArrays(MatrixUtils.getColumnStandardDeviations(m), expectedStds, DOUBLE_TOLERANCE);
    }

    @Test
    public void testCenterColumns() {
        final double[][] data = {{1.0, 10.0}, {2.0, 10.0}, {6.0, 10.0}};
        final RealMatrix m = new Array2DRowRealMatrix(data);
        final RealMatrix centered = MatrixUtils.centerColumns(m, false);
        assertEqualsMatrix(centered, new Array2DRowRealMatrix(new double[][]{{-2.0, 0.0}, {-1.0, 0.0}, {3.0, 0.0}}), DOUBLE_TOLERANCE);
        // the input is left untouched
        Assert.assertTrue(Arrays.deepEquals(m.getData(), data));
    }

    @Test
    public void testCenterAndScaleColumns() {
        final RealMatrix m = new Array2DRowRealMatrix(new double[][]{{2.0, 3.0}, {4.0, 3.0}, {4.0, 3.0}, {4.0, 3.0},
                {5.0, 3.0}, {5.0, 3.0}, {7.0, 3.0}, {9.0, 3.0}});
        final RealMatrix scaled = MatrixUtils.centerColumns(m, true);
        // constant columns are centered but not scaled
        assertEqualsDoubleArrays(scaled.getColumn(1), new double[8], DOUBLE_TOLERANCE);
        assertEqualsDoubleArrays(scaled.getColumn(0), new double[]{-1.5, -0.5, -0.5, -0.5, 0.0, 0.0, 1.0, 2.0}, DOUBLE_TOLERANCE);
        assertEqualsDoubleArrays(MatrixUtils.getColumnStandardDeviations(scaled), new double[]{1.0, 0.0}, DOUBLE_TOLERANCE);
    }

    @Test
    public void testConcatenateColumns() {
        final RealMatrix a = new Array2DRowRealMatrix(new double[][]{{1.0}, {2.0}});
        final RealMatrix b = new Array2DRowRealMatrix(new double[][]{{3.0, 4.0}, {5.0, 6.0}});
        final RealMatrix result = MatrixUtils.concatenateColumns(Arrays.asList(b, a));
        assertEqualsMatrix(result, new Array2DRowRealMatrix(new double[][]{{3.0, 4.0, 1.0}, {5.0, 6.0, 2.0}}), 0.0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testConcatenateColumnsRowMismatch() {
        MatrixUtils.concatenateColumns(Arrays.asList(new Array2DRowRealMatrix(2, 1), new Array2DRowRealMatrix(3, 1)));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testConcatenateNothing() {
        MatrixUtils.concatenateColumns(Collections.emptyList());
    }
}
