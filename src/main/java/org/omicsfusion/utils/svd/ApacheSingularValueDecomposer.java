package org.omicsfusion.utils.svd;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.omicsfusion.utils.Utils;

/**
 * Perform singular value decomposition in pure Java, Commons Math.
 *
 * <p>
 *     The result is the compact decomposition: for a MxN input, U is MxP, V is NxP and there are P singular values,
 *     where P = min(M, N).
 * </p>
 */
public final class ApacheSingularValueDecomposer implements SingularValueDecomposer {

    private static final Logger logger = LogManager.getLogger(ApacheSingularValueDecomposer.class);

    /** Create a SVD instance using Apache Commons Math.
     *
     * @param m matrix that is not {@code null}
     * @return SVD instance that is never {@code null}
     */
    @Override
    public SVD createSVD(final RealMatrix m) {

        Utils.nonNull(m, "Cannot create SVD on a null matrix.");

        logger.debug("Calculating SVD of a " + m.getRowDimension() + " x " + m.getColumnDimension() + " matrix...");
        final SingularValueDecomposition svd = new SingularValueDecomposition(m);
        return new SimpleSVD(svd.getU(), svd.getSingularValues(), svd.getV());
    }
}
