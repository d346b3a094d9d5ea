package org.omicsfusion.utils.svd;

import org.apache.commons.math3.linear.RealMatrix;
import org.omicsfusion.utils.Utils;

/**
 * Entry point for creating an instance of SVD.  When the object is created, all of the calculation will be done as well.
 */
public final class SVDFactory {

    private SVDFactory() {}

    /**
     * Create a SVD instance using the default decomposer.
     *
     * @param m matrix that is not {@code null}
     * @return SVD instance that is never {@code null}
     */
    public static SVD createSVD(final RealMatrix m){
        return createSVD(m, SingularValueDecomposer.getDefault());
    }

    /**
     * Create a SVD instance using the given decomposer.
     *
     * @param m matrix that is not {@code null}
     * @param decomposer the decomposer to use, not {@code null}
     * @return SVD instance that is never {@code null}
     */
    public static SVD createSVD(final RealMatrix m, final SingularValueDecomposer decomposer){
        Utils.nonNull(m, "Cannot create SVD from a null matrix.");
        Utils.nonNull(decomposer, "Cannot create SVD with a null decomposer.");
        return decomposer.createSVD(m);
    }
}
