package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.RealMatrix;
import org.omicsfusion.utils.Utils;
import org.omicsfusion.utils.pca.PCA;
import org.omicsfusion.utils.svd.SVDFactory;
import org.omicsfusion.utils.svd.SingularValueDecomposer;

import java.util.Arrays;

/**
 * {@link DimensionalityReducer} that keeps the leading principal components.
 *
 * <p>
 *     Features are centered, and divided by their standard deviation if requested, before the decomposition.
 * </p>
 */
public final class PrincipalComponentReducer implements DimensionalityReducer {

    private final boolean scaleFeatures;

    private final SingularValueDecomposer decomposer;

    public PrincipalComponentReducer(final boolean scaleFeatures) {
        this(scaleFeatures, SingularValueDecomposer.getDefault());
    }

    public PrincipalComponentReducer(final boolean scaleFeatures, final SingularValueDecomposer decomposer) {
        this.scaleFeatures = scaleFeatures;
        this.decomposer = Utils.nonNull(decomposer, "the decomposer cannot be null");
    }

    public boolean isScalingFeatures() {
        return scaleFeatures;
    }

    @Override
    public Reduction reduce(final RealMatrix data, final int numComponents) {
        Utils.nonNull(data, "the data matrix cannot be null");
        final PCA pca = PCA.createPCA(data, scaleFeatures, m -> SVDFactory.createSVD(m, decomposer));
        final RealMatrix scores = pca.getScores(numComponents);
        return new Reduction(scores, Arrays.copyOf(pca.getVariances().toArray(), numComponents));
    }
}
