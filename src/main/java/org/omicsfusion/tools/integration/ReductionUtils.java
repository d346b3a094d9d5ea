package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.Logger;
import org.omicsfusion.exceptions.UserException;
import org.omicsfusion.utils.Utils;

import java.util.Optional;

/**
 * Dimensionality bookkeeping shared by the per-modality and joint stages.
 */
final class ReductionUtils {

    private ReductionUtils() {}

    /**
     * Largest number of components that can be extracted from a matrix with the given shape.
     */
    static int maxNumComponents(final int rowCount, final int columnCount) {
        return Math.min(rowCount, columnCount) - 1;
    }

    /**
     * Checks a requested dimensionality against the shape of the data to reduce.
     *
     * @return the clamp to apply, or empty if the request can be honored as is.
     * @throws UserException.InsufficientRank if the data cannot be reduced to even one dimension.
     */
    static Optional<DimensionalityClamp> checkNumComponents(final String stage, final int requestedNumComponents,
                                                            final int rowCount, final int columnCount) {
        final int ceiling = maxNumComponents(rowCount, columnCount);
        if (ceiling < 1) {
            throw new UserException.InsufficientRank(stage, rowCount, columnCount);
        }
        return requestedNumComponents > ceiling
                ? Optional.of(new DimensionalityClamp(stage, requestedNumComponents, ceiling))
                : Optional.empty();
    }

    /**
     * Runs the reducer and checks that it kept the row count and produced the expected width.
     */
    static Reduction reduce(final String stage, final DimensionalityReducer reducer, final RealMatrix data,
                            final int numComponents, final Logger logger) {
        logger.debug(String.format("Reducing %s from %d x %d to %d components.",
                stage, data.getRowDimension(), data.getColumnDimension(), numComponents));
        final Reduction reduction = Utils.nonNull(reducer.reduce(data, numComponents),
                () -> "the reducer returned no result for " + stage);
        final RealMatrix latent = reduction.getLatent();
        Utils.validate(latent.getRowDimension() == data.getRowDimension() && latent.getColumnDimension() == numComponents,
                () -> String.format("the reducer for %s returned a %d x %d matrix, expected %d x %d", stage,
                        latent.getRowDimension(), latent.getColumnDimension(), data.getRowDimension(), numComponents));
        return reduction;
    }

    static void warnClamp(final Logger logger, final DimensionalityClamp clamp) {
        Utils.warnUser(logger, String.format("The requested dimensionality for %s (%d) exceeds what the data allows; " +
                "using %d components instead.", clamp.getStage(), clamp.getRequestedNumComponents(), clamp.getEffectiveNumComponents()));
    }
}
