package org.omicsfusion.tools.integration;

import com.google.common.collect.ImmutableList;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.omicsfusion.exceptions.UserException;
import org.omicsfusion.utils.Utils;

import java.util.List;
import java.util.Optional;

/**
 * Reduces each modality independently to its configured dimensionality.
 *
 * <p>
 *     When the configuration asks for more than one thread the modalities are reduced concurrently; the output
 *     keeps the input order and is identical to that of a sequential run.
 * </p>
 */
public final class ModalityReducer {

    private static final Logger logger = LogManager.getLogger(ModalityReducer.class);

    private final IntegrationConfig config;

    public ModalityReducer(final IntegrationConfig config) {
        this.config = Utils.nonNull(config, "the configuration cannot be null");
    }

    /**
     * Reduces one validated modality.
     *
     * @param dataset a dataset accepted by {@link ModalityValidator}. Not {@code null}.
     * @return never {@code null}.
     * @throws UserException.InsufficientRank if the modality cannot be reduced to a single dimension.
     */
    public ModalityLatentRepresentation reduce(final ModalityDataset dataset) {
        Utils.nonNull(dataset, "the dataset cannot be null");
        final String modality = dataset.getName();
        final int requested = config.getNumComponents(modality);
        final Optional<DimensionalityClamp> clamp =
                ReductionUtils.checkNumComponents(modality, requested, dataset.getRowCount(), dataset.getColumnCount());
        clamp.ifPresent(c -> ReductionUtils.warnClamp(logger, c));
        final int numComponents = clamp.map(DimensionalityClamp::getEffectiveNumComponents).orElse(requested);

        final RealMatrix data = dataset.getMatrix();
        final DimensionalityReducer reducer = config.getReducerFactory().create(config.isScalingFeatures(modality));
        final Reduction reduction = ReductionUtils.reduce(modality, reducer, data, numComponents, logger);
        logger.info(String.format("Reduced modality %s: %d samples x %d features -> %d components.",
                modality, dataset.getRowCount(), dataset.getColumnCount(), numComponents));
        return new ModalityLatentRepresentation(modality, dataset.getSamples(), reduction, requested);
    }

    /**
     * Reduces several validated modalities, possibly in parallel.
     *
     * @param datasets datasets accepted by {@link ModalityValidator}. Not {@code null}.
     * @return one representation per dataset, in the same order.
     */
    public List<ModalityLatentRepresentation> reduceAll(final List<ModalityDataset> datasets) {
        Utils.nonNull(datasets, "the dataset list cannot be null");
        final int numThreads = Math.min(config.getNumThreads(), Math.max(1, datasets.size()));
        if (numThreads > 1) {
            logger.info(String.format("Reducing %d modalities with %d threads.", datasets.size(), numThreads));
        }
        return ImmutableList.copyOf(Utils.transformParallel(datasets.iterator(), this::reduce, numThreads));
    }
}
