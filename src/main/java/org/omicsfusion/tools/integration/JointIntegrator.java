package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.omicsfusion.exceptions.UserException;
import org.omicsfusion.utils.MatrixUtils;
import org.omicsfusion.utils.Utils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aligns the per-modality latent representations on their shared samples, concatenates them and reduces the
 * result to the joint embedding.
 *
 * <p>
 *     Only samples present in every modality are kept; they appear in the order of the first modality.
 *     Missing samples are never imputed.
 * </p>
 */
public final class JointIntegrator {

    private static final Logger logger = LogManager.getLogger(JointIntegrator.class);

    private final IntegrationConfig config;

    public JointIntegrator(final IntegrationConfig config) {
        this.config = Utils.nonNull(config, "the configuration cannot be null");
    }

    /**
     * Returns the samples present in all the representations, in the order of the first one.
     */
    public static List<String> sharedSamples(final List<ModalityLatentRepresentation> representations) {
        Utils.nonEmpty(representations, "at least one latent representation is required");
        final List<ModalityLatentRepresentation> others = representations.subList(1, representations.size());
        return representations.get(0).getSamples().stream()
                .filter(s -> others.stream().allMatch(r -> r.containsSample(s)))
                .collect(Collectors.toList());
    }

    /**
     * Builds the joint feature matrix: one row per sample, the latent vectors of each representation side by side.
     */
    public static RealMatrix concatenate(final List<ModalityLatentRepresentation> representations, final List<String> samples) {
        Utils.nonEmpty(representations, "at least one latent representation is required");
        Utils.nonEmpty(samples, "at least one sample is required");
        final List<RealMatrix> blocks = new ArrayList<>(representations.size());
        for (final ModalityLatentRepresentation representation : representations) {
            final double[][] rows = new double[samples.size()][];
            for (int i = 0; i < samples.size(); i++) {
                rows[i] = representation.getLatentVector(samples.get(i));
            }
            blocks.add(new Array2DRowRealMatrix(rows, false));
        }
        return MatrixUtils.concatenateColumns(blocks);
    }

    /**
     * Integrates per-modality representations given in concatenation order.
     *
     * @param representations one representation per modality, in concatenation order. Not {@code null} nor empty.
     * @return never {@code null}.
     * @throws UserException.EmptyIntersection if no sample is shared by all modalities.
     * @throws UserException.InsufficientRank if the joint feature matrix cannot be reduced to a single dimension.
     */
    public JointEmbedding integrate(final List<ModalityLatentRepresentation> representations) {
        Utils.nonEmpty(representations, "at least one latent representation is required");
        final List<String> modalities = representations.stream()
                .map(ModalityLatentRepresentation::getModality).collect(Collectors.toList());

        final List<String> samples = sharedSamples(representations);
        if (samples.isEmpty()) {
            throw new UserException.EmptyIntersection(modalities);
        }
        final Set<String> allSamples = new LinkedHashSet<>();
        representations.forEach(r -> allSamples.addAll(r.getSamples()));
        logger.info(String.format("%d sample(s) shared by all %d modalities; %d sample(s) missing from some modality dropped.",
                samples.size(), representations.size(), allSamples.size() - samples.size()));

        final RealMatrix joint = concatenate(representations, samples);
        final int requested = config.getFinalNumComponents();
        final Optional<DimensionalityClamp> jointClamp = ReductionUtils.checkNumComponents(DimensionalityClamp.JOINT_STAGE,
                requested, joint.getRowDimension(), joint.getColumnDimension());
        jointClamp.ifPresent(c -> ReductionUtils.warnClamp(logger, c));
        final int numComponents = jointClamp.map(DimensionalityClamp::getEffectiveNumComponents).orElse(requested);

        final DimensionalityReducer reducer = config.getReducerFactory().create(false);
        final Reduction reduction = ReductionUtils.reduce(DimensionalityClamp.JOINT_STAGE, reducer, joint, numComponents, logger);
        logger.info(String.format("Joint embedding: %d samples x %d concatenated features -> %d components.",
                joint.getRowDimension(), joint.getColumnDimension(), numComponents));

        final List<DimensionalityClamp> clamps = new ArrayList<>();
        representations.forEach(r -> r.getClamp().ifPresent(clamps::add));
        jointClamp.ifPresent(clamps::add);
        return new JointEmbedding(samples, reduction, requested, representations, clamps);
    }
}
