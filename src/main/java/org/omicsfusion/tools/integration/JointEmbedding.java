package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.RealMatrix;
import org.omicsfusion.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of an integration run: the joint embedding of the samples shared by all modalities.
 *
 * <p>
 *     Row {@code i} of {@link #getEmbedding()} belongs to sample {@code getSamples().get(i)}.
 * </p>
 */
public final class JointEmbedding {

    private final List<String> samples;
    private final RealMatrix embedding;
    private final double[] componentVariances;
    private final int requestedNumComponents;
    private final List<String> modalityOrder;
    private final Map<String, ModalityLatentRepresentation> latentRepresentations;
    private final List<DimensionalityClamp> clamps;

    JointEmbedding(final List<String> samples, final Reduction reduction, final int requestedNumComponents,
                   final List<ModalityLatentRepresentation> latentRepresentations, final List<DimensionalityClamp> clamps) {
        this.samples = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(samples)));
        Utils.nonNull(reduction);
        this.embedding = reduction.getLatent();
        this.componentVariances = reduction.getComponentVariances();
        this.requestedNumComponents = requestedNumComponents;
        final Map<String, ModalityLatentRepresentation> byModality = new LinkedHashMap<>();
        final List<String> order = new ArrayList<>();
        for (final ModalityLatentRepresentation representation : Utils.nonNull(latentRepresentations)) {
            byModality.put(representation.getModality(), representation);
            order.add(representation.getModality());
        }
        this.latentRepresentations = Collections.unmodifiableMap(byModality);
        this.modalityOrder = Collections.unmodifiableList(order);
        this.clamps = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(clamps)));
    }

    /**
     * Returns the retained sample identifiers in embedding row order.
     */
    public List<String> getSamples() {
        return samples;
    }

    /**
     * Returns a copy of the embedding, one row per retained sample and one column per joint component.
     */
    public RealMatrix getEmbedding() {
        return embedding.copy();
    }

    /**
     * Returns a copy of the embedding as a plain array.
     */
    public double[][] getEmbeddingData() {
        return embedding.getData();
    }

    public int getNumComponents() {
        return embedding.getColumnDimension();
    }

    public int getRequestedNumComponents() {
        return requestedNumComponents;
    }

    public double[] getComponentVariances() {
        return componentVariances.clone();
    }

    /**
     * Returns the modality names in the order their latent vectors were concatenated.
     */
    public List<String> getModalityOrder() {
        return modalityOrder;
    }

    /**
     * Returns the per-modality latent representations, keyed and iterated in concatenation order.
     */
    public Map<String, ModalityLatentRepresentation> getLatentRepresentations() {
        return latentRepresentations;
    }

    /**
     * Returns every dimensionality clamp of the run: per-modality clamps in concatenation order, then the joint one.
     */
    public List<DimensionalityClamp> getClamps() {
        return clamps;
    }
}
