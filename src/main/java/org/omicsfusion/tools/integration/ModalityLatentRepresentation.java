package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.RealMatrix;
import org.omicsfusion.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reduced representation of every sample of one modality, in the row order of the modality's dataset.
 */
public final class ModalityLatentRepresentation {

    private final String modality;
    private final List<String> samples;
    private final Map<String, Integer> sampleIndexes;
    private final RealMatrix latent;
    private final double[] componentVariances;
    private final int requestedNumComponents;

    ModalityLatentRepresentation(final String modality, final List<String> samples, final Reduction reduction,
                                 final int requestedNumComponents) {
        this.modality = Utils.nonEmpty(modality, "the modality name cannot be null or empty");
        this.samples = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(samples, "the sample list cannot be null")));
        Utils.nonNull(reduction, "the reduction cannot be null");
        this.latent = reduction.getLatent();
        this.componentVariances = reduction.getComponentVariances();
        this.requestedNumComponents = requestedNumComponents;
        Utils.validateArg(latent.getRowDimension() == samples.size(),
                () -> String.format("%s has %d samples but %d latent rows", modality, samples.size(), latent.getRowDimension()));
        this.sampleIndexes = new HashMap<>(samples.size() * 2);
        for (int i = 0; i < samples.size(); i++) {
            sampleIndexes.put(samples.get(i), i);
        }
    }

    public String getModality() {
        return modality;
    }

    public List<String> getSamples() {
        return samples;
    }

    public boolean containsSample(final String sample) {
        return sampleIndexes.containsKey(sample);
    }

    /**
     * Returns the latent vector of a sample.
     *
     * @throws IllegalArgumentException if the sample is not part of this modality.
     */
    public double[] getLatentVector(final String sample) {
        final Integer index = sampleIndexes.get(sample);
        Utils.validateArg(index != null, () -> String.format("sample %s is not part of modality %s", sample, modality));
        return latent.getRow(index);
    }

    /**
     * Returns a copy of the latent matrix, one row per sample and one column per component.
     */
    public RealMatrix getLatent() {
        return latent.copy();
    }

    public int getNumComponents() {
        return latent.getColumnDimension();
    }

    public int getRequestedNumComponents() {
        return requestedNumComponents;
    }

    /**
     * Returns the clamp applied to this modality, if any.
     */
    public Optional<DimensionalityClamp> getClamp() {
        return requestedNumComponents > getNumComponents()
                ? Optional.of(new DimensionalityClamp(modality, requestedNumComponents, getNumComponents()))
                : Optional.empty();
    }

    public double[] getComponentVariances() {
        return componentVariances.clone();
    }
}
