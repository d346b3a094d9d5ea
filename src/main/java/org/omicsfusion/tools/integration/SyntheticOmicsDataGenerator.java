package org.omicsfusion.tools.integration;

import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.omicsfusion.utils.Utils;
import org.omicsfusion.utils.param.ParamUtils;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates standard-normal datasets for the {@link OmicsModality standard modalities}, for demonstrations and
 * tests.  The same seed always produces the same data.
 */
public final class SyntheticOmicsDataGenerator {

    private final long seed;

    public SyntheticOmicsDataGenerator(final long seed) {
        this.seed = seed;
    }

    /**
     * Generates one dataset per standard modality, each with its default number of features, all sharing the
     * same {@code numSamples} samples.
     */
    public Map<String, ModalityDataset> generate(final int numSamples) {
        final Map<OmicsModality, Integer> featureCounts = new EnumMap<>(OmicsModality.class);
        for (final OmicsModality modality : OmicsModality.values()) {
            featureCounts.put(modality, modality.getDefaultSyntheticFeatureCount());
        }
        return generate(numSamples, featureCounts);
    }

    /**
     * Generates one dataset per entry of {@code featureCounts}, in the enum order, all sharing the same
     * {@code numSamples} samples.
     */
    public Map<String, ModalityDataset> generate(final int numSamples, final Map<OmicsModality, Integer> featureCounts) {
        ParamUtils.isPositive(numSamples, "the number of samples must be at least 1: " + numSamples);
        Utils.nonNull(featureCounts, "the feature counts cannot be null");
        final RandomDataGenerator random = new RandomDataGenerator(new Well19937c(seed));
        final List<String> samples = MultiOmicsIntegrator.generateSampleNames(numSamples);
        final Map<String, ModalityDataset> result = new LinkedHashMap<>();
        for (final OmicsModality modality : OmicsModality.values()) {
            final Integer featureCount = featureCounts.get(modality);
            if (featureCount == null) {
                continue;
            }
            ParamUtils.isPositive(featureCount, "the number of features must be at least 1: " + featureCount);
            result.put(modality.getModalityName(),
                    new ModalityDataset(modality.getModalityName(), standardNormalMatrix(random, numSamples, featureCount), samples));
        }
        return result;
    }

    private static double[][] standardNormalMatrix(final RandomDataGenerator random, final int rows, final int columns) {
        final double[][] values = new double[rows][columns];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                values[i][j] = random.nextGaussian(0, 1);
            }
        }
        return values;
    }
}
