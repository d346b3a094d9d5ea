package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.RealMatrix;
import org.omicsfusion.OmicsFusionBaseTest;
import org.omicsfusion.exceptions.UserException;
import org.omicsfusion.utils.pca.PCA;
import org.omicsfusion.utils.svd.SVDFactory;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ModalityReducerUnitTest extends OmicsFusionBaseTest {

    @Test
    public void testPrincipalComponentReducer() {
        final RealMatrix data = randomMatrix(3, 12, 6);
        final Reduction reduction = new PrincipalComponentReducer(false).reduce(data, 3);
        final PCA pca = PCA.createPCA(data, false, SVDFactory::createSVD);
        assertEqualsMatrix(reduction.getLatent(), pca.getScores(3), 0.0);
        assertEqualsDoubleArrays(reduction.getComponentVariances(), Arrays.copyOf(pca.getVariances().toArray(), 3), 0.0);
        Assert.assertFalse(new PrincipalComponentReducer(false).isScalingFeatures());
        Assert.assertTrue(new PrincipalComponentReducer(true).isScalingFeatures());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPrincipalComponentReducerTooManyComponents() {
        new PrincipalComponentReducer(false).reduce(randomMatrix(3, 4, 3), 4);
    }

    @Test
    public void testReduceWithinCeiling() {
        final ModalityDataset dataset = new ModalityDataset("rna", randomValues(5, 6, 4), names("s", 0, 6));
        final IntegrationConfig config = IntegrationConfig.builder().setNumComponents("rna", 3).build();
        final ModalityLatentRepresentation representation = new ModalityReducer(config).reduce(dataset);
        Assert.assertEquals(representation.getModality(), "rna");
        Assert.assertEquals(representation.getSamples(), names("s", 0, 6));
        Assert.assertEquals(representation.getNumComponents(), 3);
        Assert.assertEquals(representation.getRequestedNumComponents(), 3);
        Assert.assertFalse(representation.getClamp().isPresent());
        Assert.assertEquals(representation.getComponentVariances().length, 3);

        // rows follow the dataset rows
        final RealMatrix expected = PCA.createPCA(dataset.getMatrix(), false, SVDFactory::createSVD).getScores(3);
        assertEqualsMatrix(representation.getLatent(), expected, 0.0);
        assertEqualsDoubleArrays(representation.getLatentVector("s4"), expected.getRow(4), 0.0);
    }

    @DataProvider(name = "clamps")
    public Object[][] clamps() {
        return new Object[][] {
                // samples, features, requested, effective
                {4, 3, 10, 2},
                {3, 8, 3, 2},
                {10, 5, 5, 4},
                {2, 2, 1, 1},
                {6, 20, 5, 5},
        };
    }

    @Test(dataProvider = "clamps")
    public void testClamp(final int sampleCount, final int featureCount, final int requested, final int effective) {
        final ModalityDataset dataset = new ModalityDataset("m", randomValues(sampleCount, sampleCount, featureCount), names("s", 0, sampleCount));
        final IntegrationConfig config = IntegrationConfig.builder().setNumComponents("m", requested).build();
        final ModalityLatentRepresentation representation = new ModalityReducer(config).reduce(dataset);
        Assert.assertEquals(representation.getNumComponents(), effective);
        Assert.assertEquals(representation.getLatent().getRowDimension(), sampleCount);
        Assert.assertEquals(representation.getRequestedNumComponents(), requested);
        final Optional<DimensionalityClamp> clamp = representation.getClamp();
        if (effective < requested) {
            Assert.assertEquals(clamp.orElse(null), new DimensionalityClamp("m", requested, effective));
        } else {
            Assert.assertFalse(clamp.isPresent());
        }
    }

    @DataProvider(name = "insufficientRank")
    public Object[][] insufficientRank() {
        return new Object[][] {
                {1, 5}, {5, 1}, {1, 1}
        };
    }

    @Test(dataProvider = "insufficientRank", expectedExceptions = UserException.InsufficientRank.class)
    public void testInsufficientRank(final int sampleCount, final int featureCount) {
        final ModalityDataset dataset = new ModalityDataset("m", randomValues(1, sampleCount, featureCount), names("s", 0, sampleCount));
        new ModalityReducer(IntegrationConfig.defaults()).reduce(dataset);
    }

    @Test
    public void testScalingIsPassedToTheReducer() {
        final List<Boolean> flags = Collections.synchronizedList(new ArrayList<>());
        final IntegrationConfig config = IntegrationConfig.builder()
                .setNumComponents("a", 1).setNumComponents("b", 1)
                .setScaleFeatures("b", true)
                .setReducerFactory(scale -> {
                    flags.add(scale);
                    return new FirstColumnsReducer(null);
                })
                .build();
        final ModalityReducer reducer = new ModalityReducer(config);
        reducer.reduce(new ModalityDataset("a", randomValues(1, 3, 2), names("s", 0, 3)));
        reducer.reduce(new ModalityDataset("b", randomValues(2, 3, 2), names("s", 0, 3)));
        Assert.assertEquals(flags, Arrays.asList(false, true));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testReducerReturningTheWrongShape() {
        final IntegrationConfig config = IntegrationConfig.builder()
                .setNumComponents("a", 2)
                .setReducerFactory(scale -> (data, k) -> new Reduction(data, new double[0]))
                .build();
        new ModalityReducer(config).reduce(new ModalityDataset("a", randomValues(1, 5, 4), names("s", 0, 5)));
    }

    @Test
    public void testParallelReductionMatchesSequentialReduction() {
        final Map<String, ModalityDataset> datasets = new SyntheticOmicsDataGenerator(42).generate(12);
        final List<ModalityDataset> ordered = new ArrayList<>(datasets.values());
        final List<ModalityLatentRepresentation> sequential = new ModalityReducer(IntegrationConfig.defaults()).reduceAll(ordered);
        final List<ModalityLatentRepresentation> parallel =
                new ModalityReducer(IntegrationConfig.builder().setNumThreads(4).build()).reduceAll(ordered);
        Assert.assertEquals(parallel.size(), ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            Assert.assertEquals(parallel.get(i).getModality(), ordered.get(i).getName());
            Assert.assertEquals(sequential.get(i).getModality(), ordered.get(i).getName());
            Assert.assertTrue(Arrays.deepEquals(parallel.get(i).getLatent().getData(), sequential.get(i).getLatent().getData()));
        }
    }
}
