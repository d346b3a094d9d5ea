package org.omicsfusion.tools.integration;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.omicsfusion.OmicsFusionBaseTest;
import org.omicsfusion.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class JointIntegratorUnitTest extends OmicsFusionBaseTest {

    private static ModalityLatentRepresentation representation(final String modality, final List<String> samples,
                                                               final double[][] latent, final int requested) {
        return new ModalityLatentRepresentation(modality, samples, new Reduction(new Array2DRowRealMatrix(latent), new double[0]), requested);
    }

    private static ModalityLatentRepresentation representation(final String modality, final List<String> samples, final double[][] latent) {
        return representation(modality, samples, latent, latent[0].length);
    }

    @Test
    public void testSharedSamplesFollowTheFirstModality() {
        final List<ModalityLatentRepresentation> representations = Arrays.asList(
                representation("a", Arrays.asList("s4", "s1", "s3", "s2"), randomValues(1, 4, 1)),
                representation("b", Arrays.asList("s2", "s3", "s4", "s5"), randomValues(2, 4, 1)),
                representation("c", Arrays.asList("s5", "s4", "s2", "s1"), randomValues(3, 4, 1)));
        Assert.assertEquals(JointIntegrator.sharedSamples(representations), Arrays.asList("s4", "s2"));
        Assert.assertEquals(JointIntegrator.sharedSamples(Collections.singletonList(representations.get(1))),
                Arrays.asList("s2", "s3", "s4", "s5"));
    }

    @Test
    public void testConcatenateAlignsTheSamples() {
        final List<ModalityLatentRepresentation> representations = Arrays.asList(
                representation("a", Arrays.asList("x", "y", "z"), new double[][]{{1, 2}, {3, 4}, {5, 6}}),
                representation("b", Arrays.asList("z", "x"), new double[][]{{50, 60, 70}, {10, 20, 30}}));
        final RealMatrix joint = JointIntegrator.concatenate(representations, Arrays.asList("x", "z"));
        assertEqualsMatrix(joint, new Array2DRowRealMatrix(new double[][]{{1, 2, 10, 20, 30}, {5, 6, 50, 60, 70}}), 0.0);
    }

    @Test
    public void testIntegrate() {
        final List<RealMatrix> calls = new ArrayList<>();
        final IntegrationConfig config = IntegrationConfig.builder()
                .setFinalNumComponents(2)
                .setReducerFactory(FirstColumnsReducer.factory(calls))
                .build();
        final List<ModalityLatentRepresentation> representations = Arrays.asList(
                representation("a", Arrays.asList("s1", "s2", "s3", "s4"), new double[][]{{1, 2}, {3, 4}, {5, 6}, {7, 8}}),
                representation("b", Arrays.asList("s4", "s3", "s2", "s9"), new double[][]{{40}, {30}, {20}, {90}}));
        final JointEmbedding embedding = new JointIntegrator(config).integrate(representations);

        Assert.assertEquals(embedding.getSamples(), Arrays.asList("s2", "s3", "s4"));
        Assert.assertEquals(calls.size(), 1);
        assertEqualsMatrix(calls.get(0), new Array2DRowRealMatrix(new double[][]{{3, 4, 20}, {5, 6, 30}, {7, 8, 40}}), 0.0);
        assertEqualsMatrix(embedding.getEmbedding(), new Array2DRowRealMatrix(new double[][]{{3, 4}, {5, 6}, {7, 8}}), 0.0);
        Assert.assertEquals(embedding.getNumComponents(), 2);
        Assert.assertEquals(embedding.getRequestedNumComponents(), 2);
        Assert.assertEquals(embedding.getModalityOrder(), Arrays.asList("a", "b"));
        Assert.assertEquals(new ArrayList<>(embedding.getLatentRepresentations().keySet()), Arrays.asList("a", "b"));
        Assert.assertTrue(embedding.getClamps().isEmpty());
    }

    @Test
    public void testJointClampComesAfterTheModalityClamps() {
        final IntegrationConfig config = IntegrationConfig.builder()
                .setReducerFactory(FirstColumnsReducer.factory(null))
                .build();
        final List<ModalityLatentRepresentation> representations = Arrays.asList(
                representation("a", Arrays.asList("s1", "s2", "s3"), randomValues(1, 3, 2), 5),
                representation("b", Arrays.asList("s1", "s2", "s3"), randomValues(2, 3, 1)));
        final JointEmbedding embedding = new JointIntegrator(config).integrate(representations);
        // 3 samples x 3 concatenated features allow 2 components
        Assert.assertEquals(embedding.getNumComponents(), 2);
        Assert.assertEquals(embedding.getClamps(), Arrays.asList(
                new DimensionalityClamp("a", 5, 2),
                new DimensionalityClamp(DimensionalityClamp.JOINT_STAGE, 10, 2)));
    }

    @Test(expectedExceptions = UserException.EmptyIntersection.class)
    public void testEmptyIntersection() {
        new JointIntegrator(IntegrationConfig.defaults()).integrate(Arrays.asList(
                representation("a", Arrays.asList("s1", "s2"), randomValues(1, 2, 1)),
                representation("b", Arrays.asList("s3", "s4"), randomValues(2, 2, 1))));
    }

    @Test(expectedExceptions = UserException.InsufficientRank.class)
    public void testSingleSharedSample() {
        new JointIntegrator(IntegrationConfig.defaults()).integrate(Arrays.asList(
                representation("a", Arrays.asList("s1", "s2"), randomValues(1, 2, 1)),
                representation("b", Arrays.asList("s2", "s3"), randomValues(2, 2, 1))));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownSample() {
        representation("a", Arrays.asList("s1", "s2"), randomValues(1, 2, 1)).getLatentVector("s3");
    }
}
