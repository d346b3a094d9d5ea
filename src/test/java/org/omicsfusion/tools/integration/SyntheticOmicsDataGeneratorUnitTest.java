package org.omicsfusion.tools.integration;

import org.omicsfusion.OmicsFusionBaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

public final class SyntheticOmicsDataGeneratorUnitTest extends OmicsFusionBaseTest {

    @Test
    public void testDefaultShapes() {
        final Map<String, ModalityDataset> datasets = new SyntheticOmicsDataGenerator(1).generate(20);
        Assert.assertEquals(new ArrayList<>(datasets.keySet()),
                Arrays.asList("metabolomics", "bulk_rna", "spatial_transcriptomics", "single_cell_rna"));
        for (final OmicsModality modality : OmicsModality.values()) {
            final ModalityDataset dataset = datasets.get(modality.getModalityName());
            Assert.assertEquals(dataset.getName(), modality.getModalityName());
            Assert.assertEquals(dataset.getRowCount(), 20);
            Assert.assertEquals(dataset.getColumnCount(), modality.getDefaultSyntheticFeatureCount());
            Assert.assertEquals(dataset.getSamples(), MultiOmicsIntegrator.generateSampleNames(20));
        }
        ModalityValidator.validate(datasets);
    }

    @Test
    public void testSameSeedSameData() {
        final Map<String, ModalityDataset> first = new SyntheticOmicsDataGenerator(3).generate(5);
        final Map<String, ModalityDataset> second = new SyntheticOmicsDataGenerator(3).generate(5);
        final Map<String, ModalityDataset> other = new SyntheticOmicsDataGenerator(4).generate(5);
        for (final String modality : first.keySet()) {
            Assert.assertTrue(Arrays.deepEquals(first.get(modality).getMatrix().getData(), second.get(modality).getMatrix().getData()));
            Assert.assertFalse(Arrays.deepEquals(first.get(modality).getMatrix().getData(), other.get(modality).getMatrix().getData()));
        }
    }

    @Test
    public void testSelectedModalities() {
        final Map<OmicsModality, Integer> featureCounts = new EnumMap<>(OmicsModality.class);
        featureCounts.put(OmicsModality.SINGLE_CELL_RNA, 7);
        featureCounts.put(OmicsModality.METABOLOMICS, 3);
        final Map<String, ModalityDataset> datasets = new SyntheticOmicsDataGenerator(0).generate(4, featureCounts);
        Assert.assertEquals(new ArrayList<>(datasets.keySet()), Arrays.asList("metabolomics", "single_cell_rna"));
        Assert.assertEquals(datasets.get("single_cell_rna").getColumnCount(), 7);
        Assert.assertEquals(datasets.get("metabolomics").getColumnCount(), 3);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNoSamples() {
        new SyntheticOmicsDataGenerator(0).generate(0);
    }
}
