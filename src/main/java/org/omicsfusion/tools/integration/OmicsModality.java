package org.omicsfusion.tools.integration;

/**
 * The standard molecular measurement layers integrated by {@link MultiOmicsIntegrator#fitTransform}.
 */
public enum OmicsModality {
    METABOLOMICS("metabolomics", 50),
    BULK_RNA("bulk_rna", 1000),
    SPATIAL_TRANSCRIPTOMICS("spatial_transcriptomics", 200),
    SINGLE_CELL_RNA("single_cell_rna", 500);

    private final String modalityName;
    private final int defaultSyntheticFeatureCount;

    OmicsModality(final String modalityName, final int defaultSyntheticFeatureCount) {
        this.modalityName = modalityName;
        this.defaultSyntheticFeatureCount = defaultSyntheticFeatureCount;
    }

    /**
     * Name used to key this modality's dataset and configuration.
     */
    public String getModalityName() {
        return modalityName;
    }

    /**
     * Number of features generated for this modality by {@link SyntheticOmicsDataGenerator}.
     */
    public int getDefaultSyntheticFeatureCount() {
        return defaultSyntheticFeatureCount;
    }
}
