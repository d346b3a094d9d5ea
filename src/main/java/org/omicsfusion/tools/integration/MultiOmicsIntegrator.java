package org.omicsfusion.tools.integration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.omicsfusion.exceptions.UserException;
import org.omicsfusion.utils.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Integrates several omics modalities measured on overlapping samples into one joint low-dimensional embedding.
 *
 * <p>
 *     The run is a linear pipeline:
 *     <ol>
 *         <li>the datasets are validated ({@link ModalityValidator}),</li>
 *         <li>each modality is reduced on its own ({@link ModalityReducer}),</li>
 *         <li>the samples shared by all modalities are aligned, their latent vectors concatenated and reduced
 *         once more ({@link JointIntegrator}).</li>
 *     </ol>
 *     Any failure aborts the run; no partial result is returned.
 * </p>
 *
 * <p>Example:</p>
 * <pre>
 *     final Map&lt;String, ModalityDataset&gt; datasets = ...;
 *     final IntegrationConfig config = IntegrationConfig.builder()
 *             .setNumComponents("metabolomics", 5)
 *             .setFinalNumComponents(3)
 *             .build();
 *     final JointEmbedding embedding = new MultiOmicsIntegrator(config).integrate(datasets);
 * </pre>
 */
public final class MultiOmicsIntegrator {

    private static final Logger logger = LogManager.getLogger(MultiOmicsIntegrator.class);

    /**
     * Prefix of the sample identifiers generated by {@link #fitTransform}.
     */
    public static final String GENERATED_SAMPLE_PREFIX = "sample_";

    private final IntegrationConfig config;

    public MultiOmicsIntegrator() {
        this(IntegrationConfig.defaults());
    }

    public MultiOmicsIntegrator(final IntegrationConfig config) {
        this.config = Utils.nonNull(config, "the configuration cannot be null");
    }

    public IntegrationConfig getConfig() {
        return config;
    }

    /**
     * Integrates datasets keyed by modality name; the map iteration order is the default concatenation order.
     *
     * @param datasets modality name to dataset. Not {@code null}.
     * @return never {@code null}.
     * @throws UserException if the input is inconsistent or cannot be integrated.
     */
    public JointEmbedding integrate(final Map<String, ModalityDataset> datasets) {
        return run(ModalityValidator.validate(datasets));
    }

    /**
     * Integrates datasets; the collection iteration order is the default concatenation order.
     *
     * @param datasets the datasets. Not {@code null}.
     * @return never {@code null}.
     * @throws UserException if the input is inconsistent or cannot be integrated.
     */
    public JointEmbedding integrate(final Collection<ModalityDataset> datasets) {
        return run(ModalityValidator.validate(datasets));
    }

    private JointEmbedding run(final List<ModalityDataset> validated) {
        final List<String> names = validated.stream().map(ModalityDataset::getName).collect(Collectors.toList());
        config.warnOnUnknownModalities(names);
        final List<String> order = config.resolveModalityOrder(names);
        final Map<String, ModalityDataset> byName = validated.stream()
                .collect(Collectors.toMap(ModalityDataset::getName, Function.identity(), (a, b) -> a, LinkedHashMap::new));
        final List<ModalityDataset> ordered = order.stream().map(byName::get).collect(Collectors.toList());
        logger.info(String.format("Integrating %d modalities: %s", ordered.size(), String.join(", ", order)));
        logger.debug(config.toString());

        final List<ModalityLatentRepresentation> representations = new ModalityReducer(config).reduceAll(ordered);
        return new JointIntegrator(config).integrate(representations);
    }

    /**
     * Integrates the four standard modalities measured on the same samples, in the same row order.
     *
     * <p>
     *     Rows are identified as {@value #GENERATED_SAMPLE_PREFIX}0, {@value #GENERATED_SAMPLE_PREFIX}1, ...
     *     and modalities are named after {@link OmicsModality}.
     * </p>
     *
     * @return the joint embedding, one row per input row.
     * @throws UserException.ShapeMismatch if the matrices do not all have the same number of rows.
     */
    public double[][] fitTransform(final double[][] metabolomics, final double[][] bulkRna,
                                   final double[][] spatialTranscriptomics, final double[][] singleCellRna) {
        final Map<OmicsModality, double[][]> layers = new LinkedHashMap<>();
        layers.put(OmicsModality.METABOLOMICS, Utils.nonNull(metabolomics, "the metabolomics matrix cannot be null"));
        layers.put(OmicsModality.BULK_RNA, Utils.nonNull(bulkRna, "the bulk RNA matrix cannot be null"));
        layers.put(OmicsModality.SPATIAL_TRANSCRIPTOMICS, Utils.nonNull(spatialTranscriptomics, "the spatial transcriptomics matrix cannot be null"));
        layers.put(OmicsModality.SINGLE_CELL_RNA, Utils.nonNull(singleCellRna, "the single-cell RNA matrix cannot be null"));

        final int sampleCount = metabolomics.length;
        if (layers.values().stream().anyMatch(m -> m.length != sampleCount)) {
            throw new UserException.ShapeMismatch("All input datasets must have the same number of samples (rows): " +
                    layers.entrySet().stream()
                            .map(e -> e.getKey().getModalityName() + "=" + e.getValue().length)
                            .collect(Collectors.joining(", ")));
        }
        final List<String> samples = generateSampleNames(sampleCount);
        final List<ModalityDataset> datasets = new ArrayList<>(layers.size());
        layers.forEach((modality, values) -> datasets.add(new ModalityDataset(modality.getModalityName(), values, samples)));
        return integrate(datasets).getEmbeddingData();
    }

    /**
     * Returns {@value #GENERATED_SAMPLE_PREFIX}0 ... {@value #GENERATED_SAMPLE_PREFIX}{@code (count - 1)}.
     */
    public static List<String> generateSampleNames(final int count) {
        Utils.validateArg(count >= 0, "the sample count cannot be negative");
        return IntStream.range(0, count).mapToObj(i -> GENERATED_SAMPLE_PREFIX + i).collect(Collectors.toList());
    }
}
