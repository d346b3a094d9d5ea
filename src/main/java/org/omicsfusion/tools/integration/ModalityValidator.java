package org.omicsfusion.tools.integration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.omicsfusion.exceptions.UserException;
import org.omicsfusion.utils.Utils;
import org.omicsfusion.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks that the modality datasets handed to the integrator are well formed and consistent.
 *
 * <p>
 *     Validation has no side effects: the datasets are returned unchanged and in the same order.
 * </p>
 */
public final class ModalityValidator {

    private static final Logger logger = LogManager.getLogger(ModalityValidator.class);

    private ModalityValidator() {}

    /**
     * Validates datasets keyed by modality name.
     *
     * @param datasets modality name to dataset, in the caller's order. Not {@code null}.
     * @return the datasets in the map iteration order.
     * @throws UserException.BadInput if there is no dataset, if a key does not match its dataset name or if any
     *                                dataset is malformed.
     * @throws UserException.ShapeMismatch if a dataset has not exactly one sample identifier per row.
     * @throws UserException.DuplicateSample if a dataset repeats a sample identifier.
     */
    public static List<ModalityDataset> validate(final Map<String, ModalityDataset> datasets) {
        Utils.nonNull(datasets, "the dataset map cannot be null");
        for (final Map.Entry<String, ModalityDataset> entry : datasets.entrySet()) {
            if (entry.getValue() == null) {
                throw new UserException.BadInput(String.format("no dataset given for modality %s", entry.getKey()));
            }
            if (!entry.getValue().getName().equals(entry.getKey())) {
                throw new UserException.BadInput(String.format("the dataset keyed as %s is named %s",
                        entry.getKey(), entry.getValue().getName()));
            }
        }
        return validate(datasets.values());
    }

    /**
     * Validates datasets.
     *
     * @param datasets the datasets, in the caller's order. Not {@code null}.
     * @return the same datasets in the same order.
     * @throws UserException.BadInput if there is no dataset, if two datasets share a name or if any
     *                                dataset is malformed.
     * @throws UserException.ShapeMismatch if a dataset has not exactly one sample identifier per row.
     * @throws UserException.DuplicateSample if a dataset repeats a sample identifier.
     */
    public static List<ModalityDataset> validate(final Collection<ModalityDataset> datasets) {
        Utils.nonNull(datasets, "the dataset collection cannot be null");
        if (datasets.isEmpty()) {
            throw new UserException.BadInput("at least one modality dataset is required");
        }
        if (datasets.stream().anyMatch(Objects::isNull)) {
            throw new UserException.BadInput("the modality datasets cannot contain nulls");
        }
        final List<String> names = new ArrayList<>(datasets.size());
        datasets.forEach(d -> names.add(d.getName()));
        final Set<String> repeatedNames = Utils.getDuplicatedItems(names);
        if (!repeatedNames.isEmpty()) {
            throw new UserException.BadInput(String.format("modality names must be unique: %s", String.join(", ", repeatedNames)));
        }
        for (final ModalityDataset dataset : datasets) {
            validate(dataset);
        }
        return Collections.unmodifiableList(new ArrayList<>(datasets));
    }

    /**
     * Validates a single dataset.
     *
     * @param dataset the dataset to check. Not {@code null}.
     * @return the same dataset.
     */
    public static ModalityDataset validate(final ModalityDataset dataset) {
        Utils.nonNull(dataset, "the dataset cannot be null");
        final String name = dataset.getName();
        final int rowCount = dataset.getRowCount();
        final int columnCount = dataset.getColumnCount();
        if (rowCount == 0 || columnCount == 0) {
            throw new UserException.BadInput(String.format("modality %s has an empty matrix (%d x %d)", name, rowCount, columnCount));
        }
        for (int i = 0; i < rowCount; i++) {
            final double[] row = dataset.getRow(i);
            if (row.length != columnCount) {
                throw new UserException.BadInput(String.format("modality %s is not a matrix: row %d has %d values but row 0 has %d",
                        name, i, row.length, columnCount));
            }
            if (!ParamUtils.allFinite(row)) {
                throw new UserException.BadInput(String.format("modality %s contains non-finite values on row %d", name, i));
            }
        }

        final List<String> samples = dataset.getSamples();
        if (samples.size() != rowCount) {
            throw new UserException.ShapeMismatch(name, rowCount, samples.size());
        }
        if (samples.stream().anyMatch(Objects::isNull)) {
            throw new UserException.BadInput(String.format("modality %s has null sample identifiers", name));
        }
        final Set<String> duplicates = Utils.getDuplicatedItems(samples);
        if (!duplicates.isEmpty()) {
            throw new UserException.DuplicateSample(name, duplicates);
        }

        logger.debug(String.format("Validated modality %s with %d samples and %d features.", name, rowCount, columnCount));
        return dataset;
    }
}
