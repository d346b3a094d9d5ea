package org.omicsfusion.exceptions;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as malformed or inconsistent input matrices
 * and unusable integration settings.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    /**
     * Maximum number of offending values listed in a message.
     */
    private static final int MAX_LISTED_VALUES = 5;

    public UserException(final String msg) {
        super(msg);
    }

    protected static String listSome(final Collection<?> values) {
        final String listed = values.stream().limit(MAX_LISTED_VALUES).map(String::valueOf).collect(Collectors.joining(", "));
        return values.size() > MAX_LISTED_VALUES ? listed + ", ..." : listed;
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * <p/>
     * Class UserException.ShapeMismatch
     * <p/>
     * The number of sample identifiers of a modality does not match the number of rows of its matrix.
     */
    public static class ShapeMismatch extends UserException {
        private static final long serialVersionUID = 0L;

        public ShapeMismatch(final String message) {
            super(message);
        }

        public ShapeMismatch(final String modality, final int rowCount, final int sampleCount) {
            super(String.format("Modality %s has %d matrix rows but %d sample identifiers.", modality, rowCount, sampleCount));
        }
    }

    /**
     * <p/>
     * Class UserException.DuplicateSample
     * <p/>
     * A sample identifier appears more than once within a single modality.
     */
    public static class DuplicateSample extends UserException {
        private static final long serialVersionUID = 0L;

        public DuplicateSample(final String modality, final Collection<String> duplicates) {
            super(String.format("Modality %s contains repeated sample identifiers: %s", modality, listSome(duplicates)));
        }
    }

    /**
     * <p/>
     * Class UserException.InsufficientRank
     * <p/>
     * The data cannot be reduced to even a single dimension (e.g. a single sample or a single feature).
     */
    public static class InsufficientRank extends UserException {
        private static final long serialVersionUID = 0L;

        public InsufficientRank(final String stage, final int sampleCount, final int featureCount) {
            super(String.format("Cannot reduce %s: a %d x %d matrix admits at most %d component(s), at least 1 is required.",
                    stage, sampleCount, featureCount, Math.min(sampleCount, featureCount) - 1));
        }
    }

    public static class EmptyIntersection extends UserException {
        private static final long serialVersionUID = 0L;

        public EmptyIntersection(final Collection<String> modalities) {
            super(String.format("No sample identifier is shared by all modalities: %s", String.join(", ", modalities)));
        }
    }
}
