package org.omicsfusion.utils.param;

/**
 * Numeric argument checks shared by the integration code.
 *
 * Double.NaN will generally cause a check to fail.  Note that any comparison with a NaN yields false.
 */
public class ParamUtils {
    private ParamUtils () {}

    /**
     * Checks that the  input is within range and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param min minimum value for val (inclusive)
     * @param max maximum value for val (inclusive)
     * @param message the text message that would be pass to the exception thrown when val gt min or val lt max.
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int inRange(final int val, final int min, final int max, final String message) {
        if ((val >= min) && (val <= max)){
            return val;
        } else {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks that the  input is greater than zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException
     */
    public static int isPositive(final int val, final String message) {
        if (!(val > 0)){
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * Checks that every value of the input is neither infinity nor NaN.
     * @param values values to check, not {@code null}
     * @return {@code true} iff all values are finite
     */
    public static boolean allFinite(final double[] values) {
        for (final double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
