package org.omicsfusion.exceptions;

/**
 * <p/>
 * Class OmicsFusionException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as internal pre/post condition failures
 * and "this should never happen" kinds of scenarios.
 */
public class OmicsFusionException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public OmicsFusionException( String message, Throwable throwable ) {
        super(message, throwable);
    }
}
