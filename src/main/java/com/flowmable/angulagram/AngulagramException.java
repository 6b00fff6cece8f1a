package com.flowmable.angulagram;

/**
 * Base type for failures raised by the angulagram pipeline.
 * <p>
 * Unchecked: a failure aborts the whole transform and no partial result is returned.
 */
public class AngulagramException extends RuntimeException {

    public AngulagramException(String message) {
        super(message);
    }

    public AngulagramException(String message, Throwable cause) {
        super(message, cause);
    }
}
