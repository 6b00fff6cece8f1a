package com.flowmable.angulagram;

/**
 * Raised when a normalized profile is requested but every radial integral is zero,
 * e.g. a blank image or a window that never touches the pattern.
 */
public class DegenerateSignalException extends AngulagramException {

    public DegenerateSignalException(String message) {
        super(message);
    }
}
