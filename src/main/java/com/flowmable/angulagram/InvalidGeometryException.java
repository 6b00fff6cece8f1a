package com.flowmable.angulagram;

/**
 * Raised when scan geometry or zone settings cannot describe a usable polar grid:
 * non-positive or non-finite angle step or span, non-finite origin, an angle window
 * narrower than one step, a grid larger than the configured cell limit, or an empty
 * separation zone.
 */
public class InvalidGeometryException extends AngulagramException {

    public InvalidGeometryException(String message) {
        super(message);
    }
}
