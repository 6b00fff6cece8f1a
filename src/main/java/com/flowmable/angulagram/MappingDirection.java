package com.flowmable.angulagram;

/**
 * Selects one of the two resampling formulations. They alias in opposite
 * directions and are kept numerically distinct.
 */
public enum MappingDirection {
    /** Scatter: iterate source pixels, compute the destination cell. */
    FORWARD,
    /** Gather: iterate polar cells, compute the source pixel. */
    INVERSE;

    public SamplingStrategy createStrategy(ScanSettings settings) {
        return switch (this) {
            case FORWARD -> new ForwardMapping(settings.polarity(), settings.forwardIndexing(), settings.parallel());
            case INVERSE -> new InverseMapping(settings.polarity(), settings.parallel());
        };
    }
}
