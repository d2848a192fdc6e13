package com.lattice.converter.model;

/**
 * Direction in which a beamline entry is traversed.
 */
public enum Orientation {
    FORWARD,
    REVERSED
}
