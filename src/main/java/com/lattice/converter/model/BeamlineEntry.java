package com.lattice.converter.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Reference to an element within the beamline sequence.
 */
@Value
public class BeamlineEntry {

    @NonNull
    String elementName;

    @NonNull
    Orientation orientation;

    public static BeamlineEntry forward(String elementName) {
        return new BeamlineEntry(elementName, Orientation.FORWARD);
    }

    public static BeamlineEntry reversed(String elementName) {
        return new BeamlineEntry(elementName, Orientation.REVERSED);
    }

    public boolean isReversed() {
        return orientation == Orientation.REVERSED;
    }

    @Override
    public String toString() {
        return isReversed() ? "-" + elementName : elementName;
    }
}
