package com.lattice.converter.model;

import java.util.List;

import lombok.Value;

/**
 * What a single terminated statement contributed to the lattice.
 */
@Value
public class StatementResult {
    List<ElementDefinition> elements;
    List<BeamlineEntry> beamline;
    boolean lineStatement;

    public StatementResult(List<ElementDefinition> elements, List<BeamlineEntry> beamline, boolean lineStatement) {
        this.elements = List.copyOf(elements);
        this.beamline = List.copyOf(beamline);
        this.lineStatement = lineStatement;
    }

    public boolean hasBeamline() {
        return !beamline.isEmpty();
    }
}
