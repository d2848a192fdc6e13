package com.lattice.converter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Value;

/**
 * Fully parsed lattice: element table plus the beamline sequence.
 * The element table iterates in order of first definition.
 */
@Value
public class LatticeModel {
    Map<String, ElementDefinition> elements;
    List<BeamlineEntry> beamline;

    public LatticeModel(Map<String, ElementDefinition> elements, List<BeamlineEntry> beamline) {
        this.elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
        this.beamline = List.copyOf(beamline);
    }

    public static LatticeModel empty() {
        return new LatticeModel(Map.of(), List.of());
    }

    public boolean isEmpty() {
        return elements.isEmpty() && beamline.isEmpty();
    }

    public Optional<ElementDefinition> findElement(String name) {
        return Optional.ofNullable(elements.get(name));
    }

    public int getElementCount() {
        return elements.size();
    }

    /**
     * Beamline entries whose name has no definition in the element table.
     */
    public List<BeamlineEntry> getUnresolvedEntries() {
        return beamline.stream()
                .filter(entry -> !elements.containsKey(entry.getElementName()))
                .toList();
    }
}
