package com.lattice.converter.emit;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Rendered OCELOT script plus the elements it could only emit as placeholders.
 */
@Value
@Builder
public class EmitResult {

    @NonNull
    String text;

    /** Entries of the form {@code KIND (NAME)}. */
    @Singular
    List<String> unrecognizedElements;

    public boolean hasUnrecognizedElements() {
        return !unrecognizedElements.isEmpty();
    }
}
