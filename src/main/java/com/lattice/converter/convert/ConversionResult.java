package com.lattice.converter.convert;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a conversion run.
 */
@Data
@Builder
public class ConversionResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;

    private int elementsParsed;
    private int beamlineLength;

    @Builder.Default
    private List<String> unrecognizedElements = List.of();
    @Builder.Default
    private List<String> warnings = List.of();
    @Builder.Default
    private List<String> infos = List.of();

    public static ConversionResult failure(String errorMessage) {
        return ConversionResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }

    public boolean hasUnrecognizedElements() {
        return unrecognizedElements != null && !unrecognizedElements.isEmpty();
    }
}
