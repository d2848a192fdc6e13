package com.lattice.converter.convert;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Configuration for one SAD to OCELOT conversion.
 */
@Value
@Builder
public class ConverterConfig {

    @NonNull
    Path inputFile;

    @NonNull
    Path outputFile;

    @Builder.Default
    Charset encoding = StandardCharsets.UTF_8;

    /**
     * Default output path: the input with {@code .sad} replaced by {@code .py},
     * or {@code .py} appended for any other name.
     */
    public static Path defaultOutputFor(Path inputFile) {
        String fileName = inputFile.getFileName().toString();
        String outputName = fileName.toLowerCase(Locale.ROOT).endsWith(".sad")
                ? fileName.substring(0, fileName.length() - 4) + ".py"
                : fileName + ".py";
        return inputFile.resolveSibling(outputName);
    }
}
