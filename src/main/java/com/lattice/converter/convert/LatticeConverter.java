package com.lattice.converter.convert;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lattice.converter.emit.EmitResult;
import com.lattice.converter.emit.OcelotEmitter;
import com.lattice.converter.model.LatticeModel;
import com.lattice.converter.model.ParseDiagnostics;
import com.lattice.converter.parser.LatticeModelBuilder;
import com.lattice.converter.parser.LexException;
import com.lattice.converter.util.FileWriteUtil;

/**
 * Converts one SAD file into an OCELOT lattice script.
 *
 * Nothing is written when the input cannot be read or fails to lex.
 * Unrecognized element kinds and other anomalies end up in the result's
 * warning lists and never stop the conversion.
 */
public class LatticeConverter {
    private static final Logger log = LoggerFactory.getLogger(LatticeConverter.class);

    private final ConverterConfig config;
    private final LatticeModelBuilder modelBuilder;
    private final OcelotEmitter emitter;

    public LatticeConverter(ConverterConfig config) {
        this(config, new LatticeModelBuilder(), new OcelotEmitter());
    }

    public LatticeConverter(ConverterConfig config, LatticeModelBuilder modelBuilder, OcelotEmitter emitter) {
        this.config = config;
        this.modelBuilder = modelBuilder;
        this.emitter = emitter;
    }

    public ConversionResult convert() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();
        Path outputPath = config.getOutputFile();

        try {
            log.info("Step 1: Parsing {}...", config.getInputFile());
            LatticeModel model = modelBuilder.build(config.getInputFile(), config.getEncoding(), diagnostics);
            if (diagnostics.hasErrors()) {
                return ConversionResult.failure(String.join(System.lineSeparator(), diagnostics.getErrors()));
            }

            log.info("Step 2: Rendering OCELOT lattice...");
            EmitResult emitted = emitter.emit(model, diagnostics);

            log.info("Step 3: Writing {}...", outputPath);
            FileWriteUtil.safeWriteString(outputPath, emitted.getText());

            return ConversionResult.builder()
                    .success(true)
                    .outputPath(outputPath)
                    .elementsParsed(model.getElementCount())
                    .beamlineLength(model.getBeamline().size())
                    .unrecognizedElements(emitted.getUnrecognizedElements())
                    .warnings(diagnostics.getWarnings())
                    .infos(diagnostics.getInfos())
                    .build();

        } catch (LexException e) {
            log.debug("Lexing failed", e);
            return ConversionResult.failure("Lex error in " + config.getInputFile() + ": " + e.getMessage());
        } catch (IOException e) {
            log.error("Conversion failed with exception", e);
            return ConversionResult.failure("Conversion failed: " + e.getMessage());
        }
    }
}
