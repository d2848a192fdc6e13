package com.lattice.converter.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lattice.converter.cli.model.ValidatedConvertOptions;
import com.lattice.converter.convert.ConversionResult;

/**
 * Responsible only for printing CLI output for the convert command.
 * No validation, no execution.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ValidatedConvertOptions v) {
        log.info("=================================================");
        log.info("SAD to OCELOT Converter");
        log.info("=================================================");
        log.info("Input File: {}", v.getInputFile().toAbsolutePath());
        log.info("Output File: {}", v.getOutputFile().toAbsolutePath());
        log.info("Encoding: {}", v.getEncoding());
        log.info("=================================================");
    }

    public void printSuccess(ConversionResult result) {
        log.info("");
        log.info("=================================================");
        log.info("CONVERSION COMPLETE");
        log.info("=================================================");
        log.info("Output saved to: {}", result.getOutputPath().toAbsolutePath());
        log.info("Elements Parsed: {}", result.getElementsParsed());
        log.info("Beamline Entries: {}", result.getBeamlineLength());

        for (String info : result.getInfos()) {
            log.info("  {}", info);
        }

        if (result.hasUnrecognizedElements()) {
            log.warn("");
            log.warn("Unrecognized element types found:");
            for (String item : result.getUnrecognizedElements()) {
                log.warn(" - {}", item);
            }
        }

        if (!result.getWarnings().isEmpty()) {
            log.warn("");
            log.warn("Warnings ({}):", result.getWarnings().size());
            for (String warning : result.getWarnings()) {
                log.warn(" - {}", warning);
            }
        }
        log.info("=================================================");
    }

    public void printFailure(ConversionResult result) {
        log.error("Conversion failed: {}", result.getErrorMessage());
    }
}
