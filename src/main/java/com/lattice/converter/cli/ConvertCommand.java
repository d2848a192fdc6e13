package com.lattice.converter.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.lattice.converter.cli.exception.InvalidOptionsException;
import com.lattice.converter.cli.model.ConvertOptions;
import com.lattice.converter.cli.model.ValidatedConvertOptions;
import com.lattice.converter.cli.output.ConvertResultsPrinter;
import com.lattice.converter.cli.validation.ConvertOptionsValidator;
import com.lattice.converter.convert.ConversionResult;
import com.lattice.converter.convert.ConverterConfig;
import com.lattice.converter.convert.LatticeConverter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command converting a SAD lattice file into an OCELOT lattice script.
 */
@Command(
        name = "sad2ocelot",
        mixinStandardHelpOptions = true,
        version = "sad-ocelot-converter 1.0.0",
        description = "Converts a SAD lattice file into an OCELOT lattice definition (Python)."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options = new ConvertOptions();

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();

    @Override
    public Integer call() {
        ValidatedConvertOptions validated;
        try {
            validated = validator.validate(options);
        } catch (InvalidOptionsException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        printer.printBanner(validated);

        ConverterConfig config = ConverterConfig.builder()
                .inputFile(validated.getInputFile())
                .outputFile(validated.getOutputFile())
                .encoding(validated.getEncoding())
                .build();

        ConversionResult result = new LatticeConverter(config).convert();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printSuccess(result);
        return 0;
    }
}
