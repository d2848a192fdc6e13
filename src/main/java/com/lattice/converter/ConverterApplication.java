package com.lattice.converter;

import com.lattice.converter.cli.ConvertCommand;
import picocli.CommandLine;

/**
 * Main entry point for the SAD to OCELOT converter.
 * Reads a SAD accelerator lattice file and writes the equivalent OCELOT
 * element definitions and lattice list as a Python script.
 */
public class ConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand()).execute(args);
        System.exit(exitCode);
    }
}
