package com.lattice.converter.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the convert command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Parameters(index = "0", arity = "0..1", paramLabel = "<input>", description = "Path to the input SAD file")
	private Path inputFile;

	@Option(names = { "--output",
			"-o" }, description = "Output Python file (default: same name as input with .py extension)")
	private Path outputFile;

	@Option(names = { "--encoding" }, defaultValue = "UTF-8", description = "Character encoding of the SAD file (default: UTF-8)")
	private String encoding;

}
