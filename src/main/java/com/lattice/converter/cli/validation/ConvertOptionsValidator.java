package com.lattice.converter.cli.validation;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.lattice.converter.cli.exception.InvalidOptionsException;
import com.lattice.converter.cli.model.ConvertOptions;
import com.lattice.converter.cli.model.ValidatedConvertOptions;
import com.lattice.converter.convert.ConverterConfig;

/**
 * Checks the convert options and derives the output path.
 *
 * A missing input file is not an error here: the converter reports it as a
 * file access failure.
 */
public class ConvertOptionsValidator {

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		Path input = o.getInputFile();
		if (input == null || input.toString().isBlank()) {
			errors.add("Input SAD file is required.");
		} else if (Files.isDirectory(input)) {
			errors.add("Input is a directory, not a SAD file: " + input);
		}

		Charset charset = parseCharset(o.getEncoding(), errors);

		Path output = null;
		if (input != null && !input.toString().isBlank()) {
			output = o.getOutputFile() != null ? o.getOutputFile() : ConverterConfig.defaultOutputFor(input);

			Path normalizedInput = input.toAbsolutePath().normalize();
			Path normalizedOutput = output.toAbsolutePath().normalize();
			if (normalizedInput.equals(normalizedOutput)) {
				errors.add("Output file would overwrite the input file: " + normalizedOutput);
			}
			if (Files.isDirectory(normalizedOutput)) {
				errors.add("Output path is a directory: " + normalizedOutput);
			}
		}

		if (!errors.isEmpty()) {
			throw new InvalidOptionsException(errors);
		}

		return new ValidatedConvertOptions(input, output, charset);
	}

	private static Charset parseCharset(String name, List<String> errors) {
		if (name == null || name.isBlank()) {
			errors.add("Encoding must not be blank.");
			return null;
		}
		try {
			return Charset.forName(name.trim());
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			errors.add("Unsupported encoding: " + name);
			return null;
		}
	}
}
