package com.lattice.converter.parser;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * The SAD source could not be opened or read.
 */
public class FileAccessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FileAccessException(Path source, Throwable cause) {
        super("File " + source + " could not be read: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        if (cause instanceof NoSuchFileException) {
            return "not found";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
