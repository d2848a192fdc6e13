package com.lattice.converter.cli.exception;

import java.util.List;

import lombok.Getter;

/**
 * The sad2ocelot options failed validation. Holds every problem found, in
 * the order the validator checked them.
 */
@Getter
public class InvalidOptionsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public InvalidOptionsException(List<String> errors) {
        super("Invalid sad2ocelot options (" + errors.size() + "): " + String.join(" ", errors));
        this.errors = List.copyOf(errors);
    }
}
