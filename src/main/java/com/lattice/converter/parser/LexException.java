package com.lattice.converter.parser;

import lombok.Getter;

/**
 * Raised when a line holds a character no token rule accepts.
 * Fatal for the parse in progress.
 */
@Getter
public class LexException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final SadToken offendingToken;

    public LexException(SadToken offendingToken) {
        super("'" + offendingToken.getText() + "' unexpected on " + offendingToken.position());
        this.offendingToken = offendingToken;
    }

    public int getLine() {
        return offendingToken.getLine();
    }

    public int getColumn() {
        return offendingToken.getColumn();
    }

    public char getCharacter() {
        return offendingToken.getText().charAt(0);
    }
}
