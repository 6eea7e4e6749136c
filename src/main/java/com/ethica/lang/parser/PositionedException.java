package com.ethica.lang.parser;

import com.ethica.lang.EthicaException;

/** A fault that points at a place in the source text. */
public abstract class PositionedException extends EthicaException {
    private final int line;
    private final int column;
    private final String reason;

    protected PositionedException(int line, int column, String reason) {
        super("[line " + line + ", column " + column + "] " + reason);
        this.line = line;
        this.column = column;
        this.reason = reason;
    }

    public int line() { return line; }
    public int column() { return column; }

    /** The message without the position prefix. */
    public String reason() { return reason; }
}
