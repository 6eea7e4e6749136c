package com.ethica.lang.parser;

public class SyntaxException extends PositionedException {
    public SyntaxException(int line, int column, String reason) {
        super(line, column, reason);
    }
}
