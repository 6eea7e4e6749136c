package com.ethica.lang.parser;

public class TokenizationException extends PositionedException {
    public TokenizationException(int line, int column, String reason) {
        super(line, column, reason);
    }
}
