package com.ethica.lang.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    /** Long, Double, String or Boolean for literal tokens, null otherwise. */
    public final Object literal;
    public final int line;
    public final int column;

    Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType type() { return type; }

    @Override
    public String toString() {
        String shown = (literal != null) ? String.valueOf(literal) : lexeme;
        return "Token(" + type + ", " + shown + ", " + line + ":" + column + ")";
    }
}
