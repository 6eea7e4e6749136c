package com.ethica.lang.parser;

public enum TokenType {
    // Literals
    INTEGER, FLOAT, STRING, TRUE, FALSE, NONE,

    // Identifiers and keywords
    IDENTIFIER, FUNCTION, RETURN, IF, ELSE, WHILE, FOR, IN, AND, OR, NOT,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT, POWER,
    EQ, NE, LT, LE, GT, GE,
    ASSIGN,

    // Delimiters
    LPAREN, RPAREN, LBRACE, RBRACE, LBRACKET, RBRACKET,
    COMMA, COLON, ARROW, DOT, AT,

    // Layout
    NEWLINE, INDENT, DEDENT, EOF
}
