package com.ethica.lang.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.ethica.debug.Debug;

/**
 * Hand-written scanner for EthicaLang source.
 *
 * The whole input is converted eagerly. Leading whitespace of every non-blank,
 * non-comment line is measured (space = 1, tab = 4) against a stack of open
 * indentation widths, producing INDENT / DEDENT tokens the parser treats as
 * block delimiters.
 */
public class Lexer {
    private static final String TAG = "ethica.lexer";
    private static final int TAB_WIDTH = 4;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("function", TokenType.FUNCTION);
        map.put("return", TokenType.RETURN);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("none", TokenType.NONE);
        keywords = Collections.unmodifiableMap(map);
    }

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
        indents.push(0);
    }

    /** The reserved words of the language, keyed by spelling. */
    public static Map<String, TokenType> keywords() {
        return keywords;
    }

    public List<Token> tokenize() {
        boolean atLineStart = true;

        while (!isAtEnd()) {
            if (atLineStart) {
                int width = measureIndent();
                if (isAtEnd()) break;

                char c = peek();
                if (c == '\n' || c == '\r' || c == '#') {
                    skipComment();
                    consumeLineBreak();
                    continue;
                }

                handleIndentation(width);
                atLineStart = false;
                continue;
            }

            start = current;
            startLine = line;
            startColumn = column;
            atLineStart = scanToken();
        }

        while (indents.size() > 1) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", null, line, column));
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column));

        Debug.get().t(TAG, "tokenized " + tokens.size() + " tokens over " + line + " lines");
        return Collections.unmodifiableList(tokens);
    }

    /** Scans one token; returns true when the token ended a line. */
    private boolean scanToken() {
        char c = advance();
        switch (c) {
            case ' ': case '\t':
                return false;
            case '#':
                skipComment();
                return false;
            case '\r':
                if (peek() == '\n') advance();
                addToken(TokenType.NEWLINE);
                return true;
            case '\n':
                addToken(TokenType.NEWLINE);
                return true;

            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '{': addToken(TokenType.LBRACE); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '@': addToken(TokenType.AT); break;
            case '+': addToken(TokenType.PLUS); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '-': addToken(match('>') ? TokenType.ARROW : TokenType.MINUS); break;
            case '*': addToken(match('*') ? TokenType.POWER : TokenType.STAR); break;
            case '=': addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN); break;
            case '<': addToken(match('=') ? TokenType.LE : TokenType.LT); break;
            case '>': addToken(match('=') ? TokenType.GE : TokenType.GT); break;
            case '!':
                if (match('=')) addToken(TokenType.NE);
                else throw error("Unexpected character '!'");
                break;
            case '.':
                if (isDigit(peek())) throw error("Numbers must start with a digit");
                addToken(TokenType.DOT);
                break;
            case '"': case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character '" + c + "'");
        }
        return false;
    }

    private int measureIndent() {
        int width = 0;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
            width += (advance() == '\t') ? TAB_WIDTH : 1;
        }
        return width;
    }

    private void handleIndentation(int width) {
        int top = indents.peek();
        if (width > top) {
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, "", null, line, 1));
        } else if (width < top) {
            while (indents.peek() > width) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", null, line, 1));
            }
            if (indents.peek() != width) {
                throw new TokenizationException(line, column,
                        "Inconsistent indentation: dedent to width " + width
                                + " does not match any enclosing block (expected " + indents.peek() + ")");
            }
        }
    }

    private void skipComment() {
        if (peek() != '#') return;
        while (!isAtEnd() && peek() != '\n' && peek() != '\r') advance();
    }

    private void consumeLineBreak() {
        if (peek() == '\r') advance();
        if (peek() == '\n') advance();
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        switch (type) {
            case TRUE: addToken(type, Boolean.TRUE); break;
            case FALSE: addToken(type, Boolean.FALSE); break;
            case IDENTIFIER: addToken(type, text); break;
            default: addToken(type);
        }
    }

    private void number() {
        boolean seenDot = false;
        while (isDigit(peek()) || (peek() == '.' && !seenDot)) {
            if (peek() == '.') seenDot = true;
            advance();
        }
        String text = source.substring(start, current);
        if (seenDot) {
            addToken(TokenType.FLOAT, Double.parseDouble(text));
            return;
        }
        try {
            addToken(TokenType.INTEGER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + text);
        }
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c != '\\') {
                value.append(c);
                continue;
            }
            if (isAtEnd()) break;
            char escaped = advance();
            switch (escaped) {
                case 'n': value.append('\n'); break;
                case 't': value.append('\t'); break;
                default: value.append(escaped); // covers \\ and the matching quote
            }
        }
        if (isAtEnd()) throw error("Unterminated string literal");
        advance();
        addToken(TokenType.STRING, value.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private static boolean isAlpha(char c) { return Character.isLetter(c) || c == '_'; }
    private static boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private TokenizationException error(String msg) {
        return new TokenizationException(startLine, startColumn, msg);
    }
}
