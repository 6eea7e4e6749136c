import org.junit.jupiter.api.Test;

import com.ethica.lang.parser.Lexer;
import com.ethica.lang.parser.Token;
import com.ethica.lang.parser.TokenType;
import com.ethica.lang.parser.TokenizationException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    private static long count(List<Token> tokens, TokenType type) {
        return tokens.stream().filter(t -> t.type == type).count();
    }

    @Test
    void simpleAssignment() {
        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER, TokenType.NEWLINE, TokenType.EOF),
                types("x = 42\n"));
    }

    @Test
    void literalsCarryValues() {
        List<Token> tokens = new Lexer("3 2.5 'hi' true false none name").tokenize();
        assertEquals(3L, tokens.get(0).literal);
        assertEquals(2.5, tokens.get(1).literal);
        assertEquals("hi", tokens.get(2).literal);
        assertEquals(Boolean.TRUE, tokens.get(3).literal);
        assertEquals(Boolean.FALSE, tokens.get(4).literal);
        assertEquals(TokenType.NONE, tokens.get(5).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(6).type);
        assertEquals("name", tokens.get(6).lexeme);
    }

    @Test
    void twoCharacterOperators() {
        assertEquals(
                List.of(TokenType.EQ, TokenType.NE, TokenType.LE, TokenType.GE, TokenType.ARROW, TokenType.POWER,
                        TokenType.LT, TokenType.GT, TokenType.ASSIGN, TokenType.MINUS, TokenType.STAR, TokenType.EOF),
                types("== != <= >= -> ** < > = - *"));
    }

    @Test
    void keywordsAreRecognized() {
        assertEquals(
                List.of(TokenType.FUNCTION, TokenType.RETURN, TokenType.IF, TokenType.ELSE, TokenType.WHILE,
                        TokenType.FOR, TokenType.IN, TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.EOF),
                types("function return if else while for in and or not"));
    }

    @Test
    void keywordTableIsImmutable() {
        assertEquals(TokenType.FUNCTION, Lexer.keywords().get("function"));
        assertThrows(UnsupportedOperationException.class, () -> Lexer.keywords().put("let", TokenType.IDENTIFIER));
    }

    @Test
    void indentAndDedentAreSynthesized() {
        String src = "if x:\n    y = 1\n    if y:\n        z = 2\nw = 3\n";
        List<Token> tokens = new Lexer(src).tokenize();
        assertEquals(2, count(tokens, TokenType.INDENT));
        assertEquals(2, count(tokens, TokenType.DEDENT));
    }

    @Test
    void openBlocksAreClosedAtEndOfInput() {
        String src = "function f():\n    if a:\n        return 1";
        List<Token> tokens = new Lexer(src).tokenize();
        assertEquals(count(tokens, TokenType.INDENT), count(tokens, TokenType.DEDENT));
        assertEquals(TokenType.DEDENT, tokens.get(tokens.size() - 2).type);
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type);
    }

    @Test
    void tabCountsAsFourColumns() {
        String src = "if a:\n\tb = 1\n    c = 2\n";
        List<Token> tokens = new Lexer(src).tokenize();
        assertEquals(1, count(tokens, TokenType.INDENT));
        assertEquals(1, count(tokens, TokenType.DEDENT));
    }

    @Test
    void dedentToUnseenLevelFails() {
        String src = "if a:\n        b = 1\n    c = 2\n";
        TokenizationException e = assertThrows(TokenizationException.class, () -> new Lexer(src).tokenize());
        assertEquals(3, e.line());
        assertTrue(e.getMessage().startsWith("[line 3, column"));
    }

    @Test
    void blankAndCommentLinesDoNotAffectIndentation() {
        String src = "if a:\n    b = 1\n\n# note\n        # indented comment\n    c = 2\n";
        List<Token> tokens = new Lexer(src).tokenize();
        assertEquals(1, count(tokens, TokenType.INDENT));
        assertEquals(1, count(tokens, TokenType.DEDENT));
    }

    @Test
    void trailingCommentIsDiscarded() {
        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.INTEGER, TokenType.NEWLINE, TokenType.EOF),
                types("x = 1  # the answer\n"));
    }

    @Test
    void stringEscapes() {
        List<Token> tokens = new Lexer("\"a\\nb\\t\\\\ \\\"q\\\" \\z\"").tokenize();
        assertEquals("a\nb\t\\ \"q\" z", tokens.get(0).literal);

        tokens = new Lexer("'it\\'s'").tokenize();
        assertEquals("it's", tokens.get(0).literal);
    }

    @Test
    void unterminatedStringFails() {
        TokenizationException e = assertThrows(TokenizationException.class,
                () -> new Lexer("x = \"open\n").tokenize());
        assertEquals(1, e.line());
        assertEquals(5, e.column());
    }

    @Test
    void unexpectedCharactersFail() {
        assertThrows(TokenizationException.class, () -> new Lexer("x = 1 $ 2").tokenize());
        assertThrows(TokenizationException.class, () -> new Lexer("x = !y").tokenize());
        assertThrows(TokenizationException.class, () -> new Lexer("x = .5").tokenize());
    }

    @Test
    void numberConsumesAtMostOneDot() {
        List<Token> tokens = new Lexer("1.5.x").tokenize();
        assertEquals(TokenType.FLOAT, tokens.get(0).type);
        assertEquals(TokenType.DOT, tokens.get(1).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(2).type);
    }

    @Test
    void positionsAreOneBased() {
        List<Token> tokens = new Lexer("a = 1\nbb = 22\n").tokenize();
        Token bb = tokens.get(4);
        assertEquals("bb", bb.lexeme);
        assertEquals(2, bb.line);
        assertEquals(1, bb.column);
        Token twentyTwo = tokens.get(6);
        assertEquals(2, twentyTwo.line);
        assertEquals(6, twentyTwo.column);
    }

    @Test
    void tokenizingTwiceYieldsSameSequence() {
        String src = "function f(a):\n    return a * 2\n";
        assertEquals(types(src), types(src));
    }
}
