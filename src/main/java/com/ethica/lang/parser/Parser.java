package com.ethica.lang.parser;

import java.util.ArrayList;
import java.util.List;

import com.ethica.debug.Debug;
import com.ethica.lang.parser.Ast.Annotation;
import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.BinaryOp;
import com.ethica.lang.parser.Ast.BinaryOperator;
import com.ethica.lang.parser.Ast.DictEntry;
import com.ethica.lang.parser.Ast.DictLiteral;
import com.ethica.lang.parser.Ast.ForLoop;
import com.ethica.lang.parser.Ast.FunctionCall;
import com.ethica.lang.parser.Ast.FunctionDef;
import com.ethica.lang.parser.Ast.IfStatement;
import com.ethica.lang.parser.Ast.IndexAccess;
import com.ethica.lang.parser.Ast.ListLiteral;
import com.ethica.lang.parser.Ast.Literal;
import com.ethica.lang.parser.Ast.MemberAccess;
import com.ethica.lang.parser.Ast.Node;
import com.ethica.lang.parser.Ast.Program;
import com.ethica.lang.parser.Ast.ReturnStatement;
import com.ethica.lang.parser.Ast.UnaryOp;
import com.ethica.lang.parser.Ast.UnaryOperator;
import com.ethica.lang.parser.Ast.Variable;
import com.ethica.lang.parser.Ast.WhileLoop;

/**
 * Recursive-descent parser. The first grammar violation aborts with a
 * {@link SyntaxException} positioned at the offending token.
 */
public class Parser {
    private static final String TAG = "ethica.parser";

    /** Deepest syntax tree a single top-level statement may produce. */
    public static final int MAX_NESTING_DEPTH = 500;

    private final List<Token> tokens;
    private int current = 0;

    public Parser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public Program parse() {
        List<Node> statements = new ArrayList<>();
        skipNewlines();
        while (!isAtEnd()) {
            statements.add(boundedStatement());
            skipNewlines();
        }
        Debug.get().t(TAG, "parsed " + statements.size() + " top-level statements");
        return new Program(statements);
    }

    // -------------------------
    // Statements
    // -------------------------

    /** A top-level statement whose tree is shallow enough for the recursive walkers downstream. */
    private Node boundedStatement() {
        Token start = peek();
        Node stmt;
        try {
            stmt = statement();
        } catch (StackOverflowError e) {
            throw error(peek(), "Statement nested too deeply");
        }
        int depth = TreeDepth.of(stmt);
        if (depth > MAX_NESTING_DEPTH) {
            throw error(start, "Statement nested too deeply (depth " + depth + ", limit " + MAX_NESTING_DEPTH + ")");
        }
        return stmt;
    }

    private Node statement() {
        // Annotations are read before the statement kind is known; only a function keeps them.
        List<Annotation> annotations = new ArrayList<>();
        while (match(TokenType.AT)) {
            annotations.add(annotation());
            skipNewlines();
        }

        if (match(TokenType.FUNCTION)) return functionDefinition(annotations);
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();

        Node stmt;
        if (match(TokenType.RETURN)) {
            stmt = returnStatement();
        } else if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
            stmt = assignment();
        } else {
            stmt = expression();
        }
        terminator();
        return stmt;
    }

    private Annotation annotation() {
        Token name = consume(TokenType.IDENTIFIER, "Expect annotation name after '@'.");
        List<Node> args = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN)) {
                do {
                    args.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RPAREN, "Expect ')' after annotation arguments.");
        }
        return new Annotation(name.lexeme, args);
    }

    private FunctionDef functionDefinition(List<Annotation> annotations) {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LPAREN, "Expect '(' after function name.");

        List<String> params = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name.").lexeme);
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expect ')' after parameters.");

        String returnType = null;
        if (match(TokenType.ARROW)) {
            returnType = consumeTypeName().lexeme;
        }

        consume(TokenType.COLON, "Expect ':' after function signature.");
        List<Node> body = block();
        return new FunctionDef(name.lexeme, params, body, annotations, returnType);
    }

    // `none` is a keyword but also a sensible return marker.
    private Token consumeTypeName() {
        if (check(TokenType.IDENTIFIER) || check(TokenType.NONE)) return advance();
        throw error(peek(), "Expect return type name after '->'.");
    }

    private IfStatement ifStatement() {
        Node condition = expression();
        consume(TokenType.COLON, "Expect ':' after if condition.");
        List<Node> thenBody = block();

        List<Node> elseBody = null;
        if (match(TokenType.ELSE)) {
            consume(TokenType.COLON, "Expect ':' after 'else'.");
            elseBody = block();
        }
        return new IfStatement(condition, thenBody, elseBody);
    }

    private WhileLoop whileStatement() {
        Node condition = expression();
        consume(TokenType.COLON, "Expect ':' after while condition.");
        return new WhileLoop(condition, block());
    }

    private ForLoop forStatement() {
        Token variable = consume(TokenType.IDENTIFIER, "Expect loop variable after 'for'.");
        consume(TokenType.IN, "Expect 'in' after loop variable.");
        Node iterable = expression();
        consume(TokenType.COLON, "Expect ':' after for iterable.");
        return new ForLoop(variable.lexeme, iterable, block());
    }

    private ReturnStatement returnStatement() {
        if (atStatementEnd()) return new ReturnStatement(null);
        return new ReturnStatement(expression());
    }

    private Assignment assignment() {
        Token name = advance();
        consume(TokenType.ASSIGN, "Expect '=' after variable name.");
        return new Assignment(name.lexeme, expression(), false);
    }

    private List<Node> block() {
        skipNewlines();
        consume(TokenType.INDENT, "Expect indented block.");

        List<Node> statements = new ArrayList<>();
        skipNewlines();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            statements.add(statement());
            skipNewlines();
        }
        consume(TokenType.DEDENT, "Expect end of indented block.");
        return statements;
    }

    private void terminator() {
        if (match(TokenType.NEWLINE)) return;
        if (check(TokenType.DEDENT) || isAtEnd()) return;
        throw error(peek(), "Expect end of line after statement.");
    }

    private boolean atStatementEnd() {
        return check(TokenType.NEWLINE) || check(TokenType.DEDENT) || isAtEnd();
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Node expression() { return or(); }

    private Node or() {
        Node expr = and();
        while (match(TokenType.OR)) {
            expr = new BinaryOp(expr, BinaryOperator.OR, and());
        }
        return expr;
    }

    private Node and() {
        Node expr = equality();
        while (match(TokenType.AND)) {
            expr = new BinaryOp(expr, BinaryOperator.AND, equality());
        }
        return expr;
    }

    private Node equality() {
        Node expr = comparison();
        while (match(TokenType.EQ, TokenType.NE)) {
            BinaryOperator op = previous().type == TokenType.EQ ? BinaryOperator.EQUAL : BinaryOperator.NOT_EQUAL;
            expr = new BinaryOp(expr, op, comparison());
        }
        return expr;
    }

    private Node comparison() {
        Node expr = term();
        while (match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE)) {
            BinaryOperator op = binaryOperator(previous());
            expr = new BinaryOp(expr, op, term());
        }
        return expr;
    }

    private Node term() {
        Node expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOperator op = binaryOperator(previous());
            expr = new BinaryOp(expr, op, factor());
        }
        return expr;
    }

    private Node factor() {
        Node expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            BinaryOperator op = binaryOperator(previous());
            expr = new BinaryOp(expr, op, unary());
        }
        return expr;
    }

    private Node unary() {
        if (match(TokenType.NOT)) return new UnaryOp(UnaryOperator.NOT, unary());
        if (match(TokenType.MINUS)) return new UnaryOp(UnaryOperator.NEGATE, unary());
        return power();
    }

    private Node power() {
        Node base = postfix();
        if (match(TokenType.POWER)) {
            // right operand re-enters unary, so `a ** b ** c` groups to the right and `2 ** -1` is legal
            return new BinaryOp(base, BinaryOperator.POWER, unary());
        }
        return base;
    }

    private Node postfix() {
        Node expr = primary();
        while (true) {
            if (match(TokenType.LPAREN)) {
                expr = finishCall(expr);
            } else if (match(TokenType.LBRACKET)) {
                Node index = expression();
                consume(TokenType.RBRACKET, "Expect ']' after index.");
                expr = new IndexAccess(expr, index);
            } else if (match(TokenType.DOT)) {
                Token member = consume(TokenType.IDENTIFIER, "Expect member name after '.'.");
                expr = new MemberAccess(expr, member.lexeme);
            } else {
                break;
            }
        }
        return expr;
    }

    private Node finishCall(Node callee) {
        List<Node> args = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "Expect ')' after arguments.");
        return new FunctionCall(callee, args);
    }

    private Node primary() {
        if (match(TokenType.INTEGER)) return Literal.ofInt((Long) previous().literal);
        if (match(TokenType.FLOAT)) return Literal.ofFloat((Double) previous().literal);
        if (match(TokenType.STRING)) return Literal.ofString((String) previous().literal);
        if (match(TokenType.TRUE)) return Literal.ofBool(true);
        if (match(TokenType.FALSE)) return Literal.ofBool(false);
        if (match(TokenType.NONE)) return Literal.none();
        if (match(TokenType.IDENTIFIER)) return new Variable(previous().lexeme);

        if (match(TokenType.LPAREN)) {
            Node expr = expression();
            consume(TokenType.RPAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LBRACKET)) {
            List<Node> elements = new ArrayList<>();
            while (!check(TokenType.RBRACKET)) {
                elements.add(expression());
                if (!match(TokenType.COMMA)) break;
            }
            consume(TokenType.RBRACKET, "Expect ']' after list elements.");
            return new ListLiteral(elements);
        }

        if (match(TokenType.LBRACE)) {
            List<DictEntry> entries = new ArrayList<>();
            while (!check(TokenType.RBRACE)) {
                Node key = expression();
                consume(TokenType.COLON, "Expect ':' after dict key.");
                entries.add(new DictEntry(key, expression()));
                if (!match(TokenType.COMMA)) break;
            }
            consume(TokenType.RBRACE, "Expect '}' after dict entries.");
            return new DictLiteral(entries);
        }

        throw error(peek(), "Expect expression.");
    }

    private static BinaryOperator binaryOperator(Token token) {
        switch (token.type) {
            case PLUS: return BinaryOperator.ADD;
            case MINUS: return BinaryOperator.SUBTRACT;
            case STAR: return BinaryOperator.MULTIPLY;
            case SLASH: return BinaryOperator.DIVIDE;
            case PERCENT: return BinaryOperator.MODULO;
            case LT: return BinaryOperator.LESS;
            case LE: return BinaryOperator.LESS_EQUAL;
            case GT: return BinaryOperator.GREATER;
            case GE: return BinaryOperator.GREATER_EQUAL;
            default: throw error(token, "Unexpected operator '" + token.lexeme + "'.");
        }
    }

    // -------------------------
    // Token helpers
    // -------------------------

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // skip
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }

    private Token peek() {
        return tokens.get(Math.min(current, tokens.size() - 1));
    }

    private Token previous() { return tokens.get(current - 1); }

    private static SyntaxException error(Token token, String message) {
        String where;
        switch (token.type) {
            case EOF: where = " at end"; break;
            case NEWLINE: where = " at end of line"; break;
            case INDENT: where = " at unexpected indent"; break;
            case DEDENT: where = " at end of block"; break;
            default: where = " at '" + token.lexeme + "'";
        }
        return new SyntaxException(token.line, token.column, message + where);
    }
}
