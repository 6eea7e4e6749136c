package com.ethica.lang.parser;

import java.util.List;
import java.util.Objects;

/**
 * The closed set of EthicaLang syntax tree nodes.
 *
 * Nodes are immutable records; child lists are copied on construction so a
 * parent exclusively owns its children. Every consumer of the tree (the four
 * analysis passes, the interpreter, helper walkers) implements {@link Visitor},
 * which has one method per node kind and no fallback, so adding a node kind is
 * a compile error in every walker until it is handled.
 */
public final class Ast {

    private Ast() {}

    public sealed interface Node
            permits Program, FunctionDef, Annotation, Assignment, Variable, BinaryOp, UnaryOp,
                    Literal, ListLiteral, DictLiteral, IfStatement, WhileLoop, ForLoop,
                    ReturnStatement, FunctionCall, MemberAccess, IndexAccess {
        <R> R accept(Visitor<R> visitor);
    }

    public interface Visitor<R> {
        R visitProgram(Program node);
        R visitFunctionDef(FunctionDef node);
        R visitAnnotation(Annotation node);
        R visitAssignment(Assignment node);
        R visitVariable(Variable node);
        R visitBinaryOp(BinaryOp node);
        R visitUnaryOp(UnaryOp node);
        R visitLiteral(Literal node);
        R visitListLiteral(ListLiteral node);
        R visitDictLiteral(DictLiteral node);
        R visitIfStatement(IfStatement node);
        R visitWhileLoop(WhileLoop node);
        R visitForLoop(ForLoop node);
        R visitReturnStatement(ReturnStatement node);
        R visitFunctionCall(FunctionCall node);
        R visitMemberAccess(MemberAccess node);
        R visitIndexAccess(IndexAccess node);
    }

    // -------------------------
    // Operators
    // -------------------------

    public enum BinaryOperator {
        ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/"), MODULO("%"), POWER("**"),
        EQUAL("=="), NOT_EQUAL("!="), LESS("<"), LESS_EQUAL("<="), GREATER(">"), GREATER_EQUAL(">="),
        AND("and"), OR("or"),
        // Not produced by the parser; reachable only from programmatically built trees.
        BIT_AND("&"), BIT_OR("|"), BIT_XOR("^"), SHIFT_LEFT("<<"), SHIFT_RIGHT(">>");

        public final String symbol;

        BinaryOperator(String symbol) { this.symbol = symbol; }

        public boolean isComparison() {
            switch (this) {
                case EQUAL: case NOT_EQUAL: case LESS: case LESS_EQUAL: case GREATER: case GREATER_EQUAL:
                    return true;
                default:
                    return false;
            }
        }

        public boolean isLogical() { return this == AND || this == OR; }

        public boolean isBitwise() {
            switch (this) {
                case BIT_AND: case BIT_OR: case BIT_XOR: case SHIFT_LEFT: case SHIFT_RIGHT:
                    return true;
                default:
                    return false;
            }
        }
    }

    public enum UnaryOperator {
        NEGATE("-"), NOT("not");

        public final String symbol;

        UnaryOperator(String symbol) { this.symbol = symbol; }
    }

    public enum LiteralKind { INT, FLOAT, STRING, BOOL, NONE }

    // -------------------------
    // Statements
    // -------------------------

    public record Program(List<Node> statements) implements Node {
        public Program {
            statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitProgram(this); }
    }

    /** Function-level metadata such as {@code @requires_user_consent}; no runtime effect. */
    public record Annotation(String name, List<Node> arguments) implements Node {
        public Annotation {
            Objects.requireNonNull(name, "name");
            arguments = List.copyOf(arguments);
        }

        public Annotation(String name) { this(name, List.of()); }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAnnotation(this); }
    }

    /**
     * @param returnType optional {@code -> name} marker, null when absent
     */
    public record FunctionDef(String name, List<String> parameters, List<Node> body,
                              List<Annotation> annotations, String returnType) implements Node {
        public FunctionDef {
            Objects.requireNonNull(name, "name");
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
            annotations = List.copyOf(annotations);
        }

        public FunctionDef(String name, List<String> parameters, List<Node> body) {
            this(name, parameters, body, List.of(), null);
        }

        public boolean hasAnnotation(String annotationName) {
            for (Annotation a : annotations) {
                if (a.name().equals(annotationName)) return true;
            }
            return false;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFunctionDef(this); }
    }

    /**
     * @param firstBinding forces a new binding in the current scope; the parser never sets it
     */
    public record Assignment(String name, Node value, boolean firstBinding) implements Node {
        public Assignment {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }

        public Assignment(String name, Node value) { this(name, value, false); }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAssignment(this); }
    }

    public record IfStatement(Node condition, List<Node> thenBody, List<Node> elseBody) implements Node {
        public IfStatement {
            Objects.requireNonNull(condition, "condition");
            thenBody = List.copyOf(thenBody);
            elseBody = (elseBody == null) ? List.of() : List.copyOf(elseBody);
        }

        public boolean hasElse() { return !elseBody.isEmpty(); }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitIfStatement(this); }
    }

    public record WhileLoop(Node condition, List<Node> body) implements Node {
        public WhileLoop {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitWhileLoop(this); }
    }

    public record ForLoop(String variable, Node iterable, List<Node> body) implements Node {
        public ForLoop {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(iterable, "iterable");
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitForLoop(this); }
    }

    /**
     * @param value may be null for a bare {@code return}
     */
    public record ReturnStatement(Node value) implements Node {
        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitReturnStatement(this); }
    }

    // -------------------------
    // Expressions
    // -------------------------

    public record Variable(String name) implements Node {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitVariable(this); }
    }

    public record BinaryOp(Node left, BinaryOperator operator, Node right) implements Node {
        public BinaryOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitBinaryOp(this); }
    }

    public record UnaryOp(UnaryOperator operator, Node operand) implements Node {
        public UnaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitUnaryOp(this); }
    }

    /**
     * @param value Long, Double, String, Boolean or null, matching {@code kind}
     */
    public record Literal(Object value, LiteralKind kind) implements Node {
        public Literal {
            Objects.requireNonNull(kind, "kind");
        }

        public static Literal ofInt(long v) { return new Literal(v, LiteralKind.INT); }
        public static Literal ofFloat(double v) { return new Literal(v, LiteralKind.FLOAT); }
        public static Literal ofString(String v) { return new Literal(v, LiteralKind.STRING); }
        public static Literal ofBool(boolean v) { return new Literal(v, LiteralKind.BOOL); }
        public static Literal none() { return new Literal(null, LiteralKind.NONE); }

        public boolean isNumeric() { return kind == LiteralKind.INT || kind == LiteralKind.FLOAT; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitLiteral(this); }
    }

    public record ListLiteral(List<Node> elements) implements Node {
        public ListLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitListLiteral(this); }
    }

    public record DictEntry(Node key, Node value) {
        public DictEntry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    public record DictLiteral(List<DictEntry> entries) implements Node {
        public DictLiteral {
            entries = List.copyOf(entries);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitDictLiteral(this); }
    }

    public record FunctionCall(Node callee, List<Node> arguments) implements Node {
        public FunctionCall {
            Objects.requireNonNull(callee, "callee");
            arguments = List.copyOf(arguments);
        }

        /** The callee's name when it is a plain variable reference, otherwise null. */
        public String calleeName() {
            return (callee instanceof Variable) ? ((Variable) callee).name() : null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFunctionCall(this); }
    }

    public record MemberAccess(Node object, String member) implements Node {
        public MemberAccess {
            Objects.requireNonNull(object, "object");
            Objects.requireNonNull(member, "member");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitMemberAccess(this); }
    }

    public record IndexAccess(Node object, Node index) implements Node {
        public IndexAccess {
            Objects.requireNonNull(object, "object");
            Objects.requireNonNull(index, "index");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitIndexAccess(this); }
    }
}
