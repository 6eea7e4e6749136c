package com.ethica.lang.analysis;

import java.util.List;

import com.ethica.lang.parser.Ast;
import com.ethica.lang.parser.Ast.Annotation;
import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.BinaryOp;
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
import com.ethica.lang.parser.Ast.Variable;
import com.ethica.lang.parser.Ast.WhileLoop;

/**
 * Finds a literal call to a function's own name anywhere in its body.
 * Calls through aliases are not seen; nested definitions are not entered.
 */
final class RecursionFinder implements Ast.Visitor<Boolean> {
    private final String name;

    private RecursionFinder(String name) {
        this.name = name;
    }

    static boolean callsItself(FunctionDef def) {
        return new RecursionFinder(def.name()).any(def.body());
    }

    private boolean any(List<? extends Node> nodes) {
        for (Node n : nodes) {
            if (n != null && n.accept(this)) return true;
        }
        return false;
    }

    private boolean any(Node... nodes) {
        return any(List.of(nodes));
    }

    @Override public Boolean visitProgram(Program node) { return any(node.statements()); }
    @Override public Boolean visitFunctionDef(FunctionDef node) { return false; }
    @Override public Boolean visitAnnotation(Annotation node) { return false; }
    @Override public Boolean visitAssignment(Assignment node) { return node.value().accept(this); }
    @Override public Boolean visitVariable(Variable node) { return false; }
    @Override public Boolean visitBinaryOp(BinaryOp node) { return any(node.left(), node.right()); }
    @Override public Boolean visitUnaryOp(UnaryOp node) { return node.operand().accept(this); }
    @Override public Boolean visitLiteral(Literal node) { return false; }
    @Override public Boolean visitListLiteral(ListLiteral node) { return any(node.elements()); }

    @Override
    public Boolean visitDictLiteral(DictLiteral node) {
        for (DictEntry e : node.entries()) {
            if (any(e.key(), e.value())) return true;
        }
        return false;
    }

    @Override
    public Boolean visitIfStatement(IfStatement node) {
        return node.condition().accept(this) || any(node.thenBody()) || any(node.elseBody());
    }

    @Override
    public Boolean visitWhileLoop(WhileLoop node) {
        return node.condition().accept(this) || any(node.body());
    }

    @Override
    public Boolean visitForLoop(ForLoop node) {
        return node.iterable().accept(this) || any(node.body());
    }

    @Override
    public Boolean visitReturnStatement(ReturnStatement node) {
        return node.value() != null && node.value().accept(this);
    }

    @Override
    public Boolean visitFunctionCall(FunctionCall node) {
        if (name.equals(node.calleeName())) return true;
        return node.callee().accept(this) || any(node.arguments());
    }

    @Override public Boolean visitMemberAccess(MemberAccess node) { return node.object().accept(this); }
    @Override public Boolean visitIndexAccess(IndexAccess node) { return any(node.object(), node.index()); }
}
