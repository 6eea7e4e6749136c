package com.ethica.lang.analysis;

import com.ethica.lang.parser.Ast;
import com.ethica.lang.parser.Ast.Annotation;
import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.BinaryOp;
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
 * Nesting depth of an expression: literal and variable 1, operators one more
 * than their deepest operand, a call two more than its deepest argument,
 * member and index access one more than the object, collection literals 2.
 * Statements count as 1.
 */
final class ExpressionDepth implements Ast.Visitor<Integer> {
    private static final ExpressionDepth INSTANCE = new ExpressionDepth();

    private ExpressionDepth() {}

    static int of(Node node) {
        return (node == null) ? 0 : node.accept(INSTANCE);
    }

    @Override public Integer visitLiteral(Literal node) { return 1; }
    @Override public Integer visitVariable(Variable node) { return 1; }
    @Override public Integer visitBinaryOp(BinaryOp node) { return 1 + Math.max(of(node.left()), of(node.right())); }
    @Override public Integer visitUnaryOp(UnaryOp node) { return 1 + of(node.operand()); }

    @Override
    public Integer visitFunctionCall(FunctionCall node) {
        int deepest = 0;
        for (Node arg : node.arguments()) deepest = Math.max(deepest, of(arg));
        return 2 + deepest;
    }

    @Override public Integer visitMemberAccess(MemberAccess node) { return 1 + of(node.object()); }
    @Override public Integer visitIndexAccess(IndexAccess node) { return 1 + of(node.object()); }
    @Override public Integer visitListLiteral(ListLiteral node) { return 2; }
    @Override public Integer visitDictLiteral(DictLiteral node) { return 2; }

    @Override public Integer visitProgram(Program node) { return 1; }
    @Override public Integer visitFunctionDef(FunctionDef node) { return 1; }
    @Override public Integer visitAnnotation(Annotation node) { return 1; }
    @Override public Integer visitAssignment(Assignment node) { return 1; }
    @Override public Integer visitIfStatement(IfStatement node) { return 1; }
    @Override public Integer visitWhileLoop(WhileLoop node) { return 1; }
    @Override public Integer visitForLoop(ForLoop node) { return 1; }
    @Override public Integer visitReturnStatement(ReturnStatement node) { return 1; }
}
