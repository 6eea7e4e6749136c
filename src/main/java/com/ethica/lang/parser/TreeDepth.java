package com.ethica.lang.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

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
 * Height of a syntax tree, measured without recursion so that arbitrarily
 * deep trees can be measured. The visitor only lists a node's children.
 */
final class TreeDepth implements Ast.Visitor<List<Node>> {
    private static final TreeDepth CHILDREN = new TreeDepth();

    private TreeDepth() {}

    /** Nodes on the longest root-to-leaf path; a leaf alone is 1. */
    static int of(Node root) {
        int max = 0;
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);
        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int depth = depths.pop();
            max = Math.max(max, depth);
            for (Node child : node.accept(CHILDREN)) {
                if (child == null) continue;
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return max;
    }

    private static List<Node> join(List<? extends Node> first, List<Node> second) {
        List<Node> out = new ArrayList<>(first.size() + second.size());
        out.addAll(first);
        out.addAll(second);
        return out;
    }

    @Override public List<Node> visitProgram(Program node) { return node.statements(); }
    @Override public List<Node> visitFunctionDef(FunctionDef node) { return join(node.annotations(), node.body()); }
    @Override public List<Node> visitAnnotation(Annotation node) { return node.arguments(); }
    @Override public List<Node> visitAssignment(Assignment node) { return List.of(node.value()); }
    @Override public List<Node> visitVariable(Variable node) { return List.of(); }
    @Override public List<Node> visitLiteral(Literal node) { return List.of(); }
    @Override public List<Node> visitBinaryOp(BinaryOp node) { return List.of(node.left(), node.right()); }
    @Override public List<Node> visitUnaryOp(UnaryOp node) { return List.of(node.operand()); }
    @Override public List<Node> visitListLiteral(ListLiteral node) { return node.elements(); }
    @Override public List<Node> visitMemberAccess(MemberAccess node) { return List.of(node.object()); }
    @Override public List<Node> visitIndexAccess(IndexAccess node) { return List.of(node.object(), node.index()); }
    @Override public List<Node> visitWhileLoop(WhileLoop node) { return join(List.of(node.condition()), node.body()); }
    @Override public List<Node> visitForLoop(ForLoop node) { return join(List.of(node.iterable()), node.body()); }

    @Override
    public List<Node> visitDictLiteral(DictLiteral node) {
        List<Node> out = new ArrayList<>(node.entries().size() * 2);
        for (DictEntry e : node.entries()) {
            out.add(e.key());
            out.add(e.value());
        }
        return out;
    }

    @Override
    public List<Node> visitIfStatement(IfStatement node) {
        return join(join(List.of(node.condition()), node.thenBody()), node.elseBody());
    }

    @Override
    public List<Node> visitReturnStatement(ReturnStatement node) {
        // a bare return has no value
        return (node.value() == null) ? List.of() : List.of(node.value());
    }

    @Override
    public List<Node> visitFunctionCall(FunctionCall node) {
        return join(List.of(node.callee()), node.arguments());
    }
}
