package com.ethica.lang.analysis;

import java.util.Map;

import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.BinaryOp;
import com.ethica.lang.parser.Ast.ForLoop;
import com.ethica.lang.parser.Ast.FunctionCall;
import com.ethica.lang.parser.Ast.FunctionDef;
import com.ethica.lang.parser.Ast.IfStatement;
import com.ethica.lang.parser.Ast.ListLiteral;
import com.ethica.lang.parser.Ast.Literal;
import com.ethica.lang.parser.Ast.MemberAccess;
import com.ethica.lang.parser.Ast.Node;
import com.ethica.lang.parser.Ast.ReturnStatement;
import com.ethica.lang.parser.Ast.WhileLoop;

/**
 * Flags code that trades clarity for brevity: deep or dense expressions,
 * chained comparisons, bitwise tricks, long call chains, wide signatures and
 * unexplained numeric constants.
 */
public class ClevernessDetector extends AnalysisPass {

    private final ClevernessConfig config;

    private int chainingDepth;
    private int binaryOps;
    private int deepestExpression;

    public ClevernessDetector(ClevernessConfig config) {
        super(PassName.CLEVERNESS, config.strict());
        this.config = config;
    }

    @Override
    protected void reset() {
        chainingDepth = 0;
        binaryOps = 0;
        deepestExpression = 0;
    }

    @Override
    protected void finish(Map<String, Object> metrics) {
        metrics.put("strict_mode", isStrict());
        metrics.put("violation_count", violations().size());
        metrics.put("max_expression_depth", deepestExpression);
    }

    private int depthOf(Node expr) {
        int d = ExpressionDepth.of(expr);
        deepestExpression = Math.max(deepestExpression, d);
        return d;
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    protected Walk statement(Node stmt) {
        if (stmt instanceof FunctionDef || stmt instanceof IfStatement
                || stmt instanceof WhileLoop || stmt instanceof ForLoop) {
            return walk(stmt);
        }

        int outer = binaryOps;
        binaryOps = 0;
        try {
            if (walk(stmt).halted()) return Walk.HALT;
            if (binaryOps > config.maxBinaryOpsPerStatement()) {
                String subject = (stmt instanceof Assignment)
                        ? "Assignment to \"" + ((Assignment) stmt).name() + "\""
                        : "Statement";
                return report(ViolationKind.DENSE_EXPRESSION,
                        subject + " has too many operations (" + binaryOps + " operators)",
                        details("operator_count", binaryOps));
            }
            return Walk.CONTINUE;
        } finally {
            binaryOps = outer;
        }
    }

    @Override
    public Walk visitFunctionDef(FunctionDef node) {
        String outer = currentFunction;
        currentFunction = node.name();
        try {
            int params = node.parameters().size();
            if (params > config.maxFunctionArgs()) {
                Walk w = report(ViolationKind.TOO_MANY_PARAMETERS,
                        "Function \"" + node.name() + "\" has " + params + " parameters (maximum: " + config.maxFunctionArgs() + ")",
                        details("parameter_count", params));
                if (w.halted()) return w;
            }

            if (node.body().size() == 1 && node.body().get(0) instanceof ReturnStatement) {
                Node value = ((ReturnStatement) node.body().get(0)).value();
                int depth = depthOf(value);
                if (value != null && depth > config.maxExpressionDepth()) {
                    Walk w = report(ViolationKind.COMPLEX_ONE_LINER,
                            "Function \"" + node.name() + "\" is a complex one-liner (expression depth: " + depth + ")",
                            details("expression_depth", depth));
                    if (w.halted()) return w;
                }
            }
        } finally {
            currentFunction = outer;
        }
        return enterFunction(node);
    }

    @Override
    public Walk visitAssignment(Assignment node) {
        int depth = depthOf(node.value());
        if (depth > config.maxExpressionDepth()) {
            Walk w = report(ViolationKind.COMPLEX_ASSIGNMENT,
                    "Assignment to \"" + node.name() + "\" has overly complex expression (depth: " + depth + ")",
                    details("variable", node.name(), "depth", depth));
            if (w.halted()) return w;
        }
        return walk(node.value());
    }

    @Override
    public Walk visitIfStatement(IfStatement node) {
        int depth = depthOf(node.condition());
        if (depth > config.maxConditionDepth()) {
            Walk w = report(ViolationKind.COMPLEX_CONDITION,
                    "If statement has overly complex condition (depth: " + depth + ")", details("depth", depth));
            if (w.halted()) return w;
        }
        return super.visitIfStatement(node);
    }

    @Override
    public Walk visitWhileLoop(WhileLoop node) {
        int depth = depthOf(node.condition());
        if (depth > config.maxConditionDepth()) {
            Walk w = report(ViolationKind.COMPLEX_LOOP_CONDITION,
                    "While loop has overly complex condition (depth: " + depth + ")", details("depth", depth));
            if (w.halted()) return w;
        }
        return super.visitWhileLoop(node);
    }

    @Override
    public Walk visitForLoop(ForLoop node) {
        int depth = depthOf(node.iterable());
        if (depth > config.maxIterableDepth()) {
            Walk w = report(ViolationKind.COMPLEX_ITERABLE,
                    "For loop iterates over complex expression (depth: " + depth + ")", details("depth", depth));
            if (w.halted()) return w;
        }
        return super.visitForLoop(node);
    }

    @Override
    public Walk visitReturnStatement(ReturnStatement node) {
        if (node.value() == null) return Walk.CONTINUE;
        int depth = depthOf(node.value());
        if (depth > config.maxExpressionDepth()) {
            Walk w = report(ViolationKind.COMPLEX_RETURN,
                    "Return statement has overly complex expression (depth: " + depth + ")", details("depth", depth));
            if (w.halted()) return w;
        }
        return walk(node.value());
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Walk visitBinaryOp(BinaryOp node) {
        binaryOps++;

        if (node.operator().isComparison() && node.left() instanceof BinaryOp
                && ((BinaryOp) node.left()).operator().isComparison()) {
            Walk w = report(ViolationKind.CHAINED_COMPARISONS, "Chained comparison operators can be confusing",
                    details("operator", node.operator().symbol));
            if (w.halted()) return w;
        }

        if (node.operator().isBitwise()) {
            Walk w = report(ViolationKind.BITWISE_OPERATION, "Bitwise operations can be hard to understand",
                    details("operator", node.operator().symbol));
            if (w.halted()) return w;
        }
        return super.visitBinaryOp(node);
    }

    @Override
    public Walk visitLiteral(Literal node) {
        if (!node.isNumeric()) return Walk.CONTINUE;

        double v = ((Number) node.value()).doubleValue();
        if (Math.abs(v) > config.magicNumberLimit() && !config.allowedNumbers().contains(v)) {
            return report(ViolationKind.MAGIC_NUMBER, "Magic number " + node.value() + " used without explanation",
                    details("value", node.value()));
        }
        return Walk.CONTINUE;
    }

    @Override
    public Walk visitListLiteral(ListLiteral node) {
        if (!node.elements().isEmpty()) {
            double sum = 0;
            for (Node e : node.elements()) sum += depthOf(e);
            double average = sum / node.elements().size();
            if (average > config.maxListElementDepth()) {
                Walk w = report(ViolationKind.COMPLEX_LIST_LITERAL, "List literal contains complex expressions",
                        details("element_count", node.elements().size()));
                if (w.halted()) return w;
            }
        }
        return super.visitListLiteral(node);
    }

    @Override
    public Walk visitFunctionCall(FunctionCall node) {
        int args = node.arguments().size();
        if (args > config.maxFunctionArgs()) {
            String name = (node.calleeName() != null) ? node.calleeName() : "function";
            Walk w = report(ViolationKind.TOO_MANY_ARGUMENTS,
                    "Call to " + name + " has " + args + " arguments (maximum: " + config.maxFunctionArgs() + ")",
                    details("argument_count", args));
            if (w.halted()) return w;
        }

        chainingDepth++;
        try {
            if (chainingDepth > config.maxChainingDepth()) {
                Walk w = report(ViolationKind.EXCESSIVE_CHAINING,
                        "Excessive function chaining detected (depth: " + chainingDepth + ")",
                        details("chaining_depth", chainingDepth));
                if (w.halted()) return w;
            }
            return super.visitFunctionCall(node);
        } finally {
            chainingDepth--;
        }
    }

    @Override
    public Walk visitMemberAccess(MemberAccess node) {
        chainingDepth++;
        try {
            if (chainingDepth > config.maxChainingDepth()) {
                Walk w = report(ViolationKind.EXCESSIVE_MEMBER_CHAINING,
                        "Excessive member access chaining detected (depth: " + chainingDepth + ")",
                        details("chaining_depth", chainingDepth));
                if (w.halted()) return w;
            }
            return super.visitMemberAccess(node);
        } finally {
            chainingDepth--;
        }
    }
}
