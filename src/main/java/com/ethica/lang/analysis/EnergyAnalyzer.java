package com.ethica.lang.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

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
import com.ethica.lang.parser.Ast.ReturnStatement;
import com.ethica.lang.parser.Ast.UnaryOp;
import com.ethica.lang.parser.Ast.Variable;
import com.ethica.lang.parser.Ast.WhileLoop;

/**
 * Static energy estimate.
 *
 * Every node adds its fixed cost to a running total. Conditionals cost their
 * condition plus the dearer branch; loops multiply their body by an iteration
 * estimate scaled by 2^(depth - 1); a function that calls itself by name is
 * charged its body cost again times the recursion multiplier. Crossing the
 * budget stops accumulation, and budget_exceeded always cites the total
 * reached so far.
 */
public class EnergyAnalyzer extends AnalysisPass {

    private final EnergyConfig config;
    private final CostTable costs;

    private long total;
    private int loopDepth;
    private final Map<String, Long> functionCosts = new LinkedHashMap<>();

    public EnergyAnalyzer(EnergyConfig config) {
        super(PassName.ENERGY, config.strict());
        this.config = config;
        this.costs = config.costs();
    }

    @Override
    protected void reset() {
        total = 0;
        loopDepth = 0;
        functionCosts.clear();
    }

    @Override
    protected void finish(Map<String, Object> metrics) {
        if (total > config.budget()) {
            append(ViolationKind.BUDGET_EXCEEDED,
                    "Energy budget exceeded: estimated cost = " + total + " units (limit = " + config.budget() + ")",
                    details("cost", total, "budget", config.budget()));
        }
        metrics.put("total_cost", total);
        metrics.put("budget", config.budget());
        metrics.put("within_budget", total <= config.budget());
        metrics.put("function_costs", new LinkedHashMap<>(functionCosts));
    }

    /** Adds to the running total; HALT once the budget has been crossed. */
    private Walk add(long cost) {
        total += cost;
        return Walk.of(total > config.budget());
    }

    // -------------------------
    // Functions
    // -------------------------

    @Override
    public Walk visitFunctionDef(FunctionDef node) {
        long start = total;
        if (enterFunction(node).halted()) return Walk.HALT;

        long bodyCost = total - start;
        functionCosts.put(node.name(), bodyCost);

        if (RecursionFinder.callsItself(node)) {
            long penalty = bodyCost * config.recursionMultiplier();
            String previous = currentFunction;
            currentFunction = node.name();
            Walk w = report(ViolationKind.RECURSION_DETECTED,
                    "Recursive function \"" + node.name() + "\" detected. Recursion adds significant energy cost.",
                    details("penalty", penalty));
            currentFunction = previous;
            if (w.halted()) return Walk.HALT;
            return add(penalty);
        }
        return Walk.CONTINUE;
    }

    // -------------------------
    // Control flow
    // -------------------------

    @Override
    public Walk visitIfStatement(IfStatement node) {
        if (add(config.conditionCost()).halted()) return Walk.HALT;
        if (walk(node.condition()).halted()) return Walk.HALT;

        // Branches are mutually exclusive: charge only the dearer one.
        long base = total;
        if (walkBlock(node.thenBody()).halted()) return Walk.HALT;
        long thenCost = total - base;

        total = base;
        if (walkBlock(node.elseBody()).halted()) return Walk.HALT;
        long elseCost = total - base;

        total = base;
        return add(Math.max(thenCost, elseCost));
    }

    @Override
    public Walk visitWhileLoop(WhileLoop node) {
        return loop(node.condition(), config.assumedIterations(), node.body(), ViolationKind.UNBOUNDED_LOOP, "While");
    }

    @Override
    public Walk visitForLoop(ForLoop node) {
        int iterations = (node.iterable() instanceof ListLiteral)
                ? ((ListLiteral) node.iterable()).elements().size()
                : config.assumedIterations();
        return loop(node.iterable(), iterations, node.body(), ViolationKind.HIGH_ITERATION_LOOP, "For");
    }

    private Walk loop(Node header, int iterations, List<Node> body, ViolationKind costlyKind, String label) {
        loopDepth++;
        try {
            if (loopDepth > config.maxNestingDepth()) {
                Walk w = report(ViolationKind.EXCESSIVE_NESTING,
                        "Loop nesting depth (" + loopDepth + ") exceeds maximum (" + config.maxNestingDepth() + ")",
                        details("depth", loopDepth));
                if (w.halted()) return Walk.HALT;
            }

            if (walk(header).halted()) return Walk.HALT;

            long multiplier = (long) iterations << (loopDepth - 1);
            long base = total;
            if (walkBlock(body).halted()) return Walk.HALT;
            long bodyCost = total - base;

            // the body has been charged once already
            if (bodyCost > 0 && add(bodyCost * (multiplier - 1)).halted()) return Walk.HALT;

            if (multiplier > config.highIterationThreshold()) {
                return report(costlyKind,
                        label + " loop with nesting depth " + loopDepth + " has high estimated cost",
                        details("estimated_iterations", multiplier));
            }
            return Walk.CONTINUE;
        } finally {
            loopDepth--;
        }
    }

    @Override
    public Walk visitReturnStatement(ReturnStatement node) {
        if (add(costs.returnStatement()).halted()) return Walk.HALT;
        return walk(node.value());
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Walk visitAssignment(Assignment node) {
        if (add(costs.assignment()).halted()) return Walk.HALT;
        return walk(node.value());
    }

    @Override
    public Walk visitVariable(Variable node) {
        return add(costs.variable());
    }

    @Override
    public Walk visitLiteral(Literal node) {
        return add(costs.literal());
    }

    @Override
    public Walk visitBinaryOp(BinaryOp node) {
        if (add(costs.binaryOp()).halted()) return Walk.HALT;
        return super.visitBinaryOp(node);
    }

    @Override
    public Walk visitUnaryOp(UnaryOp node) {
        if (add(costs.unaryOp()).halted()) return Walk.HALT;
        return walk(node.operand());
    }

    @Override
    public Walk visitListLiteral(ListLiteral node) {
        if (add((long) costs.listElement() * node.elements().size()).halted()) return Walk.HALT;
        return walkAll(node.elements());
    }

    @Override
    public Walk visitDictLiteral(DictLiteral node) {
        if (add((long) costs.dictPair() * node.entries().size()).halted()) return Walk.HALT;
        return super.visitDictLiteral(node);
    }

    @Override
    public Walk visitFunctionCall(FunctionCall node) {
        if (add(costs.call()).halted()) return Walk.HALT;
        if (walk(node.callee()).halted()) return Walk.HALT;
        if (walkAll(node.arguments()).halted()) return Walk.HALT;

        String callee = node.calleeName();

        if (callee != null && functionCosts.containsKey(callee)) {
            return add(functionCosts.get(callee));
        }
        return Walk.CONTINUE;
    }

    @Override
    public Walk visitMemberAccess(MemberAccess node) {
        if (add(costs.memberAccess()).halted()) return Walk.HALT;
        return walk(node.object());
    }

    @Override
    public Walk visitIndexAccess(IndexAccess node) {
        if (add(costs.indexAccess()).halted()) return Walk.HALT;
        return super.visitIndexAccess(node);
    }
}
