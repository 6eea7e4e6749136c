package com.ethica.lang.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.ethica.debug.Debug;
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
 * Base for the static analysis passes: a fold over the tree where every visit
 * returns a {@link Walk} signal.
 *
 * The default visit methods simply walk children in source order and stop as
 * soon as one returns HALT. Subclasses override the node kinds they care about.
 * A violation is always recorded; in strict mode a blocking violation also
 * halts the rest of this pass's walk.
 *
 * Instances keep walk state and are not thread-safe; {@link #analyze} resets
 * them, so one instance may be reused sequentially.
 */
public abstract class AnalysisPass implements Ast.Visitor<Walk> {

    private final PassName name;
    private final boolean strict;
    private final List<Violation> violations = new ArrayList<>();

    /** Name of the function whose body is being walked, null at top level. */
    protected String currentFunction;

    protected AnalysisPass(PassName name, boolean strict) {
        this.name = name;
        this.strict = strict;
    }

    public PassName name() { return name; }

    public boolean isStrict() { return strict; }

    public final AnalysisReport analyze(Program program) {
        violations.clear();
        currentFunction = null;
        reset();

        String tag = "ethica.analysis." + name.id;
        Debug.get().d(tag, "walking program (" + (strict ? "strict" : "collect-all") + ")");

        Walk walk = program.accept(this);
        if (walk.halted()) Debug.get().d(tag, "walk halted early");

        Map<String, Object> metrics = new LinkedHashMap<>();
        finish(metrics);

        AnalysisReport report = new AnalysisReport(name, violations, metrics);
        for (Violation v : report.violations) {
            Debug.get().i(tag, v.toString());
        }
        return report;
    }

    /** Clears per-walk state before a new walk. */
    protected abstract void reset();

    /** Runs after the walk (complete or halted); may append final violations and must publish metrics. */
    protected abstract void finish(Map<String, Object> metrics);

    protected final Walk report(ViolationKind kind, String message, Map<String, Object> details) {
        violations.add(new Violation(kind, message, currentFunction, details));
        return Walk.of(strict && kind.blocking);
    }

    protected final Walk report(ViolationKind kind, String message) {
        return report(kind, message, null);
    }

    /** Appends without any halting effect; used once the walk is over. */
    protected final void append(ViolationKind kind, String message, Map<String, Object> details) {
        violations.add(new Violation(kind, message, currentFunction, details));
    }

    protected final List<Violation> violations() { return violations; }

    // -------------------------
    // Traversal helpers
    // -------------------------

    protected Walk walk(Node node) {
        return (node == null) ? Walk.CONTINUE : node.accept(this);
    }

    protected Walk walkAll(List<? extends Node> nodes) {
        for (Node n : nodes) {
            if (walk(n).halted()) return Walk.HALT;
        }
        return Walk.CONTINUE;
    }

    /** Walks a statement list; passes that inspect whole statements override {@link #statement}. */
    protected Walk walkBlock(List<Node> statements) {
        for (Node stmt : statements) {
            if (statement(stmt).halted()) return Walk.HALT;
        }
        return Walk.CONTINUE;
    }

    protected Walk statement(Node stmt) {
        return walk(stmt);
    }

    protected Walk enterFunction(FunctionDef node) {
        String previous = currentFunction;
        currentFunction = node.name();
        try {
            return walkBlock(node.body());
        } finally {
            currentFunction = previous;
        }
    }

    // -------------------------
    // Default traversal
    // -------------------------

    @Override
    public Walk visitProgram(Program node) {
        return walkBlock(node.statements());
    }

    @Override
    public Walk visitFunctionDef(FunctionDef node) {
        return enterFunction(node);
    }

    @Override
    public Walk visitAnnotation(Annotation node) {
        return Walk.CONTINUE;
    }

    @Override
    public Walk visitAssignment(Assignment node) {
        return walk(node.value());
    }

    @Override
    public Walk visitVariable(Variable node) {
        return Walk.CONTINUE;
    }

    @Override
    public Walk visitBinaryOp(BinaryOp node) {
        if (walk(node.left()).halted()) return Walk.HALT;
        return walk(node.right());
    }

    @Override
    public Walk visitUnaryOp(UnaryOp node) {
        return walk(node.operand());
    }

    @Override
    public Walk visitLiteral(Literal node) {
        return Walk.CONTINUE;
    }

    @Override
    public Walk visitListLiteral(ListLiteral node) {
        return walkAll(node.elements());
    }

    @Override
    public Walk visitDictLiteral(DictLiteral node) {
        for (DictEntry e : node.entries()) {
            if (walk(e.key()).halted() || walk(e.value()).halted()) return Walk.HALT;
        }
        return Walk.CONTINUE;
    }

    @Override
    public Walk visitIfStatement(IfStatement node) {
        if (walk(node.condition()).halted()) return Walk.HALT;
        if (walkBlock(node.thenBody()).halted()) return Walk.HALT;
        return walkBlock(node.elseBody());
    }

    @Override
    public Walk visitWhileLoop(WhileLoop node) {
        if (walk(node.condition()).halted()) return Walk.HALT;
        return walkBlock(node.body());
    }

    @Override
    public Walk visitForLoop(ForLoop node) {
        if (walk(node.iterable()).halted()) return Walk.HALT;
        return walkBlock(node.body());
    }

    @Override
    public Walk visitReturnStatement(ReturnStatement node) {
        return walk(node.value());
    }

    @Override
    public Walk visitFunctionCall(FunctionCall node) {
        if (walk(node.callee()).halted()) return Walk.HALT;
        return walkAll(node.arguments());
    }

    @Override
    public Walk visitMemberAccess(MemberAccess node) {
        return walk(node.object());
    }

    @Override
    public Walk visitIndexAccess(IndexAccess node) {
        if (walk(node.object()).halted()) return Walk.HALT;
        return walk(node.index());
    }

    protected static Map<String, Object> details(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }
}
