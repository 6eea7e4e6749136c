package com.ethica.lang;

import java.util.ArrayList;
import java.util.List;

import com.ethica.lang.analysis.AnalysisReport;
import com.ethica.lang.analysis.StaticAnalysis;
import com.ethica.lang.analysis.Violation;
import com.ethica.lang.parser.Ast.Program;
import com.ethica.lang.parser.Token;

/**
 * Outcome of compiling a source text: how far the pipeline got, what it
 * produced on the way, and every analysis report.
 */
public final class CompilationResult {

    public enum Stage { TOKENIZE, PARSE, ANALYZE, COMPLETE }

    /** Last stage reached. A fault leaves this at the stage that failed. */
    public final Stage stage;
    public final List<Token> tokens;
    /** Null when parsing did not complete. */
    public final Program program;
    public final List<AnalysisReport> reports;
    /** Tokenization or syntax fault, or null. */
    public final EthicaException fault;

    private CompilationResult(Stage stage, List<Token> tokens, Program program,
                              List<AnalysisReport> reports, EthicaException fault) {
        this.stage = stage;
        this.tokens = (tokens == null) ? List.of() : List.copyOf(tokens);
        this.program = program;
        this.reports = (reports == null) ? List.of() : List.copyOf(reports);
        this.fault = fault;
    }

    static CompilationResult failed(Stage stage, List<Token> tokens, EthicaException fault) {
        return new CompilationResult(stage, tokens, null, null, fault);
    }

    static CompilationResult analyzed(List<Token> tokens, Program program, List<AnalysisReport> reports) {
        return new CompilationResult(Stage.COMPLETE, tokens, program, reports, null);
    }

    public boolean hasFault() {
        return fault != null;
    }

    /** True when some enabled pass reported a blocking violation. */
    public boolean isBlocked() {
        return StaticAnalysis.blocked(reports);
    }

    /** True when the program may be executed. */
    public boolean isSuccess() {
        return fault == null && !isBlocked();
    }

    public List<Violation> blockingViolations() {
        List<Violation> out = new ArrayList<>();
        for (AnalysisReport r : reports) out.addAll(r.blockingViolations());
        return out;
    }

    public List<Violation> allViolations() {
        List<Violation> out = new ArrayList<>();
        for (AnalysisReport r : reports) out.addAll(r.violations);
        return out;
    }

    @Override
    public String toString() {
        if (fault != null) return "failed at " + stage + ": " + fault.getMessage();
        return isBlocked()
                ? "blocked by " + blockingViolations().size() + " violation(s)"
                : "compiled";
    }
}
