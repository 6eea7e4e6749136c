package com.ethica.lang;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

import com.ethica.debug.Debug;
import com.ethica.lang.analysis.AnalysisConfig;
import com.ethica.lang.analysis.AnalysisReport;
import com.ethica.lang.analysis.StaticAnalysis;
import com.ethica.lang.parser.Ast.Program;
import com.ethica.lang.parser.Lexer;
import com.ethica.lang.parser.Parser;
import com.ethica.lang.parser.SyntaxException;
import com.ethica.lang.parser.Token;
import com.ethica.lang.parser.TokenizationException;
import com.ethica.lang.runtime.BuiltinFunction;
import com.ethica.lang.runtime.ExecutionException;
import com.ethica.lang.runtime.Interpreter;
import com.ethica.lang.runtime.Value;

/**
 * EthicaLang engine.
 *
 * Pipeline: tokenize, parse, run every enabled analysis pass, then execute
 * only when no pass reported a blocking violation.
 *
 * Usage:
 * <pre>
 *   EthicaLang engine = new EthicaLang();
 *   engine.registerFunction("now", args -> Value.integer(System.currentTimeMillis()));
 *   Value result = engine.run(source);
 * </pre>
 *
 * An engine instance holds only options; every run gets a fresh interpreter.
 */
public class EthicaLang {
    private static final String TAG = "ethica.engine";

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private Consumer<String> output = System.out::println;
    private int maxCallDepth = 512;
    private AnalysisConfig config = AnalysisConfig.defaults();

    public EthicaLang() {}

    public EthicaLang(AnalysisConfig config) {
        setConfig(config);
    }

    public void setOutput(Consumer<String> output) { this.output = Objects.requireNonNull(output, "output"); }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1");
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setConfig(AnalysisConfig config) { this.config = Objects.requireNonNull(config, "config"); }

    public AnalysisConfig getConfig() { return config; }

    /** Adds a host builtin visible to every program this engine runs. Replaces an existing one. */
    public void registerFunction(String name, BuiltinFunction fn) {
        functions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(fn, "fn"));
    }

    // -------------------------
    // Stages
    // -------------------------

    public List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public Program parse(List<Token> tokens) {
        return new Parser(tokens).parse();
    }

    public Program parse(String source) {
        return parse(tokenize(source));
    }

    public List<AnalysisReport> analyze(Program program, AnalysisConfig config) {
        return StaticAnalysis.run(program, config);
    }

    public List<AnalysisReport> analyze(Program program) {
        return analyze(program, config);
    }

    /**
     * Tokenizes, parses and analyzes. Lexical and syntax faults are captured in
     * the result rather than thrown.
     */
    public CompilationResult compile(String source, AnalysisConfig config) {
        Debug.get().d(TAG, "tokenize");
        List<Token> tokens;
        try {
            tokens = tokenize(source);
        } catch (TokenizationException e) {
            Debug.get().e(TAG, "tokenization failed: " + e.getMessage());
            return CompilationResult.failed(CompilationResult.Stage.TOKENIZE, null, e);
        }

        Debug.get().d(TAG, "parse " + tokens.size() + " token(s)");
        Program program;
        try {
            program = parse(tokens);
        } catch (SyntaxException e) {
            Debug.get().e(TAG, "parse failed: " + e.getMessage());
            return CompilationResult.failed(CompilationResult.Stage.PARSE, tokens, e);
        }

        Debug.get().d(TAG, "analyze " + program.statements().size() + " top-level statement(s)");
        CompilationResult result = CompilationResult.analyzed(tokens, program, analyze(program, config));
        Debug.get().d(TAG, "compile finished: " + result);
        return result;
    }

    public CompilationResult compile(String source) {
        return compile(source, config);
    }

    /** Executes a program without analyzing it. */
    public Value execute(Program program) {
        Debug.get().d(TAG, "execute");
        Interpreter interpreter = new Interpreter(output, maxCallDepth, functions);
        try {
            return interpreter.execute(program);
        } catch (ExecutionException e) {
            Debug.get().e(TAG, "execution failed: " + e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Compiles then executes.
     *
     * @throws TokenizationException on a lexical fault
     * @throws SyntaxException on a grammar fault
     * @throws PolicyBlockedException when an enabled pass reported a blocking violation
     * @throws ExecutionException on a runtime fault
     */
    public Value run(String source) {
        return run(source, config);
    }

    public Value run(String source, AnalysisConfig config) {
        CompilationResult result = compile(source, config);
        if (result.hasFault()) throw result.fault;
        if (result.isBlocked()) {
            Debug.get().w(TAG, "execution blocked: " + result.blockingViolations());
            throw new PolicyBlockedException(result);
        }
        return execute(result.program);
    }
}
