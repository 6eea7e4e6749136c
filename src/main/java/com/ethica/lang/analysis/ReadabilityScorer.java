package com.ethica.lang.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.BinaryOp;
import com.ethica.lang.parser.Ast.ForLoop;
import com.ethica.lang.parser.Ast.FunctionDef;
import com.ethica.lang.parser.Ast.IfStatement;
import com.ethica.lang.parser.Ast.Node;
import com.ethica.lang.parser.Ast.WhileLoop;

/**
 * Scores a program 0..100 from four sub-scores: cyclomatic complexity,
 * nesting depth, longest function and naming quality, weighted
 * 0.30 / 0.25 / 0.20 / 0.25. The pass fails when the rounded overall score is
 * below the configured minimum.
 */
public class ReadabilityScorer extends AnalysisPass {
    private static final double WEIGHT_COMPLEXITY = 0.30;
    private static final double WEIGHT_NESTING = 0.25;
    private static final double WEIGHT_LENGTH = 0.20;
    private static final double WEIGHT_NAMING = 0.25;
    private static final double POOR_NAMING_BELOW = 70;
    private static final Pattern SNAKE_CASE = Pattern.compile("^[a-z][a-z0-9_]*$");

    private final ReadabilityConfig config;

    private int complexity;
    private int nesting;
    private int maxNesting;
    private final List<String> names = new ArrayList<>();
    private final Map<String, Map<String, Object>> functionStats = new LinkedHashMap<>();

    public ReadabilityScorer(ReadabilityConfig config) {
        super(PassName.READABILITY, config.strict());
        this.config = config;
    }

    @Override
    protected void reset() {
        complexity = 0;
        nesting = 0;
        maxNesting = 0;
        names.clear();
        functionStats.clear();
    }

    // -------------------------
    // Walk
    // -------------------------

    @Override
    public Walk visitFunctionDef(FunctionDef node) {
        int outerComplexity = complexity;
        int outerNesting = nesting;
        int outerMaxNesting = maxNesting;

        complexity = 1;
        nesting = 0;
        maxNesting = 0;

        Walk w = enterFunction(node);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("length", countStatements(node.body()));
        stats.put("complexity", complexity);
        stats.put("max_nesting", maxNesting);
        functionStats.put(node.name(), stats);

        complexity = outerComplexity + complexity;
        maxNesting = Math.max(outerMaxNesting, maxNesting);
        nesting = outerNesting;
        return w;
    }

    @Override
    public Walk visitAssignment(Assignment node) {
        names.add(node.name());
        return walk(node.value());
    }

    @Override
    public Walk visitBinaryOp(BinaryOp node) {
        if (node.operator().isLogical()) complexity++;
        return super.visitBinaryOp(node);
    }

    @Override
    public Walk visitIfStatement(IfStatement node) {
        complexity++;
        if (node.hasElse()) complexity++;
        enterNesting();
        try {
            return super.visitIfStatement(node);
        } finally {
            nesting--;
        }
    }

    @Override
    public Walk visitWhileLoop(WhileLoop node) {
        complexity++;
        enterNesting();
        try {
            return super.visitWhileLoop(node);
        } finally {
            nesting--;
        }
    }

    @Override
    public Walk visitForLoop(ForLoop node) {
        complexity++;
        names.add(node.variable());
        enterNesting();
        try {
            return super.visitForLoop(node);
        } finally {
            nesting--;
        }
    }

    private void enterNesting() {
        nesting++;
        maxNesting = Math.max(maxNesting, nesting);
    }

    /** Statements in a body, counting those nested in compound statements too. */
    static int countStatements(List<Node> statements) {
        int count = 0;
        for (Node stmt : statements) {
            count++;
            if (stmt instanceof IfStatement) {
                IfStatement s = (IfStatement) stmt;
                count += countStatements(s.thenBody()) + countStatements(s.elseBody());
            } else if (stmt instanceof WhileLoop) {
                count += countStatements(((WhileLoop) stmt).body());
            } else if (stmt instanceof ForLoop) {
                count += countStatements(((ForLoop) stmt).body());
            }
        }
        return count;
    }

    // -------------------------
    // Scoring
    // -------------------------

    @Override
    protected void finish(Map<String, Object> metrics) {
        currentFunction = null;

        double complexityScore = 100;
        if (complexity > config.maxComplexity()) {
            complexityScore = Math.max(0, 100 - Math.min(50, (complexity - config.maxComplexity()) * 5));
            append(ViolationKind.HIGH_COMPLEXITY,
                    "Cyclomatic complexity (" + complexity + ") exceeds recommended maximum (" + config.maxComplexity() + ")",
                    details("complexity", complexity));
        }

        double nestingScore = 100;
        if (maxNesting > config.maxNestingDepth()) {
            nestingScore = Math.max(0, 100 - (maxNesting - config.maxNestingDepth()) * 15);
            append(ViolationKind.DEEP_NESTING,
                    "Maximum nesting depth (" + maxNesting + ") exceeds recommended (" + config.maxNestingDepth() + ")",
                    details("depth", maxNesting));
        }

        double lengthScore = 100;
        int longest = 0;
        List<String> longFunctions = new ArrayList<>();
        for (Map.Entry<String, Map<String, Object>> e : functionStats.entrySet()) {
            int length = (Integer) e.getValue().get("length");
            longest = Math.max(longest, length);
            if (length > config.maxFunctionLength()) longFunctions.add(e.getKey());
        }
        if (longest > config.maxFunctionLength()) {
            lengthScore = Math.max(0, 100 - Math.min(50, longest - config.maxFunctionLength()));
            append(ViolationKind.LONG_FUNCTION, "Functions too long: " + String.join(", ", longFunctions),
                    details("functions", longFunctions));
        }

        double namingScore = namingScore();
        if (namingScore < POOR_NAMING_BELOW) {
            append(ViolationKind.POOR_NAMING, "Variable names could be more descriptive",
                    details("score", namingScore));
        }

        double overall = round1(complexityScore * WEIGHT_COMPLEXITY
                + nestingScore * WEIGHT_NESTING
                + lengthScore * WEIGHT_LENGTH
                + namingScore * WEIGHT_NAMING);

        if (overall < config.minScore()) {
            append(ViolationKind.LOW_READABILITY,
                    "Readability score too low (" + overall + "/100). Minimum required: " + config.minScore() + "/100",
                    details("score", overall, "threshold", config.minScore()));
        }

        Map<String, Object> scores = new LinkedHashMap<>();
        scores.put("complexity", complexityScore);
        scores.put("nesting", nestingScore);
        scores.put("function_length", lengthScore);
        scores.put("naming", namingScore);

        metrics.put("overall_score", overall);
        metrics.put("min_score", config.minScore());
        metrics.put("scores", scores);
        metrics.put("complexity", complexity);
        metrics.put("max_nesting", maxNesting);
        metrics.put("function_stats", new LinkedHashMap<>(functionStats));
    }

    private double namingScore() {
        if (names.isEmpty()) return 100;

        Set<String> flagged = new LinkedHashSet<>();
        double total = 0;
        for (String name : names) {
            total += scoreName(name, flagged.add(name));
        }
        return total / names.size() * 100;
    }

    /** Scores one name 0..1; issues are reported only on its first occurrence. */
    private double scoreName(String name, boolean firstSeen) {
        double score = 1.0;

        if (name.length() < config.minNameLength()) {
            score -= 0.3;
            if (firstSeen) {
                append(ViolationKind.SHORT_VARIABLE_NAME,
                        "Variable name \"" + name + "\" is too short (< " + config.minNameLength() + " characters)",
                        details("variable", name));
            }
        } else if (name.length() > config.maxNameLength()) {
            score -= 0.2;
        }

        if (name.length() == 1 && config.exemptSingleLetters().indexOf(name.charAt(0)) < 0) {
            score -= 0.4;
        }

        if (config.placeholderNames().contains(name.toLowerCase(Locale.ROOT))) {
            score -= 0.5;
            if (firstSeen) {
                append(ViolationKind.NON_DESCRIPTIVE_NAME, "Variable name \"" + name + "\" is not descriptive",
                        details("variable", name));
            }
        }

        if (!SNAKE_CASE.matcher(name).matches()) score -= 0.1;

        if (name.length() >= 5 && name.indexOf('_') >= 0) score += 0.2;

        return Math.max(0.0, Math.min(1.0, score));
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
