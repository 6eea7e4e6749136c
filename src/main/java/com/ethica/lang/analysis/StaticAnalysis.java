package com.ethica.lang.analysis;

import java.util.ArrayList;
import java.util.List;

import com.ethica.debug.Debug;
import com.ethica.lang.parser.Ast.Program;

/**
 * Runs the enabled passes in their fixed order (energy, ethics, readability,
 * cleverness). Each runs to completion whatever the earlier ones found.
 */
public final class StaticAnalysis {
    private static final String TAG = "ethica.analysis";

    private StaticAnalysis() {}

    public static List<AnalysisReport> run(Program program, AnalysisConfig config) {
        List<AnalysisReport> reports = new ArrayList<>();
        for (AnalysisPass pass : passes(config)) {
            reports.add(pass.analyze(program));
        }
        Debug.get().d(TAG, "ran " + reports.size() + " pass(es), blocked=" + blocked(reports));
        return reports;
    }

    /** The enabled passes for a configuration, in run order. */
    public static List<AnalysisPass> passes(AnalysisConfig config) {
        List<AnalysisPass> out = new ArrayList<>(4);
        if (config.energy().enabled()) out.add(new EnergyAnalyzer(config.energy()));
        if (config.ethics().enabled()) out.add(new EthicsChecker(config.ethics()));
        if (config.readability().enabled()) out.add(new ReadabilityScorer(config.readability()));
        if (config.cleverness().enabled()) out.add(new ClevernessDetector(config.cleverness()));
        return out;
    }

    public static boolean blocked(List<AnalysisReport> reports) {
        for (AnalysisReport r : reports) {
            if (!r.passed) return true;
        }
        return false;
    }
}
