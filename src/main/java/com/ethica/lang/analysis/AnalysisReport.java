package com.ethica.lang.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one analysis pass: whether it passed, every violation in the
 * order found, and pass-specific metrics.
 */
public final class AnalysisReport {
    public final PassName pass;
    public final boolean passed;
    public final List<Violation> violations;
    public final Map<String, Object> metrics;

    public AnalysisReport(PassName pass, List<Violation> violations, Map<String, Object> metrics) {
        this.pass = pass;
        this.violations = List.copyOf(violations);
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        this.passed = this.violations.stream().noneMatch(Violation::isBlocking);
    }

    public List<Violation> blockingViolations() {
        List<Violation> out = new ArrayList<>();
        for (Violation v : violations) {
            if (v.isBlocking()) out.add(v);
        }
        return out;
    }

    public List<Violation> violationsOf(ViolationKind kind) {
        List<Violation> out = new ArrayList<>();
        for (Violation v : violations) {
            if (v.kind == kind) out.add(v);
        }
        return out;
    }

    public Object metric(String name) {
        return metrics.get(name);
    }

    public long metricLong(String name) {
        Object v = metrics.get(name);
        if (!(v instanceof Number)) throw new IllegalArgumentException("No numeric metric '" + name + "'");
        return ((Number) v).longValue();
    }

    public double metricDouble(String name) {
        Object v = metrics.get(name);
        if (!(v instanceof Number)) throw new IllegalArgumentException("No numeric metric '" + name + "'");
        return ((Number) v).doubleValue();
    }

    @Override
    public String toString() {
        return pass + (passed ? " passed" : " failed") + " with " + violations.size() + " violation(s)";
    }
}
