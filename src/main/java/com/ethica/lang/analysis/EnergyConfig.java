package com.ethica.lang.analysis;

import java.util.Objects;

/** Settings for {@link EnergyAnalyzer}. */
public final class EnergyConfig {
    private final boolean enabled;
    private final boolean strict;
    private final long budget;
    private final CostTable costs;
    private final int assumedIterations;
    private final int maxNestingDepth;
    private final int recursionMultiplier;
    private final int conditionCost;
    private final int highIterationThreshold;

    public EnergyConfig(boolean enabled, boolean strict, long budget, CostTable costs,
                        int assumedIterations, int maxNestingDepth, int recursionMultiplier,
                        int conditionCost, int highIterationThreshold) {
        if (budget < 0) throw new IllegalArgumentException("energy budget must be >= 0, got " + budget);
        if (assumedIterations < 0) throw new IllegalArgumentException("assumedIterations must be >= 0");
        if (maxNestingDepth < 1) throw new IllegalArgumentException("maxNestingDepth must be >= 1");
        if (recursionMultiplier < 0) throw new IllegalArgumentException("recursionMultiplier must be >= 0");
        this.enabled = enabled;
        this.strict = strict;
        this.budget = budget;
        this.costs = Objects.requireNonNull(costs, "costs");
        this.assumedIterations = assumedIterations;
        this.maxNestingDepth = maxNestingDepth;
        this.recursionMultiplier = recursionMultiplier;
        this.conditionCost = conditionCost;
        this.highIterationThreshold = highIterationThreshold;
    }

    public static EnergyConfig defaults() {
        return new EnergyConfig(true, true, 1000, CostTable.defaults(), 100, 4, 10, 5, 200);
    }

    public boolean enabled() { return enabled; }
    public boolean strict() { return strict; }
    public long budget() { return budget; }
    public CostTable costs() { return costs; }

    /** Iteration estimate for while loops and for loops over a non-literal iterable. */
    public int assumedIterations() { return assumedIterations; }

    /** Loop depth above which excessive_nesting is reported. */
    public int maxNestingDepth() { return maxNestingDepth; }

    /** Factor applied to a self-recursive function's body cost. */
    public int recursionMultiplier() { return recursionMultiplier; }

    /** Fixed cost of evaluating an if condition. */
    public int conditionCost() { return conditionCost; }

    /** Loop multiplier above which a loop is reported as costly. */
    public int highIterationThreshold() { return highIterationThreshold; }

    public EnergyConfig withEnabled(boolean on) {
        return new EnergyConfig(on, strict, budget, costs, assumedIterations, maxNestingDepth,
                recursionMultiplier, conditionCost, highIterationThreshold);
    }

    public EnergyConfig withStrict(boolean on) {
        return new EnergyConfig(enabled, on, budget, costs, assumedIterations, maxNestingDepth,
                recursionMultiplier, conditionCost, highIterationThreshold);
    }

    public EnergyConfig withBudget(long newBudget) {
        return new EnergyConfig(enabled, strict, newBudget, costs, assumedIterations, maxNestingDepth,
                recursionMultiplier, conditionCost, highIterationThreshold);
    }
}
