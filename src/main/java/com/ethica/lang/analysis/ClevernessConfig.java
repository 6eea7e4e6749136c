package com.ethica.lang.analysis;

import java.util.Set;

/** Settings for {@link ClevernessDetector}. */
public final class ClevernessConfig {
    private final boolean enabled;
    private final boolean strict;
    private final int maxChainingDepth;
    private final int maxExpressionDepth;
    private final int maxBinaryOpsPerStatement;
    private final int maxFunctionArgs;
    private final int maxConditionDepth;
    private final int maxIterableDepth;
    private final int maxListElementDepth;
    private final double magicNumberLimit;
    private final Set<Double> allowedNumbers;

    public ClevernessConfig(boolean enabled, boolean strict, int maxChainingDepth, int maxExpressionDepth,
                            int maxBinaryOpsPerStatement, int maxFunctionArgs, int maxConditionDepth,
                            int maxIterableDepth, int maxListElementDepth, double magicNumberLimit,
                            Set<Double> allowedNumbers) {
        if (maxChainingDepth < 1 || maxExpressionDepth < 1 || maxFunctionArgs < 0) {
            throw new IllegalArgumentException("cleverness thresholds must be positive");
        }
        this.enabled = enabled;
        this.strict = strict;
        this.maxChainingDepth = maxChainingDepth;
        this.maxExpressionDepth = maxExpressionDepth;
        this.maxBinaryOpsPerStatement = maxBinaryOpsPerStatement;
        this.maxFunctionArgs = maxFunctionArgs;
        this.maxConditionDepth = maxConditionDepth;
        this.maxIterableDepth = maxIterableDepth;
        this.maxListElementDepth = maxListElementDepth;
        this.magicNumberLimit = magicNumberLimit;
        this.allowedNumbers = Set.copyOf(allowedNumbers);
    }

    public static ClevernessConfig defaults() {
        return new ClevernessConfig(true, true, 3, 4, 5, 5, 3, 2, 3, 10,
                Set.of(100.0, 1000.0, 24.0, 60.0, 365.0));
    }

    public boolean enabled() { return enabled; }
    public boolean strict() { return strict; }
    public int maxChainingDepth() { return maxChainingDepth; }
    public int maxExpressionDepth() { return maxExpressionDepth; }
    public int maxBinaryOpsPerStatement() { return maxBinaryOpsPerStatement; }
    public int maxFunctionArgs() { return maxFunctionArgs; }
    public int maxConditionDepth() { return maxConditionDepth; }
    public int maxIterableDepth() { return maxIterableDepth; }
    public int maxListElementDepth() { return maxListElementDepth; }

    /** Numeric literals with absolute value above this are magic unless allowed. */
    public double magicNumberLimit() { return magicNumberLimit; }

    /** Well-known constants never reported as magic. */
    public Set<Double> allowedNumbers() { return allowedNumbers; }

    public ClevernessConfig withEnabled(boolean on) {
        return new ClevernessConfig(on, strict, maxChainingDepth, maxExpressionDepth, maxBinaryOpsPerStatement,
                maxFunctionArgs, maxConditionDepth, maxIterableDepth, maxListElementDepth, magicNumberLimit,
                allowedNumbers);
    }

    public ClevernessConfig withStrict(boolean on) {
        return new ClevernessConfig(enabled, on, maxChainingDepth, maxExpressionDepth, maxBinaryOpsPerStatement,
                maxFunctionArgs, maxConditionDepth, maxIterableDepth, maxListElementDepth, magicNumberLimit,
                allowedNumbers);
    }
}
