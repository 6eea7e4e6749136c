package com.ethica.lang.analysis;

import java.util.Objects;
import java.util.Set;

/** Settings for {@link ReadabilityScorer}. */
public final class ReadabilityConfig {
    private final boolean enabled;
    private final boolean strict;
    private final double minScore;
    private final int maxComplexity;
    private final int maxNestingDepth;
    private final int maxFunctionLength;
    private final int minNameLength;
    private final int maxNameLength;
    private final String exemptSingleLetters;
    private final Set<String> placeholderNames;

    public ReadabilityConfig(boolean enabled, boolean strict, double minScore,
                             int maxComplexity, int maxNestingDepth, int maxFunctionLength,
                             int minNameLength, int maxNameLength,
                             String exemptSingleLetters, Set<String> placeholderNames) {
        if (minScore < 0 || minScore > 100) {
            throw new IllegalArgumentException("readability minScore must be within 0..100, got " + minScore);
        }
        if (maxComplexity < 1 || maxNestingDepth < 1 || maxFunctionLength < 1) {
            throw new IllegalArgumentException("readability thresholds must be >= 1");
        }
        this.enabled = enabled;
        this.strict = strict;
        this.minScore = minScore;
        this.maxComplexity = maxComplexity;
        this.maxNestingDepth = maxNestingDepth;
        this.maxFunctionLength = maxFunctionLength;
        this.minNameLength = minNameLength;
        this.maxNameLength = maxNameLength;
        this.exemptSingleLetters = Objects.requireNonNull(exemptSingleLetters, "exemptSingleLetters");
        this.placeholderNames = Set.copyOf(placeholderNames);
    }

    public static ReadabilityConfig defaults() {
        return new ReadabilityConfig(true, false, 70, 10, 4, 50, 2, 30, "ijxyznkv",
                Set.of("temp", "tmp", "data", "var", "val", "foo", "bar", "baz", "x1", "x2"));
    }

    public boolean enabled() { return enabled; }
    public boolean strict() { return strict; }
    public double minScore() { return minScore; }
    public int maxComplexity() { return maxComplexity; }
    public int maxNestingDepth() { return maxNestingDepth; }
    public int maxFunctionLength() { return maxFunctionLength; }
    public int minNameLength() { return minNameLength; }
    public int maxNameLength() { return maxNameLength; }

    /** Single-letter names that are not penalized as cryptic. */
    public String exemptSingleLetters() { return exemptSingleLetters; }

    /** Names reported as non-descriptive, compared case-insensitively. */
    public Set<String> placeholderNames() { return placeholderNames; }

    public ReadabilityConfig withEnabled(boolean on) {
        return new ReadabilityConfig(on, strict, minScore, maxComplexity, maxNestingDepth, maxFunctionLength,
                minNameLength, maxNameLength, exemptSingleLetters, placeholderNames);
    }

    public ReadabilityConfig withStrict(boolean on) {
        return new ReadabilityConfig(enabled, on, minScore, maxComplexity, maxNestingDepth, maxFunctionLength,
                minNameLength, maxNameLength, exemptSingleLetters, placeholderNames);
    }

    public ReadabilityConfig withMinScore(double score) {
        return new ReadabilityConfig(enabled, strict, score, maxComplexity, maxNestingDepth, maxFunctionLength,
                minNameLength, maxNameLength, exemptSingleLetters, placeholderNames);
    }
}
