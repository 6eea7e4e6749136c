package com.ethica.lang.analysis;

import java.util.Iterator;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Configuration of all four analysis passes.
 *
 * {@link #fromJson(String)} overlays any subset of settings onto the defaults:
 * <pre>
 * { "energy": { "budget": 5000, "strict": false },
 *   "readability": { "minScore": 60 },
 *   "cleverness": { "enabled": false } }
 * </pre>
 */
public final class AnalysisConfig {
    private static final ObjectMapper om = new ObjectMapper();

    private static final Set<String> SECTIONS = Set.of("energy", "ethics", "readability", "cleverness");
    private static final Set<String> ENERGY_FIELDS = Set.of("enabled", "strict", "budget", "costs",
            "assumedIterations", "maxNestingDepth", "recursionMultiplier", "conditionCost", "highIterationThreshold");
    private static final Set<String> COST_FIELDS = Set.of("literal", "variable", "assignment", "binaryOp",
            "unaryOp", "call", "returnStatement", "indexAccess", "memberAccess", "listElement", "dictPair");
    private static final Set<String> ETHICS_FIELDS = Set.of("enabled", "strict");
    private static final Set<String> READABILITY_FIELDS = Set.of("enabled", "strict", "minScore",
            "maxComplexity", "maxNestingDepth", "maxFunctionLength", "minNameLength", "maxNameLength");
    private static final Set<String> CLEVERNESS_FIELDS = Set.of("enabled", "strict", "maxChainingDepth",
            "maxExpressionDepth", "maxBinaryOpsPerStatement", "maxFunctionArgs", "maxConditionDepth",
            "maxIterableDepth", "maxListElementDepth", "magicNumberLimit");

    private final EnergyConfig energy;
    private final EthicsConfig ethics;
    private final ReadabilityConfig readability;
    private final ClevernessConfig cleverness;

    public AnalysisConfig(EnergyConfig energy, EthicsConfig ethics,
                          ReadabilityConfig readability, ClevernessConfig cleverness) {
        this.energy = Objects.requireNonNull(energy, "energy");
        this.ethics = Objects.requireNonNull(ethics, "ethics");
        this.readability = Objects.requireNonNull(readability, "readability");
        this.cleverness = Objects.requireNonNull(cleverness, "cleverness");
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(EnergyConfig.defaults(), EthicsConfig.defaults(),
                ReadabilityConfig.defaults(), ClevernessConfig.defaults());
    }

    public EnergyConfig energy() { return energy; }
    public EthicsConfig ethics() { return ethics; }
    public ReadabilityConfig readability() { return readability; }
    public ClevernessConfig cleverness() { return cleverness; }

    public AnalysisConfig withEnergy(EnergyConfig c) { return new AnalysisConfig(c, ethics, readability, cleverness); }
    public AnalysisConfig withEthics(EthicsConfig c) { return new AnalysisConfig(energy, c, readability, cleverness); }
    public AnalysisConfig withReadability(ReadabilityConfig c) { return new AnalysisConfig(energy, ethics, c, cleverness); }
    public AnalysisConfig withCleverness(ClevernessConfig c) { return new AnalysisConfig(energy, ethics, readability, c); }

    // -------------------------
    // JSON
    // -------------------------

    public static AnalysisConfig fromJson(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed analysis config JSON: " + e.getOriginalMessage(), e);
        }
        return fromJson(root);
    }

    public static AnalysisConfig fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Analysis config must be a JSON object");
        }
        for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
            String section = it.next();
            if (!SECTIONS.contains(section)) {
                throw new IllegalArgumentException("Unknown analysis config section: " + section);
            }
        }

        AnalysisConfig d = defaults();
        return new AnalysisConfig(
                energy(section(root, "energy", ENERGY_FIELDS), d.energy()),
                ethics(section(root, "ethics", ETHICS_FIELDS), d.ethics()),
                readability(section(root, "readability", READABILITY_FIELDS), d.readability()),
                cleverness(section(root, "cleverness", CLEVERNESS_FIELDS), d.cleverness()));
    }

    private static JsonNode section(JsonNode parent, String name, Set<String> fields) {
        JsonNode n = parent.path(name);
        if (n.isMissingNode()) return n;
        if (!n.isObject()) throw new IllegalArgumentException("Config section '" + name + "' must be an object");
        for (Iterator<String> it = n.fieldNames(); it.hasNext(); ) {
            String field = it.next();
            if (!fields.contains(field)) {
                throw new IllegalArgumentException("Unknown field '" + field + "' in config section '" + name + "'");
            }
        }
        return n;
    }

    private static EnergyConfig energy(JsonNode n, EnergyConfig d) {
        CostTable c = d.costs();
        JsonNode cn = section(n, "costs", COST_FIELDS);
        CostTable costs = new CostTable(
                integer(cn, "literal", c.literal()),
                integer(cn, "variable", c.variable()),
                integer(cn, "assignment", c.assignment()),
                integer(cn, "binaryOp", c.binaryOp()),
                integer(cn, "unaryOp", c.unaryOp()),
                integer(cn, "call", c.call()),
                integer(cn, "returnStatement", c.returnStatement()),
                integer(cn, "indexAccess", c.indexAccess()),
                integer(cn, "memberAccess", c.memberAccess()),
                integer(cn, "listElement", c.listElement()),
                integer(cn, "dictPair", c.dictPair()));

        return new EnergyConfig(
                bool(n, "enabled", d.enabled()),
                bool(n, "strict", d.strict()),
                longValue(n, "budget", d.budget()),
                costs,
                integer(n, "assumedIterations", d.assumedIterations()),
                integer(n, "maxNestingDepth", d.maxNestingDepth()),
                integer(n, "recursionMultiplier", d.recursionMultiplier()),
                integer(n, "conditionCost", d.conditionCost()),
                integer(n, "highIterationThreshold", d.highIterationThreshold()));
    }

    private static EthicsConfig ethics(JsonNode n, EthicsConfig d) {
        return new EthicsConfig(bool(n, "enabled", d.enabled()), bool(n, "strict", d.strict()), d.policy());
    }

    private static ReadabilityConfig readability(JsonNode n, ReadabilityConfig d) {
        return new ReadabilityConfig(
                bool(n, "enabled", d.enabled()),
                bool(n, "strict", d.strict()),
                number(n, "minScore", d.minScore()),
                integer(n, "maxComplexity", d.maxComplexity()),
                integer(n, "maxNestingDepth", d.maxNestingDepth()),
                integer(n, "maxFunctionLength", d.maxFunctionLength()),
                integer(n, "minNameLength", d.minNameLength()),
                integer(n, "maxNameLength", d.maxNameLength()),
                d.exemptSingleLetters(),
                d.placeholderNames());
    }

    private static ClevernessConfig cleverness(JsonNode n, ClevernessConfig d) {
        return new ClevernessConfig(
                bool(n, "enabled", d.enabled()),
                bool(n, "strict", d.strict()),
                integer(n, "maxChainingDepth", d.maxChainingDepth()),
                integer(n, "maxExpressionDepth", d.maxExpressionDepth()),
                integer(n, "maxBinaryOpsPerStatement", d.maxBinaryOpsPerStatement()),
                integer(n, "maxFunctionArgs", d.maxFunctionArgs()),
                integer(n, "maxConditionDepth", d.maxConditionDepth()),
                integer(n, "maxIterableDepth", d.maxIterableDepth()),
                integer(n, "maxListElementDepth", d.maxListElementDepth()),
                number(n, "magicNumberLimit", d.magicNumberLimit()),
                d.allowedNumbers());
    }

    private static boolean bool(JsonNode n, String field, boolean def) {
        JsonNode v = n.path(field);
        if (v.isMissingNode()) return def;
        if (!v.isBoolean()) throw new IllegalArgumentException("'" + field + "' must be a boolean");
        return v.booleanValue();
    }

    private static int integer(JsonNode n, String field, int def) {
        JsonNode v = n.path(field);
        if (v.isMissingNode()) return def;
        if (!v.canConvertToInt() || !v.isIntegralNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be an integer");
        }
        return v.intValue();
    }

    private static long longValue(JsonNode n, String field, long def) {
        JsonNode v = n.path(field);
        if (v.isMissingNode()) return def;
        if (!v.isIntegralNumber() || !v.canConvertToLong()) {
            throw new IllegalArgumentException("'" + field + "' must be an integer");
        }
        return v.longValue();
    }

    private static double number(JsonNode n, String field, double def) {
        JsonNode v = n.path(field);
        if (v.isMissingNode()) return def;
        if (!v.isNumber()) throw new IllegalArgumentException("'" + field + "' must be a number");
        return v.doubleValue();
    }
}
