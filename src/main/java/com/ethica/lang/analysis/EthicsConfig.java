package com.ethica.lang.analysis;

import java.util.Objects;

/** Settings for {@link EthicsChecker}. */
public final class EthicsConfig {
    private final boolean enabled;
    private final boolean strict;
    private final EthicsPolicy policy;

    public EthicsConfig(boolean enabled, boolean strict, EthicsPolicy policy) {
        this.enabled = enabled;
        this.strict = strict;
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public static EthicsConfig defaults() {
        return new EthicsConfig(true, true, EthicsPolicy.defaults());
    }

    public boolean enabled() { return enabled; }
    public boolean strict() { return strict; }
    public EthicsPolicy policy() { return policy; }

    public EthicsConfig withEnabled(boolean on) { return new EthicsConfig(on, strict, policy); }

    public EthicsConfig withStrict(boolean on) { return new EthicsConfig(enabled, on, policy); }
}
