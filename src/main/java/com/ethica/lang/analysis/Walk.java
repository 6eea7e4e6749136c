package com.ethica.lang.analysis;

/**
 * Signal returned by every analysis visit step. HALT stops the rest of the
 * current pass's walk; it never affects other passes.
 */
public enum Walk {
    CONTINUE,
    HALT;

    public boolean halted() { return this == HALT; }

    public static Walk of(boolean halt) { return halt ? HALT : CONTINUE; }
}
