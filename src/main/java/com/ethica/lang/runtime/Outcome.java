package com.ethica.lang.runtime;

/**
 * Result of executing one node: either control continues with a value, or a
 * {@code return} is unwinding toward the nearest call boundary.
 */
public final class Outcome {
    public enum Kind { NORMAL, RETURN }

    private static final Outcome NORMAL_NONE = new Outcome(Kind.NORMAL, Value.none());

    public final Kind kind;
    public final Value value;

    private Outcome(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    public static Outcome normal(Value value) {
        return value.isNone() ? NORMAL_NONE : new Outcome(Kind.NORMAL, value);
    }

    public static Outcome normalNone() { return NORMAL_NONE; }

    public static Outcome returning(Value value) {
        return new Outcome(Kind.RETURN, value);
    }

    public boolean isReturn() { return kind == Kind.RETURN; }

    @Override
    public String toString() {
        return kind + "(" + value.repr() + ")";
    }
}
