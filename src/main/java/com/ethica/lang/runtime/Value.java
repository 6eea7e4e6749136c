package com.ethica.lang.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.ethica.lang.parser.Ast.FunctionDef;

/**
 * A runtime value. Collections are immutable once built; the language has no
 * in-place mutation of lists or dicts.
 */
public final class Value {
    public enum Type { NONE, BOOL, INT, FLOAT, STRING, LIST, DICT, FUNCTION, BUILTIN }

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    /** A host function bound under a name. */
    public static final class Native {
        public final String name;
        public final BuiltinFunction function;

        Native(String name, BuiltinFunction function) {
            this.name = name;
            this.function = function;
        }
    }

    public static Value none() { return NONE; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value integer(long l) { return new Value(Type.INT, l); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value list(List<Value> items) { return new Value(Type.LIST, List.copyOf(items)); }
    public static Value function(FunctionDef def) { return new Value(Type.FUNCTION, def); }
    public static Value builtin(String name, BuiltinFunction fn) { return new Value(Type.BUILTIN, new Native(name, fn)); }

    /** Builds a dict; every key must be a scalar (none, bool, int, float or string). */
    public static Value dict(Map<Value, Value> entries) {
        for (Value key : entries.keySet()) {
            if (!key.isHashable()) {
                throw new ExecutionException("Unsupported dict key type: " + key.typeName());
            }
        }
        return new Value(Type.DICT, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    public Type getType() { return type; }

    public boolean isNone() { return type == Type.NONE; }
    public boolean isNumber() { return type == Type.INT || type == Type.FLOAT; }

    public boolean isHashable() {
        switch (type) {
            case NONE: case BOOL: case INT: case FLOAT: case STRING:
                return true;
            default:
                return false;
        }
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new ExecutionException("Expected bool, got " + typeName());
        return (Boolean) value;
    }

    public long asInt() {
        if (type != Type.INT) throw new ExecutionException("Expected int, got " + typeName());
        return (Long) value;
    }

    /** Numeric view of an int or float. */
    public double asDouble() {
        if (type == Type.INT) return ((Long) value).doubleValue();
        if (type == Type.FLOAT) return (Double) value;
        throw new ExecutionException("Expected number, got " + typeName());
    }

    public String asString() {
        if (type != Type.STRING) throw new ExecutionException("Expected string, got " + typeName());
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asList() {
        if (type != Type.LIST) throw new ExecutionException("Expected list, got " + typeName());
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<Value, Value> asDict() {
        if (type != Type.DICT) throw new ExecutionException("Expected dict, got " + typeName());
        return (Map<Value, Value>) value;
    }

    public FunctionDef asFunction() {
        if (type != Type.FUNCTION) throw new ExecutionException("Expected function, got " + typeName());
        return (FunctionDef) value;
    }

    public Native asBuiltin() {
        if (type != Type.BUILTIN) throw new ExecutionException("Expected builtin, got " + typeName());
        return (Native) value;
    }

    /** none, false, numeric zero and empty string/list/dict are false. */
    public boolean isTruthy() {
        switch (type) {
            case NONE: return false;
            case BOOL: return (Boolean) value;
            case INT: return (Long) value != 0L;
            case FLOAT: return (Double) value != 0.0;
            case STRING: return !((String) value).isEmpty();
            case LIST: return !asList().isEmpty();
            case DICT: return !asDict().isEmpty();
            default: return true;
        }
    }

    public String typeName() {
        return type.name().toLowerCase(Locale.ROOT);
    }

    /** The form {@code print} and {@code str} produce. */
    public String display() {
        if (type == Type.STRING) return (String) value;
        return repr();
    }

    /** Like {@link #display()}, but strings are quoted; used for collection elements. */
    public String repr() {
        switch (type) {
            case NONE: return "none";
            case BOOL: return ((Boolean) value) ? "true" : "false";
            case INT: return Long.toString((Long) value);
            case FLOAT: return formatFloat((Double) value);
            case STRING: return quote((String) value);
            case LIST: {
                List<String> parts = new ArrayList<>();
                for (Value v : asList()) parts.add(v.repr());
                return "[" + String.join(", ", parts) + "]";
            }
            case DICT: {
                List<String> parts = new ArrayList<>();
                for (Map.Entry<Value, Value> e : asDict().entrySet()) {
                    parts.add(e.getKey().repr() + ": " + e.getValue().repr());
                }
                return "{" + String.join(", ", parts) + "}";
            }
            case FUNCTION: return "<function " + asFunction().name() + ">";
            case BUILTIN: return "<builtin " + asBuiltin().name + ">";
            default: return String.valueOf(value);
        }
    }

    static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e16) {
            return Long.toString((long) d) + ".0";
        }
        return Double.toString(d);
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;

        if (isNumber() && other.isNumber()) {
            if (type == Type.INT && other.type == Type.INT) return asInt() == other.asInt();
            if (type == Type.FLOAT && other.type == Type.FLOAT) return asDouble() == other.asDouble();
            return (type == Type.INT)
                    ? sameNumber(asInt(), other.asDouble())
                    : sameNumber(other.asInt(), asDouble());
        }
        if (type != other.type) return false;

        switch (type) {
            case NONE: return true;
            case FUNCTION: case BUILTIN: return value == other.value;
            default: return value.equals(other.value);
        }
    }

    /** True when the double is integral and within long range, so the cast loses nothing. */
    private static boolean isExactLong(double d) {
        return d == Math.rint(d) && d >= -0x1p63 && d < 0x1p63;
    }

    /** Exact int/float equality; no rounding of the int to the nearest double. */
    private static boolean sameNumber(long i, double d) {
        return isExactLong(d) && (long) d == i;
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NONE: return 0;
            case INT: return Long.hashCode((Long) value);
            case FLOAT: {
                double d = (Double) value;
                // integral floats hash like the equal int
                if (isExactLong(d)) return Long.hashCode((long) d);
                return Double.hashCode(d);
            }
            case FUNCTION: case BUILTIN: return System.identityHashCode(value);
            default: return value.hashCode();
        }
    }

    @Override
    public String toString() {
        return repr();
    }
}
