package com.ethica.lang.runtime;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * The core builtins bound in every global environment.
 */
public final class Builtins {

    private Builtins() {}

    public static void install(Environment global, Consumer<String> output) {
        register(global, "print", args -> {
            List<String> parts = new ArrayList<>();
            for (Value v : args) parts.add(v.display());
            output.accept(String.join(" ", parts));
            return Value.none();
        });

        register(global, "len", args -> {
            requireArgCount("len", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING: return Value.integer(v.asString().length());
                case LIST: return Value.integer(v.asList().size());
                case DICT: return Value.integer(v.asDict().size());
                default: throw new ExecutionException("len() not supported for type " + v.typeName());
            }
        });

        register(global, "range", Builtins::range);

        register(global, "str", args -> {
            requireArgCount("str", args, 1);
            return Value.string(args.get(0).display());
        });

        register(global, "int", args -> {
            requireArgCount("int", args, 1);
            return toInt(args.get(0));
        });

        register(global, "float", args -> {
            requireArgCount("float", args, 1);
            return toFloat(args.get(0));
        });

        register(global, "type", args -> {
            requireArgCount("type", args, 1);
            return Value.string(args.get(0).typeName());
        });

        register(global, "abs", args -> {
            requireArgCount("abs", args, 1);
            Value v = args.get(0);
            if (v.getType() == Value.Type.INT) {
                long l = v.asInt();
                if (l == Long.MIN_VALUE) throw new ExecutionException("Integer overflow in abs()");
                return Value.integer(Math.abs(l));
            }
            if (v.getType() == Value.Type.FLOAT) return Value.floating(Math.abs(v.asDouble()));
            throw new ExecutionException("abs() requires a number, got " + v.typeName());
        });

        register(global, "min", args -> extreme("min", args, -1));
        register(global, "max", args -> extreme("max", args, 1));

        register(global, "sum", args -> {
            requireArgCount("sum", args, 1);
            Value seq = args.get(0);
            if (seq.getType() != Value.Type.LIST) throw new ExecutionException("sum() requires a list");
            Value total = Value.integer(0);
            for (Value item : seq.asList()) {
                if (!item.isNumber()) throw new ExecutionException("sum() requires numbers, got " + item.typeName());
                total = Operators.add(total, item);
            }
            return total;
        });
    }

    public static void register(Environment global, String name, BuiltinFunction fn) {
        global.define(name, Value.builtin(name, fn));
    }

    /** Number of values range(start, stop, step) yields, saturating at Long.MAX_VALUE. */
    static long rangeLength(long start, long stop, long step) {
        if (step > 0 ? start >= stop : start <= stop) return 0;
        BigInteger span = BigInteger.valueOf(stop).subtract(BigInteger.valueOf(start)).abs();
        BigInteger stride = BigInteger.valueOf(step).abs();
        BigInteger[] qr = span.divideAndRemainder(stride);
        BigInteger count = qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
        return count.bitLength() < 64 ? count.longValue() : Long.MAX_VALUE;
    }

    private static Value range(List<Value> args) {
        if (args.isEmpty() || args.size() > 3) {
            throw new ExecutionException("range() takes 1 to 3 arguments, got " + args.size());
        }
        long start = 0;
        long stop;
        long step = 1;
        if (args.size() == 1) {
            stop = intArg("range", args.get(0));
        } else {
            start = intArg("range", args.get(0));
            stop = intArg("range", args.get(1));
            if (args.size() == 3) step = intArg("range", args.get(2));
        }
        if (step == 0) throw new ExecutionException("range() step must not be zero");
        long count = rangeLength(start, stop, step);
        if (count > Operators.MAX_SEQUENCE_LENGTH) {
            throw new ExecutionException("range() result too large (limit " + Operators.MAX_SEQUENCE_LENGTH + ")");
        }

        List<Value> out = new ArrayList<>((int) count);
        for (long k = 0; k < count; k++) out.add(Value.integer(start + k * step));
        return Value.list(out);
    }

    private static Value toInt(Value v) {
        switch (v.getType()) {
            case INT: return v;
            case BOOL: return Value.integer(v.asBool() ? 1 : 0);
            case FLOAT: {
                double d = v.asDouble();
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    throw new ExecutionException("Cannot convert to int: " + v.repr());
                }
                return Value.integer((long) d);
            }
            case STRING:
                try {
                    return Value.integer(Long.parseLong(v.asString().trim()));
                } catch (NumberFormatException e) {
                    throw new ExecutionException("Cannot convert to int: " + v.repr(), e);
                }
            default:
                throw new ExecutionException("Cannot convert to int: " + v.typeName());
        }
    }

    private static Value toFloat(Value v) {
        switch (v.getType()) {
            case FLOAT: return v;
            case INT: return Value.floating(v.asDouble());
            case BOOL: return Value.floating(v.asBool() ? 1.0 : 0.0);
            case STRING:
                try {
                    return Value.floating(Double.parseDouble(v.asString().trim()));
                } catch (NumberFormatException e) {
                    throw new ExecutionException("Cannot convert to float: " + v.repr(), e);
                }
            default:
                throw new ExecutionException("Cannot convert to float: " + v.typeName());
        }
    }

    // sign = -1 picks the smallest, 1 the largest
    private static Value extreme(String name, List<Value> args, int sign) {
        List<Value> items = args;
        if (args.size() == 1 && args.get(0).getType() == Value.Type.LIST) items = args.get(0).asList();
        if (items.isEmpty()) throw new ExecutionException(name + "() arg is an empty sequence");

        Value best = items.get(0);
        for (int i = 1; i < items.size(); i++) {
            Value candidate = items.get(i);
            if (Operators.compare(candidate, best) * sign > 0) best = candidate;
        }
        return best;
    }

    private static long intArg(String fn, Value v) {
        if (v.getType() != Value.Type.INT) {
            throw new ExecutionException(fn + "() requires int arguments, got " + v.typeName());
        }
        return v.asInt();
    }

    private static void requireArgCount(String fn, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new ExecutionException(fn + "() expects " + expected + " argument(s), got " + args.size());
        }
    }
}
