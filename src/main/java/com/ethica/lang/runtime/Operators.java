package com.ethica.lang.runtime;

import java.util.ArrayList;
import java.util.List;

import com.ethica.lang.parser.Ast.BinaryOperator;
import com.ethica.lang.parser.Ast.UnaryOperator;

/**
 * Operator semantics on runtime values. int op int stays int (overflow is a
 * fault); any float operand promotes to float; {@code /} is true division.
 */
public final class Operators {

    /** Largest string or list that repetition or range() may build. */
    public static final int MAX_SEQUENCE_LENGTH = 10_000_000;

    private Operators() {}

    /** Applies a non-short-circuit binary operator. {@code and}/{@code or} are handled by the interpreter. */
    public static Value binary(BinaryOperator op, Value left, Value right) {
        switch (op) {
            case ADD: return add(left, right);
            case SUBTRACT: return subtract(left, right);
            case MULTIPLY: return multiply(left, right);
            case DIVIDE: return divide(left, right);
            case MODULO: return modulo(left, right);
            case POWER: return power(left, right);
            case EQUAL: return Value.bool(left.equals(right));
            case NOT_EQUAL: return Value.bool(!left.equals(right));
            case LESS: return Value.bool(compare(left, right, op) < 0);
            case LESS_EQUAL: return Value.bool(compare(left, right, op) <= 0);
            case GREATER: return Value.bool(compare(left, right, op) > 0);
            case GREATER_EQUAL: return Value.bool(compare(left, right, op) >= 0);
            case BIT_AND: case BIT_OR: case BIT_XOR: case SHIFT_LEFT: case SHIFT_RIGHT:
                return bitwise(op, left, right);
            default:
                throw new ExecutionException("Operator '" + op.symbol + "' cannot be applied eagerly");
        }
    }

    public static Value unary(UnaryOperator op, Value operand) {
        if (op == UnaryOperator.NOT) return Value.bool(!operand.isTruthy());

        if (operand.type == Value.Type.INT) {
            try {
                return Value.integer(Math.negateExact(operand.asInt()));
            } catch (ArithmeticException e) {
                throw new ExecutionException("Integer overflow in unary '-'", e);
            }
        }
        if (operand.type == Value.Type.FLOAT) return Value.floating(-operand.asDouble());
        throw new ExecutionException("Unary '-' requires a number, got " + operand.typeName());
    }

    public static Value add(Value left, Value right) {
        if (bothInts(left, right)) {
            try {
                return Value.integer(Math.addExact(left.asInt(), right.asInt()));
            } catch (ArithmeticException e) {
                throw overflow("+", e);
            }
        }
        if (left.isNumber() && right.isNumber()) return Value.floating(left.asDouble() + right.asDouble());
        if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            checkConcat((long) left.asString().length() + right.asString().length());
            return Value.string(left.asString() + right.asString());
        }
        if (left.type == Value.Type.LIST && right.type == Value.Type.LIST) {
            checkConcat((long) left.asList().size() + right.asList().size());
            List<Value> joined = new ArrayList<>(left.asList());
            joined.addAll(right.asList());
            return Value.list(joined);
        }
        throw unsupported("+", left, right);
    }

    private static Value subtract(Value left, Value right) {
        if (bothInts(left, right)) {
            try {
                return Value.integer(Math.subtractExact(left.asInt(), right.asInt()));
            } catch (ArithmeticException e) {
                throw overflow("-", e);
            }
        }
        if (left.isNumber() && right.isNumber()) return Value.floating(left.asDouble() - right.asDouble());
        throw unsupported("-", left, right);
    }

    private static Value multiply(Value left, Value right) {
        if (bothInts(left, right)) {
            try {
                return Value.integer(Math.multiplyExact(left.asInt(), right.asInt()));
            } catch (ArithmeticException e) {
                throw overflow("*", e);
            }
        }
        if (left.isNumber() && right.isNumber()) return Value.floating(left.asDouble() * right.asDouble());

        if (right.type == Value.Type.INT && (left.type == Value.Type.STRING || left.type == Value.Type.LIST)) {
            return repeat(left, right.asInt());
        }
        if (left.type == Value.Type.INT && (right.type == Value.Type.STRING || right.type == Value.Type.LIST)) {
            return repeat(right, left.asInt());
        }
        throw unsupported("*", left, right);
    }

    private static void checkConcat(long length) {
        if (length > MAX_SEQUENCE_LENGTH) {
            throw new ExecutionException("Concatenation result too large (limit " + MAX_SEQUENCE_LENGTH + ")");
        }
    }

    private static Value repeat(Value sequence, long times) {
        boolean string = sequence.type == Value.Type.STRING;
        int length = string ? sequence.asString().length() : sequence.asList().size();
        if (times <= 0 || length == 0) return string ? Value.string("") : Value.list(List.of());
        if (times > MAX_SEQUENCE_LENGTH / length) {
            throw new ExecutionException("Repetition result too large (limit " + MAX_SEQUENCE_LENGTH + ")");
        }

        int n = (int) times;
        if (string) return Value.string(sequence.asString().repeat(n));
        List<Value> out = new ArrayList<>(length * n);
        for (int i = 0; i < n; i++) out.addAll(sequence.asList());
        return Value.list(out);
    }

    private static Value divide(Value left, Value right) {
        if (!left.isNumber() || !right.isNumber()) throw unsupported("/", left, right);
        double divisor = right.asDouble();
        if (divisor == 0.0) throw new ExecutionException("Division by zero");
        return Value.floating(left.asDouble() / divisor);
    }

    private static Value modulo(Value left, Value right) {
        if (!left.isNumber() || !right.isNumber()) throw unsupported("%", left, right);
        if (right.asDouble() == 0.0) throw new ExecutionException("Modulo by zero");

        if (bothInts(left, right)) return Value.integer(Math.floorMod(left.asInt(), right.asInt()));

        double a = left.asDouble();
        double b = right.asDouble();
        double r = a % b;
        if (r != 0.0 && (r < 0) != (b < 0)) r += b;
        return Value.floating(r);
    }

    private static Value power(Value left, Value right) {
        if (!left.isNumber() || !right.isNumber()) throw unsupported("**", left, right);

        if (bothInts(left, right) && right.asInt() >= 0) {
            long base = left.asInt();
            long exp = right.asInt();
            long result = 1;
            try {
                while (exp > 0) {
                    if ((exp & 1) == 1) result = Math.multiplyExact(result, base);
                    exp >>= 1;
                    if (exp > 0) base = Math.multiplyExact(base, base);
                }
            } catch (ArithmeticException e) {
                throw overflow("**", e);
            }
            return Value.integer(result);
        }

        if (left.asDouble() == 0.0 && right.asDouble() < 0) {
            throw new ExecutionException("Zero cannot be raised to a negative power");
        }
        return Value.floating(Math.pow(left.asDouble(), right.asDouble()));
    }

    private static Value bitwise(BinaryOperator op, Value left, Value right) {
        if (!bothInts(left, right)) throw unsupported(op.symbol, left, right);
        long a = left.asInt();
        long b = right.asInt();
        switch (op) {
            case BIT_AND: return Value.integer(a & b);
            case BIT_OR: return Value.integer(a | b);
            case BIT_XOR: return Value.integer(a ^ b);
            default:
                if (b < 0) throw new ExecutionException("Negative shift count");
                if (b >= 64) return Value.integer(op == BinaryOperator.SHIFT_LEFT || a >= 0 ? 0 : -1);
                return Value.integer(op == BinaryOperator.SHIFT_LEFT ? a << b : a >> b);
        }
    }

    /** Orders two numbers or two strings. */
    public static int compare(Value left, Value right) {
        return compare(left, right, null);
    }

    private static int compare(Value left, Value right, BinaryOperator op) {
        if (bothInts(left, right)) return Long.compare(left.asInt(), right.asInt());
        if (left.isNumber() && right.isNumber()) return Double.compare(left.asDouble(), right.asDouble());
        if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            return left.asString().compareTo(right.asString());
        }
        String symbol = (op == null) ? "comparison" : op.symbol;
        throw unsupported(symbol, left, right);
    }

    private static boolean bothInts(Value a, Value b) {
        return a.type == Value.Type.INT && b.type == Value.Type.INT;
    }

    private static ExecutionException unsupported(String op, Value left, Value right) {
        return new ExecutionException("Unsupported operand types for " + op + ": "
                + left.typeName() + " and " + right.typeName());
    }

    private static ExecutionException overflow(String op, ArithmeticException cause) {
        return new ExecutionException("Integer overflow in '" + op + "'", cause);
    }
}
