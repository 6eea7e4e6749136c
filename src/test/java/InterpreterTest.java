import org.junit.jupiter.api.Test;

import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.Literal;
import com.ethica.lang.parser.Ast.Program;
import com.ethica.lang.parser.Ast.Variable;
import com.ethica.lang.parser.Lexer;
import com.ethica.lang.parser.Parser;
import com.ethica.lang.runtime.BuiltinFunction;
import com.ethica.lang.runtime.ExecutionException;
import com.ethica.lang.runtime.Interpreter;
import com.ethica.lang.runtime.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InterpreterTest {

    private final List<String> printed = new ArrayList<>();

    private Value run(String src) {
        return run(src, Map.of());
    }

    private Value run(String src, Map<String, BuiltinFunction> host) {
        Program program = new Parser(new Lexer(src).tokenize()).parse();
        return new Interpreter(printed::add, 100, host).execute(program);
    }

    private long runInt(String src) {
        Value v = run(src);
        assertEquals(Value.Type.INT, v.getType(), "expected int, got " + v);
        return v.asInt();
    }

    @Test
    void functionCallReturnsValue() {
        assertEquals(7, runInt("function add(a, b):\n    return a + b\nresult = add(3, 4)\n"));
    }

    @Test
    void integerArithmetic() {
        assertEquals(14, runInt("2 + 3 * 4\n"));
        assertEquals(1, runInt("7 % 3\n"));
        assertEquals(2, runInt("-7 % 3\n"));
        assertEquals(1024, runInt("2 ** 10\n"));
        assertEquals(-5, runInt("-(2 + 3)\n"));
    }

    @Test
    void integerOverflowFails() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> run("9223372036854775807 + 1\n"));
        assertTrue(e.getMessage().contains("Integer overflow in '+'"), e.getMessage());
    }

    @Test
    void divisionIsTrueDivision() {
        Value v = run("7 / 2\n");
        assertEquals(Value.Type.FLOAT, v.getType());
        assertEquals(3.5, v.asDouble(), 1e-12);
        assertEquals(0.5, run("2 ** -1\n").asDouble(), 1e-12);
    }

    @Test
    void floatPromotion() {
        Value v = run("1 + 2.5\n");
        assertEquals(Value.Type.FLOAT, v.getType());
        assertEquals(3.5, v.asDouble(), 1e-12);
    }

    @Test
    void divisionByZeroFails() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> run("x = 1 / 0\n"));
        assertTrue(e.getMessage().contains("Division by zero"), e.getMessage());
        assertThrows(ExecutionException.class, () -> run("x = 5 % 0\n"));
    }

    @Test
    void stringAndListOperators() {
        assertEquals("ab", run("\"a\" + \"b\"\n").asString());
        assertEquals("xyxyxy", run("\"xy\" * 3\n").asString());
        assertEquals("[1, 2, 3]", run("[1] + [2, 3]\n").repr());
        assertEquals("[0, 0]", run("[0] * 2\n").repr());
        assertThrows(ExecutionException.class, () -> run("\"a\" + 1\n"));
    }

    @Test
    void oversizedSequencesFailCleanly() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> run("x = \"ab\" * 2000000000\n"));
        assertTrue(e.getMessage().contains("Repetition result too large"), e.getMessage());
        assertThrows(ExecutionException.class, () -> run("x = [1, 2] * 9223372036854775807\n"));
        assertThrows(ExecutionException.class, () -> run("x = 6000000 * \"ab\"\n"));

        e = assertThrows(ExecutionException.class,
                () -> run("big = \"a\" * 6000000\nbigger = big + big\n"));
        assertTrue(e.getMessage().contains("Concatenation result too large"), e.getMessage());

        e = assertThrows(ExecutionException.class, () -> run("range(-9223372036854775807, 9223372036854775807)\n"));
        assertTrue(e.getMessage().contains("range() result too large"), e.getMessage());

        assertEquals("", run("\"\" * 9223372036854775807\n").asString());
        assertEquals("[]", run("[1] * -3\n").repr());
        assertEquals(2, run("len(range(9223372036854775805, 9223372036854775807))\n").asInt());
    }

    @Test
    void largeIntsCompareExactlyWithFloats() {
        assertTrue(run("9007199254740992 == 9007199254740992.0\n").asBool());
        assertFalse(run("9007199254740993 == 9007199254740992.0\n").asBool());
        assertFalse(run("9223372036854775807 == 9223372036854775808.0\n").asBool());
        assertThrows(ExecutionException.class, () -> run("{9007199254740993: \"a\"}[9007199254740992.0]\n"));

        Value big = Value.integer(9007199254740992L);
        Value same = Value.floating(9007199254740992.0);
        assertEquals(big, same);
        assertEquals(big.hashCode(), same.hashCode());
        assertNotEquals(Value.integer(9007199254740993L), same);
    }

    @Test
    void comparisonsAndEquality() {
        assertTrue(run("1 == 1.0\n").asBool());
        assertTrue(run("\"abc\" < \"abd\"\n").asBool());
        assertTrue(run("[1, 2] == [1, 2]\n").asBool());
        assertFalse(run("none != none\n").asBool());
        assertThrows(ExecutionException.class, () -> run("[1] < [2]\n"));
    }

    @Test
    void printUsesDisplayForm() {
        run("print(\"total\", 3, 2.0, [1, \"a\"], {\"k\": none}, true)\n");
        assertEquals(List.of("total 3 2.0 [1, \"a\"] {\"k\": none} true"), printed);
    }

    @Test
    void logicalOperatorsShortCircuit() {
        assertFalse(run("false and undefined_name\n").asBool());
        assertTrue(run("true or undefined_name\n").asBool());
        assertTrue(run("1 and \"x\"\n").asBool());
    }

    @Test
    void truthiness() {
        String src = "hits = 0\n"
                + "for sample in [0, 0.0, \"\", [], {}, none, false]:\n"
                + "    if sample:\n"
                + "        hits = hits + 1\n"
                + "for sample in [1, -0.5, \"a\", [0], {1: 2}, true]:\n"
                + "    if sample:\n"
                + "        hits = hits + 10\n"
                + "hits\n";
        assertEquals(60, runInt(src));
    }

    @Test
    void forLoopMutatesEnclosingBinding() {
        assertEquals(6, runInt("total = 0\nfor step in [1, 2, 3]:\n    total = total + step\ntotal\n"));
    }

    @Test
    void forLoopOverString() {
        run("for letter in \"abc\":\n    print(letter)\n");
        assertEquals(List.of("a", "b", "c"), printed);
    }

    @Test
    void whileLoop() {
        assertEquals(10, runInt("count = 0\nwhile count < 10:\n    count = count + 1\ncount\n"));
    }

    @Test
    void functionLocalsDoNotTouchCallerLocals() {
        String src = "function inner():\n"
                + "    secret = 99\n"
                + "    return secret\n"
                + "function outer():\n"
                + "    secret = 1\n"
                + "    inner()\n"
                + "    return secret\n"
                + "outer()\n";
        assertEquals(1, runInt(src));
    }

    @Test
    void calleeCannotSeeCallerLocals() {
        String src = "function reader():\n"
                + "    return hidden\n"
                + "function caller():\n"
                + "    hidden = 5\n"
                + "    return reader()\n"
                + "caller()\n";
        ExecutionException e = assertThrows(ExecutionException.class, () -> run(src));
        assertTrue(e.getMessage().contains("Undefined variable 'hidden'"), e.getMessage());
    }

    @Test
    void functionsSeeAndMutateGlobals() {
        String src = "counter = 0\n"
                + "function bump():\n"
                + "    counter = counter + 1\n"
                + "bump()\n"
                + "bump()\n"
                + "counter\n";
        assertEquals(2, runInt(src));
    }

    @Test
    void topLevelReturnEndsProgram() {
        String src = "x = 1\nreturn 5\nprint(\"unreachable\")\n";
        assertEquals(5, runInt(src));
        assertTrue(printed.isEmpty());
    }

    @Test
    void returnInsideLoopUnwindsToCall() {
        String src = "function first_even(values):\n"
                + "    for value in values:\n"
                + "        if value % 2 == 0:\n"
                + "            return value\n"
                + "    return none\n"
                + "first_even([3, 5, 8, 10])\n";
        assertEquals(8, runInt(src));
    }

    @Test
    void functionWithoutReturnYieldsNone() {
        assertTrue(run("function noop():\n    x = 1\nnoop()\n").isNone());
    }

    @Test
    void recursionWithinDepthLimit() {
        String src = "function fact(n):\n"
                + "    if n <= 1:\n"
                + "        return 1\n"
                + "    return n * fact(n - 1)\n"
                + "fact(10)\n";
        assertEquals(3628800, runInt(src));
    }

    @Test
    void unboundedRecursionIsAnExecutionFault() {
        String src = "function forever(n):\n    return forever(n + 1)\nforever(0)\n";
        ExecutionException e = assertThrows(ExecutionException.class, () -> run(src));
        assertTrue(e.getMessage().contains("Maximum call depth exceeded"), e.getMessage());
    }

    @Test
    void arityMismatchFails() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> run("function pair(a, b):\n    return a\npair(1)\n"));
        assertTrue(e.getMessage().contains("expects 2 argument(s), got 1"), e.getMessage());
    }

    @Test
    void callingNonFunctionFails() {
        assertThrows(ExecutionException.class, () -> run("x = 3\nx()\n"));
    }

    @Test
    void functionsAreFirstClass() {
        assertEquals(9, runInt("function square(n):\n    return n * n\nop = square\nop(3)\n"));
        assertEquals("<function square>", run("function square(n):\n    return n * n\nsquare\n").repr());
    }

    @Test
    void iteratingADictFails() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> run("for key in {\"a\": 1}:\n    print(key)\n"));
        assertTrue(e.getMessage().contains("Cannot iterate over dict"), e.getMessage());
    }

    @Test
    void memberAccessReadsDictKeys() {
        assertEquals("eth", run("config = {\"name\": \"eth\"}\nconfig.name\n").asString());
        assertThrows(ExecutionException.class, () -> run("config = {\"name\": 1}\nconfig.missing\n"));
        assertThrows(ExecutionException.class, () -> run("items = [1]\nitems.size\n"));
    }

    @Test
    void indexAccess() {
        assertEquals(30, runInt("[10, 20, 30][-1]\n"));
        assertEquals("b", run("\"abc\"[1]\n").asString());
        assertEquals(2, runInt("{\"a\": 1, \"b\": 2}[\"b\"]\n"));
        assertThrows(ExecutionException.class, () -> run("[1, 2][2]\n"));
        assertThrows(ExecutionException.class, () -> run("{\"a\": 1}[\"z\"]\n"));
        assertThrows(ExecutionException.class, () -> run("[1, 2][\"0\"]\n"));
    }

    @Test
    void dictKeysMustBeHashable() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> run("bad = {[1]: 2}\n"));
        assertTrue(e.getMessage().contains("Unsupported dict key type"), e.getMessage());
    }

    @Test
    void numericDictKeysUnify() {
        assertEquals("one", run("{1: \"one\"}[1.0]\n").asString());
    }

    @Test
    void undefinedVariableFails() {
        ExecutionException e = assertThrows(ExecutionException.class, () -> run("print(ghost)\n"));
        assertTrue(e.getMessage().contains("ghost"));
    }

    @Test
    void builtins() {
        assertEquals(3, runInt("len([1, 2, 3])\n"));
        assertEquals(5, runInt("len(\"hello\")\n"));
        assertEquals("[1, 2, 3, 4]", run("range(1, 5)\n").repr());
        assertEquals("[0, 1, 2]", run("range(3)\n").repr());
        assertEquals("[10, 7, 4]", run("range(10, 2, -3)\n").repr());
        assertEquals("1.0", run("str(1.0)\n").asString());
        assertEquals(42, runInt("int(\"42\")\n"));
        assertEquals(3, runInt("int(3.9)\n"));
        assertEquals(2.5, run("float(\"2.5\")\n").asDouble(), 1e-12);
        assertEquals("none", run("type(none)\n").asString());
        assertEquals("list", run("type([])\n").asString());
        assertEquals("builtin", run("type(print)\n").asString());
        assertEquals(4, runInt("abs(-4)\n"));
        assertEquals(1, runInt("min([3, 1, 2])\n"));
        assertEquals(9, runInt("max(4, 9, 2)\n"));
        assertEquals(3.5, run("sum([1, 2.5])\n").asDouble(), 1e-12);
        assertEquals(0, runInt("sum([])\n"));
    }

    @Test
    void builtinFailures() {
        assertThrows(ExecutionException.class, () -> run("len(5)\n"));
        assertThrows(ExecutionException.class, () -> run("int(\"abc\")\n"));
        assertThrows(ExecutionException.class, () -> run("range(1, 5, 0)\n"));
        assertThrows(ExecutionException.class, () -> run("min([])\n"));
        assertThrows(ExecutionException.class, () -> run("sum([\"a\"])\n"));
    }

    @Test
    void hostBuiltinFailureIsWrapped() {
        Map<String, BuiltinFunction> host = Map.of("explode", args -> {
            throw new IllegalStateException("boom");
        });
        ExecutionException e = assertThrows(ExecutionException.class, () -> run("explode()\n", host));
        assertTrue(e.getMessage().contains("Builtin 'explode' failed: boom"), e.getMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void hostBuiltinReturningNullYieldsNone() {
        Map<String, BuiltinFunction> host = Map.of("nothing", args -> null);
        assertTrue(run("nothing()\n", host).isNone());
    }

    @Test
    void firstBindingFlagShadowsOuterBinding() {
        // A program built by hand may ask for a fresh binding even when the name exists.
        Interpreter interpreter = new Interpreter(printed::add, 10);
        Program program = new Program(List.of(
                new Assignment("level", Literal.ofInt(1), false),
                new Assignment("level", Literal.ofInt(2), true),
                new Variable("level")));
        assertEquals(2, interpreter.execute(program).asInt());
        assertEquals(2, interpreter.globals().get("level").asInt());
    }
}
