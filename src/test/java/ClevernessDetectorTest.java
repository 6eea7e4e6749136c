import org.junit.jupiter.api.Test;

import com.ethica.lang.analysis.AnalysisReport;
import com.ethica.lang.analysis.ClevernessConfig;
import com.ethica.lang.analysis.ClevernessDetector;
import com.ethica.lang.analysis.Violation;
import com.ethica.lang.analysis.ViolationKind;
import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.BinaryOp;
import com.ethica.lang.parser.Ast.BinaryOperator;
import com.ethica.lang.parser.Ast.Literal;
import com.ethica.lang.parser.Ast.Program;
import com.ethica.lang.parser.Ast.Variable;
import com.ethica.lang.parser.Lexer;
import com.ethica.lang.parser.Parser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClevernessDetectorTest {

    private static final ClevernessConfig COLLECT_ALL = ClevernessConfig.defaults().withStrict(false);

    private static AnalysisReport analyze(String src, ClevernessConfig config) {
        return new ClevernessDetector(config).analyze(new Parser(new Lexer(src).tokenize()).parse());
    }

    private static AnalysisReport analyze(String src) {
        return analyze(src, ClevernessConfig.defaults());
    }

    @Test
    void plainCodePasses() {
        AnalysisReport r = analyze("function add(a, b):\n    return a + b\nresult = add(3, 4)\n");
        assertTrue(r.passed);
        assertTrue(r.violations.isEmpty());
        assertEquals(Boolean.TRUE, r.metric("strict_mode"));
    }

    @Test
    void complexOneLinerFails() {
        String src = "function f(x, y, z):\n"
                + "    return ((x + y) * (z - x) + (y * z)) / ((x + z) - (y - x))\n";
        AnalysisReport r = analyze(src);
        assertFalse(r.passed);
        assertEquals(1, r.violations.size(), "strict mode stops at the first finding");
        Violation v = r.violations.get(0);
        assertEquals(ViolationKind.COMPLEX_ONE_LINER, v.kind);
        assertEquals(5, v.details.get("expression_depth"));
        assertEquals("f", v.function);
    }

    @Test
    void complexOneLinerCollectAllAlsoReportsReturnAndDensity() {
        String src = "function f(x, y, z):\n"
                + "    return ((x + y) * (z - x) + (y * z)) / ((x + z) - (y - x))\n";
        AnalysisReport r = analyze(src, COLLECT_ALL);
        assertEquals(1, r.violationsOf(ViolationKind.COMPLEX_ONE_LINER).size());
        assertEquals(1, r.violationsOf(ViolationKind.COMPLEX_RETURN).size());
        Violation dense = r.violationsOf(ViolationKind.DENSE_EXPRESSION).get(0);
        assertEquals(9, dense.details.get("operator_count"));
        assertEquals(5L, r.metricLong("max_expression_depth"));
    }

    @Test
    void complexAssignment() {
        AnalysisReport r = analyze("score = (((a + b) * c) - d) / e\n");
        assertEquals(ViolationKind.COMPLEX_ASSIGNMENT, r.violations.get(0).kind);
    }

    @Test
    void denseStatement() {
        AnalysisReport r = analyze("total = a + b + c + d + e + f + g\n", COLLECT_ALL);
        Violation v = r.violationsOf(ViolationKind.DENSE_EXPRESSION).get(0);
        assertEquals(6, v.details.get("operator_count"));
        assertTrue(v.message.startsWith("Assignment to \"total\""), v.message);
    }

    @Test
    void operatorCountIsPerStatement() {
        String src = "first = a + b + c\nsecond = d + e + f\n";
        assertTrue(analyze(src).violationsOf(ViolationKind.DENSE_EXPRESSION).isEmpty());
    }

    @Test
    void complexIfCondition() {
        AnalysisReport r = analyze("if (a + b) * c > d:\n    print(a)\n");
        assertEquals(ViolationKind.COMPLEX_CONDITION, r.violations.get(0).kind);
    }

    @Test
    void complexWhileCondition() {
        AnalysisReport r = analyze("while (a + b) * c > d:\n    a = a + 1\n");
        assertEquals(ViolationKind.COMPLEX_LOOP_CONDITION, r.violations.get(0).kind);
    }

    @Test
    void complexIterable() {
        AnalysisReport r = analyze("for item in load(source):\n    print(item)\n");
        assertEquals(ViolationKind.COMPLEX_ITERABLE, r.violations.get(0).kind);
        assertTrue(analyze("for item in items:\n    print(item)\n").passed);
    }

    @Test
    void chainedComparison() {
        AnalysisReport r = analyze("ok = low < value < high\n");
        assertEquals(ViolationKind.CHAINED_COMPARISONS, r.violations.get(0).kind);
    }

    @Test
    void bitwiseOperatorIsAlwaysFlagged() {
        Program program = new Program(List.of(
                new Assignment("flags", new BinaryOp(new Variable("mask"), BinaryOperator.BIT_AND, Literal.ofInt(1)))));
        AnalysisReport r = new ClevernessDetector(ClevernessConfig.defaults()).analyze(program);
        assertFalse(r.passed);
        assertEquals(ViolationKind.BITWISE_OPERATION, r.violations.get(0).kind);
        assertEquals("&", r.violations.get(0).details.get("operator"));
    }

    @Test
    void magicNumbers() {
        AnalysisReport r = analyze("timeout = 42\n");
        assertEquals(ViolationKind.MAGIC_NUMBER, r.violations.get(0).kind);
        assertEquals(42L, r.violations.get(0).details.get("value"));

        assertTrue(analyze("hours = 24\nminutes = 60\nsmall = 7\nrate = -3.5\n").passed);
        assertFalse(analyze("ratio = 12.5\n").passed);
    }

    @Test
    void tooManyParameters() {
        AnalysisReport r = analyze("function build(a, b, c, d, e, f):\n    return a\n");
        assertEquals(ViolationKind.TOO_MANY_PARAMETERS, r.violations.get(0).kind);
        assertEquals(6, r.violations.get(0).details.get("parameter_count"));
    }

    @Test
    void tooManyArguments() {
        AnalysisReport r = analyze("build(1, 2, 3, 4, 5, 6)\n");
        Violation v = r.violations.get(0);
        assertEquals(ViolationKind.TOO_MANY_ARGUMENTS, v.kind);
        assertTrue(v.message.contains("build"), v.message);
    }

    @Test
    void nestedCallChain() {
        AnalysisReport r = analyze("v = a(b(c(d(1))))\n", COLLECT_ALL);
        assertEquals(1, r.violationsOf(ViolationKind.EXCESSIVE_CHAINING).size());
        assertEquals(4, r.violationsOf(ViolationKind.EXCESSIVE_CHAINING).get(0).details.get("chaining_depth"));
        assertTrue(analyze("v = a(b(c(1)))\n", COLLECT_ALL).violationsOf(ViolationKind.EXCESSIVE_CHAINING).isEmpty());
    }

    @Test
    void memberChain() {
        AnalysisReport r = analyze("host = settings.db.primary.node.host\n", COLLECT_ALL);
        assertEquals(1, r.violationsOf(ViolationKind.EXCESSIVE_MEMBER_CHAINING).size());
        assertTrue(analyze("host = settings.db.host\n").passed);
    }

    @Test
    void complexListLiteral() {
        AnalysisReport r = analyze("rows = [f(g(x)), h(k(y))]\n", COLLECT_ALL);
        assertEquals(1, r.violationsOf(ViolationKind.COMPLEX_LIST_LITERAL).size());
        assertTrue(analyze("rows = [a, b + c]\n").passed);
    }

    @Test
    void collectAllReportsEveryFinding() {
        String src = "timeout = 42\nretries = 99\n";
        assertEquals(1, analyze(src).violations.size());
        assertEquals(2, analyze(src, COLLECT_ALL).violations.size());
    }
}
