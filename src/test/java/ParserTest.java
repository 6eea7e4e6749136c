import org.junit.jupiter.api.Test;

import com.ethica.lang.parser.Ast.Annotation;
import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.BinaryOp;
import com.ethica.lang.parser.Ast.BinaryOperator;
import com.ethica.lang.parser.Ast.DictLiteral;
import com.ethica.lang.parser.Ast.ForLoop;
import com.ethica.lang.parser.Ast.FunctionCall;
import com.ethica.lang.parser.Ast.FunctionDef;
import com.ethica.lang.parser.Ast.IfStatement;
import com.ethica.lang.parser.Ast.IndexAccess;
import com.ethica.lang.parser.Ast.ListLiteral;
import com.ethica.lang.parser.Ast.Literal;
import com.ethica.lang.parser.Ast.MemberAccess;
import com.ethica.lang.parser.Ast.Node;
import com.ethica.lang.parser.Ast.Program;
import com.ethica.lang.parser.Ast.ReturnStatement;
import com.ethica.lang.parser.Ast.UnaryOp;
import com.ethica.lang.parser.Ast.UnaryOperator;
import com.ethica.lang.parser.Ast.Variable;
import com.ethica.lang.parser.Ast.WhileLoop;
import com.ethica.lang.parser.Lexer;
import com.ethica.lang.parser.Parser;
import com.ethica.lang.parser.SyntaxException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static Program parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parse();
    }

    private static Node expr(String src) {
        Program p = parse(src + "\n");
        assertEquals(1, p.statements().size());
        return p.statements().get(0);
    }

    private static Variable var(String name) { return new Variable(name); }

    @Test
    void multiplicationBindsTighterThanAddition() {
        assertEquals(
                new BinaryOp(Literal.ofInt(1), BinaryOperator.ADD,
                        new BinaryOp(Literal.ofInt(2), BinaryOperator.MULTIPLY, Literal.ofInt(3))),
                expr("1 + 2 * 3"));
    }

    @Test
    void additionIsLeftAssociative() {
        assertEquals(
                new BinaryOp(new BinaryOp(var("a"), BinaryOperator.SUBTRACT, var("b")), BinaryOperator.SUBTRACT, var("c")),
                expr("a - b - c"));
    }

    @Test
    void powerIsRightAssociative() {
        assertEquals(
                new BinaryOp(Literal.ofInt(2), BinaryOperator.POWER,
                        new BinaryOp(Literal.ofInt(3), BinaryOperator.POWER, Literal.ofInt(2))),
                expr("2 ** 3 ** 2"));
    }

    @Test
    void unaryMinusAppliesToPower() {
        assertEquals(
                new UnaryOp(UnaryOperator.NEGATE,
                        new BinaryOp(Literal.ofInt(2), BinaryOperator.POWER, Literal.ofInt(2))),
                expr("-2 ** 2"));
    }

    @Test
    void negativeExponentIsLegal() {
        assertEquals(
                new BinaryOp(Literal.ofInt(2), BinaryOperator.POWER, new UnaryOp(UnaryOperator.NEGATE, Literal.ofInt(1))),
                expr("2 ** -1"));
    }

    @Test
    void chainedUnaryIsLegal() {
        assertEquals(new UnaryOp(UnaryOperator.NOT, new UnaryOp(UnaryOperator.NOT, var("ok"))), expr("not not ok"));
    }

    @Test
    void notBindsLikeUnaryMinus() {
        // (not a) == b
        assertEquals(
                new BinaryOp(new UnaryOp(UnaryOperator.NOT, var("a")), BinaryOperator.EQUAL, var("b")),
                expr("not a == b"));
        // (not a) and b
        assertEquals(
                new BinaryOp(new UnaryOp(UnaryOperator.NOT, var("a")), BinaryOperator.AND, var("b")),
                expr("not a and b"));
    }

    @Test
    void logicalOperatorPrecedence() {
        // a or (b and (c == d))
        assertEquals(
                new BinaryOp(var("a"), BinaryOperator.OR,
                        new BinaryOp(var("b"), BinaryOperator.AND,
                                new BinaryOp(var("c"), BinaryOperator.EQUAL, var("d")))),
                expr("a or b and c == d"));
    }

    @Test
    void comparisonBindsTighterThanEquality() {
        assertEquals(
                new BinaryOp(new BinaryOp(var("a"), BinaryOperator.LESS, var("b")), BinaryOperator.NOT_EQUAL, Literal.ofBool(true)),
                expr("a < b != true"));
    }

    @Test
    void parenthesesOverridePrecedence() {
        assertEquals(
                new BinaryOp(new BinaryOp(Literal.ofInt(1), BinaryOperator.ADD, Literal.ofInt(2)),
                        BinaryOperator.MULTIPLY, Literal.ofInt(3)),
                expr("(1 + 2) * 3"));
    }

    @Test
    void postfixChainsLeftToRight() {
        Node n = expr("config.loader(1)[0]");
        assertEquals(
                new IndexAccess(
                        new FunctionCall(new MemberAccess(var("config"), "loader"), List.of(Literal.ofInt(1))),
                        Literal.ofInt(0)),
                n);
    }

    @Test
    void assignmentIsNotAFirstBinding() {
        Node n = expr("total = 1 + 2");
        assertInstanceOf(Assignment.class, n);
        Assignment a = (Assignment) n;
        assertEquals("total", a.name());
        assertFalse(a.firstBinding());
    }

    @Test
    void identifierWithoutAssignIsExpressionStatement() {
        assertEquals(new FunctionCall(var("print"), List.of(var("x"))), expr("print(x)"));
    }

    @Test
    void collectionLiteralsAcceptTrailingCommas() {
        ListLiteral list = (ListLiteral) expr("[1, 2, 3,]");
        assertEquals(3, list.elements().size());

        DictLiteral dict = (DictLiteral) expr("{\"a\": 1, \"b\": 2,}");
        assertEquals(2, dict.entries().size());
        assertEquals(Literal.ofString("a"), dict.entries().get(0).key());

        assertTrue(((ListLiteral) expr("[]")).elements().isEmpty());
        assertTrue(((DictLiteral) expr("{}")).entries().isEmpty());
    }

    @Test
    void functionDefinitionWithAnnotationsAndReturnType() {
        String src = "@requires_user_consent\n"
                + "@audit(\"gps\", 2)\n"
                + "function collect_location(user_id) -> none:\n"
                + "    return none\n";
        FunctionDef f = (FunctionDef) parse(src).statements().get(0);

        assertEquals("collect_location", f.name());
        assertEquals(List.of("user_id"), f.parameters());
        assertEquals("none", f.returnType());
        assertEquals(2, f.annotations().size());
        assertTrue(f.hasAnnotation("requires_user_consent"));
        assertEquals(new Annotation("audit", List.of(Literal.ofString("gps"), Literal.ofInt(2))), f.annotations().get(1));
        assertEquals(List.of(new ReturnStatement(Literal.none())), f.body());
    }

    @Test
    void annotationBeforeNonFunctionIsDiscarded() {
        Program p = parse("@audit\nx = 1\n");
        assertEquals(1, p.statements().size());
        assertEquals(new Assignment("x", Literal.ofInt(1), false), p.statements().get(0));
    }

    @Test
    void ifElseStructure() {
        String src = "if score > 10:\n    grade = 1\nelse:\n    grade = 2\n";
        IfStatement s = (IfStatement) parse(src).statements().get(0);
        assertEquals(new BinaryOp(var("score"), BinaryOperator.GREATER, Literal.ofInt(10)), s.condition());
        assertEquals(1, s.thenBody().size());
        assertTrue(s.hasElse());
        assertEquals(new Assignment("grade", Literal.ofInt(2), false), s.elseBody().get(0));
    }

    @Test
    void ifWithoutElseHasEmptyElseBody() {
        IfStatement s = (IfStatement) parse("if ready:\n    go()\n").statements().get(0);
        assertFalse(s.hasElse());
        assertTrue(s.elseBody().isEmpty());
    }

    @Test
    void loops() {
        Program p = parse("while n > 0:\n    n = n - 1\nfor item in items:\n    print(item)\n");
        WhileLoop w = (WhileLoop) p.statements().get(0);
        assertEquals(1, w.body().size());
        ForLoop f = (ForLoop) p.statements().get(1);
        assertEquals("item", f.variable());
        assertEquals(var("items"), f.iterable());
    }

    @Test
    void bareReturn() {
        FunctionDef f = (FunctionDef) parse("function stop():\n    return\n").statements().get(0);
        assertEquals(new ReturnStatement(null), f.body().get(0));
    }

    @Test
    void nestedBlocksCloseTogether() {
        String src = "function outer():\n    for x in [1]:\n        if x:\n            return x\ny = 2\n";
        Program p = parse(src);
        assertEquals(2, p.statements().size());
        FunctionDef f = (FunctionDef) p.statements().get(0);
        ForLoop loop = (ForLoop) f.body().get(0);
        IfStatement branch = (IfStatement) loop.body().get(0);
        assertInstanceOf(ReturnStatement.class, branch.thenBody().get(0));
    }

    @Test
    void parsingTwiceYieldsEqualTrees() {
        String src = "function add(a, b):\n    return a + b\nresult = add(3, 4)\n";
        assertEquals(parse(src), parse(src));
    }

    @Test
    void treesAreImmutable() {
        Program p = parse("x = 1\n");
        assertThrows(UnsupportedOperationException.class, () -> p.statements().add(var("y")));
    }

    @Test
    void deeplyParenthesizedExpressionIsSyntaxError() {
        String src = "x = " + "(".repeat(20000) + "1" + ")".repeat(20000) + "\n";
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse(src));
        assertTrue(e.getMessage().contains("nested too deeply"), e.getMessage());
        assertEquals(1, e.line());
    }

    @Test
    void overlyDeepTreeIsSyntaxError() {
        String chain = "total = " + "1 + ".repeat(599) + "1\n";
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("print(1)\n" + chain));
        assertEquals(2, e.line());
        assertEquals(1, e.column());
        assertTrue(e.getMessage().contains("depth 601, limit " + Parser.MAX_NESTING_DEPTH), e.getMessage());

        assertThrows(SyntaxException.class, () -> parse("x = " + "-".repeat(2000) + "1\n"));
    }

    @Test
    void longButShallowStatementsParse() {
        Program p = parse("total = " + "1 + ".repeat(299) + "1\n");
        assertInstanceOf(Assignment.class, p.statements().get(0));
    }

    @Test
    void missingClosingParenIsSyntaxError() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("x = (1 + 2\n"));
        assertEquals(1, e.line());
        assertTrue(e.getMessage().contains("Expect ')'"), e.getMessage());
    }

    @Test
    void missingIndentedBlockIsSyntaxError() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("if ready:\ngo()\n"));
        assertTrue(e.getMessage().contains("Expect indented block"), e.getMessage());
        assertEquals(2, e.line());
    }

    @Test
    void twoExpressionsOnOneLineIsSyntaxError() {
        assertThrows(SyntaxException.class, () -> parse("x = 1 2\n"));
    }

    @Test
    void badParameterListIsSyntaxError() {
        assertThrows(SyntaxException.class, () -> parse("function f(1):\n    return 1\n"));
        assertThrows(SyntaxException.class, () -> parse("function f(a) x:\n    return 1\n"));
    }

    @Test
    void unexpectedIndentIsSyntaxError() {
        SyntaxException e = assertThrows(SyntaxException.class, () -> parse("x = 1\n    y = 2\n"));
        assertTrue(e.getMessage().contains("unexpected indent"), e.getMessage());
    }
}
