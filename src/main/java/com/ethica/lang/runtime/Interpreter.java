package com.ethica.lang.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.ethica.debug.Debug;
import com.ethica.lang.parser.Ast;
import com.ethica.lang.parser.Ast.Annotation;
import com.ethica.lang.parser.Ast.Assignment;
import com.ethica.lang.parser.Ast.BinaryOp;
import com.ethica.lang.parser.Ast.BinaryOperator;
import com.ethica.lang.parser.Ast.DictEntry;
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
import com.ethica.lang.parser.Ast.Variable;
import com.ethica.lang.parser.Ast.WhileLoop;

/**
 * Tree-walking evaluator.
 *
 * Every visit yields an {@link Outcome}; a RETURN outcome travels up through
 * blocks and loops until a call boundary unwraps it. A call's environment is
 * always parented on the global environment, never on the caller's.
 */
public class Interpreter implements Ast.Visitor<Outcome> {
    private static final String TAG = "ethica.runtime";

    private final Environment globals = new Environment();
    private final int maxCallDepth;

    private Environment env = globals;
    private int callDepth = 0;

    public Interpreter(Consumer<String> output, int maxCallDepth) {
        this(output, maxCallDepth, Map.of());
    }

    public Interpreter(Consumer<String> output, int maxCallDepth, Map<String, BuiltinFunction> hostFunctions) {
        if (maxCallDepth < 1) throw new IllegalArgumentException("maxCallDepth must be >= 1");
        this.maxCallDepth = maxCallDepth;
        Builtins.install(globals, output);
        for (Map.Entry<String, BuiltinFunction> e : hostFunctions.entrySet()) {
            Builtins.register(globals, e.getKey(), e.getValue());
        }
    }

    public Environment globals() { return globals; }

    /** Runs a program and returns the value of its last statement, or of a top-level return. */
    public Value execute(Program program) {
        env = globals;
        callDepth = 0;
        try {
            return program.accept(this).value;
        } catch (StackOverflowError e) {
            throw new ExecutionException("Maximum call depth exceeded (host stack exhausted)", e);
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Outcome visitProgram(Program node) {
        Value last = Value.none();
        for (Node stmt : node.statements()) {
            Outcome o = stmt.accept(this);
            if (o.isReturn()) {
                Debug.get().d(TAG, "top-level return ended the program");
                return o;
            }
            last = o.value;
        }
        return Outcome.normal(last);
    }

    @Override
    public Outcome visitFunctionDef(FunctionDef node) {
        env.define(node.name(), Value.function(node));
        return Outcome.normalNone();
    }

    @Override
    public Outcome visitAnnotation(Annotation node) {
        // metadata only
        return Outcome.normalNone();
    }

    @Override
    public Outcome visitAssignment(Assignment node) {
        Value value = eval(node.value());
        if (node.firstBinding() || !env.exists(node.name())) {
            env.define(node.name(), value);
        } else {
            env.assign(node.name(), value);
        }
        return Outcome.normal(value);
    }

    @Override
    public Outcome visitIfStatement(IfStatement node) {
        List<Node> branch = eval(node.condition()).isTruthy() ? node.thenBody() : node.elseBody();
        Outcome o = executeBlock(branch);
        return o.isReturn() ? o : Outcome.normalNone();
    }

    @Override
    public Outcome visitWhileLoop(WhileLoop node) {
        while (eval(node.condition()).isTruthy()) {
            Outcome o = executeBlock(node.body());
            if (o.isReturn()) return o;
        }
        return Outcome.normalNone();
    }

    @Override
    public Outcome visitForLoop(ForLoop node) {
        List<Value> items = iterate(eval(node.iterable()));

        // One scope for the whole loop; the loop variable is rebound in it each pass.
        Environment previous = env;
        env = new Environment(previous);
        try {
            for (Value item : items) {
                env.define(node.variable(), item);
                Outcome o = executeBlock(node.body());
                if (o.isReturn()) return o;
            }
        } finally {
            env = previous;
        }
        return Outcome.normalNone();
    }

    private static List<Value> iterate(Value iterable) {
        switch (iterable.getType()) {
            case LIST:
                return iterable.asList();
            case STRING: {
                String s = iterable.asString();
                List<Value> chars = new ArrayList<>(s.length());
                for (int i = 0; i < s.length(); i++) chars.add(Value.string(String.valueOf(s.charAt(i))));
                return chars;
            }
            default:
                throw new ExecutionException("Cannot iterate over " + iterable.typeName());
        }
    }

    @Override
    public Outcome visitReturnStatement(ReturnStatement node) {
        Value value = (node.value() == null) ? Value.none() : eval(node.value());
        return Outcome.returning(value);
    }

    private Outcome executeBlock(List<Node> statements) {
        for (Node stmt : statements) {
            Outcome o = stmt.accept(this);
            if (o.isReturn()) return o;
        }
        return Outcome.normalNone();
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Outcome visitVariable(Variable node) {
        return Outcome.normal(env.get(node.name()));
    }

    @Override
    public Outcome visitBinaryOp(BinaryOp node) {
        BinaryOperator op = node.operator();
        if (op == BinaryOperator.AND) {
            if (!eval(node.left()).isTruthy()) return Outcome.normal(Value.bool(false));
            return Outcome.normal(Value.bool(eval(node.right()).isTruthy()));
        }
        if (op == BinaryOperator.OR) {
            if (eval(node.left()).isTruthy()) return Outcome.normal(Value.bool(true));
            return Outcome.normal(Value.bool(eval(node.right()).isTruthy()));
        }
        Value left = eval(node.left());
        Value right = eval(node.right());
        return Outcome.normal(Operators.binary(op, left, right));
    }

    @Override
    public Outcome visitUnaryOp(UnaryOp node) {
        return Outcome.normal(Operators.unary(node.operator(), eval(node.operand())));
    }

    @Override
    public Outcome visitLiteral(Literal node) {
        switch (node.kind()) {
            case INT: return Outcome.normal(Value.integer((Long) node.value()));
            case FLOAT: return Outcome.normal(Value.floating((Double) node.value()));
            case STRING: return Outcome.normal(Value.string((String) node.value()));
            case BOOL: return Outcome.normal(Value.bool((Boolean) node.value()));
            default: return Outcome.normalNone();
        }
    }

    @Override
    public Outcome visitListLiteral(ListLiteral node) {
        List<Value> items = new ArrayList<>(node.elements().size());
        for (Node element : node.elements()) items.add(eval(element));
        return Outcome.normal(Value.list(items));
    }

    @Override
    public Outcome visitDictLiteral(DictLiteral node) {
        Map<Value, Value> entries = new LinkedHashMap<>();
        for (DictEntry entry : node.entries()) {
            Value key = eval(entry.key());
            if (!key.isHashable()) throw new ExecutionException("Unsupported dict key type: " + key.typeName());
            entries.put(key, eval(entry.value()));
        }
        return Outcome.normal(Value.dict(entries));
    }

    @Override
    public Outcome visitFunctionCall(FunctionCall node) {
        Value callee = eval(node.callee());
        List<Value> args = new ArrayList<>(node.arguments().size());
        for (Node arg : node.arguments()) args.add(eval(arg));
        return Outcome.normal(call(callee, args));
    }

    public Value call(Value callee, List<Value> args) {
        switch (callee.getType()) {
            case BUILTIN:
                return callBuiltin(callee.asBuiltin(), args);
            case FUNCTION:
                return callFunction(callee.asFunction(), args);
            default:
                throw new ExecutionException("Value of type " + callee.typeName() + " is not callable");
        }
    }

    private Value callBuiltin(Value.Native fn, List<Value> args) {
        Value result;
        try {
            result = fn.function.call(args);
        } catch (ExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExecutionException("Builtin '" + fn.name + "' failed: " + e.getMessage(), e);
        }
        return (result == null) ? Value.none() : result;
    }

    private Value callFunction(FunctionDef def, List<Value> args) {
        if (args.size() != def.parameters().size()) {
            throw new ExecutionException("Function '" + def.name() + "' expects " + def.parameters().size()
                    + " argument(s), got " + args.size());
        }
        if (callDepth >= maxCallDepth) {
            throw new ExecutionException("Maximum call depth exceeded (" + maxCallDepth + ") in '" + def.name() + "'");
        }

        Environment callEnv = new Environment(globals);
        for (int i = 0; i < args.size(); i++) {
            callEnv.define(def.parameters().get(i), args.get(i));
        }

        Environment previous = env;
        env = callEnv;
        callDepth++;
        try {
            Outcome o = executeBlock(def.body());
            return o.isReturn() ? o.value : Value.none();
        } finally {
            env = previous;
            callDepth--;
        }
    }

    @Override
    public Outcome visitMemberAccess(MemberAccess node) {
        Value object = eval(node.object());
        if (object.getType() != Value.Type.DICT) {
            throw new ExecutionException("Member access '." + node.member() + "' requires a dict, got " + object.typeName());
        }
        Value v = object.asDict().get(Value.string(node.member()));
        if (v == null) throw new ExecutionException("Unknown member '" + node.member() + "'");
        return Outcome.normal(v);
    }

    @Override
    public Outcome visitIndexAccess(IndexAccess node) {
        Value object = eval(node.object());
        Value index = eval(node.index());

        switch (object.getType()) {
            case LIST: {
                List<Value> items = object.asList();
                return Outcome.normal(items.get(position(index, items.size())));
            }
            case STRING: {
                String s = object.asString();
                return Outcome.normal(Value.string(String.valueOf(s.charAt(position(index, s.length())))));
            }
            case DICT: {
                if (!index.isHashable()) throw new ExecutionException("Unsupported dict key type: " + index.typeName());
                Value v = object.asDict().get(index);
                if (v == null) throw new ExecutionException("Key not found: " + index.repr());
                return Outcome.normal(v);
            }
            default:
                throw new ExecutionException("Cannot index into " + object.typeName());
        }
    }

    private static int position(Value index, int size) {
        if (index.getType() != Value.Type.INT) {
            throw new ExecutionException("Index must be an int, got " + index.typeName());
        }
        long i = index.asInt();
        if (i < 0) i += size;
        if (i < 0 || i >= size) throw new ExecutionException("Index out of range: " + index.asInt());
        return (int) i;
    }

    private Value eval(Node expr) {
        return expr.accept(this).value;
    }
}
