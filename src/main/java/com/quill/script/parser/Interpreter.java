package com.quill.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.quill.debug.Debug;
import com.quill.script.QuillConfig;
import com.quill.script.errors.ArithmeticError;
import com.quill.script.errors.QuillError;
import com.quill.script.errors.TypeError;
import com.quill.script.functions.FunctionRegistry;
import com.quill.script.parser.Ast.Binary;
import com.quill.script.parser.Ast.BoolLiteral;
import com.quill.script.parser.Ast.FunctionCall;
import com.quill.script.parser.Ast.Identifier;
import com.quill.script.parser.Ast.IfStatement;
import com.quill.script.parser.Ast.Node;
import com.quill.script.parser.Ast.NumberLiteral;
import com.quill.script.parser.Ast.StringLiteral;
import com.quill.script.parser.Ast.Unary;
import com.quill.script.parser.Ast.VarAssignment;
import com.quill.script.parser.Ast.VarDeclaration;

/**
 * Tree-walking evaluator.
 *
 * Owns one {@link Environment} and one {@link FunctionRegistry} for its whole life;
 * successive {@link #run(String)} calls share both. Not thread-safe.
 */
public class Interpreter implements Ast.Visitor<Value> {
    private static final String TAG = "Interpreter";

    private final Environment env;
    private final FunctionRegistry functions;
    private final int maxStringLength;

    public Interpreter(FunctionRegistry functions) {
        this(functions, new Environment(), QuillConfig.DEFAULT_MAX_STRING_LENGTH);
    }

    public Interpreter(FunctionRegistry functions, Environment env) {
        this(functions, env, QuillConfig.DEFAULT_MAX_STRING_LENGTH);
    }

    public Interpreter(FunctionRegistry functions, Environment env, int maxStringLength) {
        if (functions == null) throw new IllegalArgumentException("functions must not be null");
        if (env == null) throw new IllegalArgumentException("env must not be null");
        this.functions = functions;
        this.env = env;
        this.maxStringLength = maxStringLength;
    }

    public Environment environment() { return env; }

    /** Lex, parse and evaluate; returns the value of the last top-level statement. */
    public Value run(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        List<Node> program = new Parser(tokens).parse();
        return execute(program);
    }

    public Value execute(List<Node> program) {
        Value last = Value.nil();
        for (Node node : program) last = eval(node);
        return last;
    }

    public Value eval(Node node) {
        try {
            return node.accept(this);
        } catch (QuillError e) {
            Token at = node.token();
            throw e.at(at.line, at.column);
        }
    }

    // -------------------------
    // Literals and names
    // -------------------------

    @Override
    public Value visitNumberLiteral(NumberLiteral node) { return Value.number(node.value); }

    @Override
    public Value visitBoolLiteral(BoolLiteral node) { return Value.bool(node.value); }

    @Override
    public Value visitStringLiteral(StringLiteral node) { return Value.string(node.value); }

    @Override
    public Value visitIdentifier(Identifier node) {
        return env.resolve(node.name());
    }

    @Override
    public Value visitFunctionCall(FunctionCall node) {
        List<Value> args = new ArrayList<>(node.arguments.size());
        for (Node arg : node.arguments) args.add(eval(arg));
        return functions.call(node.name(), args);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Value visitVarDeclaration(VarDeclaration node) {
        Value value = eval(node.value);
        env.declare(node.name(), value);
        return Value.nil();
    }

    @Override
    public Value visitVarAssignment(VarAssignment node) {
        Value value = eval(node.value);
        env.assign(node.name(), value);
        return Value.nil();
    }

    @Override
    public Value visitIfStatement(IfStatement node) {
        Value cond = eval(node.condition);
        if (cond.getType() != Value.Type.BOOL) {
            throw new TypeError("if condition must be a bool, got " + cond.describe());
        }
        if (!cond.asBool()) return Value.nil();

        env.pushBlock();
        try {
            for (Node stmt : node.body) eval(stmt);
        } finally {
            env.popBlock();
        }
        return Value.nil();
    }

    // -------------------------
    // Operators
    // -------------------------

    /** Sign application reuses '*', so +"ab" is "ab" and -"ab" is a negative repeat. */
    @Override
    public Value visitUnary(Unary node) {
        Value operand = eval(node.operand);
        return multiply(operand, Value.number(node.isNegative() ? -1.0 : 1.0));
    }

    @Override
    public Value visitBinary(Binary node) {
        Value left = eval(node.left);
        Value right = eval(node.right);

        switch (node.operator.type) {
            case PLUS:
                if (bothNumbers(left, right)) return Value.number(left.asNumber() + right.asNumber());
                if (isTextPair(left, right)) return Value.string(left.stringify() + right.stringify());
                throw unsupported("add", left, right);

            case MINUS:
                if (bothNumbers(left, right)) return Value.number(left.asNumber() - right.asNumber());
                throw unsupported("subtract", left, right);

            case STAR:
                return multiply(left, right);

            case SLASH:
                if (!bothNumbers(left, right)) throw unsupported("divide", left, right);
                if (right.asNumber() == 0.0) {
                    throw new ArithmeticError("Cannot divide by zero: "
                            + Value.formatNumber(left.asNumber()) + " / " + Value.formatNumber(right.asNumber()));
                }
                return Value.number(left.asNumber() / right.asNumber());

            case CARET:
                if (bothNumbers(left, right)) return Value.number(Math.pow(left.asNumber(), right.asNumber()));
                throw unsupported("raise", left, right);

            case GREATER:
                if (bothNumbers(left, right)) return Value.bool(left.asNumber() > right.asNumber());
                throw unsupported("compare", left, right);

            case LESS:
                if (bothNumbers(left, right)) return Value.bool(left.asNumber() < right.asNumber());
                throw unsupported("compare", left, right);

            default:
                throw new IllegalStateException("Unsupported binary operator: " + node.operator.type);
        }
    }

    private Value multiply(Value left, Value right) {
        if (bothNumbers(left, right)) return Value.number(left.asNumber() * right.asNumber());
        if (left.getType() == Value.Type.STRING && right.getType() == Value.Type.NUMBER) {
            return repeat(left.asString(), right.asNumber());
        }
        if (left.getType() == Value.Type.NUMBER && right.getType() == Value.Type.STRING) {
            return repeat(right.asString(), left.asNumber());
        }
        throw unsupported("multiply", left, right);
    }

    private Value repeat(String s, double times) {
        if (Double.isNaN(times) || Double.isInfinite(times)) {
            throw new TypeError("String repeat count must be finite, got " + Value.formatNumber(times));
        }
        long count = (long) times; // truncates toward zero
        if (count < 0) {
            throw new TypeError("String repeat count must not be negative, got " + Value.formatNumber(times));
        }
        if (s.isEmpty()) return Value.string("");
        if (count > maxStringLength / s.length()) {
            throw new TypeError("String repeat result exceeds " + maxStringLength + " characters");
        }
        Debug.get().t(TAG, "repeat " + s.length() + " chars x" + count);
        return Value.string(s.repeat((int) count));
    }

    private static boolean bothNumbers(Value a, Value b) {
        return a.getType() == Value.Type.NUMBER && b.getType() == Value.Type.NUMBER;
    }

    // String+String, String+Number and Number+String concatenate.
    private static boolean isTextPair(Value a, Value b) {
        boolean aText = a.getType() == Value.Type.STRING;
        boolean bText = b.getType() == Value.Type.STRING;
        boolean aNum = a.getType() == Value.Type.NUMBER;
        boolean bNum = b.getType() == Value.Type.NUMBER;
        return (aText && bText) || (aText && bNum) || (aNum && bText);
    }

    private static TypeError unsupported(String verb, Value left, Value right) {
        return new TypeError("Cannot " + verb + " " + left.describe() + " and " + right.describe());
    }
}
