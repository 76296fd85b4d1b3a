package com.quill.script.parser;

import java.util.Collections;
import java.util.List;

/**
 * Syntax tree produced by the {@link Parser}.
 *
 * Every node is immutable and owned by exactly one parent. Nodes keep the token they
 * were built from so runtime errors can point back at the source.
 */
public class Ast {

    public interface Node {
        <R> R accept(Visitor<R> visitor);

        /** Token runtime errors raised by this node are reported at. */
        Token token();
    }

    public interface Visitor<R> {
        R visitNumberLiteral(NumberLiteral node);
        R visitBoolLiteral(BoolLiteral node);
        R visitStringLiteral(StringLiteral node);
        R visitIdentifier(Identifier node);
        R visitFunctionCall(FunctionCall node);
        R visitBinary(Binary node);
        R visitUnary(Unary node);
        R visitVarDeclaration(VarDeclaration node);
        R visitVarAssignment(VarAssignment node);
        R visitIfStatement(IfStatement node);
    }

    // -------------------------
    // Literals
    // -------------------------

    public static final class NumberLiteral implements Node {
        public final Token token;
        public final double value;

        public NumberLiteral(Token token, double value) {
            this.token = token;
            this.value = value;
        }

        @Override public Token token() { return token; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumberLiteral(this);
        }
    }

    public static final class BoolLiteral implements Node {
        public final Token token;
        public final boolean value;

        public BoolLiteral(Token token, boolean value) {
            this.token = token;
            this.value = value;
        }

        @Override public Token token() { return token; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolLiteral(this);
        }
    }

    public static final class StringLiteral implements Node {
        public final Token token;
        public final String value;

        public StringLiteral(Token token, String value) {
            this.token = token;
            this.value = value;
        }

        @Override public Token token() { return token; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringLiteral(this);
        }
    }

    // -------------------------
    // Names and calls
    // -------------------------

    public static final class Identifier implements Node {
        public final Token name;

        public Identifier(Token name) {
            this.name = name;
        }

        public String name() { return name.lexeme; }

        @Override public Token token() { return name; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    public static final class FunctionCall implements Node {
        public final Token name;
        public final List<Node> arguments;

        public FunctionCall(Token name, List<Node> arguments) {
            this.name = name;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        public String name() { return name.lexeme; }

        @Override public Token token() { return name; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Binary implements Node {
        public final Node left;
        public final Token operator;
        public final Node right;

        public Binary(Node left, Token operator, Node right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override public Token token() { return operator; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /** Sign applied to a primary: operator is PLUS or MINUS. */
    public static final class Unary implements Node {
        public final Token sign;
        public final Node operand;

        public Unary(Token sign, Node operand) {
            this.sign = sign;
            this.operand = operand;
        }

        public boolean isNegative() { return sign.type == TokenType.MINUS; }

        @Override public Token token() { return sign; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    public static final class VarDeclaration implements Node {
        public final Token name;
        public final Node value;

        public VarDeclaration(Token name, Node value) {
            this.name = name;
            this.value = value;
        }

        public String name() { return name.lexeme; }

        @Override public Token token() { return name; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarDeclaration(this);
        }
    }

    public static final class VarAssignment implements Node {
        public final Token name;
        public final Node value;

        public VarAssignment(Token name, Node value) {
            this.name = name;
            this.value = value;
        }

        public String name() { return name.lexeme; }

        @Override public Token token() { return name; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVarAssignment(this);
        }
    }

    public static final class IfStatement implements Node {
        public final Token keyword;
        public final Node condition;
        public final List<Node> body;

        public IfStatement(Token keyword, Node condition, List<Node> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = Collections.unmodifiableList(body);
        }

        @Override public Token token() { return keyword; }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfStatement(this);
        }
    }
}
