package com.quill.script.parser;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.quill.debug.Debug;
import com.quill.script.errors.ParseError;
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
 * Recursive-descent parser.
 *
 * <pre>
 * program    := (statement ';')*
 * statement  := 'let' IDENT '=' comparison
 *             | 'if' comparison '{' (statement ';')* '}'
 *             | IDENT '=' comparison
 *             | comparison
 * comparison := sum (('&gt;' | '&lt;') sum)*
 * sum        := product (('+' | '-') product)*
 * product    := power (('*' | '/') power)*
 * power      := primary ('^' primary)*
 * primary    := '(' comparison ')' | NUMBER | BOOLEAN | STRING
 *             | ('+' | '-') primary
 *             | IDENT '(' [sum (',' sum)*] ')'
 *             | IDENT
 * </pre>
 *
 * The first mismatch aborts with a {@link ParseError}; there is no recovery.
 *
 * Trees are limited to {@link #MAX_DEPTH} levels, counting both bracket nesting and
 * operator chains, so that neither parsing nor evaluation can exhaust the stack.
 */
public class Parser {
    private static final String TAG = "Parser";

    static final String LET = "let";
    static final String IF = "if";
    static final int MAX_DEPTH = 1000;

    private final List<Token> tokens;
    private int current = 0;
    private int nesting = 0;
    // Height of every non-leaf node built so far; leaves count as 1.
    private final Map<Node, Integer> heights = new IdentityHashMap<>();

    public Parser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public List<Node> parse() {
        List<Node> statements = new ArrayList<Node>();
        while (!isAtEnd()) {
            statements.add(terminatedStatement());
        }
        Debug.get().d(TAG, "parsed " + statements.size() + " top-level statements");
        return statements;
    }

    private Node terminatedStatement() {
        Node node = statement();
        consume(TokenType.SEMICOLON, "Expect ';' after statement.");
        return node;
    }

    private Node statement() {
        if (checkWord(LET)) return varDeclaration();
        if (checkWord(IF)) return ifStatement();
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUAL)) return varAssignment();
        return comparison();
    }

    private Node varDeclaration() {
        advance(); // 'let'
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name after 'let'.");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        Node value = comparison();
        return measured(new VarDeclaration(name, value), name, value);
    }

    private Node varAssignment() {
        Token name = advance();
        advance(); // '='
        Node value = comparison();
        return measured(new VarAssignment(name, value), name, value);
    }

    private Node ifStatement() {
        Token keyword = advance();
        Node condition = comparison();
        consume(TokenType.LEFT_BRACE, "Expect '{' after if condition.");

        List<Node> body = new ArrayList<>();
        enter(keyword);
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            body.add(terminatedStatement());
        }
        nesting--;
        consume(TokenType.RIGHT_BRACE, "Expect '}' after if body.");

        List<Node> children = new ArrayList<>(body);
        children.add(condition);
        return measured(new IfStatement(keyword, condition, body), keyword, children);
    }

    private Node comparison() {
        Node expr = sum();
        while (match(TokenType.GREATER, TokenType.LESS)) {
            Token op = previous();
            Node right = sum();
            expr = measured(new Binary(expr, op, right), op, expr, right);
        }
        return expr;
    }

    private Node sum() {
        Node expr = product();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Node right = product();
            expr = measured(new Binary(expr, op, right), op, expr, right);
        }
        return expr;
    }

    private Node product() {
        Node expr = power();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token op = previous();
            Node right = power();
            expr = measured(new Binary(expr, op, right), op, expr, right);
        }
        return expr;
    }

    // Left-associative: 2 ^ 3 ^ 2 == (2 ^ 3) ^ 2
    private Node power() {
        Node expr = primary();
        while (match(TokenType.CARET)) {
            Token op = previous();
            Node right = primary();
            expr = measured(new Binary(expr, op, right), op, expr, right);
        }
        return expr;
    }

    private Node primary() {
        if (match(TokenType.LEFT_PAREN)) {
            enter(previous());
            Node expr = comparison();
            nesting--;
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }
        if (match(TokenType.NUMBER)) return new NumberLiteral(previous(), (Double) previous().literal);
        if (match(TokenType.BOOLEAN)) return new BoolLiteral(previous(), (Boolean) previous().literal);
        if (match(TokenType.STRING)) return new StringLiteral(previous(), (String) previous().literal);

        if (match(TokenType.PLUS, TokenType.MINUS)) {
            Token sign = previous();
            enter(sign);
            Node operand = primary();
            nesting--;
            return measured(new Unary(sign, operand), sign, operand);
        }

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.LEFT_PAREN)) return finishCall(name);
            return new Identifier(name);
        }

        throw error(peek(), "Expect expression.");
    }

    private Node finishCall(Token name) {
        List<Node> arguments = new ArrayList<>();
        enter(name);
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(sum());
            } while (match(TokenType.COMMA));
        }
        nesting--;
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return measured(new FunctionCall(name, arguments), name, arguments);
    }

    // -------------------------
    // Depth limits
    // -------------------------

    private void enter(Token at) {
        if (++nesting > MAX_DEPTH) {
            throw error(at, "Nesting deeper than " + MAX_DEPTH + " levels.");
        }
    }

    private Node measured(Node node, Token at, Node... children) {
        return measured(node, at, List.of(children));
    }

    private Node measured(Node node, Token at, List<Node> children) {
        int height = 0;
        for (Node child : children) height = Math.max(height, heights.getOrDefault(child, 1));
        height++;
        if (height > MAX_DEPTH) {
            throw error(at, "Expression deeper than " + MAX_DEPTH + " levels.");
        }
        heights.put(node, height);
        return node;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private boolean checkWord(String word) {
        return check(TokenType.IDENTIFIER) && word.equals(peek().lexeme);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        return new ParseError(message + " Found " + token + ".", token.line, token.column);
    }
}
