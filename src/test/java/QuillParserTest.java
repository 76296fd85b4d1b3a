import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.quill.script.errors.ErrorKind;
import com.quill.script.errors.ParseError;
import com.quill.script.parser.Ast;
import com.quill.script.parser.Ast.Binary;
import com.quill.script.parser.Ast.FunctionCall;
import com.quill.script.parser.Ast.Identifier;
import com.quill.script.parser.Ast.IfStatement;
import com.quill.script.parser.Ast.Node;
import com.quill.script.parser.Ast.NumberLiteral;
import com.quill.script.parser.Ast.Unary;
import com.quill.script.parser.Ast.VarAssignment;
import com.quill.script.parser.Ast.VarDeclaration;
import com.quill.script.parser.Lexer;
import com.quill.script.parser.Parser;
import com.quill.script.parser.TokenType;

public class QuillParserTest {

    private static List<Node> parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parse();
    }

    private static Node single(String src) {
        List<Node> program = parse(src);
        assertEquals(1, program.size());
        return program.get(0);
    }

    @Test
    void declarationAssignmentAndExpressionStatements() {
        List<Node> program = parse("let x = 10 + 5; x = 8; x;");

        assertEquals(3, program.size());
        VarDeclaration decl = assertInstanceOf(VarDeclaration.class, program.get(0));
        assertEquals("x", decl.name());
        assertInstanceOf(Binary.class, decl.value);

        VarAssignment assign = assertInstanceOf(VarAssignment.class, program.get(1));
        assertEquals("x", assign.name());
        assertInstanceOf(NumberLiteral.class, assign.value);

        assertInstanceOf(Identifier.class, program.get(2));
    }

    @Test
    void productBindsTighterThanSum() {
        Binary sum = assertInstanceOf(Binary.class, single("1 + 2 * 3;"));
        assertEquals(TokenType.PLUS, sum.operator.type);
        Binary product = assertInstanceOf(Binary.class, sum.right);
        assertEquals(TokenType.STAR, product.operator.type);
    }

    @Test
    void divisionSitsWithMultiplication() {
        Binary sum = assertInstanceOf(Binary.class, single("1 - 6 / 3;"));
        assertEquals(TokenType.MINUS, sum.operator.type);
        assertEquals(TokenType.SLASH, ((Binary) sum.right).operator.type);
    }

    @Test
    void powerIsLeftAssociative() {
        Binary outer = assertInstanceOf(Binary.class, single("2 ^ 3 ^ 2;"));
        assertEquals(TokenType.CARET, outer.operator.type);
        Binary inner = assertInstanceOf(Binary.class, outer.left);
        assertEquals(TokenType.CARET, inner.operator.type);
        assertInstanceOf(NumberLiteral.class, outer.right);
    }

    @Test
    void comparisonIsLowestPrecedence() {
        Binary cmp = assertInstanceOf(Binary.class, single("1 + 1 > 1;"));
        assertEquals(TokenType.GREATER, cmp.operator.type);
        assertInstanceOf(Binary.class, cmp.left);
    }

    @Test
    void parenthesesOverridePrecedence() {
        Binary product = assertInstanceOf(Binary.class, single("(1 + 2) * 3;"));
        assertEquals(TokenType.STAR, product.operator.type);
        assertInstanceOf(Binary.class, product.left);
    }

    @Test
    void unarySignWrapsPrimary() {
        Unary neg = assertInstanceOf(Unary.class, single("-x;"));
        assertTrue(neg.isNegative());
        assertInstanceOf(Identifier.class, neg.operand);

        Unary pos = assertInstanceOf(Unary.class, single("+(1);"));
        assertFalse(pos.isNegative());
    }

    @Test
    void functionCalls() {
        FunctionCall call = assertInstanceOf(FunctionCall.class, single("substring(\"hello\", 1, 1 + 2);"));
        assertEquals("substring", call.name());
        assertEquals(3, call.arguments.size());
        assertInstanceOf(Binary.class, call.arguments.get(2));

        FunctionCall empty = assertInstanceOf(FunctionCall.class, single("random();"));
        assertTrue(empty.arguments.isEmpty());
    }

    @Test
    void callArgumentsAreSums() {
        // a comparison is not a valid argument without parentheses
        assertThrows(ParseError.class, () -> parse("print(1 > 2);"));
        FunctionCall call = assertInstanceOf(FunctionCall.class, single("print((1 > 2));"));
        assertEquals(TokenType.GREATER, ((Binary) call.arguments.get(0)).operator.type);
    }

    @Test
    void ifStatementWithBody() {
        IfStatement stmt = assertInstanceOf(IfStatement.class,
                single("if x > 1 { let y = 2; print(y); };"));
        assertInstanceOf(Binary.class, stmt.condition);
        assertEquals(2, stmt.body.size());
        assertInstanceOf(VarDeclaration.class, stmt.body.get(0));
        assertInstanceOf(FunctionCall.class, stmt.body.get(1));
    }

    @Test
    void ifWithEmptyBody() {
        IfStatement stmt = assertInstanceOf(IfStatement.class, single("if true { };"));
        assertTrue(stmt.body.isEmpty());
    }

    @Test
    void ifRequiresTrailingSemicolon() {
        assertThrows(ParseError.class, () -> parse("if true { print(1); }"));
    }

    @Test
    void nestedIf() {
        IfStatement outer = assertInstanceOf(IfStatement.class, single("if a { if b { c = 1; }; };"));
        assertInstanceOf(IfStatement.class, outer.body.get(0));
    }

    @Test
    void emptyProgram() {
        assertTrue(parse("").isEmpty());
    }

    @Test
    void missingSemicolonReportsFoundToken() {
        ParseError e = assertThrows(ParseError.class, () -> parse("let x = 1"));
        assertEquals(ErrorKind.PARSE, e.kind());
        assertTrue(e.detail().contains("Expect ';'"), e.detail());
        assertTrue(e.detail().contains("end of input"), e.detail());
    }

    @Test
    void doubleEqualsIsNotComparison() {
        assertThrows(ParseError.class, () -> parse("1 == 1;"));
    }

    @Test
    void letWithoutNameFails() {
        ParseError e = assertThrows(ParseError.class, () -> parse("let = 3;"));
        assertEquals(1, e.line());
        assertEquals(5, e.column());
    }

    @Test
    void unclosedParenthesis() {
        ParseError e = assertThrows(ParseError.class, () -> parse("(1 + 2;"));
        assertTrue(e.detail().contains("Expect ')'"), e.detail());
    }

    @Test
    void strayTokenIsNotAnExpression() {
        assertThrows(ParseError.class, () -> parse("let x = ;"));
        assertThrows(ParseError.class, () -> parse("[1];"));
    }

    private static String repeat(String s, int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) sb.append(s);
        return sb.toString();
    }

    @Test
    void deepParenthesesAreRejected() {
        String src = repeat("(", 200_000) + "1" + repeat(")", 200_000) + ";";
        ParseError e = assertThrows(ParseError.class, () -> parse(src));
        assertTrue(e.detail().contains("Nesting deeper than"), e.detail());
    }

    @Test
    void longOperatorChainsAreRejected() {
        String src = "1" + repeat(" + 1", 100_000) + ";";
        ParseError e = assertThrows(ParseError.class, () -> parse(src));
        assertTrue(e.detail().contains("Expression deeper than"), e.detail());
    }

    @Test
    void deepSignsAndIfsAreRejected() {
        assertThrows(ParseError.class, () -> parse(repeat("-", 5_000) + "1;"));
        assertThrows(ParseError.class, () -> parse(repeat("if true { ", 5_000) + repeat("}; ", 5_000)));
    }

    @Test
    void moderateNestingIsAccepted() {
        assertEquals(1, parse(repeat("(", 500) + "1" + repeat(")", 500) + ";").size());
        assertEquals(1, parse("1" + repeat(" * 2", 500) + ";").size());
    }

    @Test
    void parserRequiresEofTerminatedTokens() {
        assertThrows(IllegalArgumentException.class, () -> new Parser(List.of()));
    }

    @Test
    void nodesExposeTheirToken() {
        Ast.Node node = single("let answer = 42;");
        assertEquals("answer", node.token().lexeme);
        assertEquals(5, node.token().column);
    }
}
