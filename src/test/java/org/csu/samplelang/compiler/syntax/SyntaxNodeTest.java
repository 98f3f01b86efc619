package org.csu.samplelang.compiler.syntax;

import org.csu.samplelang.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.samplelang.compiler.parser.ast.expression.IdentifierNameNode;
import org.csu.samplelang.compiler.parser.ast.expression.LiteralExpressionNode;
import org.csu.samplelang.compiler.parser.ast.statement.BlockNode;
import org.csu.samplelang.compiler.parser.ast.statement.ProgramNode;
import org.csu.samplelang.compiler.parser.ast.statement.VarDeclStatementNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: 语法树模型的单元测试：叶子/分支的区分、parent 的自动维护
 */
public class SyntaxNodeTest {

    private static SyntaxToken token(SyntaxKind kind, String text) {
        return new SyntaxToken(kind, text, 1, 1);
    }

    private static LiteralExpressionNode number(String text) {
        return new LiteralExpressionNode(SyntaxKind.NUMERIC_LITERAL_EXPRESSION,
                new SyntaxToken(SyntaxKind.NUMERIC_LITERAL_TOKEN, text, Double.valueOf(text), 1, 1));
    }

    @Test
    void testKindRanges() {
        for (SyntaxKind kind : SyntaxKind.values()) {
            assertNotNull(kind.displayName());
            assertEquals(kind, SyntaxKind.fromDisplayName(kind.displayName()));
            if (kind.isKeyword() || kind.isTrivia()) {
                assertTrue(kind.isToken(), kind + " should be a token kind");
            }
        }
        assertTrue(SyntaxKind.STRING_LITERAL_TOKEN.isToken());
        assertFalse(SyntaxKind.IDENTIFIER_NAME.isToken());
        assertFalse(SyntaxKind.PROGRAM.isToken());
        assertTrue(SyntaxKind.ADD_EXPRESSION.isBinaryExpression());
        assertFalse(SyntaxKind.UNARY_MINUS_EXPRESSION.isBinaryExpression());
        assertNull(SyntaxKind.fromDisplayName("AndKeyword"));
    }

    @Test
    void testTokenRequiresTokenKind() {
        assertThrows(IllegalArgumentException.class, () -> token(SyntaxKind.BLOCK, "{"));
        SyntaxToken semicolon = token(SyntaxKind.SEMICOLON_TOKEN, ";");
        assertTrue(semicolon.isToken());
        assertNull(semicolon.getParent());
        assertNull(semicolon.getValue());
    }

    @Test
    void testNodeRejectsTokenKind() {
        assertThrows(IllegalArgumentException.class,
                () -> new BinaryExpressionNode(SyntaxKind.PLUS_TOKEN, number("1"), token(SyntaxKind.PLUS_TOKEN, "+"), number("2")));
        assertThrows(IllegalArgumentException.class,
                () -> new LiteralExpressionNode(SyntaxKind.ADD_EXPRESSION, token(SyntaxKind.NUMERIC_LITERAL_TOKEN, "1")));
        assertThrows(IllegalArgumentException.class,
                () -> new IdentifierNameNode(token(SyntaxKind.LET_KEYWORD, "let")));
    }

    @Test
    void testParentIsSetOnAttach() {
        System.out.println("--- Running test: testParentIsSetOnAttach ---");
        LiteralExpressionNode left = number("1");
        SyntaxToken plus = token(SyntaxKind.PLUS_TOKEN, "+");
        LiteralExpressionNode right = number("2");
        BinaryExpressionNode sum = new BinaryExpressionNode(SyntaxKind.ADD_EXPRESSION, left, plus, right);

        assertEquals(3, sum.getChildren().size());
        assertSame(sum, left.getParent());
        assertSame(sum, plus.getParent());
        assertSame(sum, right.getParent());
        assertSame(left, sum.getChildren().get(0));
        assertSame(plus, sum.operator());
        assertTrue(left.isParentKind(SyntaxKind.ADD_EXPRESSION));
        assertFalse(left.isParentKind(SyntaxKind.BLOCK));
        assertNull(sum.getParent());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testElementCannotHaveTwoParents() {
        LiteralExpressionNode shared = number("7");
        new BinaryExpressionNode(SyntaxKind.ADD_EXPRESSION, shared, token(SyntaxKind.PLUS_TOKEN, "+"), number("1"));
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new BinaryExpressionNode(SyntaxKind.SUBTRACT_EXPRESSION, shared, token(SyntaxKind.MINUS_TOKEN, "-"), number("1")));
        assertTrue(e.getMessage().contains("already attached"));
    }

    @Test
    void testChildrenAreReadOnly() {
        BlockNode block = new BlockNode(List.of());
        assertTrue(block.isEmpty());
        assertThrows(UnsupportedOperationException.class,
                () -> block.getChildren().add(token(SyntaxKind.SEMICOLON_TOKEN, ";")));
        assertThrows(UnsupportedOperationException.class, () -> block.elements().add(new BlockNode(List.of())));
    }

    @Test
    void testVarDeclArityDependsOnInitializer() {
        VarDeclStatementNode withoutInitializer = new VarDeclStatementNode(token(SyntaxKind.LET_KEYWORD, "let"),
                new IdentifierNameNode(token(SyntaxKind.IDENTIFIER_TOKEN, "x")), null);
        assertEquals(2, withoutInitializer.getChildren().size());
        assertNull(withoutInitializer.initializer());

        VarDeclStatementNode withInitializer = new VarDeclStatementNode(token(SyntaxKind.LET_KEYWORD, "let"),
                new IdentifierNameNode(token(SyntaxKind.IDENTIFIER_TOKEN, "y")), number("3"));
        assertEquals(3, withInitializer.getChildren().size());
    }

    @Test
    void testProgramIsRoot() {
        BlockNode block = new BlockNode(List.of(new BlockNode(List.of())));
        ProgramNode program = new ProgramNode(token(SyntaxKind.PROGRAM_KEYWORD, "program"),
                new IdentifierNameNode(token(SyntaxKind.IDENTIFIER_TOKEN, "P")), block);
        assertNull(program.getParent());
        assertEquals("P", program.getName());
        assertSame(program, block.getParent());
        assertTrue(block.elements().get(0).isParentKind(SyntaxKind.BLOCK));
        assertEquals(3, program.getChildren().size());
    }
}
