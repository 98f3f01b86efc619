package org.csu.samplelang.cli.tool;

import org.csu.samplelang.compiler.lexer.Lexer;
import org.csu.samplelang.compiler.syntax.SyntaxToken;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: Token 表格输出的测试
 */
public class TokenListingFormatterTest {

    @Test
    void testTableLayout() {
        System.out.println("--- Running test: testTableLayout ---");
        List<SyntaxToken> tokens = new Lexer("let x;\n").tokenize();
        String table = TokenListingFormatter.format(tokens);
        System.out.println(table);

        String[] lines = table.split("\n");
        // 上边框 + 表头 + 分隔线 + 每个 Token 一行 + 下边框 + 统计
        assertEquals(tokens.size() + 5, lines.length);
        assertTrue(lines[0].startsWith("+-"));
        assertTrue(lines[1].startsWith("| Line:Col "));
        assertTrue(lines[1].contains("| Source Text "));
        assertTrue(lines[1].contains("| Syntax Kind "));
        for (int i = 0; i < lines.length - 1; i++) {
            assertEquals(lines[0].length(), lines[i].length(), "row " + i + " is not aligned");
        }
        assertTrue(lines[3].startsWith("| 1:1 "));
        assertTrue(lines[3].contains("| let "));
        assertTrue(lines[3].contains("| LetKeyword "));
        assertTrue(lines[7].contains("| \\n "), "line break is shown escaped");
        assertTrue(lines[8].contains("| EndOfFileToken "));
        assertEquals(tokens.size() + " tokens.", lines[lines.length - 1]);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEscape() {
        assertEquals("a b", TokenListingFormatter.escape("a b"));
        assertEquals("\\t\\r\\n", TokenListingFormatter.escape("\t\r\n"));
        assertEquals("\\u00A0\\u3000\\uFEFF", TokenListingFormatter.escape("\u00A0\u3000\uFEFF"));
        assertEquals("'árvíztűrő'", TokenListingFormatter.escape("'árvíztűrő'"));
    }

    @Test
    void testEmptyListing() {
        String table = TokenListingFormatter.format(List.of());
        assertTrue(table.endsWith("0 tokens."));
        assertEquals(5, table.split("\n").length);
    }
}
