package org.csu.samplelang.compiler.parser;

import org.csu.samplelang.common.exception.ParseException;
import org.csu.samplelang.compiler.lexer.TokenSource;
import org.csu.samplelang.compiler.parser.ast.statement.ProgramNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * @description: 用模拟的 TokenSource 检查 Parser 与词法分析器之间的约定
 */
public class ParserTokenSourceTest {

    private static SyntaxToken token(SyntaxKind kind, String text, int column) {
        return new SyntaxToken(kind, text, 1, column);
    }

    @Test
    void testTriviaIsSkippedAndSourceIsReset() {
        System.out.println("--- Running test: testTriviaIsSkippedAndSourceIsReset ---");
        TokenSource source = mock(TokenSource.class);
        when(source.next()).thenReturn(
                token(SyntaxKind.PROGRAM_KEYWORD, "program", 1),
                token(SyntaxKind.WHITE_SPACE_TRIVIA, " ", 8),
                token(SyntaxKind.IDENTIFIER_TOKEN, "P", 9),
                token(SyntaxKind.END_OF_LINE_TOKEN, "\n", 10),
                token(SyntaxKind.OPEN_BRACE_TOKEN, "{", 1),
                token(SyntaxKind.CLOSE_BRACE_TOKEN, "}", 2),
                token(SyntaxKind.END_OF_FILE_TOKEN, "", 3));

        ProgramNode program = new Parser(source).parse();

        assertEquals("P", program.getName());
        assertTrue(program.block().isEmpty());
        // 到达 EOF 后不再向 TokenSource 要 Token
        verify(source, times(7)).next();
        verify(source, times(1)).reset();
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSourceIsResetWhenParsingFails() {
        TokenSource source = mock(TokenSource.class);
        when(source.next()).thenReturn(
                token(SyntaxKind.PROGRAM_KEYWORD, "program", 1),
                token(SyntaxKind.OPEN_BRACE_TOKEN, "{", 9));

        ParseException e = assertThrows(ParseException.class, () -> new Parser(source).parse());
        assertEquals("IdentifierToken expected instead of the token 'OpenBraceToken'. (line 1, column 9)",
                e.getMessage());
        verify(source).reset();
    }

    @Test
    void testLexerErrorsPropagate() {
        TokenSource source = mock(TokenSource.class);
        when(source.next()).thenThrow(new IllegalStateException("broken source"));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new Parser(source).parse());
        assertEquals("broken source", e.getMessage());
        verify(source).reset();
    }
}
