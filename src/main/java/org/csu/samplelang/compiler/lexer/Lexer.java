package org.csu.samplelang.compiler.lexer;

import org.csu.samplelang.common.exception.LexException;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将源代码文本按需分解为 Token。空白和换行也会作为 Token 返回（供显示使用），
 * 由语法分析器自行跳过。遇到错误立即抛出 {@link LexException}，不做恢复。
 */
public class Lexer implements TokenSource {

    private final String source;
    private final KeywordTable keywords;
    private final int lastPos;   // 最后一个有效字符的下标

    private int pos = 0;         // 当前读取的位置
    private int line = 1;        // 当前行号
    private int column = 1;      // 当前列号

    public Lexer(String source) {
        this(source, KeywordTable.defaults());
    }

    public Lexer(String source, KeywordTable keywords) {
        this.source = source == null ? "" : source;
        this.keywords = Objects.requireNonNull(keywords, "keywords");
        this.lastPos = this.source.length() - 1;
    }

    /**
     * 游标是否已经越过源文本末尾
     */
    public boolean isEOF() {
        return pos > lastPos;
    }

    /**
     * 从头开始扫描，返回全部 Token（包括空白和最后的 EOF）。
     * 扫描前后都会 reset，所以不会影响之后对 next() 的使用。
     */
    public List<SyntaxToken> tokenize() {
        reset();
        List<SyntaxToken> tokens = new ArrayList<>();
        SyntaxToken token;
        do {
            token = next();
            tokens.add(token);
        } while (token.getKind() != SyntaxKind.END_OF_FILE_TOKEN);
        reset();
        return tokens;
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token，源文本结束后总是返回 EndOfFileToken
     */
    @Override
    public SyntaxToken next() {
        while (pos <= lastPos) {
            char currentChar = peek();

            if (CharClassifier.isLineBreak(currentChar)) {
                return scanEndOfLine();
            }
            if (CharClassifier.isWhiteSpaceSingleLine(currentChar)) {
                return scanWhiteSpaceTrivia();
            }
            if (currentChar == '"' || currentChar == '\'') {
                return scanStringLiteral();
            }
            // 下划线也进入标识符扫描，由 scanIdentifierOrKeyword 报告非法的开头
            if (CharClassifier.isLetter(currentChar) || currentChar == '_') {
                return scanIdentifierOrKeyword();
            }
            if (CharClassifier.isDigit(currentChar)) {
                return scanNumericLiteral();
            }

            switch (currentChar) {
                case '{':
                    return consumeAndReturn(SyntaxKind.OPEN_BRACE_TOKEN);
                case '}':
                    return consumeAndReturn(SyntaxKind.CLOSE_BRACE_TOKEN);
                case '(':
                    return consumeAndReturn(SyntaxKind.OPEN_PAREN_TOKEN);
                case ')':
                    return consumeAndReturn(SyntaxKind.CLOSE_PAREN_TOKEN);
                case '=':
                    return consumeAndReturn(SyntaxKind.EQUALS_TOKEN);
                case ';':
                    return consumeAndReturn(SyntaxKind.SEMICOLON_TOKEN);
                case '+':
                    return consumeAndReturn(SyntaxKind.PLUS_TOKEN);
                case '-':
                    return consumeAndReturn(SyntaxKind.MINUS_TOKEN);
                case '*':
                    return consumeAndReturn(SyntaxKind.ASTERISK_TOKEN);
                case '/':
                    return consumeAndReturn(SyntaxKind.SLASH_TOKEN);
                case '|':
                    return consumeAndReturn(SyntaxKind.VERTICAL_BAR_TOKEN);
                default:
                    // 不认识的字符直接吞掉，不产生 Token
                    advance();
            }
        }
        return new SyntaxToken(SyntaxKind.END_OF_FILE_TOKEN, "", line, column);
    }

    /**
     * 将游标移回第一个字符
     */
    @Override
    public void reset() {
        pos = 0;
        line = 1;
        column = 1;
    }

    private SyntaxToken scanEndOfLine() {
        int startPos = pos;
        int startLine = line;
        int startCol = column;
        // CRLF 合并成一个换行 Token
        pos += peek() == '\r' && peekNext() == '\n' ? 2 : 1;
        line++;
        column = 1;
        return new SyntaxToken(SyntaxKind.END_OF_LINE_TOKEN, source.substring(startPos, pos), startLine, startCol);
    }

    private SyntaxToken scanWhiteSpaceTrivia() {
        int startPos = pos;
        int startCol = column;
        advance();
        while (pos <= lastPos && CharClassifier.isWhiteSpaceSingleLine(peek())) {
            advance();
        }
        return new SyntaxToken(SyntaxKind.WHITE_SPACE_TRIVIA, source.substring(startPos, pos), line, startCol);
    }

    private SyntaxToken scanNumericLiteral() {
        int startPos = pos;
        int startCol = column;
        while (pos <= lastPos && CharClassifier.isDigit(peek())) {
            advance();
        }
        // 小数点后面必须紧跟数字才算小数部分
        if (peek() == '.' && CharClassifier.isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (pos <= lastPos && CharClassifier.isDigit(peek())) {
                advance();
            }
        }
        // 以数字开头的标识符 (e.g., 1abc) 是非法的
        if (pos <= lastPos && CharClassifier.isIdentifierPart(peek())) {
            while (pos <= lastPos && CharClassifier.isIdentifierPart(peek())) {
                advance();
            }
            throw new LexException("Invalid identifier: '" + source.substring(startPos, pos) + "'.", line, startCol);
        }
        String text = source.substring(startPos, pos);
        return new SyntaxToken(SyntaxKind.NUMERIC_LITERAL_TOKEN, text, Double.valueOf(text), line, startCol);
    }

    private SyntaxToken scanStringLiteral() {
        char openQuote = peek();
        int startPos = pos;
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始的引号
        while (pos <= lastPos && peek() != openQuote) {
            advanceOver(peek());
        }
        if (pos > lastPos) {
            throw new LexException("Unterminated string literal.", startLine, startCol);
        }
        advance(); // 跳过结束的引号
        String text = source.substring(startPos, pos);
        return new SyntaxToken(SyntaxKind.STRING_LITERAL_TOKEN, text, text.substring(1, text.length() - 1),
                startLine, startCol);
    }

    private SyntaxToken scanIdentifierOrKeyword() {
        char firstChar = peek();
        int startPos = pos;
        int startCol = column;
        advance();
        while (pos <= lastPos && CharClassifier.isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(startPos, pos);
        SyntaxKind kind = keywords.lookup(text);
        if (kind == null) {
            if (!CharClassifier.isIdentifierStart(firstChar)) {
                throw new LexException("Invalid identifier: '" + text + "'.", line, startCol);
            }
            kind = SyntaxKind.IDENTIFIER_TOKEN;
        }
        return new SyntaxToken(kind, text, text, line, startCol);
    }

    // --- 辅助方法 ---

    private char peek() {
        if (pos > lastPos) return '\0';
        return source.charAt(pos);
    }

    private char peekNext() {
        if (pos + 1 > lastPos) return '\0';
        return source.charAt(pos + 1);
    }

    private void advance() {
        pos++;
        column++;
    }

    /**
     * 跨行的字面量里也要维护行号；CRLF 只在 LF 处换行。
     */
    private void advanceOver(char ch) {
        if (CharClassifier.isLineBreak(ch) && !(ch == '\r' && peekNext() == '\n')) {
            pos++;
            line++;
            column = 1;
        } else {
            advance();
        }
    }

    private SyntaxToken consumeAndReturn(SyntaxKind kind) {
        SyntaxToken token = new SyntaxToken(kind, String.valueOf(peek()), line, column);
        advance();
        return token;
    }
}
