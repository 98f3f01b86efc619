package org.csu.samplelang.compiler.syntax;

/**
 * @description: 语法元素的种类（种别码）
 *
 * 前半部分是词法单元（叶子），从 IDENTIFIER_NAME 开始是语法树的分支节点。
 * 声明顺序决定了 isToken() / isKeyword() 的区间判断，新增常量时要放在对应的区段里。
 */
public enum SyntaxKind {
    // ---- 控制与琐碎 (Trivia) ----
    END_OF_FILE_TOKEN,      // EOF
    END_OF_LINE_TOKEN,      // CR, LF, CRLF, LS, PS
    WHITE_SPACE_TRIVIA,     // 空白

    // ---- 标点 (Punctuation) ----
    OPEN_BRACE_TOKEN,       // {
    CLOSE_BRACE_TOKEN,      // }
    OPEN_PAREN_TOKEN,       // (
    CLOSE_PAREN_TOKEN,      // )
    EQUALS_TOKEN,           // =
    SEMICOLON_TOKEN,        // ;
    PLUS_TOKEN,             // +
    MINUS_TOKEN,            // -
    ASTERISK_TOKEN,         // *
    SLASH_TOKEN,            // /
    VERTICAL_BAR_TOKEN,     // |

    // ---- 关键字 (Keywords) ----
    PROGRAM_KEYWORD,        // "program"
    CALL_KEYWORD,           // "call"
    LET_KEYWORD,            // "let"

    // ---- 标识符与字面量 ----
    IDENTIFIER_TOKEN,
    NUMERIC_LITERAL_TOKEN,
    STRING_LITERAL_TOKEN,

    // ---- 名称 ----
    IDENTIFIER_NAME,

    // ---- 表达式 ----
    PARENTHESIZED_EXPRESSION,
    ARGUMENT_LIST,
    NUMERIC_LITERAL_EXPRESSION,
    STRING_LITERAL_EXPRESSION,
    UNARY_PLUS_EXPRESSION,
    UNARY_MINUS_EXPRESSION,
    ADD_EXPRESSION,
    SUBTRACT_EXPRESSION,
    MULTIPLY_EXPRESSION,
    DIVIDE_EXPRESSION,

    // ---- 语句 ----
    PROGRAM,
    BLOCK,
    VAR_DECL_STATEMENT,
    INVOCATION_EXPRESSION;

    /**
     * 叶子种类：词法分析器产生的所有 Token 都落在这个区间。
     */
    public boolean isToken() {
        return ordinal() <= STRING_LITERAL_TOKEN.ordinal();
    }

    public boolean isKeyword() {
        return ordinal() >= PROGRAM_KEYWORD.ordinal() && ordinal() <= LET_KEYWORD.ordinal();
    }

    /**
     * 语法分析器会跳过的 Token（空白与换行）。
     */
    public boolean isTrivia() {
        return this == WHITE_SPACE_TRIVIA || this == END_OF_LINE_TOKEN;
    }

    public boolean isBinaryExpression() {
        return ordinal() >= ADD_EXPRESSION.ordinal() && ordinal() <= DIVIDE_EXPRESSION.ordinal();
    }

    /**
     * 用于错误信息和显示的名称，例如 "CloseBraceToken"。
     */
    public String displayName() {
        return switch (this) {
            case END_OF_FILE_TOKEN -> "EndOfFileToken";
            case END_OF_LINE_TOKEN -> "EndOfLineToken";
            case WHITE_SPACE_TRIVIA -> "WhiteSpaceTrivia";
            case OPEN_BRACE_TOKEN -> "OpenBraceToken";
            case CLOSE_BRACE_TOKEN -> "CloseBraceToken";
            case OPEN_PAREN_TOKEN -> "OpenParenToken";
            case CLOSE_PAREN_TOKEN -> "CloseParenToken";
            case EQUALS_TOKEN -> "EqualsToken";
            case SEMICOLON_TOKEN -> "SemicolonToken";
            case PLUS_TOKEN -> "PlusToken";
            case MINUS_TOKEN -> "MinusToken";
            case ASTERISK_TOKEN -> "AsteriskToken";
            case SLASH_TOKEN -> "SlashToken";
            case VERTICAL_BAR_TOKEN -> "VerticalBarToken";
            case PROGRAM_KEYWORD -> "ProgramKeyword";
            case CALL_KEYWORD -> "CallKeyword";
            case LET_KEYWORD -> "LetKeyword";
            case IDENTIFIER_TOKEN -> "IdentifierToken";
            case NUMERIC_LITERAL_TOKEN -> "NumericLiteralToken";
            case STRING_LITERAL_TOKEN -> "StringLiteralToken";
            case IDENTIFIER_NAME -> "IdentifierName";
            case PARENTHESIZED_EXPRESSION -> "ParenthesizedExpression";
            case ARGUMENT_LIST -> "ArgumentList";
            case NUMERIC_LITERAL_EXPRESSION -> "NumericLiteralExpression";
            case STRING_LITERAL_EXPRESSION -> "StringLiteralExpression";
            case UNARY_PLUS_EXPRESSION -> "UnaryPlusExpression";
            case UNARY_MINUS_EXPRESSION -> "UnaryMinusExpression";
            case ADD_EXPRESSION -> "AddExpression";
            case SUBTRACT_EXPRESSION -> "SubtractExpression";
            case MULTIPLY_EXPRESSION -> "MultiplyExpression";
            case DIVIDE_EXPRESSION -> "DivideExpression";
            case PROGRAM -> "Program";
            case BLOCK -> "Block";
            case VAR_DECL_STATEMENT -> "VarDeclStatement";
            case INVOCATION_EXPRESSION -> "InvocationExpression";
        };
    }

    /**
     * displayName() 的反向查找，配置文件里的关键字表用的就是这种写法。
     *
     * @return 对应的种类；找不到时返回 null
     */
    public static SyntaxKind fromDisplayName(String name) {
        for (SyntaxKind kind : values()) {
            if (kind.displayName().equals(name)) {
                return kind;
            }
        }
        return null;
    }
}
