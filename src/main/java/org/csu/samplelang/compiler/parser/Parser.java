package org.csu.samplelang.compiler.parser;

import org.csu.samplelang.common.exception.ParseException;
import org.csu.samplelang.compiler.lexer.TokenSource;
import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
import org.csu.samplelang.compiler.parser.ast.StatementNode;
import org.csu.samplelang.compiler.parser.ast.expression.ArgumentListNode;
import org.csu.samplelang.compiler.parser.ast.expression.BinaryExpressionNode;
import org.csu.samplelang.compiler.parser.ast.expression.IdentifierNameNode;
import org.csu.samplelang.compiler.parser.ast.expression.InvocationExpressionNode;
import org.csu.samplelang.compiler.parser.ast.expression.LiteralExpressionNode;
import org.csu.samplelang.compiler.parser.ast.expression.ParenthesizedExpressionNode;
import org.csu.samplelang.compiler.parser.ast.expression.UnaryExpressionNode;
import org.csu.samplelang.compiler.parser.ast.statement.BlockNode;
import org.csu.samplelang.compiler.parser.ast.statement.ProgramNode;
import org.csu.samplelang.compiler.parser.ast.statement.VarDeclStatementNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxNode;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * <pre>
 * program    = "program" identifier block ;
 * block      = "{" { block | statement } "}" ;
 * statement  = varDecl | invocation ;
 * varDecl    = "let" identifier [ "=" expression ] ";" ;
 * invocation = "call" identifier arguments [ ";" ] ;
 * arguments  = argument { "|" argument } ;
 * expression = term { ("+"|"-") term } ;
 * term       = factor { ("*"|"/") factor } ;
 * factor     = number | string | identifier | "(" expression ")" | ("+"|"-") factor | invocation ;
 * </pre>
 *
 * 只有一个 Token 的前瞻，不回溯；空白和换行在前进时被跳过。任何不匹配都会中止整个 parse()。
 */
public class Parser {

    private final TokenSource lexer;
    private SyntaxToken token;   // 当前的前瞻 Token

    public Parser(TokenSource lexer) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
    }

    /**
     * 构建整棵语法树。结束后（无论成功与否）都会 reset 词法分析器，
     * 调用方可以重新枚举 Token 用于显示，也可以再次调用 parse()。
     */
    public ProgramNode parse() {
        try {
            token = lexer.next();
            skipTrivia();
            return parseProgram();
        } finally {
            token = null;
            lexer.reset();
        }
    }

    private ProgramNode parseProgram() {
        SyntaxToken keyword = consume(SyntaxKind.PROGRAM_KEYWORD);
        IdentifierNameNode identifier = new IdentifierNameNode(consume(SyntaxKind.IDENTIFIER_TOKEN));
        BlockNode block = parseBlock();
        consume(SyntaxKind.END_OF_FILE_TOKEN);
        return new ProgramNode(keyword, identifier, block);
    }

    /**
     * 块可以嵌套，遇到 '{' 时递归解析。
     */
    private BlockNode parseBlock() {
        consume(SyntaxKind.OPEN_BRACE_TOKEN);
        List<SyntaxNode> elements = new ArrayList<>();
        while (!check(SyntaxKind.CLOSE_BRACE_TOKEN)) {
            if (check(SyntaxKind.OPEN_BRACE_TOKEN)) {
                elements.add(parseBlock());
                continue;
            }
            if (check(SyntaxKind.END_OF_FILE_TOKEN)) {
                throw new ParseException(token, "Unterminated block.");
            }
            elements.add(parseStatement());
        }
        consume(SyntaxKind.CLOSE_BRACE_TOKEN);
        return new BlockNode(elements);
    }

    private SyntaxNode parseStatement() {
        switch (token.getKind()) {
            case LET_KEYWORD:
                return parseVarDeclStatement();
            case CALL_KEYWORD:
                return parseInvocationExpression(true);
            default:
                throw new ParseException(token,
                        String.format("A statement expected instead of the token '%s'.", token.getKindText()));
        }
    }

    private StatementNode parseVarDeclStatement() {
        SyntaxToken keyword = consume(SyntaxKind.LET_KEYWORD);
        IdentifierNameNode identifier = new IdentifierNameNode(consume(SyntaxKind.IDENTIFIER_TOKEN));
        ExpressionNode initializer = null;
        if (match(SyntaxKind.EQUALS_TOKEN) != null) {
            initializer = parseExpression();
        }
        consume(SyntaxKind.SEMICOLON_TOKEN);
        return new VarDeclStatementNode(keyword, identifier, initializer);
    }

    /**
     * @param asStatement 作为语句时允许（但不强制）以 ';' 结尾；作为表达式时分号留给外层语句
     */
    private InvocationExpressionNode parseInvocationExpression(boolean asStatement) {
        SyntaxToken keyword = consume(SyntaxKind.CALL_KEYWORD);
        IdentifierNameNode identifier = new IdentifierNameNode(consume(SyntaxKind.IDENTIFIER_TOKEN));
        ArgumentListNode arguments = parseArguments();
        if (asStatement) {
            match(SyntaxKind.SEMICOLON_TOKEN);
        }
        return new InvocationExpressionNode(keyword, identifier, arguments);
    }

    private ArgumentListNode parseArguments() {
        List<ExpressionNode> arguments = new ArrayList<>();
        do {
            arguments.add(parseExpression());
        } while (match(SyntaxKind.VERTICAL_BAR_TOKEN) != null);
        return new ArgumentListNode(arguments);
    }

    // --- 表达式: expression -> term -> factor，每一层左结合地折叠本层的运算符 ---

    private ExpressionNode parseExpression() {
        ExpressionNode left = parseTerm();
        while (check(SyntaxKind.PLUS_TOKEN) || check(SyntaxKind.MINUS_TOKEN)) {
            SyntaxToken operator = advance();
            SyntaxKind kind = operator.getKind() == SyntaxKind.PLUS_TOKEN
                    ? SyntaxKind.ADD_EXPRESSION
                    : SyntaxKind.SUBTRACT_EXPRESSION;
            left = new BinaryExpressionNode(kind, left, operator, parseTerm());
        }
        return left;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode left = parseFactor();
        while (check(SyntaxKind.ASTERISK_TOKEN) || check(SyntaxKind.SLASH_TOKEN)) {
            SyntaxToken operator = advance();
            SyntaxKind kind = operator.getKind() == SyntaxKind.ASTERISK_TOKEN
                    ? SyntaxKind.MULTIPLY_EXPRESSION
                    : SyntaxKind.DIVIDE_EXPRESSION;
            left = new BinaryExpressionNode(kind, left, operator, parseFactor());
        }
        return left;
    }

    private ExpressionNode parseFactor() {
        switch (token.getKind()) {
            case CALL_KEYWORD:
                return parseInvocationExpression(false);
            case NUMERIC_LITERAL_TOKEN:
                return new LiteralExpressionNode(SyntaxKind.NUMERIC_LITERAL_EXPRESSION, advance());
            case STRING_LITERAL_TOKEN:
                return new LiteralExpressionNode(SyntaxKind.STRING_LITERAL_EXPRESSION, advance());
            case IDENTIFIER_TOKEN:
                return new IdentifierNameNode(advance());
            case OPEN_PAREN_TOKEN: {
                SyntaxToken openParen = advance();
                ExpressionNode expression = parseExpression();
                SyntaxToken closeParen = consume(SyntaxKind.CLOSE_PAREN_TOKEN);
                return new ParenthesizedExpressionNode(openParen, expression, closeParen);
            }
            case PLUS_TOKEN:
            case MINUS_TOKEN: {
                SyntaxToken operator = advance();
                SyntaxKind kind = operator.getKind() == SyntaxKind.PLUS_TOKEN
                        ? SyntaxKind.UNARY_PLUS_EXPRESSION
                        : SyntaxKind.UNARY_MINUS_EXPRESSION;
                return new UnaryExpressionNode(kind, operator, parseFactor());
            }
            default:
                throw new ParseException(token,
                        String.format("An expression expected instead of the token '%s'.", token.getKindText()));
        }
    }

    // --- 辅助方法 ---

    /**
     * 当前 Token 匹配时消耗并返回它；否则返回 null，游标不动。
     */
    private SyntaxToken match(SyntaxKind kind) {
        return check(kind) ? advance() : null;
    }

    /**
     * 当前 Token 必须是指定种类，否则抛出语法错误。
     */
    private SyntaxToken consume(SyntaxKind kind) {
        if (check(kind)) return advance();
        throw new ParseException(token, String.format("%s expected instead of the token '%s'.",
                kind.displayName(), token.getKindText()));
    }

    private boolean check(SyntaxKind kind) {
        return token.getKind() == kind;
    }

    /**
     * 前进到下一个有意义的 Token，返回前进之前的 Token。EOF 之后不再前进。
     */
    private SyntaxToken advance() {
        SyntaxToken previous = token;
        if (previous.getKind() != SyntaxKind.END_OF_FILE_TOKEN) {
            token = lexer.next();
            skipTrivia();
        }
        return previous;
    }

    private void skipTrivia() {
        while (token.getKind().isTrivia()) {
            token = lexer.next();
        }
    }
}
