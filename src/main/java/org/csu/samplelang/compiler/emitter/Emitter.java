package org.csu.samplelang.compiler.emitter;

import org.csu.samplelang.common.exception.EmitException;
import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
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

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * @description: 代码生成器
 *
 * 遍历语法树，把它翻译成 JavaScript 源码。整个程序被包成一个以程序名命名的立即调用函数。
 * 生成器信任语法树的结构，不会重新推导优先级，也不会额外加括号。
 * 实例没有可变状态，可以共享。
 */
public class Emitter {

    public static final String DEFAULT_INDENT = "\t";

    private final String indent;

    public Emitter() {
        this(DEFAULT_INDENT);
    }

    /**
     * @param indent 每一层缩进使用的字符串
     */
    public Emitter(String indent) {
        this.indent = Objects.requireNonNull(indent, "indent");
    }

    /**
     * 将整棵语法树翻译为 JavaScript 源码
     */
    public String emit(ProgramNode program) {
        return emitProgram(program);
    }

    private String emitProgram(ProgramNode program) {
        return "(function " + program.identifier().token().getText() + "() "
                + emitBlock(program.block(), 0) + ")();";
    }

    /**
     * 每个直接子元素占一行并缩进 depth + 1 层；嵌套块本身不加分号。
     */
    private String emitBlock(BlockNode block, int depth) {
        StringBuilder text = new StringBuilder("{");
        for (SyntaxNode element : block.elements()) {
            text.append('\n').append(indent.repeat(depth + 1));
            if (element.getKind() == SyntaxKind.BLOCK) {
                text.append(emitBlock((BlockNode) element, depth + 1));
            } else {
                text.append(emitStatement(element));
            }
        }
        text.append('\n').append(indent.repeat(depth)).append('}');
        return text.toString();
    }

    private String emitStatement(SyntaxNode statement) {
        switch (statement.getKind()) {
            case VAR_DECL_STATEMENT:
                return emitVarDeclStatement((VarDeclStatementNode) statement);
            case INVOCATION_EXPRESSION:
                return emitInvocation((InvocationExpressionNode) statement);
            default:
                throw new EmitException(String.format("The statement '%s' is not supported.", statement.getKindText()));
        }
    }

    private String emitVarDeclStatement(VarDeclStatementNode statement) {
        StringBuilder text = new StringBuilder("let ");
        text.append(statement.identifier().token().getText());
        if (statement.initializer() != null) {
            text.append(" = ").append(emitExpression(statement.initializer()));
        }
        return text.append(';').toString();
    }

    /**
     * 调用直接位于块中时是一条语句，需要分号；作为子表达式时不加。
     */
    private String emitInvocation(InvocationExpressionNode invocation) {
        String arguments = invocation.argumentList().arguments().stream()
                .map(this::emitExpression)
                .collect(Collectors.joining(", "));
        String text = invocation.identifier().token().getText() + "(" + arguments + ")";
        return invocation.isStatement() ? text + ";" : text;
    }

    private String emitExpression(ExpressionNode expression) {
        switch (expression.getKind()) {
            case NUMERIC_LITERAL_EXPRESSION:
                return ((LiteralExpressionNode) expression).token().getText();
            case STRING_LITERAL_EXPRESSION:
                return quote(((LiteralExpressionNode) expression).token());
            case IDENTIFIER_NAME:
                return ((IdentifierNameNode) expression).token().getText();
            case PARENTHESIZED_EXPRESSION: {
                ParenthesizedExpressionNode parenthesized = (ParenthesizedExpressionNode) expression;
                return parenthesized.openParenToken().getText()
                        + emitExpression(parenthesized.expression())
                        + parenthesized.closeParenToken().getText();
            }
            case UNARY_PLUS_EXPRESSION:
            case UNARY_MINUS_EXPRESSION: {
                UnaryExpressionNode unary = (UnaryExpressionNode) expression;
                return prefix(unary.operator().getText(), emitExpression(unary.operand()));
            }
            case ADD_EXPRESSION:
            case SUBTRACT_EXPRESSION:
            case MULTIPLY_EXPRESSION:
            case DIVIDE_EXPRESSION: {
                BinaryExpressionNode binary = (BinaryExpressionNode) expression;
                return emitExpression(binary.left()) + prefix(binary.operator().getText(), emitExpression(binary.right()));
            }
            case INVOCATION_EXPRESSION:
                return emitInvocation((InvocationExpressionNode) expression);
            default:
                throw new EmitException(String.format("The expression '%s' is not supported.", expression.getKindText()));
        }
    }

    /**
     * 字符串字面量按它的值重新加引号，沿用源代码里的引号字符。
     * Sample 的字符串没有转义序列，可以跨行，所以反斜杠和换行在 JavaScript 里都必须转义。
     */
    static String quote(SyntaxToken token) {
        String lexeme = token.getText();
        char quoteChar = lexeme.charAt(0);
        String value = token.getValue() != null
                ? token.getValue().toString()
                : lexeme.substring(1, lexeme.length() - 1);
        StringBuilder text = new StringBuilder(value.length() + 2).append(quoteChar);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\':
                    text.append("\\\\");
                    break;
                case '\n':
                    text.append("\\n");
                    break;
                case '\r':
                    text.append("\\r");
                    break;
                case '\u2028':
                    text.append("\\u2028");
                    break;
                case '\u2029':
                    text.append("\\u2029");
                    break;
                default:
                    if (ch == quoteChar) {
                        text.append('\\');
                    }
                    text.append(ch);
            }
        }
        return text.append(quoteChar).toString();
    }

    /**
     * 运算符紧贴操作数输出；只有 "- -x"、"+ +x" 这种情况要留一个空格，否则会变成 -- / ++。
     */
    private static String prefix(String operator, String operand) {
        if (!operand.isEmpty() && operator.endsWith(operand.substring(0, 1))
                && (operand.charAt(0) == '+' || operand.charAt(0) == '-')) {
            return operator + " " + operand;
        }
        return operator + operand;
    }
}
