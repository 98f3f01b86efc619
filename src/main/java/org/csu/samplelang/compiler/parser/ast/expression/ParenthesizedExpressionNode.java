package org.csu.samplelang.compiler.parser.ast.expression;

import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * AST 节点: 括号表达式 (e.g., -(5 + (10 - 20)))，括号本身作为子 Token 保留。
 */
public final class ParenthesizedExpressionNode extends ExpressionNode {

    private final SyntaxToken openParenToken;
    private final ExpressionNode expression;
    private final SyntaxToken closeParenToken;

    public ParenthesizedExpressionNode(SyntaxToken openParenToken, ExpressionNode expression, SyntaxToken closeParenToken) {
        super(SyntaxKind.PARENTHESIZED_EXPRESSION);
        this.openParenToken = append(openParenToken);
        this.expression = append(expression);
        this.closeParenToken = append(closeParenToken);
    }

    public SyntaxToken openParenToken() {
        return openParenToken;
    }

    public ExpressionNode expression() {
        return expression;
    }

    public SyntaxToken closeParenToken() {
        return closeParenToken;
    }
}
