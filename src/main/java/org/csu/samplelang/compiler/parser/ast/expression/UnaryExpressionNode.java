package org.csu.samplelang.compiler.parser.ast.expression;

import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * AST 节点: 一元正负号表达式 (e.g., +30, -10)
 */
public final class UnaryExpressionNode extends ExpressionNode {

    private final SyntaxToken operator;
    private final ExpressionNode operand;

    public UnaryExpressionNode(SyntaxKind kind, SyntaxToken operator, ExpressionNode operand) {
        super(kind);
        if (kind != SyntaxKind.UNARY_PLUS_EXPRESSION && kind != SyntaxKind.UNARY_MINUS_EXPRESSION) {
            throw new IllegalArgumentException(kind.displayName() + " is not a unary expression kind");
        }
        this.operator = append(operator);
        this.operand = append(operand);
    }

    public SyntaxToken operator() {
        return operator;
    }

    public ExpressionNode operand() {
        return operand;
    }
}
