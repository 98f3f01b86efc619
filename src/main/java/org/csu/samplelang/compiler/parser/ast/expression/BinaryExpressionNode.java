package org.csu.samplelang.compiler.parser.ast.expression;

import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., 10 + 20)
 * 子元素固定为: 左操作数、运算符 Token、右操作数。
 */
public final class BinaryExpressionNode extends ExpressionNode {

    private final ExpressionNode left;
    private final SyntaxToken operator;
    private final ExpressionNode right;

    public BinaryExpressionNode(SyntaxKind kind, ExpressionNode left, SyntaxToken operator, ExpressionNode right) {
        super(kind);
        if (!kind.isBinaryExpression()) {
            throw new IllegalArgumentException(kind.displayName() + " is not a binary expression kind");
        }
        this.left = append(left);
        this.operator = append(operator);
        this.right = append(right);
    }

    public ExpressionNode left() {
        return left;
    }

    public SyntaxToken operator() {
        return operator;
    }

    public ExpressionNode right() {
        return right;
    }
}
