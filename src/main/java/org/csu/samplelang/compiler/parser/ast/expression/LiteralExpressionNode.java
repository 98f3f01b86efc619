package org.csu.samplelang.compiler.parser.ast.expression;

import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * AST 节点: 表示一个字面量 (如数字、字符串)
 */
public final class LiteralExpressionNode extends ExpressionNode {

    private final SyntaxToken token;

    public LiteralExpressionNode(SyntaxKind kind, SyntaxToken token) {
        super(kind);
        if (kind != SyntaxKind.NUMERIC_LITERAL_EXPRESSION && kind != SyntaxKind.STRING_LITERAL_EXPRESSION) {
            throw new IllegalArgumentException(kind.displayName() + " is not a literal expression kind");
        }
        this.token = append(token);
    }

    public SyntaxToken token() {
        return token;
    }
}
