package org.csu.samplelang.compiler.parser.ast.expression;

import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * AST 节点: 标识符，例如变量名、程序名或被调用的函数名。
 */
public final class IdentifierNameNode extends ExpressionNode {

    private final SyntaxToken token;

    public IdentifierNameNode(SyntaxToken token) {
        super(SyntaxKind.IDENTIFIER_NAME);
        if (token.getKind() != SyntaxKind.IDENTIFIER_TOKEN) {
            throw new IllegalArgumentException("IdentifierToken required, got " + token.getKindText());
        }
        this.token = append(token);
    }

    public SyntaxToken token() {
        return token;
    }

    public String getName() {
        return token.getText();
    }
}
