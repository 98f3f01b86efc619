package org.csu.samplelang.compiler.parser.ast.statement;

import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
import org.csu.samplelang.compiler.parser.ast.StatementNode;
import org.csu.samplelang.compiler.parser.ast.expression.IdentifierNameNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * AST 节点: 变量声明 (e.g., let x = 1 + 2;)
 * 初始值是可选的，缺省时 initializer() 返回 null，子元素也只有两个。
 */
public final class VarDeclStatementNode extends StatementNode {

    private final SyntaxToken keyword;
    private final IdentifierNameNode identifier;
    private final ExpressionNode initializer;

    public VarDeclStatementNode(SyntaxToken keyword, IdentifierNameNode identifier, ExpressionNode initializer) {
        super(SyntaxKind.VAR_DECL_STATEMENT);
        this.keyword = append(keyword);
        this.identifier = append(identifier);
        this.initializer = initializer == null ? null : append(initializer);
    }

    public SyntaxToken keyword() {
        return keyword;
    }

    public IdentifierNameNode identifier() {
        return identifier;
    }

    public ExpressionNode initializer() {
        return initializer;
    }
}
