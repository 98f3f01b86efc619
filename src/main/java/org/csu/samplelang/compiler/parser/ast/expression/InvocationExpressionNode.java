package org.csu.samplelang.compiler.parser.ast.expression;

import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * AST 节点: 函数调用 (e.g., call speak "Hello" | "en")
 * 既可以直接作为块中的语句，也可以作为表达式的一部分出现。
 */
public final class InvocationExpressionNode extends ExpressionNode {

    private final SyntaxToken keyword;
    private final IdentifierNameNode identifier;
    private final ArgumentListNode argumentList;

    public InvocationExpressionNode(SyntaxToken keyword, IdentifierNameNode identifier, ArgumentListNode argumentList) {
        super(SyntaxKind.INVOCATION_EXPRESSION);
        this.keyword = append(keyword);
        this.identifier = append(identifier);
        this.argumentList = append(argumentList);
    }

    public SyntaxToken keyword() {
        return keyword;
    }

    public IdentifierNameNode identifier() {
        return identifier;
    }

    public ArgumentListNode argumentList() {
        return argumentList;
    }

    /**
     * 直接位于块中时，它是一条语句。
     */
    public boolean isStatement() {
        return isParentKind(SyntaxKind.BLOCK);
    }
}
