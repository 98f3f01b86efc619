package org.csu.samplelang.compiler.parser.ast;

import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxNode;

/**
 * AST 节点: 所有表达式的基类，表达式可以出现在需要一个值的位置上。
 */
public abstract class ExpressionNode extends SyntaxNode {

    protected ExpressionNode(SyntaxKind kind) {
        super(kind);
    }
}
