package org.csu.samplelang.compiler.parser.ast;

import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxNode;

/**
 * AST 节点: 语句、块以及整个程序的基类。
 */
public abstract class StatementNode extends SyntaxNode {

    protected StatementNode(SyntaxKind kind) {
        super(kind);
    }
}
