package org.csu.samplelang.compiler.parser.ast.statement;

import org.csu.samplelang.compiler.parser.ast.StatementNode;
import org.csu.samplelang.compiler.parser.ast.expression.IdentifierNameNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * AST 根节点: program 关键字、程序名、程序体。根节点没有父节点。
 */
public final class ProgramNode extends StatementNode {

    private final SyntaxToken keyword;
    private final IdentifierNameNode identifier;
    private final BlockNode block;

    public ProgramNode(SyntaxToken keyword, IdentifierNameNode identifier, BlockNode block) {
        super(SyntaxKind.PROGRAM);
        this.keyword = append(keyword);
        this.identifier = append(identifier);
        this.block = append(block);
    }

    public SyntaxToken keyword() {
        return keyword;
    }

    public IdentifierNameNode identifier() {
        return identifier;
    }

    public BlockNode block() {
        return block;
    }

    public String getName() {
        return identifier.getName();
    }
}
