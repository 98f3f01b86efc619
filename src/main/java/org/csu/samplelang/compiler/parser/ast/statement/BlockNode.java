package org.csu.samplelang.compiler.parser.ast.statement;

import org.csu.samplelang.compiler.parser.ast.StatementNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;
import org.csu.samplelang.compiler.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 节点: 由花括号包围的块，元素是语句或嵌套的块。花括号本身不保留在树中。
 */
public final class BlockNode extends StatementNode {

    private final List<SyntaxNode> elements;

    public BlockNode(List<? extends SyntaxNode> elements) {
        super(SyntaxKind.BLOCK);
        List<SyntaxNode> attached = new ArrayList<>(elements.size());
        for (SyntaxNode element : elements) {
            attached.add(append(element));
        }
        this.elements = Collections.unmodifiableList(attached);
    }

    public List<SyntaxNode> elements() {
        return elements;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }
}
