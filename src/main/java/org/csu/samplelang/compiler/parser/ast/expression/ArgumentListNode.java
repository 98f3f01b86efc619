package org.csu.samplelang.compiler.parser.ast.expression;

import org.csu.samplelang.compiler.parser.ast.ExpressionNode;
import org.csu.samplelang.compiler.syntax.SyntaxKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 节点: 调用的实参列表。分隔符 '|' 不保留在树中。
 */
public final class ArgumentListNode extends ExpressionNode {

    private final List<ExpressionNode> arguments;

    public ArgumentListNode(List<? extends ExpressionNode> arguments) {
        super(SyntaxKind.ARGUMENT_LIST);
        List<ExpressionNode> attached = new ArrayList<>(arguments.size());
        for (ExpressionNode argument : arguments) {
            attached.add(append(argument));
        }
        this.arguments = Collections.unmodifiableList(attached);
    }

    public List<ExpressionNode> arguments() {
        return arguments;
    }
}
