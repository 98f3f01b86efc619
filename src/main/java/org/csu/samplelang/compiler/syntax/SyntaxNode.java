package org.csu.samplelang.compiler.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * @description: 语法树的分支节点
 *
 * 子元素只能在子类的构造过程中通过 {@link #append} 加入，对外只暴露只读视图，
 * 这样 parent 引用始终与唯一的一个子元素列表保持一致。
 */
public abstract class SyntaxNode extends SyntaxElement {

    private final List<SyntaxElement> children = new ArrayList<>();
    private final List<SyntaxElement> childrenView = Collections.unmodifiableList(children);

    protected SyntaxNode(SyntaxKind kind) {
        super(kind);
        if (kind.isToken()) {
            throw new IllegalArgumentException(kind.displayName() + " is a token kind, not a node kind");
        }
    }

    /**
     * 追加一个子元素并设置它的 parent。
     *
     * @return 传入的子元素本身，方便在构造函数里直接赋值给字段
     */
    protected final <T extends SyntaxElement> T append(T child) {
        Objects.requireNonNull(child, "child");
        child.attachTo(this);
        children.add(child);
        return child;
    }

    public List<SyntaxElement> getChildren() {
        return childrenView;
    }

    @Override
    public boolean isToken() {
        return false;
    }

    @Override
    public String toString() {
        return getKindText() + children;
    }
}
