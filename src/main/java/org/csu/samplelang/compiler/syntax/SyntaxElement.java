package org.csu.samplelang.compiler.syntax;

import lombok.Getter;

import java.util.Objects;

/**
 * @description: 语法树元素的公共基类
 *
 * 叶子是 {@link SyntaxToken}，分支是 {@link SyntaxNode}。
 * parent 只在元素被挂到某个节点下时由 {@link SyntaxNode} 设置一次，仅用于局部上下文查询。
 */
@Getter
public abstract class SyntaxElement {

    private final SyntaxKind kind;
    private SyntaxNode parent;

    protected SyntaxElement(SyntaxKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * 由 SyntaxNode.append 调用；一个元素只能有一个父节点。
     */
    void attachTo(SyntaxNode newParent) {
        if (this.parent != null) {
            throw new IllegalStateException(kind.displayName() + " is already attached to "
                    + this.parent.getKind().displayName());
        }
        this.parent = newParent;
    }

    /**
     * 判断父节点是否为指定种类，例如 "我是不是直接位于 Block 里"。
     */
    public boolean isParentKind(SyntaxKind parentKind) {
        return parent != null && parent.getKind() == parentKind;
    }

    public String getKindText() {
        return kind.displayName();
    }

    public abstract boolean isToken();
}
