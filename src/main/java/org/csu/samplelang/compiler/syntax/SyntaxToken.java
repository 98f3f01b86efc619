package org.csu.samplelang.compiler.syntax;

import lombok.Getter;

/**
 * @description: 词法单元，语法树的叶子
 *
 * text 是原始词素；value 是类型化的值：数字字面量为 Double，字符串字面量为去掉引号后的内容，
 * 标识符和关键字为原始文本，其余为 null。
 */
@Getter
public final class SyntaxToken extends SyntaxElement {

    private final String text;
    private final Object value;
    private final int line;
    private final int column;

    public SyntaxToken(SyntaxKind kind, String text, Object value, int line, int column) {
        super(kind);
        if (!kind.isToken()) {
            throw new IllegalArgumentException(kind.displayName() + " is not a token kind");
        }
        this.text = text == null ? "" : text;
        this.value = value;
        this.line = line;
        this.column = column;
    }

    public SyntaxToken(SyntaxKind kind, String text, int line, int column) {
        this(kind, text, null, line, column);
    }

    @Override
    public boolean isToken() {
        return true;
    }

    @Override
    public String toString() {
        return String.format("Token[Kind=%-20s, Text='%s', Position=%d:%d]",
                getKindText(), text, line, column);
    }
}
