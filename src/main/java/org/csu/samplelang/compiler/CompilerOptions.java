package org.csu.samplelang.compiler;

import lombok.Getter;
import org.csu.samplelang.compiler.emitter.Emitter;
import org.csu.samplelang.compiler.lexer.KeywordTable;

import java.util.Objects;

/**
 * @description: 编译选项：关键字表与生成代码的缩进
 *
 * 不可变；withXxx 方法返回修改后的副本。
 */
@Getter
public final class CompilerOptions {

    private static final CompilerOptions DEFAULTS = new CompilerOptions(KeywordTable.defaults(), Emitter.DEFAULT_INDENT);

    private final KeywordTable keywords;
    private final String indent;

    public CompilerOptions(KeywordTable keywords, String indent) {
        this.keywords = Objects.requireNonNull(keywords, "keywords");
        this.indent = Objects.requireNonNull(indent, "indent");
    }

    public static CompilerOptions defaults() {
        return DEFAULTS;
    }

    public CompilerOptions withKeywords(KeywordTable newKeywords) {
        return new CompilerOptions(newKeywords, indent);
    }

    public CompilerOptions withIndent(String newIndent) {
        return new CompilerOptions(keywords, newIndent);
    }

    /**
     * 用 n 个空格代替制表符缩进
     */
    public CompilerOptions withSpaceIndent(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("Indent width must not be negative: " + width);
        }
        return withIndent(" ".repeat(width));
    }
}
