package org.csu.samplelang.compiler.lexer;

import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * 语法分析器消费的 Token 序列。序列是惰性的，并且可以从头重新枚举。
 */
public interface TokenSource {

    /**
     * @return 下一个 Token；到达末尾后每次都返回 EndOfFileToken
     */
    SyntaxToken next();

    /**
     * 回到序列开头。
     */
    void reset();
}
