package org.csu.samplelang.compiler;

import org.csu.samplelang.compiler.parser.ast.statement.ProgramNode;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

import java.util.List;

/**
 * 一次成功编译的全部产物。
 *
 * @param tokens  词法分析得到的 Token 序列（包括空白、换行和最后的 EOF）
 * @param program 语法树的根节点
 * @param output  生成的 JavaScript 源码
 */
public record CompilationResult(List<SyntaxToken> tokens, ProgramNode program, String output) {

    public CompilationResult {
        tokens = List.copyOf(tokens);
    }
}
