package org.csu.samplelang.cli.tool;

import org.csu.samplelang.compiler.syntax.SyntaxElement;
import org.csu.samplelang.compiler.syntax.SyntaxNode;
import org.csu.samplelang.compiler.syntax.SyntaxToken;

/**
 * 把语法树打印成缩进文本，每个元素一行，每层缩进两个空格。
 * 节点只显示种类，Token 显示种类和原始文本。
 *
 * <pre>
 * Program
 *   ProgramKeyword 'program'
 *   IdentifierName
 *     IdentifierToken 'P'
 *   Block
 * </pre>
 */
public class SyntaxTreePrinter {

    public static String print(SyntaxElement root) {
        StringBuilder sb = new StringBuilder();
        print(root, 0, sb);
        return sb.toString();
    }

    private static void print(SyntaxElement element, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(element.getKindText());
        if (element.isToken()) {
            sb.append(" '").append(TokenListingFormatter.escape(((SyntaxToken) element).getText())).append("'");
        }
        sb.append('\n');
        if (!element.isToken()) {
            for (SyntaxElement child : ((SyntaxNode) element).getChildren()) {
                print(child, depth + 1, sb);
            }
        }
    }
}
