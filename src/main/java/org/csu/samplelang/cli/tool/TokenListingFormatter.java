package org.csu.samplelang.cli.tool;

import org.csu.samplelang.compiler.syntax.SyntaxToken;

import java.util.ArrayList;
import java.util.List;

/**
 * 将 Token 序列格式化为带边框的控制台表格，每个 Token 一行。
 */
public class TokenListingFormatter {

    private static final List<String> HEADERS = List.of("Line:Col", "Source Text", "Syntax Kind");

    /**
     * @param tokens 词法分析结果，通常以 EndOfFileToken 结尾
     * @return 格式化后的表格字符串
     */
    public static String format(List<SyntaxToken> tokens) {
        List<List<String>> rows = new ArrayList<>();
        for (SyntaxToken token : tokens) {
            rows.add(List.of(token.getLine() + ":" + token.getColumn(), escape(token.getText()), token.getKindText()));
        }

        // 1. 计算每列的最大宽度
        List<Integer> columnWidths = new ArrayList<>();
        for (int i = 0; i < HEADERS.size(); i++) {
            int maxWidth = HEADERS.get(i).length();
            for (List<String> row : rows) {
                maxWidth = Math.max(maxWidth, row.get(i).length());
            }
            columnWidths.add(maxWidth);
        }

        // 2. 表头、数据行、底部边框
        StringBuilder sb = new StringBuilder();
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(getRow(HEADERS, columnWidths)).append("\n");
        sb.append(getSeparator(columnWidths)).append("\n");
        for (List<String> row : rows) {
            sb.append(getRow(row, columnWidths)).append("\n");
        }
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(tokens.size()).append(" tokens.");
        return sb.toString();
    }

    /**
     * 空白和换行以转义形式显示，保证表格每个 Token 只占一行。
     */
    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '\t':
                    sb.append("\\t");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                default:
                    if (ch != ' ' && (Character.isWhitespace(ch) || Character.isSpaceChar(ch) || ch == '\uFEFF')) {
                        sb.append(String.format("\\u%04X", (int) ch));
                    } else {
                        sb.append(ch);
                    }
            }
        }
        return sb.toString();
    }

    private static String getRow(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(String.format(" %-" + widths.get(i) + "s |", cells.get(i)));
        }
        return sb.toString();
    }

    private static String getSeparator(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (Integer width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }
}
